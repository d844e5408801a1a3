package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.model.Comparison;
import io.github.cyfko.roaql.core.model.ComparisonOp;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.spi.GrammarContribution;
import io.github.cyfko.roaql.core.spi.OperatorKind;
import io.github.cyfko.roaql.core.spi.ParseContext;
import io.github.cyfko.roaql.core.utils.LiteralCodec;
import io.github.cyfko.roaql.core.utils.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Operator comparing a column with a JSON literal: {@code eq(name,"John")}, {@code gt(id,1)},
 * {@code in(id,[1,2,3])}.
 * <p>
 * The value is decoded with {@link LiteralCodec}. Every operator but {@link ComparisonOp#IN}
 * requires a scalar; {@code in} requires a non-empty array of scalars.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ComparisonOperator extends AbstractOperatorDescriptor {

    private final ComparisonOp op;
    private final String label;

    public ComparisonOperator(ComparisonOp op) {
        super(Objects.requireNonNull(op).token(), OperatorKind.COMPARISON, 2, 2, GrammarContribution.ARGUMENT_LIST);
        this.op = op;
        this.label = (op == ComparisonOp.IN ? "Membership operation " : "Binary operation ") + op.token();
    }

    /**
     * @return the comparison operator built by this descriptor
     */
    public ComparisonOp op() {
        return op;
    }

    @Override
    public ValidationResult validate(List<String> arguments, ParseContext context) {
        if (arguments.size() != 2) {
            return ValidationResult.failure(label + " requires two arguments.");
        }

        String columnName = arguments.get(0);
        if (columnName.isEmpty()) {
            return ValidationResult.failure(label + " first argument is empty.");
        }

        String literal = arguments.get(1);
        if (literal.isEmpty()) {
            return ValidationResult.failure(label + " second argument is empty.");
        }

        ValidationResult column = checkColumn(columnName, context);
        if (!column.isValid()) {
            return column;
        }

        Object value;
        try {
            value = LiteralCodec.decode(literal);
        } catch (IllegalArgumentException e) {
            return ValidationResult.failure(label + " value " + literal + " is not a valid literal.");
        }

        return checkValue(value, literal);
    }

    @Override
    public FilterNode build(List<String> arguments, ParseContext context) {
        return new Comparison(context.model().resolve(arguments.get(0)), op, LiteralCodec.decode(arguments.get(1)));
    }

    private ValidationResult checkValue(Object value, String literal) {
        if (op != ComparisonOp.IN) {
            return LiteralCodec.isScalar(value)
                    ? ValidationResult.success()
                    : ValidationResult.failure(label + " requires a scalar value, got " + literal + ".");
        }

        if (!(value instanceof List<?> values) || values.isEmpty()) {
            return ValidationResult.failure(label + " requires a non-empty sequence value, got " + literal + ".");
        }
        for (Object item : values) {
            if (!LiteralCodec.isScalar(item)) {
                return ValidationResult.failure(label + " requires a sequence of scalar values, got " + literal + ".");
            }
        }
        return ValidationResult.success();
    }
}
