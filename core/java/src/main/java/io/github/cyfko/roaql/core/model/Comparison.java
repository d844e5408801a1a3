package io.github.cyfko.roaql.core.model;

import io.github.cyfko.roaql.core.api.ColumnRef;
import io.github.cyfko.roaql.core.utils.LiteralCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Comparison of a column against a literal value.
 * <p>
 * For {@link ComparisonOp#IN} the value is a non-empty unmodifiable list of scalars; for every other
 * operator it is a scalar (string, number, boolean or {@code null}).
 * </p>
 *
 * @param column the resolved column
 * @param op     the comparison operator
 * @param value  the decoded literal
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Comparison(ColumnRef column, ComparisonOp op, Object value) implements FilterNode {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the value shape does not fit the operator
     */
    public Comparison {
        Objects.requireNonNull(column, "Comparison column is required");
        Objects.requireNonNull(op, "Comparison operator is required");

        if (op == ComparisonOp.IN) {
            if (!(value instanceof List<?> values) || values.isEmpty()) {
                throw new IllegalArgumentException("Operator in requires a non-empty sequence value, got: " + value);
            }
            for (Object item : values) {
                if (!LiteralCodec.isScalar(item)) {
                    throw new IllegalArgumentException("Operator in requires a sequence of scalar values, got: " + value);
                }
            }
            value = Collections.unmodifiableList(new ArrayList<>(values));
        } else if (!LiteralCodec.isScalar(value)) {
            throw new IllegalArgumentException("Operator " + op.token() + " requires a scalar value, got: " + value);
        }
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toExpression() {
        return op.token() + "(" + column.name() + "," + LiteralCodec.encode(value) + ")";
    }
}
