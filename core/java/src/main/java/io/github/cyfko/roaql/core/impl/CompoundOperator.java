package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.model.Compound;
import io.github.cyfko.roaql.core.model.CompoundKind;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;
import io.github.cyfko.roaql.core.parsing.CompoundSegmenter;
import io.github.cyfko.roaql.core.spi.GrammarContribution;
import io.github.cyfko.roaql.core.spi.OperatorKind;
import io.github.cyfko.roaql.core.spi.ParseContext;
import io.github.cyfko.roaql.core.utils.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Boolean combinator: {@code and(expr,expr,...)} or {@code or(expr,expr,...)}.
 * <p>
 * The grammar hands the text between the parentheses over verbatim. It is split into top-level
 * sub-expressions by {@link CompoundSegmenter}, and every sub-expression is parsed again through
 * {@link ParseContext#parseNested(String)}. Children keep their textual order.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CompoundOperator extends AbstractOperatorDescriptor {

    private final CompoundKind compoundKind;

    public CompoundOperator(CompoundKind compoundKind) {
        super(Objects.requireNonNull(compoundKind).token(), OperatorKind.COMPOUND, 2, Integer.MAX_VALUE,
                GrammarContribution.RAW_ARGUMENT);
        this.compoundKind = compoundKind;
    }

    @Override
    public ValidationResult validate(List<String> arguments, ParseContext context) {
        List<String> segments = CompoundSegmenter.split(String.join(",", arguments));

        if (segments.size() < minArity()) {
            return ValidationResult.failure(token() + " operation takes at least two arguments.");
        }
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).isEmpty()) {
                return ValidationResult.failure(token() + " operation argument " + (i + 1) + " is empty.");
            }
        }
        return ValidationResult.success();
    }

    @Override
    public FilterNode build(List<String> arguments, ParseContext context) {
        List<String> segments = CompoundSegmenter.split(String.join(",", arguments));
        List<FilterNode> children = new ArrayList<>(segments.size());

        for (String segment : segments) {
            FilterNode child = context.parseNested(segment);
            if (child instanceof Sort) {
                throw new FilterValidationException(
                        token() + " operation cannot combine sort expression " + segment + ".");
            }
            children.add(child);
        }
        return new Compound(compoundKind, children);
    }
}
