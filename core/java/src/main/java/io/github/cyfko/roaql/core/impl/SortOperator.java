package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;
import io.github.cyfko.roaql.core.model.SortDirection;
import io.github.cyfko.roaql.core.spi.GrammarContribution;
import io.github.cyfko.roaql.core.spi.OperatorKind;
import io.github.cyfko.roaql.core.spi.ParseContext;
import io.github.cyfko.roaql.core.utils.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Sort operator: {@code asc(name)} or {@code desc(name)}. The direction is fixed per instance.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SortOperator extends AbstractOperatorDescriptor {

    private final SortDirection direction;

    public SortOperator(SortDirection direction) {
        super(Objects.requireNonNull(direction).token(), OperatorKind.SORT, 1, 1, GrammarContribution.ARGUMENT_LIST);
        this.direction = direction;
    }

    @Override
    public ValidationResult validate(List<String> arguments, ParseContext context) {
        if (arguments.size() != 1) {
            return ValidationResult.failure("Sort operation " + token() + " requires exactly one argument.");
        }
        if (arguments.get(0).isEmpty()) {
            return ValidationResult.failure("Sort operation " + token() + " argument is empty.");
        }
        return checkColumn(arguments.get(0), context);
    }

    @Override
    public FilterNode build(List<String> arguments, ParseContext context) {
        return new Sort(context.model().resolve(arguments.get(0)), direction);
    }
}
