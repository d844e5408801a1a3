package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.model.ComparisonOp;
import io.github.cyfko.roaql.core.model.CompoundKind;
import io.github.cyfko.roaql.core.model.SortDirection;
import io.github.cyfko.roaql.core.spi.OperatorDescriptor;

import java.util.List;

/**
 * Built-in operators, in registration order: comparisons first, then compounds, then sorts.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StandardOperators {

    private StandardOperators() {}

    public static List<OperatorDescriptor> all() {
        return List.of(
                new ComparisonOperator(ComparisonOp.EQ),
                new ComparisonOperator(ComparisonOp.GT),
                new ComparisonOperator(ComparisonOp.GE),
                new ComparisonOperator(ComparisonOp.LT),
                new ComparisonOperator(ComparisonOp.LE),
                new ComparisonOperator(ComparisonOp.LIKE),
                new ComparisonOperator(ComparisonOp.IN),
                new CompoundOperator(CompoundKind.AND),
                new CompoundOperator(CompoundKind.OR),
                new SortOperator(SortDirection.ASC),
                new SortOperator(SortDirection.DESC)
        );
    }
}
