package io.github.cyfko.roaql.core.model;

import io.github.cyfko.roaql.core.api.ColumnRef;

import java.util.Objects;

/**
 * One sort key.
 *
 * @param column    the resolved column
 * @param direction ascending or descending
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Sort(ColumnRef column, SortDirection direction) implements FilterNode {

    public Sort {
        Objects.requireNonNull(column, "Sorting column is required");
        Objects.requireNonNull(direction, "Sorting direction is required. Either ASC (ascending) or DESC (descending)");
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitSort(this);
    }

    @Override
    public String toExpression() {
        return direction.token() + "(" + column.name() + ")";
    }
}
