package io.github.cyfko.roaql.core.api;

import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * Downstream capability turning parsed trees into backend-specific query parts.
 * <p>
 * Implementations are backend adapters (the JPA adapter produces Criteria predicates and orders).
 * Sort lists must be applied in order: the first element is the primary key, the following ones
 * break ties.
 * </p>
 *
 * @param <C> type of a query constraint (e.g. {@code jakarta.persistence.criteria.Predicate})
 * @param <O> type of a query ordering (e.g. {@code jakarta.persistence.criteria.Order})
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryBuilder<C, O> {

    /**
     * Translates a filter tree.
     *
     * @param filter a comparison or compound node
     * @return the query constraint
     */
    C apply(FilterNode filter);

    /**
     * Translates one sort key.
     *
     * @param sort the sort node
     * @return the query ordering
     */
    O apply(Sort sort);

    /**
     * Translates a sort list, preserving its order.
     *
     * @param sorts sort nodes, primary key first
     * @return orderings in the same order
     */
    default List<O> applyAll(List<Sort> sorts) {
        List<O> orders = new ArrayList<>(sorts.size());
        for (Sort sort : sorts) {
            orders.add(apply(sort));
        }
        return orders;
    }
}
