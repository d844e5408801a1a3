package io.github.cyfko.roaql.core.model;

/**
 * Visitor over the {@link FilterNode} family.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterNodeVisitor<R> {

    R visitComparison(Comparison comparison);

    R visitCompound(Compound compound);

    R visitSort(Sort sort);
}
