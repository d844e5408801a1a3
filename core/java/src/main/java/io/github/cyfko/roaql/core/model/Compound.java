package io.github.cyfko.roaql.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Boolean combination of two or more filters, children kept in source order.
 *
 * @param kind     AND or OR
 * @param children child filters, at least two, never a {@link Sort}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Compound(CompoundKind kind, List<FilterNode> children) implements FilterNode {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if fewer than two children are given or a child is a sort
     */
    public Compound {
        Objects.requireNonNull(kind, "Compound kind is required");
        children = List.copyOf(Objects.requireNonNull(children, "Compound children are required"));

        if (children.size() < 2) {
            throw new IllegalArgumentException(kind.token() + " operation takes at least two arguments.");
        }
        for (FilterNode child : children) {
            if (child instanceof Sort) {
                throw new IllegalArgumentException(kind.token() + " operation cannot combine sort expressions.");
            }
        }
    }

    @Override
    public <R> R accept(FilterNodeVisitor<R> visitor) {
        return visitor.visitCompound(this);
    }

    @Override
    public String toExpression() {
        return children.stream()
                .map(FilterNode::toExpression)
                .collect(Collectors.joining(",", kind.token() + "(", ")"));
    }
}
