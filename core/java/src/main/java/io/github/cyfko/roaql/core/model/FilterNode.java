package io.github.cyfko.roaql.core.model;

/**
 * Node of a parsed resource query.
 * <p>
 * The node family is closed: {@link Comparison}, {@link Compound} and {@link Sort}. Consumers
 * dispatch on it with a {@link FilterNodeVisitor}. Nodes are immutable; a tree returned by the parser
 * belongs to the caller and can be handed to any number of query builders.
 * </p>
 *
 * <pre>{@code
 * FilterNode node = parser.parseFilter("and(gt(id,1),lt(id,5))", schema);
 * node.toExpression(); // "and(gt(id,1),lt(id,5))"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterNode {

    /**
     * Dispatches this node to the matching visitor method.
     *
     * @param visitor the visitor
     * @param <R>     visitor result type
     * @return the visitor result
     */
    <R> R accept(FilterNodeVisitor<R> visitor);

    /**
     * Renders the canonical textual form of this node. Parsing the returned text against the same
     * model yields a tree equal to this one.
     *
     * @return the canonical expression
     */
    String toExpression();
}
