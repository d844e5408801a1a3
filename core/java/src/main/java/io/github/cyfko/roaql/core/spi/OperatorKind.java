package io.github.cyfko.roaql.core.spi;

/**
 * Family an operator belongs to, which decides where its nodes may appear.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorKind {
    /** Column compared to a literal; usable as a filter or inside a compound. */
    COMPARISON,
    /** Boolean combination of nested filter expressions. */
    COMPOUND,
    /** Sort key; only accepted by sort parsing. */
    SORT
}
