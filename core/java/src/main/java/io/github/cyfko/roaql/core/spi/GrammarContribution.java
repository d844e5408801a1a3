package io.github.cyfko.roaql.core.spi;

/**
 * Shape of the text an operator expects between its parentheses.
 * <p>
 * The grammar table derives the productions of every registered operator from this value:
 * </p>
 * <pre>
 * ARGUMENT_LIST : op '(' ARGUMENT (',' ARGUMENT)* ')'
 * RAW_ARGUMENT  : op '(' &lt;balanced text&gt; ')'
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum GrammarContribution {
    /** Comma separated literal arguments, each delivered trimmed to the descriptor. */
    ARGUMENT_LIST,
    /** A single verbatim argument holding nested sub-expressions. */
    RAW_ARGUMENT
}
