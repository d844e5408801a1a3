package io.github.cyfko.roaql.core.parsing;

/**
 * Side effect of applying a grammar production: opening an operator invocation, collecting an
 * argument, or building the node of the innermost invocation.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
interface SemanticAction {

    SemanticAction NONE = state -> { };

    void execute(ParseState state);
}
