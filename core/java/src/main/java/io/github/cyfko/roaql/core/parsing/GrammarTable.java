package io.github.cyfko.roaql.core.parsing;

import io.github.cyfko.roaql.core.spi.OperatorDescriptor;
import io.github.cyfko.roaql.core.spi.OperatorRegistry;

import java.util.*;

import static io.github.cyfko.roaql.core.parsing.GrammarSymbol.rule;
import static io.github.cyfko.roaql.core.parsing.GrammarSymbol.terminal;

/**
 * LL(1) transition table of the query language, derived from an {@link OperatorRegistry}.
 * <p>
 * Each registered operator contributes one {@code EXPRESSION} production, in registration order;
 * the argument rules are shared:
 * </p>
 * <pre>
 * EXPRESSION     [op]        -> op '(' ARGUMENT MORE_ARGUMENTS CLOSE     (argument list operators)
 * EXPRESSION     [op]        -> op '(' RAW_ARGUMENT CLOSE                (compound operators)
 * ARGUMENT       [literal]   -> literal                                  add argument
 * ARGUMENT       [',' | ')'] -> ε                                        add empty argument
 * MORE_ARGUMENTS [',']       -> ',' ARGUMENT MORE_ARGUMENTS
 * MORE_ARGUMENTS [')']       -> ε
 * RAW_ARGUMENT   [*]         -> ε                                        capture balanced text
 * CLOSE          [')']       -> ')'                                      validate and build node
 * </pre>
 * <p>The table is immutable once built and is shared by every parse of a parser instance.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class GrammarTable {

    public static final String EXPRESSION = "EXPRESSION";
    public static final String ARGUMENT = "ARGUMENT";
    public static final String MORE_ARGUMENTS = "MORE_ARGUMENTS";
    public static final String RAW_ARGUMENT = "RAW_ARGUMENT";
    public static final String CLOSE = "CLOSE";

    /** Lookahead key matching any token. */
    public static final String ANY = "*";

    private final Map<String, Map<String, Production>> productions;

    private GrammarTable(Map<String, Map<String, Production>> productions) {
        Map<String, Map<String, Production>> frozen = new LinkedHashMap<>();
        productions.forEach((rule, byLookahead) ->
                frozen.put(rule, Collections.unmodifiableMap(new LinkedHashMap<>(byLookahead))));
        this.productions = Collections.unmodifiableMap(frozen);
    }

    /**
     * Derives the table from the registered operators.
     *
     * @param registry the operators
     * @return the table
     */
    public static GrammarTable from(OperatorRegistry registry) {
        Map<String, Map<String, Production>> table = new LinkedHashMap<>();

        for (OperatorDescriptor descriptor : registry.descriptors()) {
            List<GrammarSymbol> rhs = new ArrayList<>();
            rhs.add(terminal(descriptor.token()));
            rhs.add(terminal("("));
            switch (descriptor.grammarContribution()) {
                case ARGUMENT_LIST -> {
                    rhs.add(rule(ARGUMENT));
                    rhs.add(rule(MORE_ARGUMENTS));
                }
                case RAW_ARGUMENT -> rhs.add(rule(RAW_ARGUMENT));
            }
            rhs.add(rule(CLOSE));
            put(table, EXPRESSION, descriptor.token(), rhs, state -> state.openInvocation(descriptor));
        }

        put(table, ARGUMENT, Token.LITERAL_KEY, List.of(terminal(Token.LITERAL_KEY)), ParseState::addCurrentArgument);
        put(table, ARGUMENT, ",", List.of(), state -> state.addArgument(""));
        put(table, ARGUMENT, ")", List.of(), state -> state.addArgument(""));

        put(table, MORE_ARGUMENTS, ",", List.of(terminal(","), rule(ARGUMENT), rule(MORE_ARGUMENTS)), SemanticAction.NONE);
        put(table, MORE_ARGUMENTS, ")", List.of(), SemanticAction.NONE);

        put(table, RAW_ARGUMENT, ANY, List.of(), ParseState::captureRawArgument);

        put(table, CLOSE, ")", List.of(terminal(")")), ParseState::closeInvocation);

        return new GrammarTable(table);
    }

    /**
     * Finds the production for a rule and lookahead key, falling back to the {@link #ANY} entry.
     *
     * @param rule      rule name
     * @param lookahead lookahead key of the current token
     * @return the production, or empty when the token is unexpected
     */
    Optional<Production> lookup(String rule, String lookahead) {
        Map<String, Production> byLookahead = productions.getOrDefault(rule, Map.of());
        Production production = byLookahead.get(lookahead);
        if (production == null) {
            production = byLookahead.get(ANY);
        }
        return Optional.ofNullable(production);
    }

    /**
     * @param rule rule name
     * @return lookahead keys accepted by the rule, for error messages
     */
    public Set<String> expectedLookaheads(String rule) {
        return productions.getOrDefault(rule, Map.of()).keySet();
    }

    private static void put(Map<String, Map<String, Production>> table, String rule, String lookahead,
                            List<GrammarSymbol> rhs, SemanticAction action) {
        table.computeIfAbsent(rule, k -> new LinkedHashMap<>())
                .put(lookahead, new Production(rule, lookahead, rhs, action));
    }
}
