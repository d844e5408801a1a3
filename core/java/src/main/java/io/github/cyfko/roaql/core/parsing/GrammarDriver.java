package io.github.cyfko.roaql.core.parsing;

import io.github.cyfko.roaql.core.api.ModelSchema;
import io.github.cyfko.roaql.core.config.ParserPolicy;
import io.github.cyfko.roaql.core.exception.DSLLexicalException;
import io.github.cyfko.roaql.core.exception.DSLSyntaxException;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.spi.ParseContext;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Stack-driven top-down parser over a {@link GrammarTable}.
 * <p>
 * The stack starts as {@code ['$', EXPRESSION]}. Each step pops the top symbol:
 * </p>
 * <ul>
 *   <li>a terminal must equal the lookahead key of the current token, which is then consumed;</li>
 *   <li>a rule is expanded with the production selected by {@code (rule, lookahead)}: the production's
 *       semantic action runs, then its right-hand side is pushed in reverse order.</li>
 * </ul>
 * <p>
 * Parsing ends when the stack is empty. The node built by the last closing parenthesis is the result.
 * </p>
 *
 * <p>A driver is bound to one model and one nesting depth; it creates a fresh {@code ParseState} for
 * every call and may therefore be reused sequentially. Nested compound arguments are parsed by a new
 * driver one level deeper.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class GrammarDriver implements ParseContext {

    private static final Logger log = Logger.getLogger(GrammarDriver.class.getName());

    private static final int SNIPPET_RADIUS = 20;

    private final GrammarTable table;
    private final ExpressionLexer lexer;
    private final ParserPolicy policy;
    private final ModelSchema model;
    private final int depth;

    public GrammarDriver(GrammarTable table, ExpressionLexer lexer, ParserPolicy policy, ModelSchema model) {
        this(table, lexer, policy, model, 0);
    }

    private GrammarDriver(GrammarTable table, ExpressionLexer lexer, ParserPolicy policy, ModelSchema model, int depth) {
        this.table = Objects.requireNonNull(table, "Grammar table is required");
        this.lexer = Objects.requireNonNull(lexer, "Lexer is required");
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");
        this.model = Objects.requireNonNull(model, "Model schema is required");
        this.depth = depth;
    }

    /**
     * Tokenizes and parses an expression.
     *
     * @param expression the expression
     * @return the node of the outermost operator
     */
    public FilterNode parse(String expression) {
        return parse(expression, lexer.tokenize(expression));
    }

    /**
     * Parses an already tokenized expression.
     *
     * @param expression the source text, used for raw compound arguments and error snippets
     * @param tokens     tokens of {@code expression}, ending with {@link TokenType#END}
     * @return the node of the outermost operator
     */
    public FilterNode parse(String expression, List<Token> tokens) {
        ParseState state = new ParseState(expression, tokens, this);
        state.push(GrammarSymbol.terminal(Token.END_KEY));
        state.push(GrammarSymbol.rule(GrammarTable.EXPRESSION));

        while (state.hasPendingSymbols()) {
            GrammarSymbol top = state.pop();
            Token token = state.current();

            if (token.type() == TokenType.MALFORMED_LITERAL) {
                throw new DSLLexicalException(
                        "Unterminated literal '" + token.text() + "' at position " + token.position(), token.position());
            }

            if (top.terminal()) {
                if (!top.name().equals(token.key())) {
                    throw unexpected(expression, token, describe(top.name()));
                }
                state.advance();
            } else {
                Production production = table.lookup(top.name(), token.key())
                        .orElseThrow(() -> unexpectedForRule(expression, token, top.name()));
                production.action().execute(state);
                state.expand(production);
            }
        }

        FilterNode result = state.result();
        if (log.isLoggable(Level.FINEST)) {
            log.finest("Derivation of '" + expression + "' (depth " + depth + "): " + state.derivation());
        }
        return result;
    }

    @Override
    public ModelSchema model() {
        return model;
    }

    @Override
    public int depth() {
        return depth;
    }

    @Override
    public FilterNode parseNested(String expression) {
        if (depth + 1 > policy.maxNestingDepth()) {
            throw new DSLSyntaxException(String.format(
                    "Expression nesting too deep (max: %d). Policy applied: %s",
                    policy.maxNestingDepth(), policy.policyName()));
        }
        return new GrammarDriver(table, lexer, policy, model, depth + 1).parse(expression);
    }

    private DSLSyntaxException unexpectedForRule(String expression, Token token, String rule) {
        if (GrammarTable.EXPRESSION.equals(rule) && token.type() == TokenType.LITERAL) {
            return new DSLSyntaxException(String.format("Unknown operator '%s' at position %d near '%s'",
                    token.text(), token.position(), snippet(expression, token.position())),
                    token.text(), token.position());
        }
        String expected = table.expectedLookaheads(rule).stream()
                .map(GrammarDriver::describe)
                .collect(Collectors.joining(", ", "one of [", "]"));
        return unexpected(expression, token, expected);
    }

    private static DSLSyntaxException unexpected(String expression, Token token, String expected) {
        return new DSLSyntaxException(String.format("Unexpected %s at position %d, expected %s near '%s'",
                token.describe(), token.position(), expected, snippet(expression, token.position())),
                token.text(), token.position());
    }

    private static String describe(String key) {
        return switch (key) {
            case Token.END_KEY -> "end of expression";
            case Token.LITERAL_KEY -> "a literal";
            default -> "'" + key + "'";
        };
    }

    private static String snippet(String expression, int position) {
        int from = Math.max(0, position - SNIPPET_RADIUS);
        int to = Math.min(expression.length(), position + SNIPPET_RADIUS);
        return (from > 0 ? "..." : "") + expression.substring(from, to) + (to < expression.length() ? "..." : "");
    }
}
