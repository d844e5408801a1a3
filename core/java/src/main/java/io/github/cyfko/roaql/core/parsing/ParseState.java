package io.github.cyfko.roaql.core.parsing;

import io.github.cyfko.roaql.core.exception.DSLLexicalException;
import io.github.cyfko.roaql.core.exception.DSLSyntaxException;
import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.spi.OperatorDescriptor;
import io.github.cyfko.roaql.core.spi.ParseContext;
import io.github.cyfko.roaql.core.utils.ValidationResult;

import java.util.*;

/**
 * Mutable scratch of one parse: grammar stack, input position, open operator invocations and built
 * nodes. A new instance is created for every expression and discarded afterwards.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class ParseState {

    private final String source;
    private final List<Token> tokens;
    private final ParseContext context;

    private final Deque<GrammarSymbol> stack = new ArrayDeque<>();
    private final Deque<OperatorInvocation> invocations = new ArrayDeque<>();
    private final List<FilterNode> built = new ArrayList<>();
    private final List<Production> derivation = new ArrayList<>();
    private int position;

    ParseState(String source, List<Token> tokens, ParseContext context) {
        this.source = source;
        this.tokens = tokens;
        this.context = context;
    }

    // Grammar stack

    boolean hasPendingSymbols() {
        return !stack.isEmpty();
    }

    GrammarSymbol pop() {
        return stack.pop();
    }

    void push(GrammarSymbol symbol) {
        stack.push(symbol);
    }

    /**
     * Pushes the right-hand side of a production so that its first symbol ends on top.
     */
    void expand(Production production) {
        derivation.add(production);
        List<GrammarSymbol> rhs = production.rightHandSide();
        for (int i = rhs.size() - 1; i >= 0; i--) {
            stack.push(rhs.get(i));
        }
    }

    // Input

    Token current() {
        return tokens.get(position);
    }

    void advance() {
        position++;
    }

    // Semantic actions

    void openInvocation(OperatorDescriptor descriptor) {
        invocations.push(new OperatorInvocation(descriptor));
    }

    void addCurrentArgument() {
        addArgument(current().text());
    }

    void addArgument(String text) {
        innermost().arguments.add(text.trim());
    }

    /**
     * Takes the text between the parenthesis just consumed and its matching closing parenthesis as a
     * single argument, and moves the input to that closing parenthesis.
     */
    void captureRawArgument() {
        Token open = tokens.get(position - 1);
        int depth = 0;

        for (int i = position; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case MALFORMED_LITERAL -> throw new DSLLexicalException(
                        "Unterminated literal '" + token.text() + "' at position " + token.position(), token.position());
                case OPEN -> depth++;
                case CLOSE -> {
                    if (depth == 0) {
                        addArgument(source.substring(open.position() + 1, token.position()));
                        position = i;
                        return;
                    }
                    depth--;
                }
                case END -> throw new DSLSyntaxException(
                        "Unbalanced parentheses: '(' at position " + open.position() + " is never closed",
                        open.text(), open.position());
                default -> {
                }
            }
        }
    }

    /**
     * Validates the arguments of the innermost invocation and builds its node.
     *
     * @throws FilterValidationException if the descriptor rejects the arguments
     */
    void closeInvocation() {
        OperatorInvocation invocation = invocations.pop();
        List<String> arguments = List.copyOf(invocation.arguments);

        ValidationResult result = invocation.descriptor.validate(arguments, context);
        if (!result.isValid()) {
            throw new FilterValidationException(result.getErrorMessage());
        }
        built.add(invocation.descriptor.build(arguments, context));
    }

    // Result

    FilterNode result() {
        if (built.isEmpty()) {
            throw new DSLSyntaxException("Expression '" + source + "' does not contain any operator");
        }
        return built.get(built.size() - 1);
    }

    List<Production> derivation() {
        return Collections.unmodifiableList(derivation);
    }

    private OperatorInvocation innermost() {
        OperatorInvocation invocation = invocations.peek();
        if (invocation == null) {
            throw new IllegalStateException("No operator invocation is open");
        }
        return invocation;
    }

    private static final class OperatorInvocation {
        private final OperatorDescriptor descriptor;
        private final List<String> arguments = new ArrayList<>();

        private OperatorInvocation(OperatorDescriptor descriptor) {
            this.descriptor = descriptor;
        }
    }
}
