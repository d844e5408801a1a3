package io.github.cyfko.roaql.core.parsing;

import io.github.cyfko.roaql.core.spi.OperatorRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a query expression into {@link Token}s.
 * <p>
 * Single left-to-right pass, no backtracking:
 * </p>
 * <ul>
 *   <li>{@code (}, {@code )} and {@code ,} are structural symbols. Each one first flushes the pending
 *       literal buffer.</li>
 *   <li>A flushed buffer is an {@link TokenType#OPERATOR} when it equals a registered keyword and the
 *       symbol that ends it is {@code (}; otherwise it is a {@link TokenType#LITERAL}. Column names
 *       such as {@code gender} or {@code eq} are therefore never split into keywords.</li>
 *   <li>Double-quoted strings (with {@code \"} escapes) and JSON arrays or objects are copied verbatim,
 *       so the commas and parentheses they contain are not structural.</li>
 *   <li>Unquoted spaces are skipped while the buffer is no longer than the longest keyword. Past
 *       that length the literal is free text: it is captured verbatim, spaces included, up to the next
 *       structural symbol.</li>
 *   <li>An {@link TokenType#END} marker terminates the stream.</li>
 * </ul>
 * <p>
 * Tokenizing never fails. An unterminated quote or bracket makes the rest of the input a
 * {@link TokenType#MALFORMED_LITERAL}, reported later by the {@link GrammarDriver}.
 * </p>
 *
 * <pre>{@code
 * lexer.tokenize("and(gt(id,1),lt(id,5))");
 * // OPERATOR(and) OPEN OPERATOR(gt) OPEN LITERAL(id) COMMA LITERAL(1) CLOSE COMMA
 * // OPERATOR(lt) OPEN LITERAL(id) COMMA LITERAL(5) CLOSE CLOSE END
 * }</pre>
 *
 * <p>Instances only hold the read-only registry and may be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionLexer {

    private final OperatorRegistry registry;

    public ExpressionLexer(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Operator registry is required");
    }

    /**
     * Tokenizes an expression.
     *
     * @param expression the expression
     * @return tokens in input order, ending with {@link TokenType#END}
     */
    public List<Token> tokenize(String expression) {
        Objects.requireNonNull(expression, "Expression is required");

        List<Token> tokens = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        int bufferStart = -1;
        boolean malformed = false;
        int i = 0;

        while (i < expression.length()) {
            char c = expression.charAt(i);

            if (isSymbol(c)) {
                flush(tokens, buffer, bufferStart, malformed, c == '(');
                malformed = false;
                tokens.add(new Token(symbolType(c), String.valueOf(c), i));
                i++;
                continue;
            }

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (buffer.length() == 0) {
                bufferStart = i;
            }

            int next = c == '"' || c == '[' || c == '{' ? skipLiteral(expression, i) : i + 1;
            if (next < 0) {
                buffer.append(expression, i, expression.length());
                malformed = true;
                i = expression.length();
                break;
            }
            buffer.append(expression, i, next);
            i = next;

            if (buffer.length() > registry.maxTokenLength()) {
                int end = scanFreeText(expression, i);
                if (end < 0) {
                    buffer.append(expression, i, expression.length());
                    malformed = true;
                    i = expression.length();
                } else {
                    buffer.append(expression, i, end);
                    i = end;
                }
            }
        }

        flush(tokens, buffer, bufferStart, malformed, false);
        tokens.add(new Token(TokenType.END, "", expression.length()));
        return tokens;
    }

    private void flush(List<Token> tokens, StringBuilder buffer, int start, boolean malformed, boolean beforeOpen) {
        if (buffer.length() == 0) return;

        String text = buffer.toString();
        TokenType type;
        if (malformed) {
            type = TokenType.MALFORMED_LITERAL;
        } else if (beforeOpen && registry.isOperator(text.trim())) {
            type = TokenType.OPERATOR;
            text = text.trim();
        } else {
            type = TokenType.LITERAL;
        }

        tokens.add(new Token(type, text, start));
        buffer.setLength(0);
    }

    /**
     * Captures free text from {@code from} up to the next structural symbol outside quotes and brackets.
     *
     * @return index of that symbol (or the input length), or {@code -1} if a quote or bracket is never closed
     */
    private static int scanFreeText(String expression, int from) {
        int i = from;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (isSymbol(c)) {
                return i;
            }
            if (c == '"' || c == '[' || c == '{') {
                i = skipLiteral(expression, i);
                if (i < 0) return -1;
            } else {
                i++;
            }
        }
        return i;
    }

    /**
     * Skips a quoted string or a bracketed JSON value starting at {@code from}.
     *
     * @return index right after the closing character, or {@code -1} if it is never closed
     */
    static int skipLiteral(String expression, int from) {
        char opening = expression.charAt(from);
        if (opening == '"') {
            return skipQuoted(expression, from);
        }

        int depth = 0;
        int i = from;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '"') {
                i = skipQuoted(expression, i);
                if (i < 0) return -1;
                continue;
            }
            if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i + 1;
            }
            i++;
        }
        return -1;
    }

    private static int skipQuoted(String expression, int from) {
        int i = from + 1;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') return i + 1;
            i++;
        }
        return -1;
    }

    private static boolean isSymbol(char c) {
        return c == '(' || c == ')' || c == ',';
    }

    private static TokenType symbolType(char c) {
        return switch (c) {
            case '(' -> TokenType.OPEN;
            case ')' -> TokenType.CLOSE;
            default -> TokenType.COMMA;
        };
    }
}
