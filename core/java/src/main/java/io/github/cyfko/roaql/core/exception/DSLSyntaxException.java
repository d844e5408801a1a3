package io.github.cyfko.roaql.core.exception;

import io.github.cyfko.roaql.core.api.QueryParser;
import io.github.cyfko.roaql.core.parsing.GrammarDriver;

/**
 * Exception thrown when a query expression does not follow the resource query grammar.
 * <p>
 * Raised by the {@link GrammarDriver} when the next input token does not match the expected
 * terminal, or when no grammar production exists for the current rule and token. The message
 * always names the offending token, its position and a snippet of the expression around it so
 * that an API client can locate the mistake.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parseFilter("", schema);
 * // → "Filter expression cannot be null or empty"
 *
 * parser.parseFilter("eq(name,\"John\"", schema);
 * // → "Unexpected end of expression at position 15, expected ')' near 'eq(name,"John"'"
 *
 * parser.parseFilter("eq(name,1)x", schema);
 * // → "Unexpected token 'x' at position 10, expected end of expression near 'eq(name,1)x'"
 * }</pre>
 *
 * <p>Configuration limits of {@link io.github.cyfko.roaql.core.config.ParserPolicy} (expression length,
 * nesting depth) are reported with this exception as well.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryParser
 */
public class DSLSyntaxException extends QueryExpressionException {

    private final int position;
    private final String token;

    /**
     * Constructor for failures that are not tied to a particular token.
     *
     * @param message the message describing the cause of the exception
     */
    public DSLSyntaxException(String message) {
        super(message);
        this.position = -1;
        this.token = null;
    }

    /**
     * Constructor for token mismatches.
     *
     * @param message  the message describing the cause of the exception
     * @param token    the offending token text
     * @param position zero-based offset of the token in the expression
     */
    public DSLSyntaxException(String message, String token, int position) {
        super(message);
        this.position = position;
        this.token = token;
    }

    /**
     * @return zero-based offset of the offending token, or {@code -1} when the failure has no position
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the offending token text, or {@code null} when the failure has no token
     */
    public String getToken() {
        return token;
    }
}
