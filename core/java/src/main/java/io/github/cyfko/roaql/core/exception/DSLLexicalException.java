package io.github.cyfko.roaql.core.exception;

/**
 * Exception thrown when a literal of the expression cannot be delimited, such as a quoted string
 * or a JSON sequence that is never closed.
 * <p>
 * The lexer itself never fails: it degrades an unterminated literal to free text running to the end
 * of the input. The grammar driver reports that literal with this exception once it reaches it.
 * </p>
 *
 * <pre>{@code
 * parser.parseFilter("eq(name,\"John)", schema);
 * // → "Unterminated literal '\"John)' at position 8"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DSLLexicalException extends QueryExpressionException {

    private final int position;

    /**
     * @param message  the message describing the cause of the exception
     * @param position zero-based offset where the literal starts
     */
    public DSLLexicalException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return zero-based offset where the faulty literal starts
     */
    public int getPosition() {
        return position;
    }
}
