package io.github.cyfko.roaql.core.exception;

/**
 * Base type of every failure raised while turning a resource query expression into a filter or sort tree.
 * <p>
 * Parsing never recovers from an error and never returns a partial tree: callers either receive a
 * complete AST or one of the subclasses below.
 * </p>
 * <ul>
 *   <li>{@link DSLLexicalException} - the expression cannot be split into tokens</li>
 *   <li>{@link DSLSyntaxException} - the token stream does not match the grammar</li>
 *   <li>{@link FilterValidationException} - the expression is well formed but meaningless for the model</li>
 * </ul>
 *
 * <p>An HTTP layer typically maps the whole hierarchy to a {@code 400 Bad Request}:</p>
 * <pre>{@code
 * try {
 *     FilterNode filter = parser.parseFilter(request.getParameter("filter"), schema);
 * } catch (QueryExpressionException e) {
 *     return ResponseEntity.badRequest().body(e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QueryExpressionException extends RuntimeException {

    /**
     * @param message description of the failure, including operator or column context when known
     */
    public QueryExpressionException(String message) {
        super(message);
    }

    /**
     * @param message description of the failure
     * @param cause   underlying cause
     */
    public QueryExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
