package io.github.cyfko.roaql.core.exception;

/**
 * Exception thrown when an operator registry is configured with an invalid or duplicated operator.
 * <p>
 * This is a startup failure: registries are assembled once and are read-only afterwards, so this
 * exception never surfaces from a parse call.
 * </p>
 *
 * <pre>{@code
 * OperatorRegistry.builder()
 *     .registerStandardOperators()
 *     .register(new MyEqualsOperator()); // token "eq"
 * // → "Operator [eq] is already registered."
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OperatorDefinitionException extends FilterValidationException {

    /**
     * @param message explanation of the configuration error
     */
    public OperatorDefinitionException(String message) {
        super(message);
    }
}
