package io.github.cyfko.roaql.core.exception;

import io.github.cyfko.roaql.core.api.ModelSchema;
import io.github.cyfko.roaql.core.spi.OperatorDescriptor;

/**
 * Exception thrown when a syntactically valid expression cannot be turned into a filter node.
 * <p>
 * This exception carries the semantic errors detected by {@link OperatorDescriptor#validate} and by
 * {@link ModelSchema#resolve(String)}. Messages name the operator and, when relevant, the column.
 * </p>
 *
 * <p><strong>Common Validation Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Unknown column:</strong> "Resource model person does not contain unknown_attr attribute."</li>
 *   <li><strong>Arity:</strong> "Binary operation eq requires two arguments."</li>
 *   <li><strong>Empty argument:</strong> "Binary operation eq second argument is empty."</li>
 *   <li><strong>Invalid literal:</strong> "Binary operation eq value John is not a valid literal."</li>
 *   <li><strong>Membership:</strong> "Membership operation in requires a non-empty sequence value."</li>
 *   <li><strong>Compound:</strong> "or operation takes at least two arguments."</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see OperatorDescriptor
 */
public class FilterValidationException extends QueryExpressionException {

    /**
     * @param message the description of the cause of the exception, should be specific and actionable
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * @param message the description of the cause of the exception
     * @param cause   the original cause of the exception (e.g. a JSON decoding failure)
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
