package io.github.cyfko.roaql.core.api;

import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.impl.SimpleModelSchema;

import java.util.Map;
import java.util.Optional;

/**
 * Describes the attributes of the resource model a query expression is evaluated against.
 * <p>
 * This is the only capability the parser needs from the persistence side: resolving an attribute
 * name into a typed {@link ColumnRef}. Resolution is all-or-nothing, either the attribute exists or
 * the parse fails with a {@link FilterValidationException} naming it.
 * </p>
 *
 * <pre>{@code
 * ModelSchema schema = ModelSchema.of("person", Map.of(
 *     "id", Long.class,
 *     "name", String.class));
 *
 * ColumnRef id = schema.resolve("id");
 * schema.resolve("unknown_attr"); // FilterValidationException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ModelSchema {

    /**
     * @return the model name used in error messages
     */
    String modelName();

    /**
     * Looks an attribute up.
     *
     * @param attributeName attribute name as written in the expression
     * @return the column reference, or empty when the model has no such attribute
     */
    Optional<ColumnRef> findColumn(String attributeName);

    /**
     * Resolves an attribute that must exist.
     *
     * @param attributeName attribute name as written in the expression
     * @return the column reference
     * @throws FilterValidationException if the model has no such attribute
     */
    default ColumnRef resolve(String attributeName) {
        return findColumn(attributeName).orElseThrow(() -> new FilterValidationException(
                "Resource model " + modelName() + " does not contain " + attributeName + " attribute."));
    }

    /**
     * Creates an immutable in-memory schema.
     *
     * @param modelName model name used in error messages
     * @param columns   attribute names mapped to their Java types
     * @return the schema
     */
    static ModelSchema of(String modelName, Map<String, Class<?>> columns) {
        return new SimpleModelSchema(modelName, columns);
    }
}
