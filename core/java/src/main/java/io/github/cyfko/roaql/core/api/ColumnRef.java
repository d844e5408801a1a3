package io.github.cyfko.roaql.core.api;

import java.util.Objects;

/**
 * Resolved handle to a queryable attribute of a resource model.
 * <p>
 * Column references are only obtained from a {@link ModelSchema}; the parser never builds one
 * from raw text, so every reference found in a filter tree points to an attribute that exists.
 * </p>
 *
 * @param name     attribute name as written in query expressions
 * @param javaType Java type of the attribute values, used by query builders for value conversion
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ColumnRef(String name, Class<?> javaType) {

    /**
     * Canonical constructor with validation.
     */
    public ColumnRef {
        Objects.requireNonNull(name, "Column name is required");
        Objects.requireNonNull(javaType, "Column type is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }
}
