package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.api.ColumnRef;
import io.github.cyfko.roaql.core.api.ModelSchema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link ModelSchema} backed by a map of attribute names to Java types.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SimpleModelSchema implements ModelSchema {

    private final String modelName;
    private final Map<String, ColumnRef> columns;

    public SimpleModelSchema(String modelName, Map<String, Class<?>> columns) {
        this.modelName = Objects.requireNonNull(modelName, "Model name is required");
        Objects.requireNonNull(columns, "Columns are required");

        Map<String, ColumnRef> resolved = new LinkedHashMap<>();
        columns.forEach((name, type) -> resolved.put(name, new ColumnRef(name, type)));
        this.columns = Map.copyOf(resolved);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public Optional<ColumnRef> findColumn(String attributeName) {
        if (attributeName == null) return Optional.empty();
        return Optional.ofNullable(columns.get(attributeName));
    }

    @Override
    public String toString() {
        return "SimpleModelSchema[" + modelName + ", columns=" + columns.keySet() + "]";
    }
}
