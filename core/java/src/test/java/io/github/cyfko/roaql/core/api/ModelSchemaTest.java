package io.github.cyfko.roaql.core.api;

import io.github.cyfko.roaql.core.exception.FilterValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelSchemaTest {

    @Test
    void shouldResolveKnownAttribute() {
        ModelSchema schema = ModelSchema.of("person", Map.of("id", Long.class));

        assertEquals(new ColumnRef("id", Long.class), schema.resolve("id"));
        assertEquals("person", schema.modelName());
    }

    @Test
    void shouldNameMissingAttribute() {
        ModelSchema schema = ModelSchema.of("person", Map.of("id", Long.class));

        FilterValidationException ex = assertThrows(FilterValidationException.class,
                () -> schema.resolve("unknown_attr"));

        assertEquals("Resource model person does not contain unknown_attr attribute.", ex.getMessage());
        assertTrue(schema.findColumn("unknown_attr").isEmpty());
        assertTrue(schema.findColumn(null).isEmpty());
    }

    @Test
    void shouldNotFollowSourceMapChanges() {
        Map<String, Class<?>> columns = new HashMap<>();
        columns.put("id", Long.class);
        ModelSchema schema = ModelSchema.of("person", columns);

        columns.put("name", String.class);

        assertTrue(schema.findColumn("name").isEmpty());
    }

    @Test
    void columnRefRequiresNameAndType() {
        assertThrows(NullPointerException.class, () -> new ColumnRef(null, String.class));
        assertThrows(NullPointerException.class, () -> new ColumnRef("name", null));
        assertThrows(IllegalArgumentException.class, () -> new ColumnRef(" ", String.class));
    }
}
