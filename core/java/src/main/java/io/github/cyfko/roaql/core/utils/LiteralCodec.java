package io.github.cyfko.roaql.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decodes and encodes the literal values of comparison operators.
 * <p>
 * Values are written in JSON: {@code "John"}, {@code 42}, {@code 3.5}, {@code true}, {@code null}
 * and, for membership tests, arrays such as {@code [1,2,3]}. Decoding yields the corresponding Java
 * values ({@link String}, {@link Integer}/{@link Long}/{@link java.math.BigInteger}, {@link Double},
 * {@link Boolean}, {@code null}, unmodifiable {@link List}).
 * </p>
 *
 * <p>The underlying {@link ObjectMapper} is configured once and only used for reading and writing
 * afterwards, which makes this class safe for concurrent use.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LiteralCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private LiteralCodec() {}

    /**
     * Decodes a JSON literal.
     *
     * @param literal raw literal text, already trimmed
     * @return the decoded value; arrays are returned as unmodifiable lists and objects as maps
     * @throws IllegalArgumentException if the text is not a single JSON value, or holds a number too
     *                                  large to be represented as a finite {@link Double}
     */
    public static Object decode(String literal) {
        Object value;
        try {
            value = MAPPER.readValue(literal, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON literal: " + literal, e);
        }
        return freeze(value, literal);
    }

    /**
     * Encodes a value in the JSON form accepted by {@link #decode(String)}.
     *
     * @param value a scalar or a list of scalars
     * @return the JSON text
     */
    public static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be written as a JSON literal: " + value, e);
        }
    }

    /**
     * Tells whether a decoded value is a scalar (string, number, boolean or null).
     *
     * @param value decoded value
     * @return {@code true} for scalars
     */
    public static boolean isScalar(Object value) {
        return value == null || value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static Object freeze(Object value, String literal) {
        if (value instanceof Double d && !Double.isFinite(d)) {
            throw new IllegalArgumentException("Number out of range in JSON literal: " + literal);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item, literal));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(map);
        }
        return value;
    }
}
