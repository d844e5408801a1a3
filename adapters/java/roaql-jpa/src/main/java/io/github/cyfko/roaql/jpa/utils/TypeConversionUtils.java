package io.github.cyfko.roaql.jpa.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Converts decoded expression literals to the Java type of the attribute they are compared with.
 * <p>
 * Literals reach the JPA layer in their JSON shape: strings, numbers ({@link Integer}, {@link Long},
 * {@link BigInteger}, {@link Double}, {@link BigDecimal}), booleans or {@code null}. Attributes on the
 * other hand may be dates, enums, UUIDs or narrower numeric types, so each literal is coerced before
 * it is handed to the {@link jakarta.persistence.criteria.CriteriaBuilder}.
 * </p>
 *
 * <h2>Supported targets</h2>
 * <ul>
 *   <li>numeric primitives and wrappers, {@link BigDecimal}, {@link BigInteger}; integral targets only
 *       accept literals they can hold exactly, so {@code 17.9} or {@code 3000000000} never reach an
 *       {@link Integer} attribute</li>
 *   <li>{@link Boolean} (from booleans, numbers or {@code "true"}/{@code "false"} strings)</li>
 *   <li>enums, matched by constant name ignoring case</li>
 *   <li>ISO-8601 strings to {@link LocalDate}, {@link LocalDateTime}, {@link LocalTime}, {@link Instant},
 *       {@link ZonedDateTime}, {@link OffsetDateTime}; epoch milliseconds to {@link Instant}</li>
 *   <li>{@link UUID} and {@link String}</li>
 * </ul>
 *
 * <p>All methods are stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeConversionUtils {

    private TypeConversionUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Converts a literal to the target type.
     *
     * @param targetType attribute Java type
     * @param value      decoded literal, may be {@code null}
     * @return the converted value, {@code null} for a {@code null} literal
     * @throws IllegalArgumentException if the literal cannot represent a value of the target type
     */
    public static Object convertValue(Class<?> targetType, Object value) {
        if (value == null) {
            return null;
        }

        Class<?> boxed = box(targetType);
        if (boxed.isInstance(value)) {
            return value;
        }

        try {
            if (boxed == BigDecimal.class) return new BigDecimal(value.toString());
            if (boxed == BigInteger.class) return toBigInteger(value);
            if (Number.class.isAssignableFrom(boxed)) return toNumber(boxed, value);
            if (boxed.isEnum()) return toEnum(boxed, value);
            if (boxed == Boolean.class) return toBoolean(value);

            if (boxed == LocalDate.class) return LocalDate.parse(value.toString());
            if (boxed == LocalDateTime.class) return LocalDateTime.parse(value.toString());
            if (boxed == LocalTime.class) return LocalTime.parse(value.toString());
            if (boxed == Instant.class) {
                return value instanceof Number n ? Instant.ofEpochMilli(toEpochMillis(n)) : Instant.parse(value.toString());
            }
            if (boxed == ZonedDateTime.class) return ZonedDateTime.parse(value.toString());
            if (boxed == OffsetDateTime.class) return OffsetDateTime.parse(value.toString());

            if (boxed == UUID.class) return UUID.fromString(value.toString());
            if (boxed == String.class) return value.toString();
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    String.format("Error converting value '%s' to type %s: %s",
                            value, targetType.getName(), e.getMessage()), e);
        }

        throw new IllegalArgumentException(
                String.format("Cannot convert value '%s' (type: %s) to target type %s",
                        value, value.getClass().getName(), targetType.getName()));
    }

    /**
     * Converts every element of a membership list.
     *
     * @param elementType attribute Java type
     * @param values      decoded list literal
     * @return a new list of converted values
     */
    public static List<Object> convertAll(Class<?> elementType, Collection<?> values) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object item : values) {
            result.add(convertValue(elementType, item));
        }
        return result;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return type;
    }

    private static Object toNumber(Class<?> targetType, Object value) {
        if (targetType == Double.class || targetType == Float.class) {
            double d = value instanceof Number num ? num.doubleValue() : Double.parseDouble(value.toString());
            Number result = targetType == Double.class ? (Number) d : (Number) (float) d;
            if (!Double.isFinite(result.doubleValue())) {
                throw outOfRange(targetType, value, null);
            }
            return result;
        }

        BigDecimal exact = new BigDecimal(value.toString().trim());
        try {
            if (targetType == Integer.class) return exact.intValueExact();
            if (targetType == Long.class) return exact.longValueExact();
            if (targetType == Short.class) return exact.shortValueExact();
            if (targetType == Byte.class) return exact.byteValueExact();
        } catch (ArithmeticException e) {
            throw outOfRange(targetType, value, e);
        }

        throw new IllegalArgumentException("Unsupported numeric type: " + targetType);
    }

    private static long toEpochMillis(Number value) {
        try {
            return new BigDecimal(value.toString()).longValueExact();
        } catch (ArithmeticException e) {
            throw outOfRange(Instant.class, value, e);
        }
    }

    private static IllegalArgumentException outOfRange(Class<?> targetType, Object value, ArithmeticException cause) {
        return new IllegalArgumentException(
                String.format("Value '%s' cannot be represented exactly as %s", value, targetType.getSimpleName()), cause);
    }

    private static BigInteger toBigInteger(Object value) {
        try {
            return new BigDecimal(value.toString().trim()).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw outOfRange(BigInteger.class, value, e);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object toEnum(Class<?> enumType, Object value) {
        String name = value.toString();
        for (Object constant : enumType.getEnumConstants()) {
            if (((Enum) constant).name().equalsIgnoreCase(name)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s", name, enumType.getSimpleName()));
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Number num) return num.intValue() != 0;

        String normalized = value.toString().trim().toLowerCase();
        if ("true".equals(normalized)) return Boolean.TRUE;
        if ("false".equals(normalized)) return Boolean.FALSE;
        throw new IllegalArgumentException("Invalid boolean value '" + value + "'");
    }
}
