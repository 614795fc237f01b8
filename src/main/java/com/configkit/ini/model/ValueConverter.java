package com.configkit.ini.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

import com.configkit.ini.model.exception.ValueConversionException;

import lombok.experimental.UtilityClass;

/**
 * String to typed-value conversion used by the typed property accessors.
 * Conversion is fallible by result ({@link #tryConvert}); {@link #convert} unwraps it.
 */
@UtilityClass
public class ValueConverter {

    public static <T> T convert(String raw, Class<T> type) {
        return tryConvert(raw, type).orElseThrow(() -> new ValueConversionException(raw, type));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <T> Optional<T> tryConvert(String raw, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("Target type cannot be null");
        }
        if (raw == null) {
            return Optional.empty();
        }
        if (type == String.class) {
            return Optional.of((T) raw);
        }

        Class<?> boxed = box(type);
        String text = raw.trim();
        try {
            Object value;
            if (boxed == Integer.class) {
                value = Integer.valueOf(text);
            } else if (boxed == Boolean.class) {
                value = parseBoolean(text);
            } else if (boxed == Double.class) {
                value = Double.valueOf(text);
            } else if (boxed == Long.class) {
                value = Long.valueOf(text);
            } else if (boxed == Float.class) {
                value = Float.valueOf(text);
            } else if (boxed == BigDecimal.class) {
                value = new BigDecimal(text);
            } else if (boxed == BigInteger.class) {
                value = new BigInteger(text);
            } else if (boxed == Short.class) {
                value = Short.valueOf(text);
            } else if (boxed == Byte.class) {
                value = Byte.valueOf(text);
            } else if (boxed == Character.class) {
                value = raw.length() == 1 ? raw.charAt(0) : null;
            } else if (boxed.isEnum()) {
                value = parseEnum((Class<? extends Enum>) boxed, text);
            } else {
                throw new IllegalArgumentException("Unsupported target type: " + type.getName());
            }
            return Optional.ofNullable((T) value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Canonical text for a typed value, the inverse of {@link #tryConvert}.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    private static Boolean parseBoolean(String text) {
        if (text.equalsIgnoreCase("true") || text.equals("1") || text.equalsIgnoreCase("yes")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("false") || text.equals("0") || text.equalsIgnoreCase("no")) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> enumType, String text) {
        for (E constant : enumType.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(text)) {
                return constant;
            }
        }
        String normalized = text.toUpperCase(Locale.ROOT).replace('-', '_');
        for (E constant : enumType.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        return null;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) return Integer.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == long.class) return Long.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        throw new IllegalArgumentException("Unsupported primitive type: " + type.getName());
    }
}
