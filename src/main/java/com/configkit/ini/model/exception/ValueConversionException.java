package com.configkit.ini.model.exception;

import lombok.Getter;

/**
 * Raised when a property's string value cannot be converted to the requested type.
 */
@Getter
public class ValueConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String rawValue;
    private final Class<?> targetType;

    public ValueConversionException(String rawValue, Class<?> targetType) {
        this("Cannot convert '" + rawValue + "' to " + targetType.getSimpleName(), rawValue, targetType);
    }

    public ValueConversionException(String message, String rawValue, Class<?> targetType) {
        super(message);
        this.rawValue = rawValue;
        this.targetType = targetType;
    }
}
