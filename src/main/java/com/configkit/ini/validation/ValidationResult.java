package com.configkit.ini.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a single check: valid, or invalid with a message for the user.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    boolean valid;
    String errorMessage;

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult error(String message) {
        return new ValidationResult(false, message);
    }
}
