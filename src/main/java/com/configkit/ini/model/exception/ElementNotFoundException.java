package com.configkit.ini.model.exception;

/**
 * Raised by the throwing accessors when a named section or property does not exist.
 */
public class ElementNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ElementNotFoundException(String message) {
        super(message);
    }
}
