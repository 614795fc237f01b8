package com.configkit.ini.model.exception;

import lombok.Getter;

/**
 * Raised when a section or property name collides (case-insensitively) with an existing one.
 */
@Getter
public class DuplicateNameException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String elementName;
    private final String elementType;
    private final String sectionName;

    public DuplicateNameException(String message, String elementName, String elementType, String sectionName) {
        super(message);
        this.elementName = elementName;
        this.elementType = elementType;
        this.sectionName = sectionName;
    }

    public static DuplicateNameException forSection(String name) {
        return new DuplicateNameException("Section '" + name + "' already exists", name, "Section", null);
    }

    public static DuplicateNameException forProperty(String name, String sectionName) {
        return new DuplicateNameException(
                "Property '" + name + "' already exists in section '" + sectionName + "'",
                name, "Property", sectionName);
    }
}
