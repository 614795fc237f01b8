package com.configkit.ini.model;

/**
 * How a repeated property name within one section is resolved.
 */
public enum DuplicateKeyPolicy {

    /**
     * Keep the existing property, drop the newcomer.
     */
    FIRST_WIN,

    /**
     * The newcomer replaces the existing property.
     */
    LAST_WIN,

    /**
     * Abort the whole operation.
     */
    THROW_ERROR
}
