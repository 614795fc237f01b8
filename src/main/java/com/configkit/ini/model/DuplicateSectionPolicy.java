package com.configkit.ini.model;

/**
 * How a repeated section header is resolved while parsing.
 */
public enum DuplicateSectionPolicy {

    FIRST_WIN,

    LAST_WIN,

    /**
     * Fold the repeated section's properties into the first one, using the key policy.
     */
    MERGE,

    THROW_ERROR
}
