package com.configkit.ini.model;

import java.util.Objects;

import lombok.Getter;

/**
 * A single-line comment: a prefix character (e.g. ';' or '#') and the text that follows it.
 * The text never contains a line terminator.
 */
@Getter
public class Comment {

    public static final char DEFAULT_PREFIX = ';';

    private char prefix;
    private String value;

    public Comment(String value) {
        this(DEFAULT_PREFIX, value);
    }

    public Comment(char prefix, String value) {
        setPrefix(prefix);
        setValue(value);
    }

    public void setPrefix(char prefix) {
        if (prefix == '\r' || prefix == '\n' || Character.isWhitespace(prefix)) {
            throw new IllegalArgumentException("Comment prefix must be a visible character");
        }
        this.prefix = prefix;
    }

    /**
     * @throws IllegalArgumentException when the text contains '\r' or '\n'
     */
    public void setValue(String value) {
        String text = value == null ? "" : value;
        if (containsLineBreak(text)) {
            throw new IllegalArgumentException("Comment value cannot contain newline characters");
        }
        this.value = text;
    }

    /**
     * Non-throwing variant of {@link #setValue(String)}.
     */
    public boolean trySetValue(String value) {
        String text = value == null ? "" : value;
        if (containsLineBreak(text)) {
            return false;
        }
        this.value = text;
        return true;
    }

    public Comment copy() {
        return new Comment(prefix, value);
    }

    static boolean containsLineBreak(String text) {
        return text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comment other)) return false;
        return prefix == other.prefix && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, value);
    }

    @Override
    public String toString() {
        return prefix + value;
    }
}
