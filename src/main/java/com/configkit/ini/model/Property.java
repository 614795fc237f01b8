package com.configkit.ini.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;

/**
 * A key/value line. The value is always held as text; typed access converts on read.
 * Not thread-safe.
 */
public class Property extends ElementBase {

    @Getter
    private String value;

    /**
     * Serialization hint: write the value between double quotes.
     */
    @Getter
    @Setter
    private boolean quoted;

    public Property(String name) {
        this(name, "");
    }

    public Property(String name, String value) {
        super(name);
        this.value = value == null ? "" : value;
    }

    public void setValue(String value) {
        this.value = value == null ? "" : value;
    }

    /**
     * Stores the canonical text of a typed value.
     */
    public void setValue(Object value) {
        this.value = ValueConverter.toText(value);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * The value converted to {@code type}, or empty when it does not convert.
     */
    public <T> Optional<T> getValueAs(Class<T> type) {
        return ValueConverter.tryConvert(value, type);
    }

    /**
     * @throws com.configkit.ini.model.exception.ValueConversionException when the value does not convert
     */
    public <T> T getRequiredValue(Class<T> type) {
        return ValueConverter.convert(value, type);
    }

    public <T> T getValueOrDefault(Class<T> type, T defaultValue) {
        return getValueAs(type).orElse(defaultValue);
    }

    public <T> List<T> getValueArray(Class<T> elementType) {
        return getValueArray(elementType, ArrayValueCodec.DEFAULT_MAX_ELEMENTS);
    }

    /**
     * Decodes a <code>{a, b, c}</code> value.
     *
     * @param maxElements 0 for no limit
     */
    public <T> List<T> getValueArray(Class<T> elementType, int maxElements) {
        return ArrayValueCodec.decode(value, elementType, maxElements);
    }

    public void setValueArray(Collection<?> values) {
        this.value = ArrayValueCodec.encode(values);
    }

    /**
     * Deep copy, comments included.
     */
    public Property copy() {
        return copyAs(getName());
    }

    /**
     * Copy under a different name, keeping value, quoting and comments.
     */
    public Property copyAs(String newName) {
        Property copy = new Property(newName, value);
        copy.quoted = quoted;
        copy.copyCommentsFrom(this);
        return copy;
    }

    public Property withValue(String value) {
        setValue(value);
        return this;
    }

    public Property withValue(Object value) {
        setValue(value);
        return this;
    }

    public Property withQuoted(boolean quoted) {
        this.quoted = quoted;
        return this;
    }

    public Property withComment(String comment) {
        setComment(new Comment(comment));
        return this;
    }

    public Property withPreComment(String comment) {
        addPreComment(comment);
        return this;
    }

    @Override
    public String toString() {
        return getName() + "=" + value;
    }
}
