package com.configkit.ini.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.configkit.ini.model.exception.DuplicateNameException;
import com.configkit.ini.model.exception.ElementNotFoundException;

/**
 * A named, ordered group of properties. Property names are unique ignoring case.
 * Not thread-safe.
 */
public class Section extends ElementBase implements Iterable<Property> {

    private final NamedElementMap<Property> properties = new NamedElementMap<>();

    public Section(String name) {
        super(name);
    }

    public int size() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public Optional<Property> get(String name) {
        return properties.get(name);
    }

    public Optional<Property> get(int index) {
        return properties.get(index);
    }

    /**
     * @throws ElementNotFoundException when no property has this name
     */
    public Property require(String name) {
        return get(name).orElseThrow(() -> new ElementNotFoundException(
                "Property '" + name + "' not found in section '" + getName() + "'"));
    }

    /**
     * Looks the property up and appends an empty one when it is missing.
     */
    public Property getOrCreate(String name) {
        Optional<Property> existing = get(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Property property = new Property(name);
        properties.append(property);
        return property;
    }

    public boolean has(String name) {
        return properties.containsName(name);
    }

    public int indexOf(String name) {
        return properties.indexOf(name);
    }

    public List<Property> getProperties() {
        return properties.values();
    }

    public Stream<Property> stream() {
        return getProperties().stream();
    }

    @Override
    public Iterator<Property> iterator() {
        return properties.iterator();
    }

    /**
     * @throws DuplicateNameException when a property with the same name exists
     */
    public void add(Property property) {
        checkNotDuplicate(property);
        properties.append(property);
    }

    public Property add(String name, String value) {
        Property property = new Property(name, value);
        add(property);
        return property;
    }

    public void addAll(Iterable<Property> toAdd) {
        for (Property property : toAdd) {
            if (property != null) {
                add(property);
            }
        }
    }

    /**
     * @throws IndexOutOfBoundsException when {@code index > size()}
     * @throws DuplicateNameException    when a property with the same name exists
     */
    public void insert(int index, Property property) {
        checkNotDuplicate(property);
        properties.insert(index, property);
    }

    public Property insert(int index, String name, String value) {
        Property property = new Property(name, value);
        insert(index, property);
        return property;
    }

    /**
     * Inserts {@code property} right before the property named {@code targetName}.
     */
    public void insertBefore(String targetName, Property property) {
        int index = properties.indexOf(targetName);
        if (index < 0) {
            throw new ElementNotFoundException("Target key '" + targetName + "' not found");
        }
        insert(index, property);
    }

    public boolean remove(String name) {
        return properties.remove(name).isPresent();
    }

    public boolean remove(int index) {
        return properties.remove(index).isPresent();
    }

    /**
     * Updates the value of an existing property or appends a new one.
     */
    public Property set(String name, String value) {
        Property property = getOrCreate(name);
        property.setValue(value);
        return property;
    }

    public Property set(String name, Object value) {
        Property property = getOrCreate(name);
        property.setValue(value);
        return property;
    }

    /**
     * Renames a property in place. Value, quoting and comments move to the new name as copies.
     */
    public Property rename(String oldName, String newName) {
        Property old = require(oldName);
        if (!NamedElementMap.key(oldName).equals(NamedElementMap.key(newName)) && has(newName)) {
            throw DuplicateNameException.forProperty(newName, getName());
        }
        int index = properties.indexOf(oldName);
        Property renamed = old.copyAs(newName);
        properties.remove(oldName);
        properties.insert(index, renamed);
        return renamed;
    }

    public <T> Optional<T> getValueAs(String name, Class<T> type) {
        return get(name).flatMap(p -> p.getValueAs(type));
    }

    /**
     * @throws ElementNotFoundException when the property is missing
     * @throws com.configkit.ini.model.exception.ValueConversionException when the value does not convert
     */
    public <T> T getRequiredValue(String name, Class<T> type) {
        return require(name).getRequiredValue(type);
    }

    public <T> T getValueOrDefault(String name, Class<T> type, T defaultValue) {
        return getValueAs(name, type).orElse(defaultValue);
    }

    /**
     * Re-orders the properties with {@code comparator}.
     */
    public void sort(Comparator<? super Property> comparator) {
        List<Property> ordered = new ArrayList<>(properties.values());
        ordered.sort(comparator);
        properties.reorder(ordered);
    }

    /**
     * Removes every property and all comments.
     */
    public void clear() {
        clearComments();
        properties.clear();
    }

    /**
     * Merges a copy of {@code other} into this section. {@code other} is never modified or aliased.
     *
     * <ul>
     *   <li>FIRST_WIN: existing properties stay, new names are appended.</li>
     *   <li>LAST_WIN: comments are taken from {@code other}; colliding properties are replaced in place.</li>
     *   <li>THROW_ERROR: any collision aborts before anything changes.</li>
     * </ul>
     */
    public void mergeFrom(Section other, DuplicateKeyPolicy policy) {
        if (other == null) {
            throw new IllegalArgumentException("Section to merge cannot be null");
        }
        Section source = other.copy();
        switch (policy) {
            case THROW_ERROR -> mergeOrThrow(source);
            case LAST_WIN -> mergeLastWin(source);
            default -> mergeFirstWin(source);
        }
    }

    private void mergeFirstWin(Section source) {
        for (Property property : source) {
            if (!has(property.getName())) {
                properties.append(property);
            }
        }
    }

    private void mergeLastWin(Section source) {
        copyCommentsFrom(source);
        for (Property property : source) {
            if (has(property.getName())) {
                properties.replace(property);
            } else {
                properties.append(property);
            }
        }
    }

    private void mergeOrThrow(Section source) {
        for (Property property : source) {
            if (has(property.getName())) {
                throw DuplicateNameException.forProperty(property.getName(), getName());
            }
        }
        getPreComments().addAll(source.getPreComments());
        appendComment(source.getComment());
        for (Property property : source) {
            properties.append(property);
        }
    }

    /**
     * Deep copy: properties and comments are cloned.
     */
    public Section copy() {
        return copyAs(getName());
    }

    public Section copyAs(String newName) {
        Section copy = new Section(newName);
        copy.copyCommentsFrom(this);
        for (Property property : properties) {
            copy.properties.append(property.copy());
        }
        return copy;
    }

    /**
     * Fluent {@link #set(String, String)}: an existing property of the same name takes the new value.
     */
    public Section withProperty(String name, String value) {
        set(name, value);
        return this;
    }

    public Section withProperty(String name, Object value) {
        set(name, value);
        return this;
    }

    public Section withComment(String comment) {
        setComment(new Comment(comment));
        return this;
    }

    public Section withPreComment(String comment) {
        addPreComment(comment);
        return this;
    }

    private void checkNotDuplicate(Property property) {
        if (property == null) {
            throw new IllegalArgumentException("Property cannot be null");
        }
        if (has(property.getName())) {
            throw DuplicateNameException.forProperty(property.getName(), getName());
        }
    }

    @Override
    public String toString() {
        return "[" + getName() + "] (" + size() + " properties)";
    }
}
