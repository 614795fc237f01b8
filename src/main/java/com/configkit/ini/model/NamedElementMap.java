package com.configkit.ini.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered map of elements keyed case-insensitively by {@link ElementBase#getName()}.
 * Order and lookup live in the same {@link LinkedHashMap}, so they cannot drift apart.
 *
 * @param <E> section or property
 */
class NamedElementMap<E extends ElementBase> implements Iterable<E> {

    private LinkedHashMap<String, E> elements = new LinkedHashMap<>();

    /**
     * Folds one character at a time, the same way {@link String#CASE_INSENSITIVE_ORDER} compares,
     * so a name never changes length ({@code straße} and {@code STRASSE} stay distinct).
     */
    static String key(String name) {
        StringBuilder folded = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            folded.append(Character.toLowerCase(Character.toUpperCase(name.charAt(i))));
        }
        return folded.toString();
    }

    int size() {
        return elements.size();
    }

    boolean isEmpty() {
        return elements.isEmpty();
    }

    boolean containsName(String name) {
        return name != null && elements.containsKey(key(name));
    }

    Optional<E> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(elements.get(key(name)));
    }

    Optional<E> get(int index) {
        if (index < 0 || index >= elements.size()) {
            return Optional.empty();
        }
        int i = 0;
        for (E element : elements.values()) {
            if (i++ == index) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    int indexOf(String name) {
        if (name == null) {
            return -1;
        }
        String k = key(name);
        int i = 0;
        for (String existing : elements.keySet()) {
            if (existing.equals(k)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Appends {@code element}; the caller has checked for a collision.
     */
    void append(E element) {
        elements.put(key(element.getName()), element);
    }

    /**
     * Inserts at {@code index} (0..size).
     */
    void insert(int index, E element) {
        if (index < 0 || index > elements.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range [0, " + elements.size() + "]");
        }
        if (index == elements.size()) {
            append(element);
            return;
        }
        LinkedHashMap<String, E> rebuilt = new LinkedHashMap<>();
        int i = 0;
        for (Map.Entry<String, E> entry : elements.entrySet()) {
            if (i++ == index) {
                rebuilt.put(key(element.getName()), element);
            }
            rebuilt.put(entry.getKey(), entry.getValue());
        }
        elements = rebuilt;
    }

    /**
     * Swaps in {@code element} at the position of the same-named element.
     */
    void replace(E element) {
        String k = key(element.getName());
        if (!elements.containsKey(k)) {
            throw new IllegalStateException("No element named '" + element.getName() + "' to replace");
        }
        elements.put(k, element);
    }

    Optional<E> remove(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(elements.remove(key(name)));
    }

    Optional<E> remove(int index) {
        return get(index).flatMap(e -> remove(e.getName()));
    }

    void clear() {
        elements.clear();
    }

    /**
     * Re-orders the elements; {@code ordered} must contain exactly the current elements.
     */
    void reorder(List<E> ordered) {
        LinkedHashMap<String, E> rebuilt = new LinkedHashMap<>();
        for (E element : ordered) {
            rebuilt.put(key(element.getName()), element);
        }
        if (rebuilt.size() != elements.size() || !rebuilt.keySet().containsAll(elements.keySet())) {
            throw new IllegalArgumentException("Re-ordered elements must match the existing elements");
        }
        elements = rebuilt;
    }

    List<E> values() {
        return Collections.unmodifiableList(new ArrayList<>(elements.values()));
    }

    @Override
    public Iterator<E> iterator() {
        return values().iterator();
    }
}
