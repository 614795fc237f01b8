package com.configkit.ini.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.configkit.ini.diff.DocumentComparator;
import com.configkit.ini.diff.DocumentDiff;
import com.configkit.ini.diff.DocumentMerger;
import com.configkit.ini.diff.MergeOptions;
import com.configkit.ini.diff.MergeResult;
import com.configkit.ini.model.exception.DuplicateNameException;
import com.configkit.ini.model.exception.ElementNotFoundException;

import lombok.Getter;

/**
 * An INI document: the default section (properties before any header), the ordered named
 * sections, the recognised comment prefixes and any errors recorded while parsing.
 * Not thread-safe; callers serialize access.
 */
public class Document implements Iterable<Section> {

    /**
     * Reserved name of the default section; no named section may use it.
     */
    public static final String DEFAULT_SECTION_NAME = "$DEFAULT";

    public static final String DEFAULT_COMMENT_PREFIX_CHARS = ";#";

    @Getter
    private final Section defaultSection = new Section(DEFAULT_SECTION_NAME);
    private final NamedElementMap<Section> sections = new NamedElementMap<>();
    private final String commentPrefixChars;
    @Getter
    private char defaultCommentPrefixChar;
    private final List<ParsingError> parsingErrors = new ArrayList<>();

    public Document() {
        this(DEFAULT_COMMENT_PREFIX_CHARS, Comment.DEFAULT_PREFIX);
    }

    public Document(String commentPrefixChars, char defaultCommentPrefixChar) {
        if (commentPrefixChars == null || commentPrefixChars.isEmpty()) {
            throw new IllegalArgumentException("At least one comment prefix character is required");
        }
        for (int i = 0; i < commentPrefixChars.length(); i++) {
            char c = commentPrefixChars.charAt(i);
            if (Character.isWhitespace(c) || c == '[' || c == '=' || c == '"') {
                throw new IllegalArgumentException("Invalid comment prefix character: '" + c + "'");
            }
        }
        this.commentPrefixChars = commentPrefixChars;
        setDefaultCommentPrefixChar(defaultCommentPrefixChar);
    }

    public String getCommentPrefixChars() {
        return commentPrefixChars;
    }

    public boolean isCommentPrefix(char c) {
        return commentPrefixChars.indexOf(c) >= 0;
    }

    /**
     * @throws IllegalArgumentException when {@code prefix} is not one of the recognised prefixes
     */
    public void setDefaultCommentPrefixChar(char prefix) {
        if (!isCommentPrefix(prefix)) {
            throw new IllegalArgumentException("Invalid character prefix: '" + prefix + "'");
        }
        this.defaultCommentPrefixChar = prefix;
    }

    /**
     * A new comment using the document's default prefix.
     */
    public Comment newComment(String text) {
        return new Comment(defaultCommentPrefixChar, text);
    }

    // ---- parsing errors

    public List<ParsingError> getParsingErrors() {
        return Collections.unmodifiableList(parsingErrors);
    }

    public boolean hasParsingErrors() {
        return !parsingErrors.isEmpty();
    }

    public void addParsingError(ParsingError error) {
        parsingErrors.add(error);
    }

    // ---- sections

    public int size() {
        return sections.size();
    }

    public boolean isEmpty() {
        return sections.isEmpty() && defaultSection.isEmpty();
    }

    public Optional<Section> get(String name) {
        return sections.get(name);
    }

    public Optional<Section> get(int index) {
        return sections.get(index);
    }

    /**
     * Like {@link #get(String)}, but {@link #DEFAULT_SECTION_NAME}, in any case, addresses the default section.
     */
    public Optional<Section> resolve(String name) {
        if (DEFAULT_SECTION_NAME.equalsIgnoreCase(name)) {
            return Optional.of(defaultSection);
        }
        return get(name);
    }

    /**
     * @throws ElementNotFoundException when no section has this name
     */
    public Section require(String name) {
        return get(name).orElseThrow(() -> new ElementNotFoundException("Section '" + name + "' not found"));
    }

    /**
     * Looks the section up and appends an empty one when it is missing.
     */
    public Section getOrCreate(String name) {
        Optional<Section> existing = get(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Section section = new Section(name);
        add(section);
        return section;
    }

    public boolean has(String name) {
        return sections.containsName(name);
    }

    public int indexOf(String name) {
        return sections.indexOf(name);
    }

    public List<Section> getSections() {
        return sections.values();
    }

    public Stream<Section> stream() {
        return getSections().stream();
    }

    @Override
    public Iterator<Section> iterator() {
        return sections.iterator();
    }

    /**
     * @throws DuplicateNameException when a section with the same name exists
     */
    public void add(Section section) {
        checkAddable(section);
        sections.append(section);
    }

    public Section add(String name) {
        Section section = new Section(name);
        add(section);
        return section;
    }

    /**
     * @throws IndexOutOfBoundsException when {@code index > size()}
     */
    public void insert(int index, Section section) {
        checkAddable(section);
        sections.insert(index, section);
    }

    public Section insert(int index, String name) {
        Section section = new Section(name);
        insert(index, section);
        return section;
    }

    /**
     * @throws ElementNotFoundException when no section is named {@code targetName}
     */
    public void insertBefore(String targetName, Section section) {
        int index = sections.indexOf(targetName);
        if (index < 0) {
            throw new ElementNotFoundException("Target section '" + targetName + "' not found");
        }
        insert(index, section);
    }

    public boolean remove(String name) {
        return sections.remove(name).isPresent();
    }

    public boolean remove(int index) {
        return sections.remove(index).isPresent();
    }

    /**
     * Renames a section in place; properties and comments move to the new name as copies.
     */
    public Section rename(String oldName, String newName) {
        Section old = require(oldName);
        if (!NamedElementMap.key(oldName).equals(NamedElementMap.key(newName)) && has(newName)) {
            throw DuplicateNameException.forSection(newName);
        }
        checkNotReserved(newName);
        int index = sections.indexOf(oldName);
        Section renamed = old.copyAs(newName);
        sections.remove(oldName);
        sections.insert(index, renamed);
        return renamed;
    }

    public void sort(Comparator<? super Section> comparator) {
        List<Section> ordered = new ArrayList<>(sections.values());
        ordered.sort(comparator);
        sections.reorder(ordered);
    }

    /**
     * Removes all named sections; the default section is kept.
     */
    public void clear() {
        sections.clear();
    }

    // ---- typed access

    public <T> Optional<T> getValueAs(String sectionName, String key, Class<T> type) {
        return resolve(sectionName).flatMap(s -> s.getValueAs(key, type));
    }

    /**
     * @throws ElementNotFoundException when the section or property is missing
     */
    public <T> T getRequiredValue(String sectionName, String key, Class<T> type) {
        Section section = resolve(sectionName)
                .orElseThrow(() -> new ElementNotFoundException("Section '" + sectionName + "' not found"));
        return section.getRequiredValue(key, type);
    }

    public <T> T getValueOrDefault(String sectionName, String key, Class<T> type, T defaultValue) {
        return getValueAs(sectionName, key, type).orElse(defaultValue);
    }

    // ---- copy, diff, merge

    /**
     * Deep copy with the same comment prefixes. Parsing errors are not carried over.
     */
    public Document copy() {
        Document copy = new Document(commentPrefixChars, defaultCommentPrefixChar);
        copy.defaultSection.mergeFrom(defaultSection, DuplicateKeyPolicy.LAST_WIN);
        for (Section section : sections) {
            copy.sections.append(section.copy());
        }
        return copy;
    }

    /**
     * Replaces this document's content with copies of {@code source}'s sections and default properties.
     */
    public void restoreFrom(Document source) {
        sections.clear();
        defaultSection.clear();
        defaultSection.mergeFrom(source.defaultSection, DuplicateKeyPolicy.LAST_WIN);
        for (Section section : source.sections) {
            sections.append(section.copy());
        }
    }

    /**
     * Structural differences from this document (left) to {@code other} (right).
     */
    public DocumentDiff compare(Document other) {
        return new DocumentComparator().compare(this, other);
    }

    public MergeResult merge(DocumentDiff diff) {
        return merge(diff, MergeOptions.defaults());
    }

    public MergeResult merge(DocumentDiff diff, MergeOptions options) {
        return new DocumentMerger().merge(this, diff, options);
    }

    public Document withSection(String name) {
        add(name);
        return this;
    }

    public Document withSection(Section section) {
        add(section);
        return this;
    }

    /**
     * Sets a property of the default section, overwriting one of the same name.
     */
    public Document withDefaultProperty(String key, String value) {
        defaultSection.set(key, value);
        return this;
    }

    public Document withDefaultProperty(String key, Object value) {
        defaultSection.set(key, value);
        return this;
    }

    private void checkAddable(Section section) {
        if (section == null) {
            throw new IllegalArgumentException("Section cannot be null");
        }
        checkNotReserved(section.getName());
        if (has(section.getName())) {
            throw DuplicateNameException.forSection(section.getName());
        }
    }

    private static void checkNotReserved(String name) {
        if (DEFAULT_SECTION_NAME.equalsIgnoreCase(name)) {
            throw new IllegalArgumentException("Section name '" + DEFAULT_SECTION_NAME + "' is reserved");
        }
    }
}
