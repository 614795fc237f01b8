package com.configkit.ini.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;

import lombok.experimental.UtilityClass;

/**
 * Read-only lookups over documents and sections. Name patterns are regular expressions matched
 * case-insensitively anywhere in the name; compiled patterns are cached.
 */
@UtilityClass
public class DocumentQueries {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    public List<Section> sectionsWhere(Document document, Predicate<Section> predicate) {
        return document.stream().filter(predicate).collect(Collectors.toList());
    }

    public List<Section> sectionsMatching(Document document, String namePattern) {
        Pattern pattern = compile(namePattern);
        return sectionsWhere(document, s -> pattern.matcher(s.getName()).find());
    }

    public List<Property> propertiesWhere(Section section, Predicate<Property> predicate) {
        return section.stream().filter(predicate).collect(Collectors.toList());
    }

    public List<Property> propertiesMatching(Section section, String namePattern) {
        Pattern pattern = compile(namePattern);
        return propertiesWhere(section, p -> pattern.matcher(p.getName()).find());
    }

    public List<Property> propertiesWithValue(Section section, String value) {
        return propertiesWhere(section, p -> p.getValue().equals(value));
    }

    public List<Property> propertiesContaining(Section section, String text) {
        return propertiesWhere(section, p -> p.getValue().contains(text));
    }

    /**
     * Every property named {@code name} (case-insensitive), default section first.
     */
    public List<PropertyMatch> findByName(Document document, String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Property name cannot be empty");
        }
        List<PropertyMatch> matches = new ArrayList<>();
        for (Section section : allSections(document)) {
            section.get(name).ifPresent(p -> matches.add(new PropertyMatch(section, p)));
        }
        return matches;
    }

    /**
     * Every property whose value equals {@code value} exactly, default section first.
     */
    public List<PropertyMatch> findByValue(Document document, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        List<PropertyMatch> matches = new ArrayList<>();
        for (Section section : allSections(document)) {
            for (Property property : section) {
                if (property.getValue().equals(value)) {
                    matches.add(new PropertyMatch(section, property));
                }
            }
        }
        return matches;
    }

    /**
     * Deep copy keeping the default section and the sections accepted by {@code filter}.
     */
    public Document copyWithSections(Document source, Predicate<Section> filter) {
        Document copy = new Document(source.getCommentPrefixChars(), source.getDefaultCommentPrefixChar());
        for (Property property : source.getDefaultSection()) {
            copy.getDefaultSection().add(property.copy());
        }
        for (Section section : source) {
            if (filter.test(section)) {
                copy.add(section.copy());
            }
        }
        return copy;
    }

    /**
     * Copy of {@code source} (comments included) holding only the properties accepted by {@code filter}.
     */
    public Section copyWithProperties(Section source, Predicate<Property> filter) {
        Section copy = source.copy();
        for (Property property : source) {
            if (!filter.test(property)) {
                copy.remove(property.getName());
            }
        }
        return copy;
    }

    private List<Section> allSections(Document document) {
        List<Section> sections = new ArrayList<>(document.size() + 1);
        sections.add(document.getDefaultSection());
        sections.addAll(document.getSections());
        return sections;
    }

    private Pattern compile(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("Name pattern cannot be empty");
        }
        return PATTERN_CACHE.computeIfAbsent(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE));
    }
}
