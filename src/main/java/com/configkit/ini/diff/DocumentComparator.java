package com.configkit.ini.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;

/**
 * Compares two documents by section and property name, case-insensitively.
 * Values are compared exactly; comments and quoting are not part of the comparison.
 */
public class DocumentComparator {
    private static final Logger log = LoggerFactory.getLogger(DocumentComparator.class);

    /**
     * Differences that turn {@code left} into {@code right}. Neither document is modified.
     */
    public DocumentDiff compare(Document left, Document right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Documents to compare cannot be null");
        }
        DocumentDiff diff = new DocumentDiff();

        SectionDiff defaults = compareSections(Document.DEFAULT_SECTION_NAME,
                left.getDefaultSection(), right.getDefaultSection());
        if (defaults.hasChanges()) {
            diff.getModifiedSections().add(defaults);
        }

        for (Section rightSection : right) {
            Section leftSection = left.get(rightSection.getName()).orElse(null);
            if (leftSection == null) {
                diff.getAddedSections().add(rightSection.copy());
                continue;
            }
            SectionDiff sectionDiff = compareSections(leftSection.getName(), leftSection, rightSection);
            if (sectionDiff.hasChanges()) {
                diff.getModifiedSections().add(sectionDiff);
            }
        }

        for (Section leftSection : left) {
            if (!right.has(leftSection.getName())) {
                diff.getRemovedSections().add(leftSection.copy());
            }
        }

        log.debug("Compared documents: {} added, {} removed, {} modified sections",
                diff.getAddedSections().size(), diff.getRemovedSections().size(),
                diff.getModifiedSections().size());
        return diff;
    }

    SectionDiff compareSections(String name, Section left, Section right) {
        SectionDiff diff = new SectionDiff(name);
        for (Property rightProperty : right) {
            Property leftProperty = left.get(rightProperty.getName()).orElse(null);
            if (leftProperty == null) {
                diff.getAddedProperties().add(rightProperty.copy());
            } else if (!leftProperty.getValue().equals(rightProperty.getValue())) {
                diff.getModifiedProperties().add(new PropertyDiff(
                        rightProperty.getName(), leftProperty.getValue(), rightProperty.getValue()));
            }
        }
        for (Property leftProperty : left) {
            if (!right.has(leftProperty.getName())) {
                diff.getRemovedProperties().add(leftProperty.copy());
            }
        }
        return diff;
    }
}
