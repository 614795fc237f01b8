package com.configkit.ini.diff;

import java.util.ArrayList;
import java.util.List;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;

import lombok.Getter;

/**
 * Property-level differences of one section present on both sides.
 * The lists are mutable so callers can build partial diffs for a selective merge.
 */
@Getter
public class SectionDiff {

    private final String sectionName;
    private final List<Property> addedProperties = new ArrayList<>();
    private final List<Property> removedProperties = new ArrayList<>();
    private final List<PropertyDiff> modifiedProperties = new ArrayList<>();

    public SectionDiff(String sectionName) {
        if (sectionName == null || sectionName.isEmpty()) {
            throw new IllegalArgumentException("Section name cannot be empty");
        }
        this.sectionName = sectionName;
    }

    public boolean isDefaultSection() {
        return Document.DEFAULT_SECTION_NAME.equalsIgnoreCase(sectionName);
    }

    public boolean hasChanges() {
        return !addedProperties.isEmpty() || !removedProperties.isEmpty() || !modifiedProperties.isEmpty();
    }

    public int getChangeCount() {
        return addedProperties.size() + removedProperties.size() + modifiedProperties.size();
    }
}
