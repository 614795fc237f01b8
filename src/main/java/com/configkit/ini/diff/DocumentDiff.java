package com.configkit.ini.diff;

import java.util.ArrayList;
import java.util.List;

import com.configkit.ini.model.Section;

import lombok.Getter;

/**
 * Structural differences between two documents. Added and removed sections are copies carrying
 * their properties; modified sections list only sections with at least one property change.
 *
 * Pure structure: a diff built by hand (for example holding a single item) is a valid merge input.
 */
@Getter
public class DocumentDiff {

    private final List<Section> addedSections = new ArrayList<>();
    private final List<Section> removedSections = new ArrayList<>();
    private final List<SectionDiff> modifiedSections = new ArrayList<>();

    public boolean hasChanges() {
        return !addedSections.isEmpty() || !removedSections.isEmpty() || !modifiedSections.isEmpty();
    }
}
