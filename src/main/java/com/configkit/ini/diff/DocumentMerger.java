package com.configkit.ini.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.DuplicateKeyPolicy;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;

/**
 * Applies a {@link DocumentDiff} to a target document in place.
 *
 * Every item is applied independently and tolerates a target that no longer matches the diff:
 * - an added section that already exists is folded into the existing one, keeping existing keys
 * - an added property is inserted only when missing
 * - a modified property is created when missing
 * - removing something absent does nothing
 *
 * Only changes that altered the target are counted.
 */
public class DocumentMerger {
    private static final Logger log = LoggerFactory.getLogger(DocumentMerger.class);

    public MergeResult merge(Document target, DocumentDiff diff, MergeOptions options) {
        if (target == null || diff == null || options == null) {
            throw new IllegalArgumentException("Merge target, diff and options are required");
        }
        Counts counts = new Counts();

        if (options.isApplyAddedSections()) {
            for (Section added : diff.getAddedSections()) {
                addSection(target, added, counts);
            }
        }
        if (options.isApplyRemovedSections()) {
            for (Section removed : diff.getRemovedSections()) {
                if (target.remove(removed.getName())) {
                    counts.sectionsRemoved++;
                }
            }
        }
        for (SectionDiff sectionDiff : diff.getModifiedSections()) {
            mergeSection(target, sectionDiff, options, counts);
        }

        MergeResult result = counts.toResult();
        log.debug("Merge applied {} changes", result.getTotalChanges());
        return result;
    }

    private void addSection(Document target, Section added, Counts counts) {
        Section existing = target.resolve(added.getName()).orElse(null);
        if (existing == null) {
            target.add(added.copy());
            counts.sectionsAdded++;
            return;
        }
        int before = existing.size();
        existing.mergeFrom(added, DuplicateKeyPolicy.FIRST_WIN);
        counts.propertiesAdded += existing.size() - before;
    }

    private void mergeSection(Document target, SectionDiff diff, MergeOptions options, Counts counts) {
        Section section = target.resolve(diff.getSectionName()).orElse(null);

        if (options.isApplyAddedProperties()) {
            for (Property added : diff.getAddedProperties()) {
                if (section == null) {
                    section = target.add(diff.getSectionName());
                }
                if (!section.has(added.getName())) {
                    section.add(added.copy());
                    counts.propertiesAdded++;
                }
            }
        }
        if (options.isApplyRemovedProperties() && section != null) {
            for (Property removed : diff.getRemovedProperties()) {
                if (section.remove(removed.getName())) {
                    counts.propertiesRemoved++;
                }
            }
        }
        if (options.isApplyModifiedProperties()) {
            for (PropertyDiff modified : diff.getModifiedProperties()) {
                if (section == null) {
                    section = target.add(diff.getSectionName());
                }
                Property property = section.get(modified.getPropertyName()).orElse(null);
                if (property == null) {
                    section.add(modified.getPropertyName(), modified.getNewValue());
                    counts.propertiesModified++;
                } else if (!property.getValue().equals(modified.getNewValue())) {
                    property.setValue(modified.getNewValue());
                    counts.propertiesModified++;
                }
            }
        }
    }

    private static final class Counts {
        int sectionsAdded;
        int sectionsRemoved;
        int propertiesAdded;
        int propertiesRemoved;
        int propertiesModified;

        MergeResult toResult() {
            return MergeResult.builder()
                    .sectionsAdded(sectionsAdded)
                    .sectionsRemoved(sectionsRemoved)
                    .propertiesAdded(propertiesAdded)
                    .propertiesRemoved(propertiesRemoved)
                    .propertiesModified(propertiesModified)
                    .build();
        }
    }
}
