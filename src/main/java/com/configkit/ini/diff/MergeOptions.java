package com.configkit.ini.diff;

import lombok.Builder;
import lombok.Value;

/**
 * Independent switches selecting which categories of a {@link DocumentDiff} a merge applies.
 * Additions and modifications are applied by default, removals are not.
 */
@Value
@Builder(toBuilder = true)
public class MergeOptions {

    @Builder.Default
    boolean applyAddedSections = true;
    boolean applyRemovedSections;
    @Builder.Default
    boolean applyAddedProperties = true;
    boolean applyRemovedProperties;
    @Builder.Default
    boolean applyModifiedProperties = true;

    public static MergeOptions defaults() {
        return builder().build();
    }

    public static MergeOptions all() {
        return builder()
                .applyRemovedSections(true)
                .applyRemovedProperties(true)
                .build();
    }

    public static MergeOptions none() {
        return builder()
                .applyAddedSections(false)
                .applyAddedProperties(false)
                .applyModifiedProperties(false)
                .build();
    }
}
