package com.configkit.ini.diff;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of the changes a merge actually applied.
 */
@Value
@Builder(toBuilder = true)
public class MergeResult {

    int sectionsAdded;
    int sectionsRemoved;
    int propertiesAdded;
    int propertiesRemoved;
    int propertiesModified;

    public int getTotalChanges() {
        return sectionsAdded + sectionsRemoved + propertiesAdded + propertiesRemoved + propertiesModified;
    }
}
