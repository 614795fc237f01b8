package com.configkit.ini.diff;

import lombok.Value;

/**
 * A key present on both sides whose value differs.
 */
@Value
public class PropertyDiff {

    String propertyName;
    String oldValue;
    String newValue;
}
