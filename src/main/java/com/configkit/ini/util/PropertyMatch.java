package com.configkit.ini.util;

import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;

import lombok.Value;

/**
 * A property found by a document-wide search, with the section holding it
 * (the default section for properties before any header).
 */
@Value
public class PropertyMatch {

    Section section;
    Property property;
}
