package com.configkit.ini.util;

import java.util.Comparator;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.ElementBase;
import com.configkit.ini.model.Section;

import lombok.experimental.UtilityClass;

/**
 * Alphabetical re-ordering of sections and properties, ignoring case.
 */
@UtilityClass
public class DocumentSorter {

    public static final Comparator<ElementBase> BY_NAME =
            Comparator.comparing(ElementBase::getName, String.CASE_INSENSITIVE_ORDER);

    public void sortProperties(Section section) {
        section.sort(BY_NAME);
    }

    /**
     * Sorts the properties of every section, the default section included.
     */
    public void sortProperties(Document document) {
        sortProperties(document.getDefaultSection());
        for (Section section : document) {
            sortProperties(section);
        }
    }

    public void sortSections(Document document) {
        document.sort(BY_NAME);
    }

    public void sortAll(Document document) {
        sortSections(document);
        sortProperties(document);
    }
}
