package com.configkit.ini.diff;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;
import com.configkit.ini.parser.IniParser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DocumentComparator.
 */
class DocumentComparatorTest {

    private final IniParser parser = new IniParser();

    private final Document left = parser.parse("""
            mode = dev
            [shared]
            keep = 1
            change = old
            gone = x
            [onlyLeft]
            a = 1
            """);

    private final Document right = parser.parse("""
            mode = prod
            [SHARED]
            keep = 1
            change = new
            fresh = y
            [onlyRight]
            b = 2
            """);

    @Test
    void testSectionLevelChanges() {
        DocumentDiff diff = new DocumentComparator().compare(left, right);

        assertThat(diff.hasChanges()).isTrue();
        assertThat(diff.getAddedSections()).extracting(Section::getName).containsExactly("onlyRight");
        assertThat(diff.getRemovedSections()).extracting(Section::getName).containsExactly("onlyLeft");
        assertThat(diff.getModifiedSections()).extracting(SectionDiff::getSectionName)
                .containsExactly(Document.DEFAULT_SECTION_NAME, "shared");
    }

    @Test
    void testPropertyLevelChanges() {
        DocumentDiff diff = new DocumentComparator().compare(left, right);

        SectionDiff defaults = diff.getModifiedSections().get(0);
        assertThat(defaults.isDefaultSection()).isTrue();
        assertThat(defaults.getModifiedProperties()).containsExactly(new PropertyDiff("mode", "dev", "prod"));

        SectionDiff shared = diff.getModifiedSections().get(1);
        assertThat(shared.getAddedProperties()).extracting(Property::getName).containsExactly("fresh");
        assertThat(shared.getRemovedProperties()).extracting(Property::getName).containsExactly("gone");
        assertThat(shared.getModifiedProperties()).containsExactly(new PropertyDiff("change", "old", "new"));
        assertThat(shared.getChangeCount()).isEqualTo(3);
    }

    @Test
    void testDiffIsSymmetric() {
        DocumentDiff forward = new DocumentComparator().compare(left, right);
        DocumentDiff backward = new DocumentComparator().compare(right, left);

        assertThat(forward.getAddedSections()).extracting(Section::getName)
                .containsExactlyElementsOf(backward.getRemovedSections().stream().map(Section::getName).toList());
        assertThat(forward.getRemovedSections()).extracting(Section::getName)
                .containsExactlyElementsOf(backward.getAddedSections().stream().map(Section::getName).toList());

        SectionDiff sharedForward = forward.getModifiedSections().get(1);
        SectionDiff sharedBackward = backward.getModifiedSections().get(1);
        assertThat(sharedForward.getAddedProperties()).extracting(Property::getName)
                .containsExactlyElementsOf(sharedBackward.getRemovedProperties().stream().map(Property::getName).toList());
    }

    @Test
    void testIdenticalDocumentsHaveNoChanges() {
        DocumentDiff diff = left.compare(left.copy());

        assertThat(diff.hasChanges()).isFalse();
        assertThat(diff.getModifiedSections()).isEmpty();
    }

    @Test
    void testValuesAreComparedExactly() {
        Document upper = new Document().withDefaultProperty("k", "Value");
        Document lower = new Document().withDefaultProperty("K", "value");

        DocumentDiff diff = upper.compare(lower);

        assertThat(diff.getModifiedSections()).hasSize(1);
        assertThat(diff.getModifiedSections().get(0).getModifiedProperties()).hasSize(1);
    }

    @Test
    void testCommentsAreIgnored() {
        Document a = parser.parse("[s] ; one\nk = v ; note\n");
        Document b = parser.parse("; above\n[s]\nk = v\n");

        assertThat(a.compare(b).hasChanges()).isFalse();
    }

    @Test
    void testDiffHoldsCopies() {
        DocumentDiff diff = new DocumentComparator().compare(left, right);

        diff.getAddedSections().get(0).require("b").setValue("changed");

        assertThat(right.require("onlyRight").require("b").getValue()).isEqualTo("2");
        assertThat(diff.getAddedSections().get(0)).isNotSameAs(right.require("onlyRight"));
    }
}
