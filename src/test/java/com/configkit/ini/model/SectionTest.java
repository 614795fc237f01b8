package com.configkit.ini.model;

import com.configkit.ini.model.exception.DuplicateNameException;
import com.configkit.ini.model.exception.ElementNotFoundException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Section.
 */
class SectionTest {

    @Test
    void testLookupIsCaseInsensitive() {
        Section section = new Section("Server");
        Property property = section.add("Key", "1");

        assertThat(section.has("KEY")).isTrue();
        assertThat(section.get("key")).containsSame(property);
        assertThat(section.get("kEy")).containsSame(section.get("Key").get());
    }

    @Test
    void testGetDoesNotCreate() {
        Section section = new Section("s");

        assertThat(section.get("missing")).isEmpty();
        assertThat(section.size()).isZero();

        Property created = section.getOrCreate("missing");

        assertThat(section.size()).isEqualTo(1);
        assertThat(section.getOrCreate("MISSING")).isSameAs(created);
    }

    @Test
    void testAddDuplicateFails() {
        Section section = new Section("s");
        section.add("name", "a");

        assertThatThrownBy(() -> section.add("NAME", "b"))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessage("Property 'NAME' already exists in section 's'");
        assertThat(section.size()).isEqualTo(1);
    }

    @Test
    void testNamesThatOnlyMatchAfterExpansionStayDistinct() {
        Section section = new Section("s");
        section.add("straße", "1");

        assertThat(section.has("STRASSE")).isFalse();

        section.add("STRASSE", "2");

        assertThat(section.size()).isEqualTo(2);
        assertThat(section.require("STRAẞE").getValue()).isEqualTo("1");
        assertThat(section.require("strasse").getValue()).isEqualTo("2");
    }

    @Test
    void testWithPropertyOverwritesForBothOverloads() {
        Section section = new Section("s")
                .withProperty("host", "a")
                .withProperty("HOST", "b")
                .withProperty("port", 1)
                .withProperty("port", 2);

        assertThat(section.size()).isEqualTo(2);
        assertThat(section.require("host").getValue()).isEqualTo("b");
        assertThat(section.require("host").getName()).isEqualTo("host");
        assertThat(section.require("port").getValue()).isEqualTo("2");
    }

    @Test
    void testInsertPositions() {
        Section section = new Section("s");
        section.add("a", "1");
        section.add("c", "3");

        section.insert(1, "b", "2");
        section.insert(3, "d", "4");

        assertThat(section.getProperties()).extracting(Property::getName).containsExactly("a", "b", "c", "d");
        assertThatThrownBy(() -> section.insert(6, "e", "5")).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(section.has("e")).isFalse();
    }

    @Test
    void testInsertBefore() {
        Section section = new Section("s");
        section.add("a", "1");
        section.add("c", "3");

        section.insertBefore("C", new Property("b", "2"));

        assertThat(section.indexOf("b")).isEqualTo(1);
        assertThatThrownBy(() -> section.insertBefore("zzz", new Property("x")))
                .isInstanceOf(ElementNotFoundException.class);
    }

    @Test
    void testRemoveKeepsLookupInSync() {
        Section section = new Section("s");
        section.add("a", "1");
        section.add("b", "2");
        section.add("c", "3");

        assertThat(section.remove("B")).isTrue();
        assertThat(section.remove("B")).isFalse();
        assertThat(section.remove(0)).isTrue();
        assertThat(section.remove(5)).isFalse();

        assertThat(section.getProperties()).extracting(Property::getName).containsExactly("c");
        assertThat(section.has("a")).isFalse();
        assertThat(section.get(0)).map(Property::getName).contains("c");
    }

    @Test
    void testRequireThrowsForMissing() {
        Section section = new Section("db");

        assertThatThrownBy(() -> section.require("host"))
                .isInstanceOf(ElementNotFoundException.class)
                .hasMessage("Property 'host' not found in section 'db'");
    }

    @Test
    void testRenameKeepsPosition() {
        Section section = new Section("s");
        section.add("a", "1");
        section.add("b", "2").setComment("note");
        section.add("c", "3");

        section.rename("b", "beta");

        assertThat(section.getProperties()).extracting(Property::getName).containsExactly("a", "beta", "c");
        assertThat(section.require("beta").getComment().getValue()).isEqualTo("note");
    }

    @Test
    void testTypedAccess() {
        Section section = new Section("s").withProperty("timeout", "30");

        assertThat(section.getValueAs("timeout", Integer.class)).contains(30);
        assertThat(section.getValueAs("missing", Integer.class)).isEmpty();
        assertThat(section.getValueOrDefault("missing", Integer.class, 5)).isEqualTo(5);
    }

    @Test
    void testMergeFirstWinKeepsExisting() {
        Section target = new Section("s").withProperty("a", "1");
        Section other = new Section("s").withProperty("a", "x").withProperty("b", "2");

        target.mergeFrom(other, DuplicateKeyPolicy.FIRST_WIN);

        assertThat(target.require("a").getValue()).isEqualTo("1");
        assertThat(target.require("b").getValue()).isEqualTo("2");
    }

    @Test
    void testMergeLastWinReplacesInPlaceAndTakesComments() {
        Section target = new Section("s").withProperty("a", "1").withProperty("b", "2");
        Section other = new Section("s").withProperty("a", "x").withComment("from other");

        target.mergeFrom(other, DuplicateKeyPolicy.LAST_WIN);

        assertThat(target.getProperties()).extracting(Property::getValue).containsExactly("x", "2");
        assertThat(target.getComment().getValue()).isEqualTo("from other");
    }

    @Test
    void testMergeThrowErrorIsAllOrNothing() {
        Section target = new Section("s").withProperty("a", "1");
        Section other = new Section("s").withProperty("new", "n").withProperty("A", "x");

        assertThatThrownBy(() -> target.mergeFrom(other, DuplicateKeyPolicy.THROW_ERROR))
                .isInstanceOf(DuplicateNameException.class);
        assertThat(target.size()).isEqualTo(1);
        assertThat(target.has("new")).isFalse();
    }

    @Test
    void testMergeNeverAliasesSource() {
        Section target = new Section("s");
        Section other = new Section("s").withProperty("a", "1");

        target.mergeFrom(other, DuplicateKeyPolicy.FIRST_WIN);
        target.require("a").setValue("changed");

        assertThat(other.require("a").getValue()).isEqualTo("1");
        assertThat(target.require("a")).isNotSameAs(other.require("a"));
    }

    @Test
    void testCopyIsDeep() {
        Section original = new Section("s").withProperty("a", "1").withPreComment("head");

        Section copy = original.copy();
        copy.require("a").setValue("2");
        copy.getPreComments().get(0).setValue("changed");
        copy.add("b", "3");

        assertThat(original.require("a").getValue()).isEqualTo("1");
        assertThat(original.getPreComments().get(0).getValue()).isEqualTo("head");
        assertThat(original.has("b")).isFalse();
    }

    @Test
    void testClearRemovesPropertiesAndComments() {
        Section section = new Section("s").withProperty("a", "1").withComment("c");

        section.clear();

        assertThat(section.isEmpty()).isTrue();
        assertThat(section.hasComment()).isFalse();
        assertThat(section.get("a")).isEmpty();
    }
}
