package com.configkit.ini.model;

import com.configkit.ini.model.exception.DuplicateNameException;
import com.configkit.ini.model.exception.ElementNotFoundException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Document.
 */
class DocumentTest {

    @Test
    void testNewDocumentIsEmpty() {
        Document document = new Document();

        assertThat(document.isEmpty()).isTrue();
        assertThat(document.size()).isZero();
        assertThat(document.getDefaultSection().getName()).isEqualTo(Document.DEFAULT_SECTION_NAME);
        assertThat(document.getCommentPrefixChars()).isEqualTo(";#");
        assertThat(document.getDefaultCommentPrefixChar()).isEqualTo(';');
    }

    @Test
    void testDefaultPropertyMakesDocumentNonEmpty() {
        Document document = new Document().withDefaultProperty("key", "value");

        assertThat(document.isEmpty()).isFalse();
        assertThat(document.size()).isZero();
    }

    @Test
    void testCommentPrefixValidation() {
        assertThatThrownBy(() -> new Document("", ';'))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Document(";=", ';'))
                .hasMessage("Invalid comment prefix character: '='");
        assertThatThrownBy(() -> new Document(";#", '!'))
                .hasMessage("Invalid character prefix: '!'");

        Document document = new Document("!", '!');
        assertThat(document.isCommentPrefix('!')).isTrue();
        assertThat(document.isCommentPrefix(';')).isFalse();
        assertThat(document.newComment("x").getPrefix()).isEqualTo('!');
    }

    @Test
    void testReservedSectionName() {
        Document document = new Document();

        assertThatThrownBy(() -> document.add("$DEFAULT"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Section name '$DEFAULT' is reserved");
        assertThatThrownBy(() -> document.add("$default"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(document.size()).isZero();
    }

    @Test
    void testSectionLookupIsCaseInsensitive() {
        Document document = new Document();
        Section section = document.add("Database");

        assertThat(document.has("DATABASE")).isTrue();
        assertThat(document.get("database")).containsSame(section);
        assertThatThrownBy(() -> document.add("DATABASE"))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessage("Section 'DATABASE' already exists");
    }

    @Test
    void testResolveAddressesDefaultSection() {
        Document document = new Document().withDefaultProperty("root", "1");

        assertThat(document.resolve(Document.DEFAULT_SECTION_NAME)).containsSame(document.getDefaultSection());
        assertThat(document.get(Document.DEFAULT_SECTION_NAME)).isEmpty();
        assertThat(document.getValueAs(Document.DEFAULT_SECTION_NAME, "root", Integer.class)).contains(1);
    }

    @Test
    void testResolveIgnoresCaseOfDefaultSectionName() {
        Document document = new Document();

        assertThat(document.resolve("$default")).containsSame(document.getDefaultSection());
        assertThat(document.resolve("$Default")).containsSame(document.getDefaultSection());
    }

    @Test
    void testWithDefaultPropertyOverwritesForBothOverloads() {
        Document document = new Document()
                .withDefaultProperty("name", "first")
                .withDefaultProperty("NAME", "second")
                .withDefaultProperty("port", 80)
                .withDefaultProperty("port", 8080);

        assertThat(document.getDefaultSection().size()).isEqualTo(2);
        assertThat(document.getDefaultSection().require("name").getValue()).isEqualTo("second");
        assertThat(document.getDefaultSection().require("port").getValue()).isEqualTo("8080");
    }

    @Test
    void testInsertAndInsertBefore() {
        Document document = new Document().withSection("a").withSection("c");

        document.insert(1, "b");
        document.insertBefore("a", new Section("first"));

        assertThat(document.getSections()).extracting(Section::getName).containsExactly("first", "a", "b", "c");
        assertThatThrownBy(() -> document.insert(10, "x")).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> document.insertBefore("none", new Section("y")))
                .isInstanceOf(ElementNotFoundException.class)
                .hasMessage("Target section 'none' not found");
    }

    @Test
    void testRemoveAndRename() {
        Document document = new Document().withSection("a").withSection("b").withSection("c");
        document.require("b").add("key", "value");

        assertThat(document.remove("A")).isTrue();
        assertThat(document.remove("A")).isFalse();

        Section renamed = document.rename("b", "beta");

        assertThat(document.getSections()).extracting(Section::getName).containsExactly("beta", "c");
        assertThat(renamed.require("key").getValue()).isEqualTo("value");
        assertThatThrownBy(() -> document.rename("beta", "C")).isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void testTypedAccess() {
        Document document = new Document();
        document.add("server").add("port", "8080");

        assertThat(document.getRequiredValue("server", "port", Integer.class)).isEqualTo(8080);
        assertThat(document.getValueOrDefault("server", "missing", Integer.class, 80)).isEqualTo(80);
        assertThat(document.getValueAs("nope", "port", Integer.class)).isEmpty();
        assertThatThrownBy(() -> document.getRequiredValue("nope", "port", Integer.class))
                .isInstanceOf(ElementNotFoundException.class);
    }

    @Test
    void testCopyIsIndependent() {
        Document original = new Document().withDefaultProperty("root", "1");
        original.add("s").add("k", "v");
        original.addParsingError(new ParsingError(1, "bad", "reason"));

        Document copy = original.copy();
        copy.require("s").require("k").setValue("changed");
        copy.getDefaultSection().require("root").setValue("2");
        copy.add("extra");

        assertThat(original.require("s").require("k").getValue()).isEqualTo("v");
        assertThat(original.getDefaultSection().require("root").getValue()).isEqualTo("1");
        assertThat(original.has("extra")).isFalse();
        assertThat(copy.hasParsingErrors()).isFalse();
        assertThat(original.getParsingErrors()).hasSize(1);
    }

    @Test
    void testClearKeepsDefaultSection() {
        Document document = new Document().withDefaultProperty("root", "1").withSection("s");

        document.clear();

        assertThat(document.size()).isZero();
        assertThat(document.getDefaultSection().has("root")).isTrue();
    }

    @Test
    void testRestoreFrom() {
        Document document = new Document().withSection("old");
        Document snapshot = new Document().withDefaultProperty("k", "v").withSection("new");

        document.restoreFrom(snapshot);

        assertThat(document.has("old")).isFalse();
        assertThat(document.has("new")).isTrue();
        assertThat(document.require("new")).isNotSameAs(snapshot.require("new"));
        assertThat(document.getDefaultSection().require("k").getValue()).isEqualTo("v");
    }
}
