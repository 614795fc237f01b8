package com.configkit.ini.io;

import com.configkit.ini.model.Comment;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;
import com.configkit.ini.parser.IniParser;
import com.configkit.ini.parser.IniParserOptions;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IniSerializer.
 */
class IniSerializerTest {

    private final IniSerializer serializer = new IniSerializer("\n");

    @Test
    void testLayout() {
        Document document = new Document().withDefaultProperty("root", "1");
        Section server = document.add("server");
        server.addPreComment(" web tier");
        server.setComment(" inline");
        server.add("host", "localhost");
        server.add(new Property("port", "80").withComment(" http"));
        document.add("empty");

        assertThat(serializer.toText(document)).isEqualTo("""
                root = 1

                ; web tier
                [server] ; inline
                host = localhost
                port = 80 ; http

                [empty]
                """);
    }

    @Test
    void testQuotingAndEscaping() {
        Document document = new Document();
        Section section = document.add("s");
        section.add(new Property("quoted", "a\"b").withQuoted(true));
        section.add("padded", "  x ");
        section.add("multi", "one\ntwo");
        section.add("hash", "a#b;c");
        section.add("empty", "");

        assertThat(serializer.toText(document)).isEqualTo("""
                [s]
                quoted = "a\\"b"
                padded = "  x "
                multi = "one\\ntwo"
                hash = a\\#b\\;c
                empty =
                """);
        assertThat(section.require("padded").isQuoted()).isFalse();
    }

    @Test
    void testUnknownCommentPrefixFallsBackToDefault() {
        Document document = new Document(";#", '#');
        document.getDefaultSection().add(new Property("k", "v"));
        document.getDefaultSection().require("k").setComment(new Comment('!', "note"));

        assertThat(serializer.toText(document)).isEqualTo("k = v #note\n");
    }

    @Test
    void testEmptyDocument() {
        assertThat(serializer.toText(new Document())).isEmpty();
    }

    @Test
    void testRoundTripPreservesStructure() {
        String ini = """
                ; header comment
                name = "  padded  "
                plain = value with spaces

                # about the section
                [Paths] ; inline
                home = C:\\Users\\me
                pattern = a\\;b ; explained
                escaped = "tab\\there"
                blank =
                """;
        IniParser parser = new IniParser();

        Document first = parser.parse(ini);
        String written = serializer.toText(first);
        Document second = parser.parse(written);

        assertThat(second.getDefaultSection().getProperties()).extracting(Property::toString)
                .containsExactly("name=  padded  ", "plain=value with spaces");
        Section paths = second.require("Paths");
        assertThat(paths.getPreComments()).extracting(Comment::toString).containsExactly("# about the section");
        assertThat(paths.getComment().getValue()).isEqualTo(" inline");
        assertThat(paths.require("home").getValue()).isEqualTo("C:\\Users\\me");
        assertThat(paths.require("pattern").getValue()).isEqualTo("a;b");
        assertThat(paths.require("pattern").getComment().getValue()).isEqualTo(" explained");
        assertThat(paths.require("escaped").getValue()).isEqualTo("tab\there");
        assertThat(paths.require("blank").getValue()).isEmpty();
        assertThat(second.compare(first).hasChanges()).isFalse();
        assertThat(serializer.toText(second)).isEqualTo(written);
    }

    @Test
    void testRoundTripKeepsCommentWhitespace() {
        Document document = new Document();
        Section section = document.add("s");
        section.addPreComment(new Comment(';', " note  "));
        section.setComment(new Comment('#', "  tail "));
        Property property = section.add("k", "v");
        property.addPreComment(new Comment(';', "\tindented\t"));
        property.setComment(new Comment(';', " inline "));

        Document reread = new IniParser().parse(serializer.toText(document));

        Section readSection = reread.require("s");
        assertThat(readSection.getPreComments()).extracting(Comment::getValue).containsExactly(" note  ");
        assertThat(readSection.getComment().getValue()).isEqualTo("  tail ");
        Property readProperty = readSection.require("k");
        assertThat(readProperty.getValue()).isEqualTo("v");
        assertThat(readProperty.getPreComments()).extracting(Comment::getValue).containsExactly("\tindented\t");
        assertThat(readProperty.getComment().getValue()).isEqualTo(" inline ");
    }

    @Test
    void testRoundTripWithCustomPrefixes() {
        IniParser parser = new IniParser(IniParserOptions.builder()
                .commentPrefixChars("!")
                .defaultCommentPrefixChar('!')
                .build());
        Document document = parser.parse("k = a;b\\!c ! note\n");

        Document reread = parser.parse(serializer.toText(document));

        assertThat(reread.getDefaultSection().require("k").getValue()).isEqualTo("a;b!c");
        assertThat(reread.getDefaultSection().require("k").getComment().getPrefix()).isEqualTo('!');
    }
}
