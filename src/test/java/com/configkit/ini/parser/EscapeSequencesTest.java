package com.configkit.ini.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for EscapeSequences.
 */
class EscapeSequencesTest {

    @Test
    void testDecode() {
        assertThat(EscapeSequences.decode('n')).isEqualTo('\n');
        assertThat(EscapeSequences.decode('t')).isEqualTo('\t');
        assertThat(EscapeSequences.decode('0')).isEqualTo('\0');
        assertThat(EscapeSequences.decode('a')).isEqualTo('\u0007');
        assertThat(EscapeSequences.decode('"')).isEqualTo('"');
        assertThat(EscapeSequences.decode('z')).isEqualTo('z');
    }

    @Test
    void testEscapeQuoted() {
        assertThat(EscapeSequences.escapeQuoted("a\"b\\c;d#e\nf"))
                .isEqualTo("a\\\"b\\\\c\\;d\\#e\\nf");
    }

    @Test
    void testEscapeUnquotedOnlyTouchesPrefixes() {
        assertThat(EscapeSequences.escapeUnquoted("a;b#c!d\\e", ";#")).isEqualTo("a\\;b\\#c!d\\e");
        assertThat(EscapeSequences.escapeUnquoted("a;b!c", "!")).isEqualTo("a;b\\!c");
    }

    @Test
    void testRequiresQuotes() {
        assertThat(EscapeSequences.requiresQuotes("")).isFalse();
        assertThat(EscapeSequences.requiresQuotes("plain value")).isFalse();
        assertThat(EscapeSequences.requiresQuotes(" lead")).isTrue();
        assertThat(EscapeSequences.requiresQuotes("trail ")).isTrue();
        assertThat(EscapeSequences.requiresQuotes("\"starts")).isTrue();
        assertThat(EscapeSequences.requiresQuotes("two\nlines")).isTrue();
    }
}
