package com.configkit.ini.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import com.configkit.ini.model.Comment;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.ElementBase;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;
import com.configkit.ini.parser.EscapeSequences;

/**
 * Writes a {@link Document} back to INI text.
 *
 * Layout:
 * - default section properties first, without a header
 * - each section as {@code [name]} followed by its properties, sections separated by a blank line
 * - pre-comments one per line above their element, inline comments after a single space
 *
 * Writing only reads the model; flags such as {@link Property#isQuoted()} are never changed.
 * A value that would not read back unchanged without quotes is written quoted regardless of the flag.
 */
public class IniSerializer {

    private final String lineSeparator;

    public IniSerializer() {
        this(System.lineSeparator());
    }

    public IniSerializer(String lineSeparator) {
        if (lineSeparator == null || lineSeparator.isEmpty()) {
            throw new IllegalArgumentException("Line separator cannot be empty");
        }
        this.lineSeparator = lineSeparator;
    }

    public String toText(Document document) {
        StringWriter out = new StringWriter();
        try {
            write(document, out);
        } catch (IOException e) {
            throw new IllegalStateException("Writing to a string failed", e);
        }
        return out.toString();
    }

    /**
     * Writes {@code document} to {@code out}. The writer is flushed but not closed.
     */
    public void write(Document document, Writer out) throws IOException {
        Section defaults = document.getDefaultSection();
        for (Property property : defaults) {
            writeProperty(document, property, out);
        }
        if (!defaults.isEmpty() && document.size() > 0) {
            out.write(lineSeparator);
        }

        boolean first = true;
        for (Section section : document) {
            if (!first) {
                out.write(lineSeparator);
            }
            first = false;
            writePreComments(document, section, out);
            out.write('[');
            out.write(section.getName());
            out.write(']');
            writeInlineComment(document, section, out);
            out.write(lineSeparator);
            for (Property property : section) {
                writeProperty(document, property, out);
            }
        }
        out.flush();
    }

    private void writeProperty(Document document, Property property, Writer out) throws IOException {
        writePreComments(document, property, out);
        out.write(property.getName());
        out.write(" =");
        String value = property.getValue();
        if (property.isQuoted() || EscapeSequences.requiresQuotes(value)) {
            out.write(" \"");
            out.write(EscapeSequences.escapeQuoted(value));
            out.write('"');
        } else if (!value.isEmpty()) {
            out.write(' ');
            out.write(EscapeSequences.escapeUnquoted(value, document.getCommentPrefixChars()));
        }
        writeInlineComment(document, property, out);
        out.write(lineSeparator);
    }

    private void writePreComments(Document document, ElementBase element, Writer out) throws IOException {
        for (Comment comment : element.getPreComments()) {
            out.write(prefixOf(document, comment));
            out.write(comment.getValue());
            out.write(lineSeparator);
        }
    }

    private void writeInlineComment(Document document, ElementBase element, Writer out) throws IOException {
        Comment comment = element.getComment();
        if (comment == null || comment.getValue().isEmpty()) {
            return;
        }
        out.write(' ');
        out.write(prefixOf(document, comment));
        out.write(comment.getValue());
    }

    /**
     * The comment's own prefix when the document recognises it, otherwise the document default.
     */
    private static char prefixOf(Document document, Comment comment) {
        return document.isCommentPrefix(comment.getPrefix())
                ? comment.getPrefix()
                : document.getDefaultCommentPrefixChar();
    }
}
