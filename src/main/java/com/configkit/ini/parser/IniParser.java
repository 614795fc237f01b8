package com.configkit.ini.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Comment;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.DuplicateKeyPolicy;
import com.configkit.ini.model.ElementBase;
import com.configkit.ini.model.ParsingError;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;
import com.configkit.ini.model.exception.DuplicateNameException;

/**
 * Line-oriented INI parser.
 *
 * Grammar:
 * - Comment: first non-blank character is a comment prefix, e.g. {@code ; text}
 * - Section: {@code [name]} optionally followed by an inline comment
 * - Property: {@code key = value} or {@code key = "escaped value"}, optionally followed by an inline comment
 *
 * Comment lines become pre-comments of the next section or property. Comments left over at the
 * end of the input have no element to attach to and are dropped.
 */
public class IniParser {
    private static final Logger log = LoggerFactory.getLogger(IniParser.class);

    static final String MISSING_CLOSING_BRACKET = "Missing closing bracket in section declaration";
    static final String EMPTY_SECTION_NAME = "Section name cannot be empty";
    static final String INVALID_SECTION_NAME = "Invalid section name: ";
    static final String MISSING_EQUALS_SIGN = "Missing equals sign in key-value pair";
    static final String EMPTY_KEY = "Key is empty";
    static final String INCOMPLETE_ESCAPE = "Invalid escape sequence: incomplete escape marker";
    static final String UNTERMINATED_QUOTE = "Unterminated quote: missing closing quotation mark";
    static final String CONTENT_AFTER_QUOTE = "Invalid content after closing quote";
    static final String INVALID_QUOTE_FORMAT = "Invalid quote format";
    static final String LINE_TOO_LONG = "Line exceeds maximum length";
    static final String VALUE_TOO_LONG = "Value exceeds maximum length";
    static final String TOO_MANY_COMMENTS = "Too many pending comments";

    private final IniParserOptions options;
    private final List<ParsingErrorListener> listeners = new CopyOnWriteArrayList<>();

    public IniParser() {
        this(IniParserOptions.defaults());
    }

    public IniParser(IniParserOptions options) {
        checkLimit("maxSections", options.getMaxSections());
        checkLimit("maxPropertiesPerSection", options.getMaxPropertiesPerSection());
        checkLimit("maxValueLength", options.getMaxValueLength());
        checkLimit("maxLineLength", options.getMaxLineLength());
        checkLimit("maxParsingErrors", options.getMaxParsingErrors());
        checkLimit("maxPendingComments", options.getMaxPendingComments());
        // fail fast on an inconsistent prefix configuration
        new Document(options.getCommentPrefixChars(), options.getDefaultCommentPrefixChar());
        this.options = options;
    }

    public IniParserOptions getOptions() {
        return options;
    }

    public void addErrorListener(ParsingErrorListener listener) {
        listeners.add(listener);
    }

    public void removeErrorListener(ParsingErrorListener listener) {
        listeners.remove(listener);
    }

    public Document parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalStateException("Reading from a string failed", e);
        }
    }

    /**
     * Reads every line of {@code reader}. The reader is not closed.
     *
     * @throws ParsingException      when a line is malformed and errors are not collected, or a limit is exceeded
     * @throws DuplicateNameException when a duplicate policy is {@code THROW_ERROR} and a name repeats
     */
    public Document parse(Reader reader) throws IOException {
        ParseRun run = new ParseRun();
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        String line;
        while ((line = lines.readLine()) != null) {
            run.lineNumber++;
            run.parseLine(line);
        }
        run.finish();

        log.debug("Parsed {} lines into {} sections ({} errors)",
                run.lineNumber, run.document.size(), run.document.getParsingErrors().size());
        return run.document;
    }

    private static void checkLimit(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }

    /**
     * State of a single parse call.
     */
    private final class ParseRun {
        private final Document document = new Document(
                options.getCommentPrefixChars(), options.getDefaultCommentPrefixChar());
        private final List<Comment> pendingComments = new ArrayList<>();
        private int lineNumber = 0;

        /** Section receiving properties; detached when it is a repeated section being dropped or merged. */
        private Section current = document.getDefaultSection();
        /** Existing section that {@link #current} folds into when it ends, under the MERGE policy. */
        private Section mergeTarget;

        void parseLine(String rawLine) {
            if (options.getMaxLineLength() > 0 && rawLine.length() > options.getMaxLineLength()) {
                error(rawLine, LINE_TOO_LONG);
                return;
            }

            // trailing whitespace may belong to comment text, so only the indentation goes
            String line = rawLine.stripLeading();
            if (line.isBlank()) {
                return;
            }

            char first = line.charAt(0);
            if (document.isCommentPrefix(first)) {
                if (options.getMaxPendingComments() > 0 && pendingComments.size() >= options.getMaxPendingComments()) {
                    error(rawLine, TOO_MANY_COMMENTS);
                    return;
                }
                pendingComments.add(new Comment(first, line.substring(1)));
            } else if (first == '[') {
                parseSection(rawLine, line);
            } else {
                parseProperty(rawLine, line);
            }
        }

        void finish() {
            closeSection();
            if (!pendingComments.isEmpty()) {
                log.debug("Dropping {} trailing comment lines", pendingComments.size());
                pendingComments.clear();
            }
        }

        private void parseSection(String rawLine, String line) {
            int close = line.indexOf(']');
            if (close < 0) {
                error(rawLine, MISSING_CLOSING_BRACKET);
                return;
            }
            String name = line.substring(1, close).strip();
            if (name.isEmpty()) {
                error(rawLine, EMPTY_SECTION_NAME);
                return;
            }

            Section section;
            try {
                section = new Section(name);
                if (Document.DEFAULT_SECTION_NAME.equalsIgnoreCase(name)) {
                    throw new IllegalArgumentException("Section name '" + name + "' is reserved");
                }
            } catch (IllegalArgumentException e) {
                error(rawLine, INVALID_SECTION_NAME + e.getMessage());
                return;
            }

            attachPendingComments(section);
            String rest = line.substring(close + 1).stripLeading();
            if (!rest.isEmpty() && document.isCommentPrefix(rest.charAt(0)) && rest.length() > 1) {
                section.setComment(new Comment(rest.charAt(0), rest.substring(1)));
            } else if (!rest.isEmpty() && !document.isCommentPrefix(rest.charAt(0))) {
                log.debug("Ignoring text after section header at line {}: {}", lineNumber, rest.strip());
            }

            closeSection();
            openSection(section);
        }

        private void openSection(Section section) {
            Section existing = document.get(section.getName()).orElse(null);
            if (existing == null) {
                checkSectionLimit();
                document.add(section);
                current = section;
                log.debug("Section [{}] at line {}", section.getName(), lineNumber);
                return;
            }

            switch (options.getDuplicateSectionPolicy()) {
                case THROW_ERROR -> throw DuplicateNameException.forSection(section.getName());
                case LAST_WIN -> {
                    log.debug("Section [{}] repeated at line {}, replacing earlier one", section.getName(), lineNumber);
                    document.remove(existing.getName());
                    document.add(section);
                    current = section;
                }
                case MERGE -> {
                    log.debug("Section [{}] repeated at line {}, merging", section.getName(), lineNumber);
                    current = section;
                    mergeTarget = existing;
                }
                default -> {
                    log.debug("Section [{}] repeated at line {}, ignoring it", section.getName(), lineNumber);
                    current = section;
                }
            }
        }

        private void closeSection() {
            if (mergeTarget != null) {
                mergeTarget.mergeFrom(current, options.getDuplicateKeyPolicy());
                mergeTarget = null;
            }
        }

        private void checkSectionLimit() {
            if (options.getMaxSections() > 0 && document.size() >= options.getMaxSections()) {
                throw new ParsingException("Document exceeds maximum of " + options.getMaxSections()
                        + " sections at line " + lineNumber, document.getParsingErrors());
            }
        }

        private void parseProperty(String rawLine, String line) {
            int equals = line.indexOf('=');
            if (equals < 0) {
                error(rawLine, MISSING_EQUALS_SIGN);
                return;
            }
            String key = line.substring(0, equals).strip();
            if (key.isEmpty()) {
                error(rawLine, EMPTY_KEY);
                return;
            }

            String valuePart = line.substring(equals + 1).stripLeading();
            boolean quoted = !valuePart.isEmpty() && valuePart.charAt(0) == '"';
            ValueAndComment parsed = quoted ? parseQuoted(valuePart) : parseUnquoted(valuePart);
            if (parsed.error != null) {
                error(rawLine, parsed.error);
                return;
            }
            if (options.getMaxValueLength() > 0 && parsed.value.length() > options.getMaxValueLength()) {
                error(rawLine, VALUE_TOO_LONG);
                return;
            }

            Property property = new Property(key, parsed.value);
            property.setQuoted(quoted);
            if (parsed.comment != null) {
                property.setComment(parsed.comment);
            }
            attachPendingComments(property);
            addProperty(property);
        }

        private void addProperty(Property property) {
            if (current.has(property.getName())) {
                DuplicateKeyPolicy policy = options.getDuplicateKeyPolicy();
                if (policy == DuplicateKeyPolicy.THROW_ERROR) {
                    throw DuplicateNameException.forProperty(property.getName(), current.getName());
                }
                if (policy == DuplicateKeyPolicy.FIRST_WIN) {
                    log.debug("Key '{}' repeated at line {}, ignoring it", property.getName(), lineNumber);
                    return;
                }
                log.debug("Key '{}' repeated at line {}, replacing earlier one", property.getName(), lineNumber);
                current.remove(property.getName());
            }
            if (options.getMaxPropertiesPerSection() > 0 && current.size() >= options.getMaxPropertiesPerSection()) {
                throw new ParsingException("Section '" + current.getName() + "' exceeds maximum of "
                        + options.getMaxPropertiesPerSection() + " properties at line " + lineNumber,
                        document.getParsingErrors());
            }
            current.add(property);
        }

        private ValueAndComment parseQuoted(String valuePart) {
            StringBuilder value = new StringBuilder(valuePart.length());
            boolean escaped = false;
            int i = 1;
            for (; i < valuePart.length(); i++) {
                char c = valuePart.charAt(i);
                if (escaped) {
                    value.append(EscapeSequences.decode(c));
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    break;
                } else {
                    value.append(c);
                }
            }
            if (escaped) {
                return ValueAndComment.failure(INCOMPLETE_ESCAPE);
            }
            if (i >= valuePart.length()) {
                return ValueAndComment.failure(UNTERMINATED_QUOTE);
            }

            String rest = valuePart.substring(i + 1).stripLeading();
            Comment comment = null;
            int prefixAt = indexOfPrefix(rest);
            if (prefixAt == 0) {
                comment = inlineComment(rest.charAt(0), rest.substring(1));
                rest = "";
            } else if (prefixAt > 0) {
                return ValueAndComment.failure(CONTENT_AFTER_QUOTE);
            }
            if (!rest.isBlank()) {
                return ValueAndComment.failure(INVALID_QUOTE_FORMAT);
            }
            return new ValueAndComment(value.toString(), comment, null);
        }

        private ValueAndComment parseUnquoted(String valuePart) {
            StringBuilder value = new StringBuilder(valuePart.length());
            Comment comment = null;
            int i = 0;
            while (i < valuePart.length()) {
                char c = valuePart.charAt(i);
                if (c == '\\' && i + 1 < valuePart.length() && document.isCommentPrefix(valuePart.charAt(i + 1))) {
                    value.append(valuePart.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (document.isCommentPrefix(c)) {
                    comment = inlineComment(c, valuePart.substring(i + 1));
                    break;
                }
                value.append(c);
                i++;
            }
            return new ValueAndComment(value.toString().stripTrailing(), comment, null);
        }

        private Comment inlineComment(char prefix, String text) {
            return text.isEmpty() ? null : new Comment(prefix, text);
        }

        private int indexOfPrefix(String text) {
            for (int i = 0; i < text.length(); i++) {
                if (document.isCommentPrefix(text.charAt(i))) {
                    return i;
                }
            }
            return -1;
        }

        private void attachPendingComments(ElementBase element) {
            element.getPreComments().addAll(pendingComments);
            pendingComments.clear();
        }

        private void error(String rawLine, String reason) {
            ParsingError error = new ParsingError(lineNumber, rawLine, reason);
            log.warn("Failed to parse line {}: {}", lineNumber, reason);
            for (ParsingErrorListener listener : listeners) {
                listener.onParsingError(error);
            }
            if (!options.isCollectParsingErrors()) {
                throw new ParsingException(error);
            }
            document.addParsingError(error);
            if (options.getMaxParsingErrors() > 0
                    && document.getParsingErrors().size() > options.getMaxParsingErrors()) {
                throw new ParsingException("Too many parsing errors (limit " + options.getMaxParsingErrors() + ")",
                        document.getParsingErrors());
            }
        }
    }

    private static final class ValueAndComment {
        private final String value;
        private final Comment comment;
        private final String error;

        private ValueAndComment(String value, Comment comment, String error) {
            this.value = value;
            this.comment = comment;
            this.error = error;
        }

        static ValueAndComment failure(String reason) {
            return new ValueAndComment(null, null, reason);
        }
    }
}
