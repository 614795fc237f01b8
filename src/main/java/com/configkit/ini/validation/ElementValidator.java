package com.configkit.ini.validation;

import java.util.ArrayList;
import java.util.List;

import com.configkit.ini.model.Comment;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;

/**
 * Checks user-entered text before it is put into a document, and whole documents for
 * content that would not survive a save and reload unchanged.
 */
public class ElementValidator {

    private final String commentPrefixChars;

    public ElementValidator() {
        this(Document.DEFAULT_COMMENT_PREFIX_CHARS);
    }

    public ElementValidator(String commentPrefixChars) {
        this.commentPrefixChars = commentPrefixChars;
    }

    public static ElementValidator forDocument(Document document) {
        return new ElementValidator(document.getCommentPrefixChars());
    }

    /**
     * Multi-line pre-comment text, one comment per line.
     */
    public ValidationResult validatePreCommentText(String text) {
        if (text == null || text.isEmpty()) {
            return ValidationResult.error("Pre-comment cannot be empty");
        }
        return ValidationResult.success();
    }

    public ValidationResult validatePreComment(String value) {
        if (value == null || value.isEmpty()) {
            return ValidationResult.error("Pre-comment cannot be empty");
        }
        if (hasLineBreak(value)) {
            return ValidationResult.error("Pre-comment cannot contain newline characters");
        }
        return ValidationResult.success();
    }

    public ValidationResult validateInlineComment(String value) {
        if (value == null || value.isEmpty()) {
            return ValidationResult.error("Inline comment cannot be empty");
        }
        if (hasLineBreak(value)) {
            return ValidationResult.error("Inline comment cannot contain newline characters");
        }
        return ValidationResult.success();
    }

    public ValidationResult validateSectionName(String value) {
        if (value == null || value.isEmpty()) {
            return ValidationResult.error("Section name cannot be empty");
        }
        if (hasLineBreak(value)) {
            return ValidationResult.error("Section name cannot contain newline characters");
        }
        if (value.indexOf('[') >= 0 || value.indexOf(']') >= 0) {
            return ValidationResult.error("Section name cannot contain brackets");
        }
        if (Document.DEFAULT_SECTION_NAME.equalsIgnoreCase(value)) {
            return ValidationResult.error("Section name '" + Document.DEFAULT_SECTION_NAME + "' is reserved");
        }
        return ValidationResult.success();
    }

    public ValidationResult validateKey(String value) {
        if (value == null || value.isEmpty()) {
            return ValidationResult.error("Key cannot be empty");
        }
        if (hasLineBreak(value)) {
            return ValidationResult.error("Key cannot contain newline characters");
        }
        if (value.indexOf('=') >= 0) {
            return ValidationResult.error("Key cannot contain equals sign");
        }
        if (commentPrefixChars.indexOf(value.charAt(0)) >= 0 || value.charAt(0) == '[') {
            return ValidationResult.error("Key cannot start with '" + value.charAt(0) + "'");
        }
        return ValidationResult.success();
    }

    public ValidationResult validateValue(String value, boolean quoted) {
        if (value == null) {
            return ValidationResult.error("Value cannot be null");
        }
        if (!quoted && hasLineBreak(value)) {
            return ValidationResult.error("Unquoted value cannot contain newline characters");
        }
        return ValidationResult.success();
    }

    /**
     * Runs the key, value, section name and inline comment checks over every element of {@code document}.
     *
     * @return one message per problem, prefixed with its location; empty when the document is clean
     */
    public List<String> validate(Document document) {
        List<String> problems = new ArrayList<>();
        for (Property property : document.getDefaultSection()) {
            validateProperty(Document.DEFAULT_SECTION_NAME, property, problems);
        }
        for (Section section : document) {
            collect(problems, "[" + section.getName() + "]", validateSectionName(section.getName()));
            collectInlineComment(problems, "[" + section.getName() + "]", section.getComment());
            for (Property property : section) {
                validateProperty(section.getName(), property, problems);
            }
        }
        return problems;
    }

    private void validateProperty(String sectionName, Property property, List<String> problems) {
        String location = "[" + sectionName + "] " + property.getName();
        collect(problems, location, validateKey(property.getName()));
        collect(problems, location, validateValue(property.getValue(), property.isQuoted()));
        collectInlineComment(problems, location, property.getComment());
    }

    private void collectInlineComment(List<String> problems, String location, Comment inline) {
        if (inline != null) {
            collect(problems, location, validateInlineComment(inline.getValue()));
        }
    }

    private static void collect(List<String> problems, String location, ValidationResult result) {
        if (!result.isValid()) {
            problems.add(location + ": " + result.getErrorMessage());
        }
    }

    private static boolean hasLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }
}
