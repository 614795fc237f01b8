package com.configkit.ini.parser;

import com.configkit.ini.model.Comment;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.DuplicateKeyPolicy;
import com.configkit.ini.model.DuplicateSectionPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable parser configuration. Numeric limits use 0 for "unlimited".
 */
@Value
@Builder(toBuilder = true)
public class IniParserOptions {

    @NonNull
    @Builder.Default
    String commentPrefixChars = Document.DEFAULT_COMMENT_PREFIX_CHARS;

    @Builder.Default
    char defaultCommentPrefixChar = Comment.DEFAULT_PREFIX;

    @NonNull
    @Builder.Default
    DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.FIRST_WIN;

    @NonNull
    @Builder.Default
    DuplicateSectionPolicy duplicateSectionPolicy = DuplicateSectionPolicy.FIRST_WIN;

    /**
     * When false the first malformed line aborts the load with a {@link ParsingException}.
     */
    boolean collectParsingErrors;

    int maxSections;
    int maxPropertiesPerSection;
    int maxValueLength;
    int maxLineLength;
    int maxParsingErrors;
    int maxPendingComments;

    public static IniParserOptions defaults() {
        return builder().build();
    }

    /**
     * Defaults, but malformed lines are recorded instead of aborting the load.
     */
    public static IniParserOptions lenient() {
        return builder().collectParsingErrors(true).build();
    }
}
