package com.configkit.ini.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.configkit.ini.cli.exception.OptionsValidationException;
import com.configkit.ini.cli.model.DocumentOptions;
import com.configkit.ini.cli.model.ValidatedDocumentOptions;
import com.configkit.ini.parser.IniParserOptions;

public class DocumentOptionsValidator {

    /**
     * @param collectErrors whether malformed lines are recorded instead of aborting the load
     * @param inputs        files that must exist and be readable
     * @throws OptionsValidationException listing every problem found
     */
    public ValidatedDocumentOptions validate(DocumentOptions o, boolean collectErrors, List<Path> inputs) {
        List<String> errors = new ArrayList<>();

        for (Path input : inputs) {
            if (input == null) {
                errors.add("Input file is required.");
            } else if (!Files.isRegularFile(input)) {
                errors.add("Input file does not exist or is not a file: " + input);
            } else if (!Files.isReadable(input)) {
                errors.add("Input file is not readable: " + input);
            }
        }

        Charset charset = null;
        if (isBlank(o.getEncoding())) {
            errors.add("Encoding cannot be empty (--encoding).");
        } else {
            try {
                charset = Charset.forName(o.getEncoding().trim());
            } catch (IllegalArgumentException e) {
                errors.add("Unsupported encoding: " + o.getEncoding());
            }
        }

        String commentChars = o.getCommentChars();
        if (commentChars == null || commentChars.isEmpty()) {
            errors.add("At least one comment character is required (--comment-chars).");
        } else {
            for (char c : commentChars.toCharArray()) {
                if (Character.isWhitespace(c) || c == '[' || c == '=' || c == '"') {
                    errors.add("Invalid comment character: '" + c + "'");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        IniParserOptions parserOptions = IniParserOptions.builder()
                .commentPrefixChars(commentChars)
                .defaultCommentPrefixChar(commentChars.charAt(0))
                .duplicateKeyPolicy(o.getDuplicateKeyPolicy())
                .duplicateSectionPolicy(o.getDuplicateSectionPolicy())
                .collectParsingErrors(collectErrors)
                .build();
        return new ValidatedDocumentOptions(charset, parserOptions);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
