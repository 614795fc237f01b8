package com.configkit.ini.cli.model;

import com.configkit.ini.model.DuplicateKeyPolicy;
import com.configkit.ini.model.DuplicateSectionPolicy;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every command that reads INI files. No validation, no execution logic.
 */
@Getter
public class DocumentOptions {

    @Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Text encoding of the INI files (default: UTF-8)")
    private String encoding;

    @Option(names = { "--comment-chars" }, defaultValue = ";#", description = "Characters starting a comment (default: ;#)")
    private String commentChars;

    @Option(names = { "--duplicate-keys" }, defaultValue = "FIRST_WIN",
            description = "Repeated keys in a section: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private DuplicateKeyPolicy duplicateKeyPolicy;

    @Option(names = { "--duplicate-sections" }, defaultValue = "FIRST_WIN",
            description = "Repeated sections: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private DuplicateSectionPolicy duplicateSectionPolicy;
}
