package com.configkit.ini.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.diff.MergeResult;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.ParsingError;
import com.configkit.ini.model.Section;

/**
 * Responsible only for printing CLI status output. No validation, no execution.
 */
public class CommandResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CommandResultsPrinter.class);

    public void printOptionErrors(List<String> errors) {
        log.error("Invalid options ({}):", errors.size());
        for (String error : errors) {
            log.error("  {}", error);
        }
    }

    public void printCheck(Path file, Document document, List<String> problems) {
        log.info("=================================================");
        log.info("Checked: {}", file.toAbsolutePath());
        log.info("=================================================");
        log.info("Sections: {}", document.size());
        log.info("Default Section Properties: {}", document.getDefaultSection().size());
        log.info("Total Properties: {}", countProperties(document));

        if (document.hasParsingErrors()) {
            log.info("");
            log.warn("Parsing Errors: {}", document.getParsingErrors().size());
            for (ParsingError error : document.getParsingErrors()) {
                log.warn("  Line {}: {} [{}]", error.getLineNumber(), error.getReason(), error.getLine());
            }
        }
        if (!problems.isEmpty()) {
            log.info("");
            log.warn("Content Warnings: {}", problems.size());
            for (String problem : problems) {
                log.warn("  {}", problem);
            }
        }
        if (!document.hasParsingErrors() && problems.isEmpty()) {
            log.info("No problems found.");
        }
    }

    public void printFormatted(Path source, Path target) {
        log.info("Formatted {} -> {}", source, target.toAbsolutePath());
    }

    public void printExported(Path source, Path target, String format) {
        log.info("Exported {} as {} -> {}", source, format, target.toAbsolutePath());
    }

    public void printMergeSummary(Path target, Path source, Path output, MergeResult result) {
        log.info("=================================================");
        log.info("MERGE COMPLETE");
        log.info("=================================================");
        log.info("Target: {}", target.toAbsolutePath());
        log.info("Source: {}", source.toAbsolutePath());
        log.info("Written To: {}", output.toAbsolutePath());
        log.info("Sections Added: {}", result.getSectionsAdded());
        log.info("Sections Removed: {}", result.getSectionsRemoved());
        log.info("Properties Added: {}", result.getPropertiesAdded());
        log.info("Properties Removed: {}", result.getPropertiesRemoved());
        log.info("Properties Modified: {}", result.getPropertiesModified());
        log.info("Total Changes: {}", result.getTotalChanges());
    }

    private static int countProperties(Document document) {
        return document.getDefaultSection().size()
                + document.stream().mapToInt(Section::size).sum();
    }
}
