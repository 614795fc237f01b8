package com.configkit.ini.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.configkit.ini.model.Document;
import com.configkit.ini.validation.ElementValidator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Parses a file collecting every malformed line and reports them with content warnings.
 */
@Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Reports parsing errors and content problems of an INI file. Exits with 1 when lines are malformed."
)
public class CheckCommand extends DocumentCommandSupport {

    @Parameters(index = "0", description = "INI file to check")
    private Path file;

    @Override
    protected List<Path> inputs() {
        return List.of(file);
    }

    @Override
    protected boolean collectParsingErrors() {
        return true;
    }

    @Override
    protected int execute() throws IOException {
        Document document = load(file);
        List<String> problems = ElementValidator.forDocument(document).validate(document);
        printer.printCheck(file, document, problems);
        return document.hasParsingErrors() ? 1 : 0;
    }
}
