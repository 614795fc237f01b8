package com.configkit.ini.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

import com.configkit.ini.io.IniSerializer;
import com.configkit.ini.model.Document;
import com.configkit.ini.util.DocumentSorter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Rewrites a file in the canonical layout, optionally sorted.
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        description = "Normalizes the layout of an INI file. Prints to standard output unless --output is given."
)
public class FormatCommand extends DocumentCommandSupport {

    @Parameters(index = "0", description = "INI file to format")
    private Path file;

    @Option(names = { "--output", "-o" }, description = "File to write; may be the input file itself")
    private Path output;

    @Option(names = { "--sort" }, description = "Sort sections and keys by name")
    private boolean sort;

    @Override
    protected List<Path> inputs() {
        return List.of(file);
    }

    @Override
    protected int execute() throws IOException {
        Document document = load(file);
        if (sort) {
            DocumentSorter.sortAll(document);
        }
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            new IniSerializer().write(document, out);
            return 0;
        }
        save(document, output);
        printer.printFormatted(file, output);
        return 0;
    }
}
