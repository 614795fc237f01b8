package com.configkit.ini.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.configkit.ini.export.CsvExportOptions;
import com.configkit.ini.export.DocumentExporter;
import com.configkit.ini.export.ExportFormat;
import com.configkit.ini.export.JsonExportOptions;
import com.configkit.ini.export.XmlExportOptions;
import com.configkit.ini.model.Document;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Converts a file to JSON, XML or CSV.
 */
@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        description = "Exports an INI file as JSON, XML or CSV. Prints to standard output unless --output is given."
)
public class ExportCommand extends DocumentCommandSupport {

    @Parameters(index = "0", description = "INI file to export")
    private Path file;

    @Option(names = { "--format", "-f" }, defaultValue = "JSON",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ExportFormat format;

    @Option(names = { "--output", "-o" }, description = "File to write (UTF-8)")
    private Path output;

    @Option(names = { "--include-comments" }, description = "Carry comments into the export")
    private boolean includeComments;

    private final DocumentExporter exporter = new DocumentExporter();

    @Override
    protected List<Path> inputs() {
        return List.of(file);
    }

    @Override
    protected int execute() throws IOException {
        Document document = load(file);
        String text = switch (format) {
            case JSON -> exporter.toJson(document, JsonExportOptions.builder().includeComments(includeComments).build());
            case XML -> exporter.toXml(document, XmlExportOptions.builder().includeComments(includeComments).build());
            case CSV -> exporter.toCsv(document, CsvExportOptions.builder().includeComments(includeComments).build());
        };

        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(text);
            out.flush();
            return 0;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, text, StandardCharsets.UTF_8);
        printer.printExported(file, output, format.name());
        return 0;
    }
}
