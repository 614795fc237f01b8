package com.configkit.ini.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.configkit.ini.diff.DocumentDiff;
import com.configkit.ini.model.Document;
import com.configkit.ini.report.DiffReportRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Prints the structural differences between two files.
 */
@Command(
        name = "diff",
        mixinStandardHelpOptions = true,
        description = "Compares two INI files section by section and key by key."
)
public class DiffCommand extends DocumentCommandSupport {

    @Parameters(index = "0", description = "Original INI file")
    private Path left;

    @Parameters(index = "1", description = "Changed INI file")
    private Path right;

    @Option(names = { "--exit-code" }, description = "Exit with 1 when the files differ")
    private boolean exitCode;

    @Override
    protected List<Path> inputs() {
        return List.of(left, right);
    }

    @Override
    protected int execute() throws IOException {
        Document leftDocument = load(left);
        Document rightDocument = load(right);
        DocumentDiff diff = leftDocument.compare(rightDocument);

        String report = new DiffReportRenderer().render(left.toString(), right.toString(), diff);
        spec.commandLine().getOut().print(report);
        spec.commandLine().getOut().flush();
        return exitCode && diff.hasChanges() ? 1 : 0;
    }
}
