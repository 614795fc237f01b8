package com.configkit.ini.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.configkit.ini.diff.DocumentDiff;
import com.configkit.ini.diff.MergeOptions;
import com.configkit.ini.diff.MergeResult;
import com.configkit.ini.model.Document;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Applies the differences from a target file to a source file onto the target.
 */
@Command(
        name = "merge",
        mixinStandardHelpOptions = true,
        description = "Merges sections and keys of SOURCE into TARGET. Additions and changed values are applied; "
                + "removals only with --apply-removals."
)
public class MergeCommand extends DocumentCommandSupport {

    @Parameters(index = "0", paramLabel = "TARGET", description = "INI file receiving the changes")
    private Path target;

    @Parameters(index = "1", paramLabel = "SOURCE", description = "INI file providing the changes")
    private Path source;

    @Option(names = { "--apply-removals" }, description = "Also remove sections and keys missing from SOURCE")
    private boolean applyRemovals;

    @Option(names = { "--output", "-o" }, description = "File to write (default: overwrite TARGET)")
    private Path output;

    @Override
    protected List<Path> inputs() {
        return List.of(target, source);
    }

    @Override
    protected int execute() throws IOException {
        Document targetDocument = load(target);
        Document sourceDocument = load(source);
        DocumentDiff diff = targetDocument.compare(sourceDocument);

        MergeOptions options = applyRemovals ? MergeOptions.all() : MergeOptions.defaults();
        MergeResult result = targetDocument.merge(diff, options);

        Path destination = output != null ? output : target;
        save(targetDocument, destination);
        printer.printMergeSummary(target, source, destination, result);
        return 0;
    }
}
