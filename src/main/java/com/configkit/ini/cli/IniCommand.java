package com.configkit.ini.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command grouping the INI file operations.
 */
@Command(
        name = "ini",
        mixinStandardHelpOptions = true,
        version = "ini-document-toolkit 1.0.0",
        description = "Checks, formats, compares, merges and exports INI files while keeping comments and ordering.",
        subcommands = { CheckCommand.class, FormatCommand.class, DiffCommand.class, MergeCommand.class,
                ExportCommand.class }
)
public class IniCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }
}
