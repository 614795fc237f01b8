package com.configkit.ini;

import com.configkit.ini.cli.IniCommand;

import picocli.CommandLine;

/**
 * Main entry point for the INI document toolkit.
 * Checks, normalizes, compares, merges and exports INI files from the command line.
 */
public class IniToolApplication {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new IniCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
