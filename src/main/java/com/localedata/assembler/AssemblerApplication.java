package com.localedata.assembler;

import com.localedata.assembler.cli.AssembleCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Locale Bundle Assembler.
 * Rewrites the locale directives of a source tree and emits one locale data
 * bundle per hierarchy part needed by the configured locales.
 */
public class AssemblerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AssembleCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
