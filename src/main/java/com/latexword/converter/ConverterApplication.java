package com.latexword.converter;

import com.latexword.converter.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the LaTeX to Word converter.
 * Converts one LaTeX source file into a .docx package shaped by a template profile.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
