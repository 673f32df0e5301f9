package com.latexword.converter.cli.output;

import com.latexword.converter.cli.model.ConvertOptions;
import com.latexword.converter.cli.model.ValidatedConvertOptions;
import com.latexword.converter.export.ExportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Responsible only for printing CLI output for the "convert" command.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("LaTeX to Word Converter");
        log.info("=================================================");
        log.info("Input: {}", v.getInput());
        log.info("Output: {}", v.getOutput());
        log.info("Template: {}", o.getTemplate() != null ? o.getTemplate() : "default");
        log.info("Templates Directory: {}", o.getTemplatesDir() != null ? o.getTemplatesDir().toAbsolutePath() : "bundled");
        log.info("Build Directory: {}", v.getBuildDir());
        log.info("Aux File: {}", describe(v.getAuxFile()));
        log.info("Bbl File: {}", describe(v.getBblFile()));
        log.info("Font Set: {}", o.getFontset());
        log.info("Front Matter: {}", o.getFrontmatter());
        log.info("Extract Metadata: {}", o.isExtractMetadata());
        log.info("Keep Numbering: {}", o.isKeepNumbering());
        log.info("=================================================");
    }

    public void printSuccess(ExportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Size: {} bytes", result.getBytesWritten());
        log.info("Chapters: {}", result.getChapters());
        log.info("Footnotes: {}", result.getFootnotes());
        log.info("Cross-references: {}", result.isAuxAvailable() ? "from aux file" : "computed");
        log.info("Front Matter Built: {}", result.isFrontmatterBuilt());
        log.info("=================================================");
    }

    public void printFailure(ExportResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }

    private static String describe(Path file) {
        return Files.isRegularFile(file) ? file.toString() : file + " (not found)";
    }
}
