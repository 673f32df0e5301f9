package com.latexword.converter.cli.model;

import com.latexword.converter.export.ConverterConfig;
import com.latexword.converter.fonts.FontRegistry;
import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Holds all CLI options for the "convert" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

    @Option(names = {"--input", "-i"}, required = true, description = "LaTeX source file")
    private Path input;

    @Option(names = {"--output", "-o"}, description = "Output .docx file (defaults to the input name with .docx)")
    private Path output;

    @Option(names = {"--template", "-t"}, description = "Template id selecting the document profile")
    private String template;

    @Option(names = {"--templates-dir"}, description = "Directory of <id>/meta.json templates")
    private Path templatesDir;

    @Option(names = {"--image-dir"}, description = "Base directory for images and build files (defaults to the input's directory)")
    private Path imageDir;

    @Option(names = {"--aux"}, description = "TeX .aux file (defaults to <image-dir>/document.aux)")
    private Path aux;

    @Option(names = {"--bbl"}, description = "Bibliography .bbl file (defaults to <image-dir>/document.bbl)")
    private Path bbl;

    @Option(names = {"--reference-docx"}, description = "Document whose styles and settings seed the output")
    private Path referenceDocx;

    @Option(names = {"--fontset"}, defaultValue = "MAC", description = "CJK font set: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private FontRegistry.Fontset fontset;

    @Option(names = {"--image-width-cm"}, defaultValue = "12", description = "Width of images without an explicit size (default: ${DEFAULT-VALUE})")
    private double imageWidthCm;

    @Option(names = {"--frontmatter"}, defaultValue = "AUTO",
            description = "Build the cover and front-matter sections: ${COMPLETION-CANDIDATES} "
                    + "(default: ${DEFAULT-VALUE}, i.e. when a template is selected or a cover is found)")
    private ConverterConfig.FrontmatterMode frontmatter;

    @Option(names = {"--keep-numbering"}, description = "Keep the numbering part in the saved package")
    private boolean keepNumbering;

    @Option(names = {"--extract-metadata"}, description = "Extract title, cover and revision metadata from the source")
    private boolean extractMetadata;

    @Option(names = {"--force", "-f"}, description = "Overwrite an existing output file")
    private boolean force;
}
