package com.latexword.converter.cli;

import com.latexword.converter.cli.exception.OptionsValidationException;
import com.latexword.converter.cli.model.ConvertOptions;
import com.latexword.converter.cli.model.ValidatedConvertOptions;
import com.latexword.converter.cli.output.ConvertResultsPrinter;
import com.latexword.converter.cli.validation.ConvertOptionsValidator;
import com.latexword.converter.export.ConversionException;
import com.latexword.converter.export.ConverterConfig;
import com.latexword.converter.export.ExportRequest;
import com.latexword.converter.export.ExportResult;
import com.latexword.converter.export.LatexDocxExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command converting a LaTeX source file into a .docx package.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        version = "latex-word-converter 1.0.0",
        description = "Converts a LaTeX document into a Word .docx file using a template profile and TeX build artifacts."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        printer.printBanner(options, validated);

        ConverterConfig config = ConverterConfig.builder()
                .templatesDir(options.getTemplatesDir())
                .fontset(options.getFontset())
                .frontmatterMode(options.getFrontmatter())
                .stripNumberingPart(!options.isKeepNumbering())
                .defaultImageWidthCm(options.getImageWidthCm())
                .build();
        ExportRequest request = ExportRequest.builder()
                .sourceFile(validated.getInput())
                .templateId(options.getTemplate())
                .buildDir(validated.getBuildDir())
                .auxFile(validated.getAuxFile())
                .bblFile(validated.getBblFile())
                .extractMetadata(options.isExtractMetadata())
                .referenceDocx(options.getReferenceDocx())
                .outputFile(validated.getOutput())
                .build();

        ExportResult result;
        try {
            result = new LatexDocxExporter(config).export(request);
        } catch (ConversionException e) {
            log.debug("Conversion failure", e);
            result = ExportResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Conversion failed with exception", e);
            result = ExportResult.failure(e.toString());
        }

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }
        printer.printSuccess(result);
        return 0;
    }
}
