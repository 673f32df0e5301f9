package com.latexword.converter.cli.validation;

import com.latexword.converter.cli.exception.OptionsValidationException;
import com.latexword.converter.cli.model.ConvertOptions;
import com.latexword.converter.cli.model.ValidatedConvertOptions;
import com.latexword.converter.fonts.FontRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConvertOptionsValidator.
 */
class ConvertOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path input;
    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        input = Files.writeString(tempDir.resolve("thesis.tex"), "\\begin{document}x\\end{document}");
    }

    @Test
    void testDefaultsAreDerivedFromInput() {
        ConvertOptions options = parse("-i", input.toString());

        ValidatedConvertOptions validated = validator.validate(options);

        assertThat(validated.getInput()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getOutput()).isEqualTo(tempDir.resolve("thesis.docx").toAbsolutePath().normalize());
        assertThat(validated.getBuildDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(validated.getAuxFile()).isEqualTo(validated.getBuildDir().resolve("document.aux"));
        assertThat(validated.getBblFile()).isEqualTo(validated.getBuildDir().resolve("document.bbl"));
        assertThat(options.getFontset()).isEqualTo(FontRegistry.Fontset.MAC);
        assertThat(options.getImageWidthCm()).isEqualTo(12.0);
    }

    @Test
    void testFontsetIsCaseInsensitive() {
        ConvertOptions options = new ConvertOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true)
                .parseArgs("-i", input.toString(), "--fontset", "windows");

        assertThat(options.getFontset()).isEqualTo(FontRegistry.Fontset.WINDOWS);
    }

    @Test
    void testAllErrorsAreCollected() {
        ConvertOptions options = parse(
                "-i", tempDir.resolve("missing.tex").toString(),
                "-o", tempDir.resolve("out.pdf").toString(),
                "--image-dir", tempDir.resolve("nope").toString(),
                "--aux", tempDir.resolve("missing.aux").toString(),
                "--image-width-cm", "0");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(5)
                        .anyMatch(m -> m.startsWith("Input file does not exist"))
                        .anyMatch(m -> m.startsWith("Output file must have the .docx extension"))
                        .anyMatch(m -> m.startsWith("Image directory does not exist"))
                        .anyMatch(m -> m.startsWith("Aux file does not exist"))
                        .anyMatch(m -> m.startsWith("Image width must be > 0")));
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path output = Files.writeString(tempDir.resolve("thesis.docx"), "old");

        assertThatThrownBy(() -> validator.validate(parse("-i", input.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Use --force to overwrite");

        ValidatedConvertOptions forced = validator.validate(parse("-i", input.toString(), "--force"));
        assertThat(forced.getOutput()).isEqualTo(output.toAbsolutePath().normalize());
    }

    @Test
    void testMissingDefaultAuxIsNotAnError() throws IOException {
        Path images = Files.createDirectories(tempDir.resolve("build"));

        ValidatedConvertOptions validated = validator.validate(
                parse("-i", input.toString(), "--image-dir", images.toString()));

        assertThat(validated.getAuxFile()).isEqualTo(images.toAbsolutePath().normalize().resolve("document.aux"));
    }

    @Test
    void testInputIsRequiredByParser() {
        assertThatThrownBy(() -> parse("--force"))
                .isInstanceOf(CommandLine.MissingParameterException.class);
    }

    private static ConvertOptions parse(String... args) {
        ConvertOptions options = new ConvertOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
