package com.latexword.converter.cli.validation;

import com.latexword.converter.cli.exception.OptionsValidationException;
import com.latexword.converter.cli.model.ConvertOptions;
import com.latexword.converter.cli.model.ValidatedConvertOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ConvertOptionsValidator {

    static final String DEFAULT_AUX = "document.aux";
    static final String DEFAULT_BBL = "document.bbl";

    public ValidatedConvertOptions validate(ConvertOptions o) {
        List<String> errors = new ArrayList<>();

        Path input = o.getInput() == null ? null : o.getInput().toAbsolutePath().normalize();
        if (input == null) {
            errors.add("Input file is required (--input / -i).");
        } else if (!Files.isRegularFile(input)) {
            errors.add("Input file does not exist or is not a file: " + input);
        }

        Path output = resolveOutput(o, input);
        if (output != null) {
            if (!output.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".docx")) {
                errors.add("Output file must have the .docx extension: " + output);
            }
            if (output.equals(input)) {
                errors.add("Output file must differ from the input file: " + output);
            }
            if (Files.isDirectory(output)) {
                errors.add("Output path is a directory: " + output);
            } else if (Files.exists(output) && !o.isForce()) {
                errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
            }
        }

        Path buildDir = resolveBuildDir(o, input);
        if (o.getImageDir() != null && !existsDirectory(buildDir)) {
            errors.add("Image directory does not exist or is not a directory: " + buildDir);
        }
        if (o.getTemplatesDir() != null && !existsDirectory(o.getTemplatesDir())) {
            errors.add("Templates directory does not exist or is not a directory: " + o.getTemplatesDir());
        }

        // Explicit build files must exist; the defaults are optional
        Path auxFile = resolveBuildFile(o.getAux(), buildDir, DEFAULT_AUX, "Aux", errors);
        Path bblFile = resolveBuildFile(o.getBbl(), buildDir, DEFAULT_BBL, "Bbl", errors);

        if (o.getReferenceDocx() != null && !Files.isRegularFile(o.getReferenceDocx())) {
            errors.add("Reference document does not exist: " + o.getReferenceDocx());
        }
        if (o.getImageWidthCm() <= 0) {
            errors.add("Image width must be > 0 cm. Got: " + o.getImageWidthCm());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedConvertOptions(input, output, buildDir, auxFile, bblFile);
    }

    static Path resolveOutput(ConvertOptions o, Path input) {
        if (o.getOutput() != null) {
            return o.getOutput().toAbsolutePath().normalize();
        }
        if (input == null) {
            return null;
        }
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + ".docx");
    }

    private static Path resolveBuildDir(ConvertOptions o, Path input) {
        if (o.getImageDir() != null) {
            return o.getImageDir().toAbsolutePath().normalize();
        }
        if (input != null && input.getParent() != null) {
            return input.getParent();
        }
        return Path.of(".").toAbsolutePath().normalize();
    }

    private static Path resolveBuildFile(Path explicit, Path buildDir, String defaultName, String label,
                                         List<String> errors) {
        if (explicit == null) {
            return buildDir.resolve(defaultName);
        }
        if (!Files.isRegularFile(explicit)) {
            errors.add(label + " file does not exist: " + explicit);
        }
        return explicit.toAbsolutePath().normalize();
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }
}
