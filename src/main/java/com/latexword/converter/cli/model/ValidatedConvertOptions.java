package com.latexword.converter.cli.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Paths resolved from the raw options. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path input;
    Path output;
    Path buildDir;
    Path auxFile;
    Path bblFile;
}
