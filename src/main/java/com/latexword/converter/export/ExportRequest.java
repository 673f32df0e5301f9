package com.latexword.converter.export;

import com.latexword.converter.metadata.ExportMetadata;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * One document to convert.
 *
 * <p>Either {@code latex} or {@code sourceFile} must be set. The build
 * directory resolves relative image paths and holds the aux and bbl files
 * unless explicit paths are given.</p>
 */
@Data
@Builder
public class ExportRequest {
    private String latex;
    private Path sourceFile;
    private String templateId;
    private Path buildDir;
    private Path auxFile;
    private Path bblFile;
    /** Pre-extracted metadata; takes precedence over {@code extractMetadata}. */
    private ExportMetadata metadata;
    private boolean extractMetadata;
    /** Optional .docx whose styles and settings seed the output. */
    private Path referenceDocx;
    private Path outputFile;
}
