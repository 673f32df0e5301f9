package com.latexword.converter.export;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of one export.
 */
@Data
@Builder
public class ExportResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private String templateId;
    private boolean auxAvailable;
    private boolean frontmatterBuilt;
    private int chapters;
    private int footnotes;
    private long bytesWritten;

    public static ExportResult failure(String errorMessage) {
        return ExportResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
