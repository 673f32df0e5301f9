package com.latexword.converter.export;

import com.latexword.converter.fonts.FontRegistry;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Per-run configuration for the exporter.
 */
@Data
@Builder
public class ConverterConfig {

    /** When the cover and front-matter sections are built. */
    public enum FrontmatterMode {
        /** Build when a template is selected or the metadata carries a cover. */
        AUTO,
        ALWAYS,
        NEVER
    }

    /** Directory of {@code <id>/meta.json} templates; null uses the bundled ones. */
    private Path templatesDir;
    @Builder.Default
    private FontRegistry.Fontset fontset = FontRegistry.Fontset.MAC;
    @Builder.Default
    private String auxName = "document.aux";
    @Builder.Default
    private String bblName = "document.bbl";
    @Builder.Default
    private FrontmatterMode frontmatterMode = FrontmatterMode.AUTO;
    @Builder.Default
    private boolean stripNumberingPart = true;
    @Builder.Default
    private double defaultImageWidthCm = 12.0;

    public static ConverterConfig defaults() {
        return ConverterConfig.builder().build();
    }

    /**
     * Whether front matter is built for a document of the given template
     * and cover state.
     */
    public boolean shouldBuildFrontmatter(String templateId, boolean hasCover) {
        return switch (frontmatterMode) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> (templateId != null && !templateId.isBlank()) || hasCover;
        };
    }
}
