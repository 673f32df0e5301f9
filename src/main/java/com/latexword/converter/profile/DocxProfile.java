package com.latexword.converter.profile;

import com.latexword.converter.profile.model.FontsConfig;
import com.latexword.converter.profile.model.FrontmatterConfig;
import com.latexword.converter.profile.model.HeadingStyleConfig;
import com.latexword.converter.profile.model.LabelsConfig;
import com.latexword.converter.profile.model.NumberingConfig;
import com.latexword.converter.profile.model.PageHeadersConfig;
import com.latexword.converter.profile.model.PreprocessorConfig;
import com.latexword.converter.profile.model.StylesConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Per-template configuration for a LaTeX to Word conversion.
 *
 * <p>Every field has a default reproducing a Chinese academic thesis layout,
 * so a template without a {@code docx_profile} still converts sensibly.
 * A profile is built once per conversion and then only read.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocxProfile {

    public static final String REPORT = "report";
    public static final String ARTICLE = "article";

    private static final FieldInterpolator INTERPOLATOR = new FieldInterpolator();

    @Builder.Default
    private String language = "zh-CN";
    @Builder.Default
    private LabelsConfig labels = new LabelsConfig();
    @Builder.Default
    private NumberingConfig numbering = new NumberingConfig();
    @Builder.Default
    private FontsConfig fonts = new FontsConfig();
    @Builder.Default
    private StylesConfig styles = new StylesConfig();
    @Builder.Default
    private PageHeadersConfig pageHeaders = new PageHeadersConfig();
    @Builder.Default
    private FrontmatterConfig frontmatter = new FrontmatterConfig();
    @Builder.Default
    private PreprocessorConfig preprocessor = new PreprocessorConfig();
    private String referenceDocx;
    /** {@code report} (chapters are level 1) or {@code article} (sections are level 1). */
    @Builder.Default
    private String docClassType = REPORT;
    private Path templateDir;

    public static DocxProfile defaults() {
        return new DocxProfile();
    }

    public boolean isReport() {
        return REPORT.equals(docClassType);
    }

    public boolean isUnnumbered(String title) {
        return numbering.getUnnumberedHeadings().contains(title);
    }

    /**
     * Formats a chapter heading with {@code numbering.chapter_format}.
     * Titles in the unnumbered list are returned unchanged.
     */
    public String formatChapter(int n, String title) {
        if (isUnnumbered(title)) {
            return title;
        }
        return INTERPOLATOR.interpolate(numbering.getChapterFormat(), Map.of("n", n, "title", title));
    }

    /**
     * Formats a level 2 to 4 heading. Other levels and unnumbered titles
     * return the bare title.
     */
    public String formatSection(int level, String title, int chapter, int section,
                                int subsection, int subsubsection) {
        if (isUnnumbered(title)) {
            return title;
        }
        String format = switch (level) {
            case 2 -> numbering.getSectionFormat();
            case 3 -> numbering.getSubsectionFormat();
            case 4 -> numbering.getSubsubsectionFormat();
            default -> null;
        };
        if (format == null) {
            return title;
        }
        return INTERPOLATOR.interpolate(format, Map.of(
            "chapter", chapter,
            "section", section,
            "subsection", subsection,
            "subsubsection", subsubsection,
            "title", title));
    }

    public Optional<String> getCjkFont(String command) {
        return Optional.ofNullable(fonts.getCjkFontCommands().get(command));
    }

    public boolean isCjk() {
        return language.startsWith("zh") || language.startsWith("ja") || language.startsWith("ko");
    }

    public Optional<HeadingStyleConfig> getHeadingStyle(int level) {
        return styles.getHeadings().stream()
            .filter(h -> h.getLevel() != null && h.getLevel() == level)
            .findFirst();
    }
}
