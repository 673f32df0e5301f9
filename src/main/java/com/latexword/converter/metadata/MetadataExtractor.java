package com.latexword.converter.metadata;

import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.ApprovalFieldConfig;
import com.latexword.converter.profile.model.CoverConfig;
import com.latexword.converter.profile.model.MetadataFieldRuleConfig;
import com.latexword.converter.profile.model.PreprocessorConfig;
import com.latexword.converter.profile.model.RevisionTableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads {@link ExportMetadata} out of LaTeX source using the rules of a
 * profile's {@code preprocessor} section, and prepares the body for
 * conversion by removing blocks that the front-matter builder recreates.
 */
public class MetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("^[^%\\n]*\\\\begin\\{document\\}", Pattern.MULTILINE);
    private static final Pattern TITLE = Pattern.compile("(?<!%)\\\\title\\{(.*?)\\}%?", Pattern.DOTALL);
    private static final Pattern AUTHOR = Pattern.compile("(?<!%)\\\\author\\{(.*?)\\}%?", Pattern.DOTALL);
    private static final Pattern SCHOOL_LOGO = Pattern.compile("\\\\schoollogo(?:\\[([^\\]]*)\\])?\\{([^}]*)\\}");
    private static final Pattern SCALE = Pattern.compile("scale\\s*=\\s*([\\d.]+)");
    private static final Pattern CLASS_OPTIONS = Pattern.compile("\\\\documentclass\\[([^\\]]*)\\]");
    private static final Pattern DOCUMENT_CLASS = Pattern.compile("\\\\documentclass\\s*(\\[[^\\]]*\\])?\\{([^}]*)\\}");
    private static final Pattern TWOSIDE = Pattern.compile("\\btwoside\\b");
    private static final Pattern GEOMETRY = Pattern.compile("\\\\(?:new)?geometry\\s*\\{([^}]*)\\}", Pattern.DOTALL);
    private static final Pattern GEOMETRY_PARAM = Pattern.compile("(\\w+)\\s*=\\s*([\\d.]+\\s*(?:cm|mm|in|pt|bp))");
    private static final Pattern PAGENUMBERING = Pattern.compile("^[^%\\n]*\\\\pagenumbering\\{(\\w+)\\}", Pattern.MULTILINE);
    private static final Pattern MAINMATTER = Pattern.compile("^[^%\\n]*\\\\mainmatter\\b", Pattern.MULTILINE);
    private static final Pattern TABULARX = Pattern.compile("(\\\\begin\\{tabularx\\}.*?\\\\end\\{tabularx\\})", Pattern.DOTALL);
    private static final Pattern CENTER_END = Pattern.compile("\\s*\\\\end\\{center\\}");
    private static final Pattern ROW_END = Pattern.compile("\\\\tabularnewline");
    private static final Pattern ANY_COMMAND = Pattern.compile("\\\\[a-zA-Z]+\\b");
    private static final Pattern COVER_PAGESTYLE = Pattern.compile("\\\\thispagestyle\\{coverpage\\}");
    private static final Pattern INTOBMK_LINE = Pattern.compile("\\\\intobmk\\*?(?:\\{[^}]*\\})+[^\\n]*\\n?");
    private static final Pattern INTOBMK_PREFIX = Pattern.compile("\\\\intobmk\\s*(?=\\\\chapter)");

    private static final Pattern CLEAN_FONT = Pattern.compile(
        "\\\\(?:heiti|songti|fangsong|kaiti|bfseries|normalfont|selectfont|centering)\\b");
    private static final Pattern CLEAN_FONTSIZE = Pattern.compile("\\\\fontsize\\{[^}]*\\}\\{[^}]*\\}");
    private static final Pattern CLEAN_EMPHASIS = Pattern.compile("\\\\(?:textbf|textit)\\{([^}]*)\\}");
    private static final Pattern CLEAN_QUAD = Pattern.compile("\\\\quad\\s*");

    private static final Map<String, String> PAGE_FORMATS = Map.of(
        "roman", "lowerRoman",
        "Roman", "upperRoman",
        "arabic", "decimal",
        "alph", "lowerLetter",
        "Alph", "upperLetter"
    );

    private final DocxProfile profile;

    public MetadataExtractor(DocxProfile profile) {
        this.profile = profile;
    }

    /**
     * Extracts metadata only. The source is not modified.
     */
    public ExportMetadata extract(String latex, String templateId) {
        return prepare(latex, templateId).getMetadata();
    }

    /**
     * Extracts metadata and returns the source with the cover block removed,
     * the revision table rewritten as a plain tabular, and configured
     * front-matter commands stripped from the body.
     */
    public PreparedSource prepare(String latex, String templateId) {
        ExportMetadata metadata = new ExportMetadata();
        metadata.setTemplateId(templateId == null ? "" : templateId);

        Matcher begin = BEGIN_DOCUMENT.matcher(latex);
        if (!begin.find()) {
            log.debug("No \\begin{{document}} found; metadata left empty");
            return new PreparedSource(latex, metadata);
        }
        int split = begin.start() + begin.group().indexOf("\\begin{document}");
        String preamble = latex.substring(0, split);
        String body = latex.substring(split);

        extractGeometry(preamble, metadata);
        extractPreambleFields(preamble, metadata);

        body = extractCover(body, metadata);
        body = extractRevisionRecords(body, metadata);
        extractPageNumbering(body, metadata);
        body = stripFrontmatterCommands(body);
        preamble = normalizePreamble(preamble);

        log.debug("Extracted metadata: title='{}', cover={}, revisions={}",
            metadata.getTitle(), metadata.isCoverDetected(), metadata.getRevisionRecords().size());
        return new PreparedSource(preamble + body, metadata);
    }

    void extractPreambleFields(String preamble, ExportMetadata metadata) {
        Matcher m = TITLE.matcher(preamble);
        if (m.find()) {
            metadata.set(ExportMetadata.TITLE, m.group(1).replaceAll("[{}]", "").strip());
        }
        m = AUTHOR.matcher(preamble);
        if (m.find()) {
            metadata.set(ExportMetadata.AUTHOR, m.group(1).replaceAll("[{}]", "").strip());
        }

        PreprocessorConfig config = profile.getPreprocessor();
        for (MetadataFieldRuleConfig rule : config.getPreambleMetadataFields()) {
            if (rule.getAttr().isEmpty() || rule.getCommand().isEmpty()) {
                continue;
            }
            Pattern command = Pattern.compile("\\\\" + Pattern.quote(rule.getCommand()) + "\\{([^}]*)\\}");
            Matcher field = command.matcher(preamble);
            if (field.find()) {
                String value = field.group(1).replace("~", " ").strip();
                if (!rule.getStripPrefixRegex().isEmpty()) {
                    Optional<Pattern> prefix = profilePattern(rule.getStripPrefixRegex(), Pattern.CASE_INSENSITIVE);
                    if (prefix.isPresent()) {
                        value = prefix.get().matcher(value).replaceAll("");
                    }
                }
                metadata.set(rule.getAttr(), value);
            }
        }

        m = SCHOOL_LOGO.matcher(preamble);
        if (m.find()) {
            metadata.setSchoolLogo(m.group(2).strip());
            if (m.group(1) != null) {
                Matcher scale = SCALE.matcher(m.group(1));
                if (scale.find()) {
                    metadata.setSchoolLogoScale(Double.parseDouble(scale.group(1)));
                }
            }
        }

        m = CLASS_OPTIONS.matcher(preamble);
        if (m.find() && TWOSIDE.matcher(m.group(1)).find()) {
            metadata.setTwoside(true);
        }

        if (config.isTitleImpliesCover() && !metadata.getTitle().isEmpty()) {
            metadata.setCoverDetected(true);
        }
    }

    /** Every {@code \geometry} block is read; later blocks override earlier keys. */
    void extractGeometry(String preamble, ExportMetadata metadata) {
        Matcher block = GEOMETRY.matcher(preamble);
        while (block.find()) {
            Matcher param = GEOMETRY_PARAM.matcher(block.group(1));
            while (param.find()) {
                metadata.getGeometry().put(param.group(1), param.group(2));
            }
        }
    }

    /**
     * The first {@code \pagenumbering} gives the front-matter format, the
     * second the body format. A {@code \mainmatter} alone implies arabic.
     */
    void extractPageNumbering(String body, ExportMetadata metadata) {
        List<String> numberings = new ArrayList<>();
        Matcher m = PAGENUMBERING.matcher(body);
        while (m.find()) {
            numberings.add(m.group(1));
        }
        if (numberings.isEmpty()) {
            return;
        }
        String first = PAGE_FORMATS.get(numberings.get(0));
        if (first != null) {
            metadata.setFrontmatterPageFormat(first);
        }
        if (numberings.size() >= 2) {
            String second = PAGE_FORMATS.get(numberings.get(1));
            if (second != null) {
                metadata.setBodyPageFormat(second);
            }
        } else if (MAINMATTER.matcher(body).find()) {
            metadata.setBodyPageFormat("decimal");
        }
    }

    String extractCover(String body, ExportMetadata metadata) {
        CoverConfig cover = profile.getPreprocessor().getCover();
        if (!cover.isEnabled()) {
            return body;
        }

        Optional<Pattern> blockStart = profilePattern(cover.getBlockStart(), 0);
        Optional<Pattern> blockEnd = profilePattern(cover.getBlockEnd(), 0);
        if (blockStart.isEmpty() || blockEnd.isEmpty()) {
            return body;
        }
        Matcher start = blockStart.get().matcher(body);
        if (!start.find()) {
            return body;
        }
        Matcher end = blockEnd.get().matcher(body);
        if (!end.find(start.end())) {
            return body;
        }

        String coverText = body.substring(start.start(), end.end());
        if (!cover.getDetectionMarkers().isEmpty()
                && cover.getDetectionMarkers().stream().noneMatch(coverText::contains)) {
            log.debug("Block at offset {} has no cover marker; left in place", start.start());
            return body;
        }

        parseCover(coverText, cover, metadata);
        metadata.setCoverDetected(true);

        String remaining = body.substring(0, start.start()) + body.substring(end.end());
        return COVER_PAGESTYLE.matcher(remaining).replaceAll("");
    }

    private void parseCover(String coverText, CoverConfig cover, ExportMetadata metadata) {
        cover.getFieldPatterns().forEach((attr, regex) -> profilePattern(regex, Pattern.DOTALL)
            .map(pattern -> pattern.matcher(coverText))
            .filter(Matcher::find)
            .ifPresent(m -> metadata.set(attr, cleanCoverText(m.group(1)))));

        for (ApprovalFieldConfig approval : cover.getApprovalFields()) {
            if (approval.getLabel().isEmpty()) {
                continue;
            }
            Pattern row = Pattern.compile(Pattern.quote(approval.getLabel())
                + "\\s*&\\s*\\\\centering\\s*(.*?)\\s*&\\s*(.*?)\\s*\\\\tabularnewline");
            Matcher m = row.matcher(coverText);
            if (m.find()) {
                if (!approval.getNameAttr().isEmpty()) {
                    metadata.set(approval.getNameAttr(), cleanCoverText(m.group(1)));
                }
                if (!approval.getDateAttr().isEmpty()) {
                    metadata.set(approval.getDateAttr(), cleanCoverText(m.group(2)));
                }
            }
        }

        profilePattern(cover.getInstitutePattern(), Pattern.DOTALL)
            .map(pattern -> pattern.matcher(coverText))
            .filter(Matcher::find)
            .ifPresent(m -> metadata.set(ExportMetadata.INSTITUTE, cleanCoverText(m.group(1))));

        // The report date is the large line after the last \vfill
        int vfill = coverText.lastIndexOf("\\vfill");
        if (vfill >= 0) {
            String tail = coverText.substring(vfill);
            profilePattern(cover.getDatePattern(), Pattern.DOTALL)
                .map(pattern -> pattern.matcher(tail))
                .filter(Matcher::find)
                .ifPresent(m -> metadata.set(ExportMetadata.REPORT_DATE, cleanCoverText(m.group(1))));
        }
    }

    private static Optional<Pattern> profilePattern(String regex, int flags) {
        try {
            return Optional.of(Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid profile pattern '{}': {}", regex, e.getDescription());
            return Optional.empty();
        }
    }

    static String cleanCoverText(String text) {
        String result = CLEAN_FONT.matcher(text).replaceAll("");
        result = CLEAN_FONTSIZE.matcher(result).replaceAll("");
        result = CLEAN_EMPHASIS.matcher(result).replaceAll("$1");
        result = CLEAN_QUAD.matcher(result).replaceAll(" ");
        return result.replaceAll("[{}]", "").strip();
    }

    String extractRevisionRecords(String body, ExportMetadata metadata) {
        RevisionTableConfig config = profile.getPreprocessor().getRevisionTable();
        int marker = config.getMarker().isEmpty() ? -1 : body.indexOf(config.getMarker());
        if (marker < 0) {
            return body;
        }
        Matcher table = TABULARX.matcher(body);
        if (!table.find(marker)) {
            return body;
        }

        List<RevisionRecord> records = new ArrayList<>();
        for (String rawRow : ROW_END.split(table.group(1))) {
            if (rawRow.contains("\\heiti") || rawRow.contains("\\begin{") || rawRow.contains("\\end{")) {
                continue;
            }
            String[] cells = rawRow.split("&", -1);
            if (cells.length < 5) {
                continue;
            }
            String version = ANY_COMMAND.matcher(cells[0]).replaceAll("").replaceAll("[{}]", "").strip();
            if (version.isEmpty()) {
                continue;
            }
            records.add(new RevisionRecord(version, cells[1].strip(), cells[2].strip(), cells[3].strip(),
                cells[4].replace("\\hline", "").strip()));
        }
        metadata.setRevisionRecords(records);

        int blockStart = body.lastIndexOf("\\begin{center}", marker);
        if (blockStart < 0) {
            blockStart = marker;
        }
        int blockEnd = table.end();
        Matcher closing = CENTER_END.matcher(body).region(blockEnd, body.length());
        if (blockStart < marker && closing.lookingAt()) {
            blockEnd = closing.end();
        }
        return body.substring(0, blockStart) + revisionTableLatex(config, records) + body.substring(blockEnd);
    }

    private static String revisionTableLatex(RevisionTableConfig config, List<RevisionRecord> records) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n\\section*{").append(config.getSectionTitle()).append("}\n\n");
        if (!records.isEmpty()) {
            List<String> headers = new ArrayList<>(config.getColumnHeaders());
            while (headers.size() < 5) {
                headers.add("");
            }
            sb.append("\\begin{tabular}{|l|l|p{5cm}|l|l|}\n\\hline\n");
            for (int i = 0; i < 5; i++) {
                sb.append("\\textbf{").append(headers.get(i)).append('}').append(i < 4 ? " & " : " \\\\\n\\hline\n");
            }
            for (RevisionRecord r : records) {
                sb.append(r.getVersion()).append(" & ").append(r.getDate()).append(" & ")
                    .append(r.getChangeSummary()).append(" & ").append(r.getModifiedSections()).append(" & ")
                    .append(r.getRemarks()).append(" \\\\\n\\hline\n");
            }
            sb.append("\\end{tabular}\n");
        }
        sb.append("\n\\clearpage\n");
        return sb.toString();
    }

    /**
     * Maps the document class to a standard one and drops preamble commands
     * that only affect the PDF output.
     */
    String normalizePreamble(String preamble) {
        PreprocessorConfig config = profile.getPreprocessor();
        String result = preamble;
        Matcher cls = DOCUMENT_CLASS.matcher(result);
        if (cls.find()) {
            String mapped = config.getNormalizeDocumentclassMap().get(cls.group(2).strip());
            if (mapped != null) {
                result = result.substring(0, cls.start(2)) + mapped + result.substring(cls.end(2));
            }
        }
        for (String command : config.getRemovePreambleCommandsWithArg()) {
            result = Pattern.compile("\\\\" + Pattern.quote(command) + "\\s*(?:\\[[^\\]]*\\])?\\{[^}]*\\}")
                .matcher(result).replaceAll("");
        }
        return result;
    }

    private String stripFrontmatterCommands(String body) {
        String result = body;
        for (String command : profile.getPreprocessor().getStripBodyCommands()) {
            result = Pattern.compile("\\\\" + Pattern.quote(command) + "\\b[^\\n]*\\n?").matcher(result).replaceAll("");
        }
        result = INTOBMK_LINE.matcher(result).replaceAll("");
        result = INTOBMK_PREFIX.matcher(result).replaceAll("");
        result = result.replace("{\\contentsname}", "{" + profile.getLabels().getToc() + "}")
            .replace("{\\listfigurename}", "{" + profile.getLabels().getListOfFigures() + "}")
            .replace("{\\listtablename}", "{" + profile.getLabels().getListOfTables() + "}");
        return result;
    }
}
