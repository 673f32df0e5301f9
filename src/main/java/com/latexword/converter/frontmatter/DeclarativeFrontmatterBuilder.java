package com.latexword.converter.frontmatter;

import com.latexword.converter.convert.DocxStyles;
import com.latexword.converter.convert.ImageResolver;
import com.latexword.converter.convert.PictureEmbedder;
import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.FieldInterpolator;
import com.latexword.converter.profile.model.AutoTocConfig;
import com.latexword.converter.profile.model.BodySectionBreakConfig;
import com.latexword.converter.profile.model.FrontmatterElementConfig;
import com.latexword.converter.profile.model.FrontmatterSectionConfig;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.TableRowAlign;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTable.XWPFBorderType;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableCell.XWPFVertAlign;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblWidth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds front matter from the profile's section recipes, then inserts the
 * configured body section breaks and an automatic table of contents, and
 * finally assigns headers and page numbers per section.
 */
public class DeclarativeFrontmatterBuilder implements FrontmatterBuilder {

    private static final Logger log = LoggerFactory.getLogger(DeclarativeFrontmatterBuilder.class);

    static final List<String> LOGO_EXTENSIONS = List.of("", ".pdf", ".png", ".jpg", ".jpeg", ".eps");
    static final double DEFAULT_LOGO_WIDTH_CM = 10;
    static final double INFO_FONT_PT = 14;
    static final String INFO_FONT = "STSong";
    static final int INFO_TABLE_WIDTH_PCT = 4200;
    static final int INFO_LABEL_WIDTH_PCT = 1800;
    static final int INFO_VALUE_WIDTH_PCT = 3200;
    static final int INFO_CELL_MARGIN = 57;
    static final double TOC_HEADING_PT = 16;
    static final String ODD_PAGE = "oddPage";

    private static final FieldInterpolator INTERPOLATOR = new FieldInterpolator();

    private final DocxProfile profile;
    private final PictureEmbedder pictureEmbedder;
    private final PageHeaderAssigner headerAssigner;

    public DeclarativeFrontmatterBuilder(DocxProfile profile) {
        this(profile, new PictureEmbedder());
    }

    public DeclarativeFrontmatterBuilder(DocxProfile profile, PictureEmbedder pictureEmbedder) {
        this.profile = profile;
        this.pictureEmbedder = pictureEmbedder;
        this.headerAssigner = new PageHeaderAssigner(profile);
    }

    @Override
    public void build(XWPFDocument doc, ExportMetadata metadata) {
        int coverSections = buildSections(doc, metadata);
        int bodyBreaks = applyBodySectionBreaks(doc);
        boolean tocInserted = insertAutoToc(doc);
        headerAssigner.assign(doc, metadata, coverSections);
        log.info("Front matter built: {} cover sections, {} body section breaks, auto TOC {}",
            coverSections, bodyBreaks, tocInserted ? "inserted" : "not needed");
    }

    // ------------------------------------------------------------------
    // front-matter sections

    /**
     * Inserts every visible section before the existing body content.
     *
     * @return the number of sections that ended with a section break
     */
    int buildSections(XWPFDocument doc, ExportMetadata metadata) {
        BodyInserter inserter = BodyInserter.atStart(doc);
        int breaks = 0;
        for (FrontmatterSectionConfig section : profile.getFrontmatter().getSections()) {
            if (!visible(section.getCondition(), metadata)) {
                log.debug("Skipping front-matter section '{}': {} not present", section.getId(), section.getCondition());
                continue;
            }
            for (FrontmatterElementConfig element : section.getElements()) {
                if (visible(element.getCondition(), metadata)) {
                    buildElement(inserter, element, metadata);
                }
            }
            if (!section.getBreakAfter().isEmpty()) {
                SectionBreaks.configure(doc, inserter.paragraph(), section.getBreakAfter());
                breaks++;
            }
        }
        return breaks;
    }

    private static boolean visible(String condition, ExportMetadata metadata) {
        return condition == null || condition.isEmpty() || metadata.isPresent(condition);
    }

    private void buildElement(BodyInserter inserter, FrontmatterElementConfig cfg, ExportMetadata metadata) {
        switch (cfg.getType()) {
            case "text" -> buildText(inserter, cfg, metadata);
            case "spacer" -> {
                for (int i = 0; i < Math.max(cfg.getLines(), 0); i++) {
                    inserter.paragraph().setIndentationFirstLine(0);
                }
            }
            case "logo" -> {
                Optional<Path> logo = resolveLogo(metadata);
                if (logo.isPresent()) {
                    spacingBefore(inserter, cfg);
                    buildLogo(inserter, logo.get(), metadata);
                } else {
                    log.warn("School logo '{}' not found in template", metadata.getSchoolLogo());
                }
            }
            case "info_table" -> {
                List<String[]> rows = infoRows(cfg, metadata);
                if (!rows.isEmpty()) {
                    spacingBefore(inserter, cfg);
                    buildInfoTable(inserter, rows);
                }
            }
            case "boilerplate" -> buildBoilerplate(inserter, cfg, metadata);
            case "signature_block" -> {
                spacingBefore(inserter, cfg);
                for (List<String> row : cfg.getRows()) {
                    String text = row.isEmpty() ? "" : interpolate(row.get(0), metadata);
                    FrontmatterParagraphs.text(inserter.paragraph(), text, cfg.getFont(), cfg.getSizePt(),
                        false, FrontmatterParagraphs.alignment(cfg.getAlign()));
                }
            }
            default -> log.warn("Unknown front-matter element type '{}'", cfg.getType());
        }
    }

    private void buildText(BodyInserter inserter, FrontmatterElementConfig cfg, ExportMetadata metadata) {
        String text = cfg.getField().isEmpty()
            ? interpolate(cfg.getContent(), metadata)
            : metadata.get(cfg.getField());
        if (text.isEmpty() && cfg.getContent().isEmpty()) {
            return;
        }
        XWPFParagraph paragraph = FrontmatterParagraphs.text(inserter.paragraph(), text, cfg.getFont(),
            cfg.getSizePt(), cfg.isBold(), FrontmatterParagraphs.alignment(cfg.getAlign()));
        FrontmatterParagraphs.spaceBefore(paragraph, cfg.getSpaceBeforePt());
    }

    private void buildBoilerplate(BodyInserter inserter, FrontmatterElementConfig cfg, ExportMetadata metadata) {
        boolean first = true;
        for (List<String> row : cfg.getRows()) {
            String text = row.isEmpty() ? "" : interpolate(row.get(0), metadata);
            if (text.isEmpty()) {
                continue;
            }
            XWPFParagraph paragraph = FrontmatterParagraphs.text(inserter.paragraph(), text, cfg.getFont(),
                cfg.getSizePt(), cfg.isBold(), FrontmatterParagraphs.alignment(cfg.getAlign()));
            if (first) {
                FrontmatterParagraphs.spaceBefore(paragraph, cfg.getSpaceBeforePt());
                first = false;
            }
        }
    }

    private static void spacingBefore(BodyInserter inserter, FrontmatterElementConfig cfg) {
        Double pt = cfg.getSpaceBeforePt();
        if (pt != null && pt > 0) {
            FrontmatterParagraphs.spacer(inserter.paragraph(), pt);
        }
    }

    private static String interpolate(String format, ExportMetadata metadata) {
        if (format == null || format.isEmpty()) {
            return "";
        }
        return INTERPOLATOR.interpolate(format, metadata.asMap());
    }

    // ------------------------------------------------------------------
    // logo

    /** Looks the metadata logo name up in the template's {@code Img} directory. */
    Optional<Path> resolveLogo(ExportMetadata metadata) {
        String name = metadata.getSchoolLogo();
        if (name == null || name.isBlank() || profile.getTemplateDir() == null) {
            return Optional.empty();
        }
        Path imgDir = profile.getTemplateDir().resolve("Img");
        for (String extension : LOGO_EXTENSIONS) {
            Path candidate = imgDir.resolve(name + extension);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private void buildLogo(BodyInserter inserter, Path logo, ExportMetadata metadata) {
        XWPFParagraph paragraph = inserter.paragraph();
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        paragraph.setIndentationFirstLine(0);
        try {
            pictureEmbedder.embed(paragraph, logo, logoWidthCm(logo, metadata.getSchoolLogoScale()));
        } catch (IOException | InvalidFormatException e) {
            log.warn("Cannot embed school logo {}: {}", logo, e.getMessage());
        }
    }

    /** A PDF logo keeps its natural width times the LaTeX scale; bitmaps get a fixed width. */
    double logoWidthCm(Path logo, double scale) {
        if (!ImageResolver.isPdf(logo)) {
            return DEFAULT_LOGO_WIDTH_CM;
        }
        double factor = scale > 0 ? scale : 1;
        return pictureEmbedder.getPdfRasterizer().firstPageWidth(logo)
            .map(widthPt -> widthPt * factor / 72 * 2.54)
            .orElse(DEFAULT_LOGO_WIDTH_CM);
    }

    // ------------------------------------------------------------------
    // info table

    private List<String[]> infoRows(FrontmatterElementConfig cfg, ExportMetadata metadata) {
        List<String[]> rows = new ArrayList<>();
        for (List<String> row : cfg.getRows()) {
            if (row.size() >= 2) {
                rows.add(new String[] {row.get(0), interpolate(row.get(1), metadata)});
            }
        }
        return rows;
    }

    /** A borderless label/value table; each value sits on an underline. */
    private void buildInfoTable(BodyInserter inserter, List<String[]> rows) {
        XWPFTable table = inserter.table();
        table.setTableAlignment(TableRowAlign.CENTER);
        table.setCellMargins(0, INFO_CELL_MARGIN, 0, INFO_CELL_MARGIN);
        table.setTopBorder(XWPFBorderType.NONE, 0, 0, "auto");
        table.setBottomBorder(XWPFBorderType.NONE, 0, 0, "auto");
        table.setLeftBorder(XWPFBorderType.NONE, 0, 0, "auto");
        table.setRightBorder(XWPFBorderType.NONE, 0, 0, "auto");
        table.setInsideHBorder(XWPFBorderType.NONE, 0, 0, "auto");
        table.setInsideVBorder(XWPFBorderType.NONE, 0, 0, "auto");
        CTTblPr tblPr = table.getCTTbl().getTblPr() != null ? table.getCTTbl().getTblPr() : table.getCTTbl().addNewTblPr();
        CTTblWidth width = tblPr.isSetTblW() ? tblPr.getTblW() : tblPr.addNewTblW();
        width.setType(STTblWidth.PCT);
        width.setW(BigInteger.valueOf(INFO_TABLE_WIDTH_PCT));

        XWPFTableRow first = table.getRow(0);
        if (first.getTableCells().size() < 2) {
            first.addNewTableCell();
        }
        for (int i = 1; i < rows.size(); i++) {
            table.createRow();
        }

        for (int i = 0; i < rows.size(); i++) {
            XWPFTableRow row = table.getRow(i);
            fillLabelCell(row.getCell(0), rows.get(i)[0]);
            fillValueCell(row.getCell(1), rows.get(i)[1]);
        }
    }

    private static void fillLabelCell(XWPFTableCell cell, String label) {
        cellWidth(cell, INFO_LABEL_WIDTH_PCT);
        cell.setVerticalAlignment(XWPFVertAlign.BOTTOM);
        XWPFParagraph paragraph = infoParagraph(cell, ParagraphAlignment.RIGHT);
        FrontmatterParagraphs.text(paragraph, label + "：", INFO_FONT, INFO_FONT_PT, false, ParagraphAlignment.RIGHT);
    }

    private static void fillValueCell(XWPFTableCell cell, String value) {
        cellWidth(cell, INFO_VALUE_WIDTH_PCT);
        cell.setVerticalAlignment(XWPFVertAlign.BOTTOM);
        CTTcPr tcPr = tcPr(cell.getCTTc());
        CTTcBorders borders = tcPr.isSetTcBorders() ? tcPr.getTcBorders() : tcPr.addNewTcBorders();
        OoxmlUtil.setBorder(borders.isSetBottom() ? borders.getBottom() : borders.addNewBottom(), STBorder.SINGLE, 4);
        CTTblWidth bottomMargin = tcPr.addNewTcMar().addNewBottom();
        bottomMargin.setType(STTblWidth.DXA);
        bottomMargin.setW(BigInteger.ZERO);
        XWPFParagraph paragraph = infoParagraph(cell, ParagraphAlignment.CENTER);
        FrontmatterParagraphs.text(paragraph, value, INFO_FONT, INFO_FONT_PT, false, ParagraphAlignment.CENTER);
    }

    private static XWPFParagraph infoParagraph(XWPFTableCell cell, ParagraphAlignment alignment) {
        XWPFParagraph paragraph = cell.getParagraphs().isEmpty() ? cell.addParagraph() : cell.getParagraphs().get(0);
        paragraph.setAlignment(alignment);
        paragraph.setSpacingBefore(0);
        paragraph.setSpacingAfter(0);
        paragraph.setSpacingBetween(1.0);
        return paragraph;
    }

    private static void cellWidth(XWPFTableCell cell, int pct) {
        CTTcPr tcPr = tcPr(cell.getCTTc());
        CTTblWidth width = tcPr.isSetTcW() ? tcPr.getTcW() : tcPr.addNewTcW();
        width.setType(STTblWidth.PCT);
        width.setW(BigInteger.valueOf(pct));
    }

    private static CTTcPr tcPr(CTTc tc) {
        return tc.isSetTcPr() ? tc.getTcPr() : tc.addNewTcPr();
    }

    // ------------------------------------------------------------------
    // body section breaks

    /**
     * Inserts a section break before headings matching the configured
     * rules. A heading gets at most one break; {@code firstOnly} rules fire
     * once per document.
     *
     * @return the number of breaks inserted
     */
    int applyBodySectionBreaks(XWPFDocument doc) {
        List<BodySectionBreakConfig> rules = profile.getFrontmatter().getBodySectionBreaks();
        if (rules.isEmpty()) {
            return 0;
        }
        Set<String> fired = new HashSet<>();
        int inserted = 0;
        for (XWPFParagraph paragraph : new ArrayList<>(doc.getParagraphs())) {
            boolean heading = "Heading1".equals(paragraph.getStyle()) || FrontmatterParagraphs.isHeadingLike(paragraph);
            if (!heading) {
                continue;
            }
            String text = paragraph.getText().strip();
            for (BodySectionBreakConfig rule : rules) {
                String key = rule.getBeforeHeadingText().isEmpty()
                    ? rule.getBeforeHeadingPattern()
                    : rule.getBeforeHeadingText();
                if (rule.isFirstOnly() && fired.contains(key)) {
                    continue;
                }
                if (matches(rule, text)) {
                    SectionBreaks.configure(doc, new BodyInserter(doc, paragraph).paragraph(), rule.getBreakType());
                    fired.add(key);
                    inserted++;
                    break;
                }
            }
        }
        return inserted;
    }

    static boolean matches(BodySectionBreakConfig rule, String text) {
        if (!rule.getBeforeHeadingText().isEmpty() && text.equals(rule.getBeforeHeadingText())) {
            return true;
        }
        if (rule.getBeforeHeadingPattern().isEmpty()) {
            return false;
        }
        try {
            return Pattern.compile(rule.getBeforeHeadingPattern()).matcher(text).lookingAt();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid body break pattern '{}': {}", rule.getBeforeHeadingPattern(), e.getDescription());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // automatic table of contents

    /**
     * Adds a table of contents in its own odd-page section before the first
     * numbered chapter, unless the document already has a TOC heading.
     *
     * @return whether a table of contents was inserted
     */
    boolean insertAutoToc(XWPFDocument doc) {
        AutoTocConfig autoToc = profile.getFrontmatter().getAutoToc();
        if (autoToc == null || !autoToc.isInsertBeforeFirstChapter()) {
            return false;
        }
        Pattern chapter;
        try {
            chapter = Pattern.compile(profile.getPageHeaders().getChapterPattern());
        } catch (PatternSyntaxException e) {
            log.warn("Invalid chapter pattern '{}', no table of contents inserted: {}",
                profile.getPageHeaders().getChapterPattern(), e.getDescription());
            return false;
        }
        XWPFParagraph firstChapter = null;
        for (XWPFParagraph paragraph : doc.getParagraphs()) {
            String text = paragraph.getText().strip();
            if (text.contains("目") && text.contains("录")) {
                return false;
            }
            if (firstChapter == null && DocxStyles.headingStyleId(1).equals(paragraph.getStyle())
                && chapter.matcher(text).lookingAt()) {
                firstChapter = paragraph;
            }
        }
        if (firstChapter == null) {
            return false;
        }

        BodyInserter inserter = new BodyInserter(doc, firstChapter);
        SectionBreaks.configure(doc, inserter.paragraph(), ODD_PAGE);
        FrontmatterParagraphs.text(inserter.paragraph(), autoToc.getHeadingText(), autoToc.getHeadingFont(),
            TOC_HEADING_PT, true, ParagraphAlignment.CENTER);
        inserter.paragraph().setIndentationFirstLine(0);
        FrontmatterParagraphs.tocField(inserter.paragraph(), profile.getLabels().getTocUpdateHint());
        SectionBreaks.configure(doc, inserter.paragraph(), ODD_PAGE);
        log.debug("Inserted table of contents before '{}'", firstChapter.getText());
        return true;
    }
}
