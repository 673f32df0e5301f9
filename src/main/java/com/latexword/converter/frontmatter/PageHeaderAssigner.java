package com.latexword.converter.frontmatter;

import com.latexword.converter.convert.DocxStyles;
import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.FieldInterpolator;
import com.latexword.converter.profile.model.PageHeadersConfig;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.model.XWPFHeaderFooterPolicy;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageNumber;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STHdrFtr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Assigns headers, footers and page numbering to every page section.
 *
 * <p>Sections fall into three runs: the cover sections produced by the
 * front-matter recipe get no header and no page number; the sections before
 * the first numbered chapter get a static header and front-matter page
 * numbers; from the first chapter on, sections show the current chapter
 * title and body page numbers restarting at 1.</p>
 */
public class PageHeaderAssigner {

    private static final Logger log = LoggerFactory.getLogger(PageHeaderAssigner.class);

    static final String STYLEREF_FIELD = "STYLEREF \"heading 1\"";
    static final int FOOTER_FONT_HALF_POINTS = 20;

    private static final FieldInterpolator INTERPOLATOR = new FieldInterpolator();

    private final DocxProfile profile;

    public PageHeaderAssigner(DocxProfile profile) {
        this.profile = profile;
    }

    /**
     * @param coverSections number of leading sections that are cover pages
     */
    public void assign(XWPFDocument doc, ExportMetadata metadata, int coverSections) {
        PageHeadersConfig ph = profile.getPageHeaders();
        boolean oddEven = metadata.isTwoside() || ph.isOddEven();
        String frontmatterFormat = metadata.getFrontmatterPageFormat() != null
            ? metadata.getFrontmatterPageFormat()
            : ph.getFrontmatterPageFormat();
        String bodyFormat = metadata.getBodyPageFormat() != null
            ? metadata.getBodyPageFormat()
            : ph.getBodyPageFormat();
        if (oddEven) {
            doc.setEvenAndOddHeadings(true);
        }
        String evenText = oddEven ? evenPageText(ph, metadata) : "";

        List<DocumentSection> sections = SectionBreaks.split(doc);
        int firstBody = firstBodySection(sections, coverSections);
        boolean firstFrontmatter = true;
        boolean firstBodySeen = false;

        for (int i = 0; i < sections.size(); i++) {
            DocumentSection section = sections.get(i);
            XWPFHeaderFooterPolicy policy = new XWPFHeaderFooterPolicy(doc, section.getSectPr());
            if (i < coverSections || (i < firstBody && hasNoHeaderMarker(section))) {
                clearAll(policy, oddEven);
            } else if (i < firstBody) {
                String heading = frontmatterHeading(section);
                if (heading.isEmpty()) {
                    freshParagraph(policy.createHeader(STHdrFtr.DEFAULT), DocxStyles.HEADER);
                } else {
                    staticHeader(policy.createHeader(STHdrFtr.DEFAULT), heading);
                }
                if (!evenText.isEmpty()) {
                    staticHeader(policy.createHeader(STHdrFtr.EVEN), evenText);
                }
                pageNumberFooters(policy, oddEven, false);
                pageNumberFormat(section.getSectPr(), frontmatterFormat, firstFrontmatter);
                firstFrontmatter = false;
            } else {
                String heading = FrontmatterParagraphs.firstHeadingText(section.getParagraphs());
                if (ph.isEnableStyleref()) {
                    chapterHeader(policy.createHeader(STHdrFtr.DEFAULT), heading);
                } else if (!heading.isEmpty()) {
                    staticHeader(policy.createHeader(STHdrFtr.DEFAULT), heading);
                }
                if (!evenText.isEmpty()) {
                    staticHeader(policy.createHeader(STHdrFtr.EVEN), evenText);
                }
                pageNumberFooters(policy, oddEven, true);
                if (!firstBodySeen) {
                    pageNumberFormat(section.getSectPr(), bodyFormat, true);
                    firstBodySeen = true;
                }
            }
        }
        log.debug("Assigned headers to {} sections: {} cover, first body section {}",
            sections.size(), coverSections, firstBody);
    }

    /**
     * The first section at or after the cover whose first level 1 heading
     * is a numbered chapter rather than a front-matter title.
     *
     * @return the section index, or the section count when there is none
     */
    int firstBodySection(List<DocumentSection> sections, int coverSections) {
        Set<String> frontmatterTitles = new HashSet<>();
        for (String title : profile.getNumbering().getUnnumberedHeadings()) {
            frontmatterTitles.add(normalize(title));
        }
        frontmatterTitles.add(normalize(profile.getLabels().getListOfFigures()));
        frontmatterTitles.add(normalize(profile.getLabels().getListOfTables()));

        for (int i = coverSections; i < sections.size(); i++) {
            for (XWPFParagraph paragraph : sections.get(i).getParagraphs()) {
                if (DocxStyles.isLevelOneHeading(paragraph.getStyle())) {
                    if (!frontmatterTitles.contains(normalize(paragraph.getText()))) {
                        return i;
                    }
                    break;
                }
            }
        }
        return sections.size();
    }

    private static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }

    /** Whether the first line of the section names a page that carries no header, such as a declaration. */
    private boolean hasNoHeaderMarker(DocumentSection section) {
        String text = section.getParagraphs().stream()
            .map(p -> p.getText().strip())
            .filter(t -> !t.isEmpty())
            .findFirst()
            .orElse("");
        return profile.getPageHeaders().getNoHeaderMarkers().stream()
            .anyMatch(marker -> !marker.isEmpty() && text.contains(marker));
    }

    /** The section's first heading, or the configured content header it maps to. */
    String frontmatterHeading(DocumentSection section) {
        String heading = FrontmatterParagraphs.firstHeadingText(section.getParagraphs());
        if (heading.isEmpty()) {
            return heading;
        }
        for (Map.Entry<String, String> entry : profile.getPageHeaders().getContentHeaders().entrySet()) {
            if (findsPattern(entry.getKey(), heading)) {
                return entry.getValue();
            }
        }
        return heading;
    }

    private static boolean findsPattern(String regex, String text) {
        try {
            return Pattern.compile(regex).matcher(text).find();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid content header pattern '{}': {}", regex, e.getDescription());
            return text.contains(regex);
        }
    }

    private static String evenPageText(PageHeadersConfig ph, ExportMetadata metadata) {
        if (metadata.getTitle().isBlank()) {
            return "";
        }
        return INTERPOLATOR.interpolate(ph.getEvenPageContent(), metadata.asMap()).strip();
    }

    // ------------------------------------------------------------------
    // headers and footers

    private static void clearAll(XWPFHeaderFooterPolicy policy, boolean oddEven) {
        freshParagraph(policy.createHeader(STHdrFtr.DEFAULT), DocxStyles.HEADER);
        freshParagraph(policy.createFooter(STHdrFtr.DEFAULT), DocxStyles.FOOTER);
        if (oddEven) {
            freshParagraph(policy.createHeader(STHdrFtr.EVEN), DocxStyles.HEADER);
            freshParagraph(policy.createFooter(STHdrFtr.EVEN), DocxStyles.FOOTER);
        }
    }

    /** Empties a header or footer down to a single paragraph. */
    static XWPFParagraph freshParagraph(XWPFHeaderFooter part, String style) {
        for (XWPFParagraph paragraph : new ArrayList<>(part.getParagraphs())) {
            part.removeParagraph(paragraph);
        }
        XWPFParagraph paragraph = part.createParagraph();
        paragraph.setStyle(style);
        paragraph.setIndentationFirstLine(0);
        return paragraph;
    }

    private void staticHeader(XWPFHeaderFooter header, String text) {
        PageHeadersConfig ph = profile.getPageHeaders();
        XWPFParagraph paragraph = headerParagraph(header);
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        OoxmlUtil.setFonts(run, ph.getHeaderFont(), ph.getHeaderFont());
        run.setFontSize(ph.getHeaderFontSizePt());
    }

    /** A STYLEREF field showing the nearest level 1 heading, seeded with the section's own heading. */
    private void chapterHeader(XWPFHeaderFooter header, String placeholder) {
        PageHeadersConfig ph = profile.getPageHeaders();
        XWPFParagraph paragraph = headerParagraph(header);
        CTR shown = OoxmlUtil.appendField(paragraph, STYLEREF_FIELD, placeholder);
        if (shown != null) {
            CTRPr rPr = shown.isSetRPr() ? shown.getRPr() : shown.addNewRPr();
            CTFonts fonts = rPr.addNewRFonts();
            fonts.setAscii(ph.getHeaderFont());
            fonts.setHAnsi(ph.getHeaderFont());
            fonts.setEastAsia(ph.getHeaderFont());
            rPr.addNewSz().setVal(BigInteger.valueOf(Math.round(ph.getHeaderFontSizePt() * 2)));
        }
    }

    private XWPFParagraph headerParagraph(XWPFHeaderFooter header) {
        XWPFParagraph paragraph = freshParagraph(header, DocxStyles.HEADER);
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        OoxmlUtil.addBottomRule(paragraph, (int) Math.round(profile.getPageHeaders().getHeaderRulePt() * 8));
        return paragraph;
    }

    /**
     * Centered page numbers; in body sections of a two-sided layout odd
     * pages number on the right and even pages on the left.
     */
    private static void pageNumberFooters(XWPFHeaderFooterPolicy policy, boolean oddEven, boolean body) {
        ParagraphAlignment odd = body && oddEven ? ParagraphAlignment.RIGHT : ParagraphAlignment.CENTER;
        pageNumber(freshParagraph(policy.createFooter(STHdrFtr.DEFAULT), DocxStyles.FOOTER), odd);
        if (oddEven) {
            ParagraphAlignment even = body ? ParagraphAlignment.LEFT : ParagraphAlignment.CENTER;
            pageNumber(freshParagraph(policy.createFooter(STHdrFtr.EVEN), DocxStyles.FOOTER), even);
        }
    }

    private static void pageNumber(XWPFParagraph paragraph, ParagraphAlignment alignment) {
        paragraph.setAlignment(alignment);
        CTR number = OoxmlUtil.appendField(paragraph, "PAGE", "1");
        if (number != null) {
            CTRPr rPr = number.isSetRPr() ? number.getRPr() : number.addNewRPr();
            rPr.addNewSz().setVal(BigInteger.valueOf(FOOTER_FONT_HALF_POINTS));
        }
    }

    static void pageNumberFormat(CTSectPr sectPr, String format, boolean restart) {
        CTPageNumber pgNumType = sectPr.isSetPgNumType() ? sectPr.getPgNumType() : sectPr.addNewPgNumType();
        STNumberFormat.Enum fmt = STNumberFormat.Enum.forString(format);
        if (fmt == null) {
            log.warn("Unknown page number format '{}', using decimal", format);
            fmt = STNumberFormat.DECIMAL;
        }
        pgNumType.setFmt(fmt);
        if (restart) {
            pgNumType.setStart(BigInteger.ONE);
        }
    }
}
