package com.latexword.converter.convert;

import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.FontsConfig;
import com.latexword.converter.profile.model.HeadingStyleConfig;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSpacing;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STUnderline;
import org.openxmlformats.schemas.officeDocument.x2006.sharedTypes.STVerticalAlignRun;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the paragraph and character styles the converter refers to and
 * applies the profile's fonts and sizes to them. Existing styles (from a
 * reference document) are updated in place. Call once per document.
 */
public class DocxStyles {

    public static final String NORMAL = "Normal";
    public static final String CAPTION = "Caption";
    public static final String TITLE = "Title";
    public static final String HYPERLINK = "Hyperlink";
    public static final String FOOTNOTE_REFERENCE = "FootnoteReference";
    public static final String FOOTNOTE_TEXT = "FootnoteText";
    public static final String HEADER = "Header";
    public static final String FOOTER = "Footer";
    public static final String TABLE_NORMAL = "TableNormal";
    public static final String HYPERLINK_COLOR = "0563C1";

    static final int HEADING_LEVELS = 6;
    static final int UNLISTED_HEADING_LEVELS = 4;

    private final DocxProfile profile;

    public DocxStyles(DocxProfile profile) {
        this.profile = profile;
    }

    /** Style id of the built-in heading for a level, e.g. {@code Heading2}. */
    public static String headingStyleId(int level) {
        return "Heading" + Math.min(Math.max(level, 1), HEADING_LEVELS);
    }

    /**
     * Style id of a heading that looks like {@code Heading N} but carries no
     * outline level, so TOC fields skip it.
     */
    public static String unlistedHeadingStyleId(int level) {
        return "LaTeXHeading" + Math.min(Math.max(level, 1), UNLISTED_HEADING_LEVELS);
    }

    /** Whether a paragraph style marks a level 1 heading of either kind. */
    public static boolean isLevelOneHeading(String styleId) {
        return "Heading1".equals(styleId) || "LaTeXHeading1".equals(styleId);
    }

    public static boolean isHeading(String styleId) {
        return styleId != null && (styleId.startsWith("Heading") || styleId.startsWith("LaTeXHeading"));
    }

    /**
     * Creates or updates every style. New styles are added to the styles
     * part only after they are fully configured, because POI stores a copy.
     */
    public void apply(XWPFDocument doc) {
        XWPFStyles styles = doc.createStyles();
        FontsConfig fonts = profile.getFonts();
        List<CTStyle> created = new ArrayList<>();

        CTStyle normal = paragraphStyle(styles, created, NORMAL, "Normal", null);
        OoxmlUtil.setWAttribute(normal, "default", "1");
        setFonts(rPr(normal), fonts.getBodyLatin(), fonts.getBodyEastAsian());
        setSize(rPr(normal), profile.getStyles().getNormal().getFontSizePt());
        ind(pPr(normal), OoxmlUtil.ptToTwips(profile.getStyles().getNormal().getFirstLineIndentPt()));

        for (int level = 1; level <= HEADING_LEVELS; level++) {
            CTStyle heading = paragraphStyle(styles, created, headingStyleId(level), "heading " + level, NORMAL);
            CTPPrGeneral pPr = pPr(heading);
            (pPr.isSetOutlineLvl() ? pPr.getOutlineLvl() : pPr.addNewOutlineLvl())
                .setVal(BigInteger.valueOf(level - 1L));
            applyHeadingLook(heading, level);
        }

        for (int level = 1; level <= UNLISTED_HEADING_LEVELS; level++) {
            CTStyle heading = paragraphStyle(styles, created, unlistedHeadingStyleId(level),
                "LaTeX Heading " + level, NORMAL);
            applyHeadingLook(heading, level);
        }

        CTStyle caption = paragraphStyle(styles, created, CAPTION, "caption", NORMAL);
        setFonts(rPr(caption), fonts.getHeadingLatin(), fonts.getCaptionEastAsian());
        setSize(rPr(caption), profile.getStyles().getCaption().getFontSizePt());
        setBold(rPr(caption), true);
        setColor(rPr(caption), OoxmlUtil.BLACK);
        jc(pPr(caption), STJc.CENTER);
        ind(pPr(caption), 0);

        CTStyle title = paragraphStyle(styles, created, TITLE, "Title", NORMAL);
        setSize(rPr(title), 16);
        setBold(rPr(title), true);
        setColor(rPr(title), OoxmlUtil.BLACK);
        jc(pPr(title), STJc.CENTER);
        ind(pPr(title), 0);

        CTStyle footnoteText = paragraphStyle(styles, created, FOOTNOTE_TEXT, "footnote text", NORMAL);
        setSize(rPr(footnoteText), 9);
        ind(pPr(footnoteText), 0);

        ind(pPr(paragraphStyle(styles, created, HEADER, "header", NORMAL)), 0);
        ind(pPr(paragraphStyle(styles, created, FOOTER, "footer", NORMAL)), 0);

        CTStyle hyperlink = style(styles, created, HYPERLINK, "Hyperlink", STStyleType.CHARACTER, null);
        setColor(rPr(hyperlink), HYPERLINK_COLOR);
        CTRPr linkRPr = rPr(hyperlink);
        (linkRPr.sizeOfUArray() > 0 ? linkRPr.getUArray(0) : linkRPr.addNewU()).setVal(STUnderline.SINGLE);

        CTStyle footnoteRef = style(styles, created, FOOTNOTE_REFERENCE, "footnote reference",
            STStyleType.CHARACTER, null);
        CTRPr refRPr = rPr(footnoteRef);
        (refRPr.sizeOfVertAlignArray() > 0 ? refRPr.getVertAlignArray(0) : refRPr.addNewVertAlign())
            .setVal(STVerticalAlignRun.SUPERSCRIPT);

        style(styles, created, TABLE_NORMAL, "Normal Table", STStyleType.TABLE, null);

        for (CTStyle ct : created) {
            styles.addStyle(new XWPFStyle(ct, styles));
        }
    }

    private void applyHeadingLook(CTStyle heading, int level) {
        FontsConfig fonts = profile.getFonts();
        HeadingStyleConfig config = profile.getHeadingStyle(level)
            .orElse(new HeadingStyleConfig(level, 12, true));

        CTRPr rPr = rPr(heading);
        setFonts(rPr, fonts.getHeadingLatin(), fonts.getHeadingEastAsian());
        setSize(rPr, config.getFontSizePt());
        setBold(rPr, config.isBold());
        setColor(rPr, OoxmlUtil.BLACK);

        CTPPrGeneral pPr = pPr(heading);
        if (!pPr.isSetKeepNext()) {
            pPr.addNewKeepNext();
        }
        CTSpacing spacing = pPr.isSetSpacing() ? pPr.getSpacing() : pPr.addNewSpacing();
        spacing.setBefore(BigInteger.valueOf(OoxmlUtil.ptToTwips(6)));
        spacing.setAfter(BigInteger.valueOf(OoxmlUtil.ptToTwips(6)));
        ind(pPr, 0);
        if (pPr.isSetNumPr()) {
            pPr.unsetNumPr();
        }
    }

    private static CTStyle paragraphStyle(XWPFStyles styles, List<CTStyle> created, String id, String name,
                                          String basedOn) {
        return style(styles, created, id, name, STStyleType.PARAGRAPH, basedOn);
    }

    private static CTStyle style(XWPFStyles styles, List<CTStyle> created, String id, String name,
                                 STStyleType.Enum type, String basedOn) {
        XWPFStyle existing = styles.getStyle(id);
        if (existing != null) {
            return existing.getCTStyle();
        }
        CTStyle ct = CTStyle.Factory.newInstance();
        ct.setStyleId(id);
        ct.setType(type);
        ct.addNewName().setVal(name);
        if (basedOn != null) {
            ct.addNewBasedOn().setVal(basedOn);
            ct.addNewNext().setVal(NORMAL);
        }
        ct.addNewQFormat();
        created.add(ct);
        return ct;
    }

    private static CTRPr rPr(CTStyle style) {
        return style.isSetRPr() ? style.getRPr() : style.addNewRPr();
    }

    private static CTPPrGeneral pPr(CTStyle style) {
        return style.isSetPPr() ? style.getPPr() : style.addNewPPr();
    }

    static void setFonts(CTRPr rPr, String latin, String eastAsian) {
        CTFonts fonts = rPr.sizeOfRFontsArray() > 0 ? rPr.getRFontsArray(0) : rPr.addNewRFonts();
        fonts.setAscii(latin);
        fonts.setHAnsi(latin);
        fonts.setCs(latin);
        if (eastAsian != null && !eastAsian.isEmpty()) {
            fonts.setEastAsia(eastAsian);
        }
    }

    static void setSize(CTRPr rPr, double pt) {
        BigInteger halfPoints = BigInteger.valueOf(Math.round(pt * 2));
        (rPr.sizeOfSzArray() > 0 ? rPr.getSzArray(0) : rPr.addNewSz()).setVal(halfPoints);
        (rPr.sizeOfSzCsArray() > 0 ? rPr.getSzCsArray(0) : rPr.addNewSzCs()).setVal(halfPoints);
    }

    static void setBold(CTRPr rPr, boolean bold) {
        if (bold && rPr.sizeOfBArray() == 0) {
            rPr.addNewB();
        }
        while (!bold && rPr.sizeOfBArray() > 0) {
            rPr.removeB(0);
        }
    }

    static void setColor(CTRPr rPr, String rgb) {
        (rPr.sizeOfColorArray() > 0 ? rPr.getColorArray(0) : rPr.addNewColor()).setVal(rgb);
    }

    private static void jc(CTPPrGeneral pPr, STJc.Enum alignment) {
        (pPr.isSetJc() ? pPr.getJc() : pPr.addNewJc()).setVal(alignment);
    }

    private static void ind(CTPPrGeneral pPr, int firstLineTwips) {
        (pPr.isSetInd() ? pPr.getInd() : pPr.addNewInd()).setFirstLine(BigInteger.valueOf(firstLineTwips));
    }
}
