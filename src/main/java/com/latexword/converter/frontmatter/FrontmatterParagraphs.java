package com.latexword.converter.frontmatter;

import com.latexword.converter.convert.DocxStyles;
import com.latexword.converter.convert.LatexToDocxConverter;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTParaRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Paragraph helpers shared by the front-matter builders and the header
 * assignment.
 */
final class FrontmatterParagraphs {

    static final double HEADING_LIKE_MIN_PT = 14;

    private FrontmatterParagraphs() {
        // Utility class
    }

    /** Fills {@code paragraph} with one run of directly formatted text. */
    static XWPFParagraph text(XWPFParagraph paragraph, String text, String font, double sizePt,
                              boolean bold, ParagraphAlignment alignment) {
        paragraph.setIndentationFirstLine(0);
        if (alignment != null) {
            paragraph.setAlignment(alignment);
        }
        if (text != null && !text.isEmpty()) {
            XWPFRun run = paragraph.createRun();
            run.setText(text);
            OoxmlUtil.setFonts(run, font, font);
            run.setFontSize(sizePt);
            run.setBold(bold);
        }
        return paragraph;
    }

    static ParagraphAlignment alignment(String align) {
        if (align == null) {
            return ParagraphAlignment.LEFT;
        }
        return switch (align.toLowerCase(Locale.ROOT)) {
            case "center" -> ParagraphAlignment.CENTER;
            case "right" -> ParagraphAlignment.RIGHT;
            case "justify", "both" -> ParagraphAlignment.BOTH;
            default -> ParagraphAlignment.LEFT;
        };
    }

    static void spaceBefore(XWPFParagraph paragraph, Double pt) {
        if (pt != null && pt > 0) {
            paragraph.setSpacingBefore(OoxmlUtil.ptToTwips(pt));
        }
    }

    /** An invisible paragraph of exactly zero line height followed by {@code pt} of space. */
    static void spacer(XWPFParagraph paragraph, double pt) {
        paragraph.setIndentationFirstLine(0);
        paragraph.setSpacingBetween(0, LineSpacingRule.EXACT);
        paragraph.setSpacingAfter(OoxmlUtil.ptToTwips(pt));
        CTParaRPr rPr = OoxmlUtil.pPr(paragraph).addNewRPr();
        rPr.addNewSz().setVal(BigInteger.valueOf(2));
    }

    /** A TOC field showing a gray hint until fields are updated. */
    static void tocField(XWPFParagraph paragraph, String hint) {
        paragraph.setIndentationFirstLine(0);
        CTR shown = OoxmlUtil.appendField(paragraph, LatexToDocxConverter.TOC_FIELD, hint);
        if (shown != null) {
            CTRPr rPr = shown.isSetRPr() ? shown.getRPr() : shown.addNewRPr();
            rPr.addNewColor().setVal(LatexToDocxConverter.HINT_COLOR);
        }
    }

    /** Direct bold formatting of at least 14pt on the first run, as unlisted headings carry. */
    static boolean isHeadingLike(XWPFParagraph paragraph) {
        List<XWPFRun> runs = paragraph.getRuns();
        if (runs.isEmpty()) {
            return false;
        }
        XWPFRun first = runs.get(0);
        Double size = first.getFontSizeAsDouble();
        return first.isBold() && size != null && size >= HEADING_LIKE_MIN_PT;
    }

    /**
     * The first heading in the paragraphs: a heading style, or direct
     * heading-like formatting.
     *
     * @return the stripped text, or empty when there is no heading
     */
    static String firstHeadingText(List<XWPFParagraph> paragraphs) {
        for (XWPFParagraph paragraph : paragraphs) {
            String text = paragraph.getText().strip();
            if (text.isEmpty()) {
                continue;
            }
            if (DocxStyles.isHeading(paragraph.getStyle()) || isHeadingLike(paragraph)) {
                return text;
            }
        }
        return "";
    }
}
