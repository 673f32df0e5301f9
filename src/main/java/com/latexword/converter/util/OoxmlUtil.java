package com.latexword.converter.util;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFRun.FontCharRange;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPBdr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabStop;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabs;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STFldCharType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabTlc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STThemeColor;

import javax.xml.namespace.QName;
import java.math.BigInteger;

/**
 * Low-level WordprocessingML helpers shared by the converter, the table
 * builder and the front-matter builders.
 */
public final class OoxmlUtil {

    public static final String W_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String BLACK = "000000";

    private static final double TWIPS_PER_CM = 1440 / 2.54;

    private OoxmlUtil() {
        // Utility class
    }

    public static int cmToTwips(double cm) {
        return (int) Math.round(cm * TWIPS_PER_CM);
    }

    public static int ptToTwips(double pt) {
        return (int) Math.round(pt * 20);
    }

    /** Sets the Latin font and, when given, a distinct East Asian font. */
    public static void setFonts(XWPFRun run, String latin, String eastAsian) {
        if (latin != null) {
            run.setFontFamily(latin);
        }
        if (eastAsian != null) {
            run.setFontFamily(eastAsian, FontCharRange.eastAsia);
        }
    }

    /**
     * Colors the run black and pins the theme color to {@code text1} so no
     * table or theme style can recolor it.
     */
    public static void forceBlack(XWPFRun run) {
        run.setColor(BLACK);
        CTRPr rPr = run.getCTR().isSetRPr() ? run.getCTR().getRPr() : run.getCTR().addNewRPr();
        if (rPr.sizeOfColorArray() > 0) {
            rPr.getColorArray(0).setThemeColor(STThemeColor.TEXT_1);
        }
    }

    /** Sets a {@code w:}-namespaced attribute that the typed schema does not expose conveniently. */
    public static void setWAttribute(XmlObject element, String name, String value) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.setAttributeText(new QName(W_NS, name), value);
        }
    }

    /**
     * Appends a complex field ({@code PAGE}, {@code TOC \o "1-3"}, ...) to the
     * paragraph. The placeholder text is shown until the field is updated.
     *
     * @return the run holding the placeholder, or null when there is none
     */
    public static CTR appendField(XWPFParagraph paragraph, String instruction, String placeholder) {
        CTP ctp = paragraph.getCTP();

        CTR begin = ctp.addNewR();
        begin.addNewFldChar().setFldCharType(STFldCharType.BEGIN);

        CTR instr = ctp.addNewR();
        CTText text = instr.addNewInstrText();
        text.setStringValue(" " + instruction + " ");
        preserveSpace(text);

        CTR separate = ctp.addNewR();
        separate.addNewFldChar().setFldCharType(STFldCharType.SEPARATE);

        CTR shown = null;
        if (placeholder != null && !placeholder.isEmpty()) {
            shown = ctp.addNewR();
            CTText t = shown.addNewT();
            t.setStringValue(placeholder);
            preserveSpace(t);
        }

        CTR end = ctp.addNewR();
        end.addNewFldChar().setFldCharType(STFldCharType.END);
        return shown;
    }

    public static void preserveSpace(CTText text) {
        try (XmlCursor cursor = text.newCursor()) {
            cursor.setAttributeText(new QName("http://www.w3.org/XML/1998/namespace", "space"), "preserve");
        }
    }

    /** Adds a right-aligned tab stop with a dot leader, as used by TOC lines. */
    public static void addDotLeaderTab(XWPFParagraph paragraph, int posTwips) {
        addTab(paragraph, STTabJc.RIGHT, posTwips, STTabTlc.DOT);
    }

    public static void addTab(XWPFParagraph paragraph, STTabJc.Enum alignment, int posTwips, STTabTlc.Enum leader) {
        CTPPr pPr = pPr(paragraph);
        CTTabs tabs = pPr.isSetTabs() ? pPr.getTabs() : pPr.addNewTabs();
        CTTabStop stop = tabs.addNewTab();
        stop.setVal(alignment);
        stop.setPos(BigInteger.valueOf(posTwips));
        if (leader != null) {
            stop.setLeader(leader);
        }
    }

    /** Draws a single black rule under the paragraph; {@code sizeEighths} is in eighths of a point. */
    public static void addBottomRule(XWPFParagraph paragraph, int sizeEighths) {
        CTPPr pPr = pPr(paragraph);
        CTPBdr borders = pPr.isSetPBdr() ? pPr.getPBdr() : pPr.addNewPBdr();
        CTBorder bottom = borders.isSetBottom() ? borders.getBottom() : borders.addNewBottom();
        bottom.setVal(STBorder.SINGLE);
        bottom.setSz(BigInteger.valueOf(sizeEighths));
        bottom.setSpace(BigInteger.ONE);
        bottom.setColor(BLACK);
    }

    public static void setBorder(CTBorder border, STBorder.Enum val, int size) {
        border.setVal(val);
        border.setSz(BigInteger.valueOf(size));
        border.setSpace(BigInteger.ZERO);
        if (val != STBorder.NONE) {
            border.setColor(BLACK);
        }
    }

    public static CTPPr pPr(XWPFParagraph paragraph) {
        CTP ctp = paragraph.getCTP();
        return ctp.isSetPPr() ? ctp.getPPr() : ctp.addNewPPr();
    }
}
