package com.latexword.converter.convert;

import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.model.XWPFHeaderFooterPolicy;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.xmlbeans.XmlCursor;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBody;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STHdrFtr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last pass over a converted document: section properties, styles, page
 * layout, page numbers and the update-fields flag.
 */
public class DocumentFinalizer {

    private static final Logger log = LoggerFactory.getLogger(DocumentFinalizer.class);

    static final int A4_WIDTH = 11906;
    static final int A4_HEIGHT = 16838;
    static final int DEFAULT_MARGIN = 1440;
    static final int HEADER_FOOTER_DISTANCE = 720;

    private static final Pattern LENGTH = Pattern.compile("([\\d.]+)\\s*(cm|mm|in|pt|bp)");

    private final DocxProfile profile;
    private final ExportMetadata metadata;

    public DocumentFinalizer(DocxProfile profile, ExportMetadata metadata) {
        this.profile = profile;
        this.metadata = metadata;
    }

    public void finish(XWPFDocument doc) {
        CTSectPr sectPr = moveSectionPropertiesToEnd(doc);
        new DocxStyles(profile).apply(doc);
        stripHeadingNumbering(doc);
        applyPageLayout(sectPr);
        addPageNumbers(doc, sectPr);
        doc.enforceUpdateFields();
    }

    /**
     * Makes sure the body section properties exist and are the last child
     * of the body.
     */
    public static CTSectPr moveSectionPropertiesToEnd(XWPFDocument doc) {
        CTBody body = doc.getDocument().getBody();
        if (!body.isSetSectPr()) {
            return body.addNewSectPr();
        }
        boolean last;
        try (XmlCursor cursor = body.newCursor()) {
            cursor.toLastChild();
            last = cursor.getObject() instanceof CTSectPr;
        }
        if (last) {
            return body.getSectPr();
        }
        CTSectPr copy = (CTSectPr) body.getSectPr().copy();
        body.unsetSectPr();
        CTSectPr moved = body.addNewSectPr();
        moved.set(copy);
        log.debug("Moved body section properties to the end");
        return moved;
    }

    private static void stripHeadingNumbering(XWPFDocument doc) {
        for (XWPFParagraph paragraph : doc.getParagraphs()) {
            if (DocxStyles.isHeading(paragraph.getStyle()) && paragraph.getCTP().isSetPPr()) {
                CTPPr pPr = paragraph.getCTP().getPPr();
                if (pPr.isSetNumPr()) {
                    pPr.unsetNumPr();
                }
            }
        }
    }

    /** A4 portrait with margins taken from the document geometry. */
    void applyPageLayout(CTSectPr sectPr) {
        CTPageSz size = sectPr.isSetPgSz() ? sectPr.getPgSz() : sectPr.addNewPgSz();
        size.setW(BigInteger.valueOf(A4_WIDTH));
        size.setH(BigInteger.valueOf(A4_HEIGHT));

        Map<String, String> geometry = metadata.getGeometry();
        CTPageMar margins = sectPr.isSetPgMar() ? sectPr.getPgMar() : sectPr.addNewPgMar();
        margins.setTop(BigInteger.valueOf(margin(geometry, "top")));
        margins.setBottom(BigInteger.valueOf(margin(geometry, "bottom")));
        margins.setLeft(BigInteger.valueOf(margin(geometry, "left")));
        margins.setRight(BigInteger.valueOf(margin(geometry, "right")));
        margins.setHeader(BigInteger.valueOf(HEADER_FOOTER_DISTANCE));
        margins.setFooter(BigInteger.valueOf(HEADER_FOOTER_DISTANCE));
        margins.setGutter(BigInteger.ZERO);
    }

    private static int margin(Map<String, String> geometry, String key) {
        String value = geometry == null ? null : geometry.get(key);
        if (value == null) {
            return DEFAULT_MARGIN;
        }
        Integer twips = parseLength(value);
        return twips == null ? DEFAULT_MARGIN : twips;
    }

    /**
     * Converts a LaTeX length such as {@code 2.5cm} or {@code 1in} to twips.
     *
     * @return null when the length is not understood
     */
    static Integer parseLength(String value) {
        Matcher m = LENGTH.matcher(value.strip());
        if (!m.find()) {
            return null;
        }
        double number = Double.parseDouble(m.group(1));
        double cm = switch (m.group(2)) {
            case "mm" -> number / 10;
            case "in" -> number * 2.54;
            case "pt" -> number * 2.54 / 72.27;
            case "bp" -> number * 2.54 / 72;
            default -> number;
        };
        return OoxmlUtil.cmToTwips(cm);
    }

    /** Adds a centered PAGE field to the footer of every section. */
    private static void addPageNumbers(XWPFDocument doc, CTSectPr bodySectPr) {
        List<CTSectPr> sections = new ArrayList<>();
        for (XWPFParagraph paragraph : doc.getParagraphs()) {
            if (paragraph.getCTP().isSetPPr() && paragraph.getCTP().getPPr().isSetSectPr()) {
                sections.add(paragraph.getCTP().getPPr().getSectPr());
            }
        }
        sections.add(bodySectPr);

        for (CTSectPr sectPr : sections) {
            if (sectPr.sizeOfFooterReferenceArray() > 0) {
                continue;
            }
            XWPFHeaderFooterPolicy policy = new XWPFHeaderFooterPolicy(doc, sectPr);
            XWPFFooter footer = policy.createFooter(STHdrFtr.DEFAULT);
            XWPFParagraph paragraph = footer.getParagraphs().isEmpty()
                ? footer.createParagraph()
                : footer.getParagraphs().get(0);
            paragraph.setStyle(DocxStyles.FOOTER);
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            paragraph.setIndentationFirstLine(0);
            CTR number = OoxmlUtil.appendField(paragraph, "PAGE", "1");
            if (number != null) {
                CTRPr rPr = number.isSetRPr() ? number.getRPr() : number.addNewRPr();
                rPr.addNewSz().setVal(BigInteger.valueOf(20));
            }
        }
    }
}
