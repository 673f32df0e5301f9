package com.latexword.converter.frontmatter;

import com.latexword.converter.convert.DocumentFinalizer;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STSectionMark;

import java.util.ArrayList;
import java.util.List;

/**
 * Section breaks: paragraphs whose properties carry a {@code w:sectPr}
 * ending the section they belong to.
 */
public final class SectionBreaks {

    private SectionBreaks() {
        // Utility class
    }

    /**
     * Turns {@code paragraph} into a section break of the given type
     * ({@code oddPage}, {@code evenPage}, {@code nextPage}, ...). Page size
     * and margins are copied from the body section of {@code doc}.
     */
    public static void configure(XWPFDocument doc, XWPFParagraph paragraph, String breakType) {
        CTSectPr body = DocumentFinalizer.moveSectionPropertiesToEnd(doc);
        CTSectPr sectPr = OoxmlUtil.pPr(paragraph).addNewSectPr();
        if (body.isSetPgSz()) {
            sectPr.setPgSz((CTPageSz) body.getPgSz().copy());
        }
        if (body.isSetPgMar()) {
            sectPr.setPgMar((CTPageMar) body.getPgMar().copy());
        }
        STSectionMark.Enum type = STSectionMark.Enum.forString(breakType);
        sectPr.addNewType().setVal(type == null ? STSectionMark.NEXT_PAGE : type);
    }

    public static CTSectPr sectionPropertiesOf(XWPFParagraph paragraph) {
        CTPPr pPr = paragraph.getCTP().getPPr();
        return pPr != null && pPr.isSetSectPr() ? pPr.getSectPr() : null;
    }

    /** Splits the body into its page sections; the last one is closed by the body properties. */
    public static List<DocumentSection> split(XWPFDocument doc) {
        CTSectPr body = DocumentFinalizer.moveSectionPropertiesToEnd(doc);
        List<DocumentSection> sections = new ArrayList<>();
        List<IBodyElement> current = new ArrayList<>();
        for (IBodyElement element : doc.getBodyElements()) {
            current.add(element);
            if (element instanceof XWPFParagraph paragraph) {
                CTSectPr sectPr = sectionPropertiesOf(paragraph);
                if (sectPr != null) {
                    sections.add(new DocumentSection(List.copyOf(current), sectPr));
                    current = new ArrayList<>();
                }
            }
        }
        sections.add(new DocumentSection(List.copyOf(current), body));
        return sections;
    }
}
