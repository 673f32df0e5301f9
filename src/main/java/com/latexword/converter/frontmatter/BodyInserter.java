package com.latexword.converter.frontmatter;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

/**
 * Creates paragraphs and tables in document order in front of a fixed body
 * element, or at the end of the body when there is none.
 */
class BodyInserter {

    private final XWPFDocument doc;
    private final XmlObject anchor;

    BodyInserter(XWPFDocument doc, IBodyElement before) {
        this.doc = doc;
        this.anchor = xmlOf(before);
    }

    /** Inserts in front of the first paragraph or table of the body. */
    static BodyInserter atStart(XWPFDocument doc) {
        for (IBodyElement element : doc.getBodyElements()) {
            if (xmlOf(element) != null) {
                return new BodyInserter(doc, element);
            }
        }
        return new BodyInserter(doc, null);
    }

    XWPFParagraph paragraph() {
        if (anchor == null) {
            return doc.createParagraph();
        }
        try (XmlCursor cursor = anchor.newCursor()) {
            return doc.insertNewParagraph(cursor);
        }
    }

    /** A new table with one row of one cell. */
    XWPFTable table() {
        if (anchor == null) {
            return doc.createTable();
        }
        try (XmlCursor cursor = anchor.newCursor()) {
            return doc.insertNewTbl(cursor);
        }
    }

    private static XmlObject xmlOf(IBodyElement element) {
        if (element instanceof XWPFParagraph paragraph) {
            return paragraph.getCTP();
        }
        if (element instanceof XWPFTable table) {
            return table.getCTTbl();
        }
        return null;
    }
}
