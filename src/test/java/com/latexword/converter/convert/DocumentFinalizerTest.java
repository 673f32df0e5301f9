package com.latexword.converter.convert;

import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.xmlbeans.XmlCursor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBody;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DocumentFinalizer.
 */
class DocumentFinalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "2.54cm | 1440",
        "25.4mm | 1440",
        "1in    | 1440",
        "72bp   | 1440",
        "3 cm   | 1701"
    })
    void testParseLength(String length, int twips) {
        assertThat(DocumentFinalizer.parseLength(length)).isEqualTo(twips);
    }

    @Test
    void testParseLengthRejectsUnknownUnits() {
        assertThat(DocumentFinalizer.parseLength("2em")).isNull();
        assertThat(DocumentFinalizer.parseLength("wide")).isNull();
    }

    @Test
    void testMarginsFollowGeometry() throws IOException {
        ExportMetadata metadata = new ExportMetadata();
        metadata.getGeometry().put("top", "2.5cm");
        metadata.getGeometry().put("left", "1in");
        metadata.getGeometry().put("right", "odd");

        try (XWPFDocument doc = new XWPFDocument()) {
            doc.createParagraph().createRun().setText("body");
            new DocumentFinalizer(DocxProfile.defaults(), metadata).finish(doc);

            CTPageMar margins = doc.getDocument().getBody().getSectPr().getPgMar();
            assertThat(margins.getTop().toString()).isEqualTo("1417");
            assertThat(margins.getLeft().toString()).isEqualTo("1440");
            assertThat(margins.getRight().toString()).isEqualTo("1440");
            assertThat(margins.getBottom().toString()).isEqualTo("1440");
        }
    }

    @Test
    void testSectionPropertiesEndTheBody() throws IOException {
        try (XWPFDocument doc = new XWPFDocument()) {
            CTBody body = doc.getDocument().getBody();
            body.addNewSectPr();
            try (XmlCursor cursor = body.getSectPr().newCursor()) {
                cursor.toEndToken();
                cursor.toNextToken();
                cursor.beginElement("p", "http://schemas.openxmlformats.org/wordprocessingml/2006/main");
            }

            CTSectPr sectPr = DocumentFinalizer.moveSectionPropertiesToEnd(doc);

            try (XmlCursor cursor = body.newCursor()) {
                cursor.toLastChild();
                assertThat(cursor.getObject()).isInstanceOf(CTSectPr.class);
            }
            assertThat(body.getSectPr()).isNotNull();
            assertThat(sectPr).isNotNull();
        }
    }

    @Test
    void testHeadingNumberingIsRemoved() throws IOException {
        try (XWPFDocument doc = new XWPFDocument()) {
            XWPFParagraph heading = doc.createParagraph();
            heading.setStyle("Heading2");
            heading.getCTP().getPPr().addNewNumPr();
            XWPFParagraph numbered = doc.createParagraph();
            numbered.setStyle("ListParagraph");
            numbered.getCTP().getPPr().addNewNumPr();

            new DocumentFinalizer(DocxProfile.defaults(), new ExportMetadata()).finish(doc);

            assertThat(heading.getCTP().getPPr().isSetNumPr()).isFalse();
            assertThat(numbered.getCTP().getPPr().isSetNumPr()).isTrue();
            assertThat(doc.isEnforcedUpdateFields()).isTrue();
        }
    }
}
