package com.latexword.converter.convert;

import com.latexword.converter.profile.DocxProfile;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DocxStyles.
 */
class DocxStylesTest {

    @Test
    void testCreatesOutlineAndUnlistedHeadings() throws IOException {
        try (XWPFDocument doc = new XWPFDocument()) {
            new DocxStyles(DocxProfile.defaults()).apply(doc);

            XWPFStyle heading = doc.getStyles().getStyle("Heading1");
            assertThat(heading.getCTStyle().getPPr().getOutlineLvl().getVal().intValue()).isZero();
            assertThat(heading.getCTStyle().getRPr().getSzArray(0).getVal().toString()).isEqualTo("30");

            XWPFStyle unlisted = doc.getStyles().getStyle("LaTeXHeading1");
            assertThat(unlisted.getCTStyle().getPPr().isSetOutlineLvl()).isFalse();
            assertThat(doc.getStyles().styleExist("LaTeXHeading5")).isFalse();
        }
    }

    @Test
    void testApplyUpdatesExistingStyles() throws IOException {
        List<String> ids = List.of(DocxStyles.NORMAL, DocxStyles.CAPTION, DocxStyles.TITLE, DocxStyles.HYPERLINK,
            DocxStyles.FOOTNOTE_REFERENCE, DocxStyles.FOOTNOTE_TEXT, DocxStyles.HEADER, DocxStyles.FOOTER,
            DocxStyles.headingStyleId(1), DocxStyles.unlistedHeadingStyleId(1));
        try (XWPFDocument doc = new XWPFDocument()) {
            DocxStyles styles = new DocxStyles(DocxProfile.defaults());
            styles.apply(doc);
            Map<String, XWPFStyle> first = new HashMap<>();
            for (String id : ids) {
                assertThat(doc.getStyles().styleExist(id)).as(id).isTrue();
                first.put(id, doc.getStyles().getStyle(id));
            }

            styles.apply(doc);

            for (String id : ids) {
                assertThat(doc.getStyles().getStyle(id)).as(id).isSameAs(first.get(id));
            }
            assertThat(doc.getStyles().getStyle(DocxStyles.HYPERLINK).getCTStyle().getRPr().sizeOfColorArray()).isEqualTo(1);
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1 | Heading1 | LaTeXHeading1",
        "4 | Heading4 | LaTeXHeading4",
        "6 | Heading6 | LaTeXHeading4",
        "0 | Heading1 | LaTeXHeading1"
    })
    void testStyleIds(int level, String listed, String unlisted) {
        assertThat(DocxStyles.headingStyleId(level)).isEqualTo(listed);
        assertThat(DocxStyles.unlistedHeadingStyleId(level)).isEqualTo(unlisted);
        assertThat(DocxStyles.isHeading(listed)).isTrue();
        assertThat(DocxStyles.isLevelOneHeading("LaTeXHeading1")).isTrue();
        assertThat(DocxStyles.isLevelOneHeading("Heading2")).isFalse();
    }
}
