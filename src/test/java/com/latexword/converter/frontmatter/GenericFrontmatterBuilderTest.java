package com.latexword.converter.frontmatter;

import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.FrontmatterSectionConfig;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenericFrontmatterBuilder and FrontmatterBuilders.
 */
class GenericFrontmatterBuilderTest {

    @Test
    void testTitlePageIsInsertedBeforeBody() throws IOException {
        ExportMetadata metadata = new ExportMetadata();
        metadata.set(ExportMetadata.TITLE, "Report");
        metadata.set(ExportMetadata.AUTHOR, "Li Lei");
        metadata.set(ExportMetadata.REPORT_DATE, "2024-05-01");

        try (XWPFDocument doc = new XWPFDocument()) {
            doc.createParagraph().createRun().setText("Body");
            new GenericFrontmatterBuilder(DocxProfile.defaults()).build(doc, metadata);

            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            assertThat(texts(paragraphs)).containsExactly("Report", "Li Lei", "2024-05-01", "Body");
            XWPFParagraph title = paragraphs.get(3);
            assertThat(title.getText()).isEqualTo("Report");
            assertThat(title.getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
            assertThat(title.getRuns().get(0).isBold()).isTrue();
            assertThat(title.getRuns().get(0).getFontSizeAsDouble()).isEqualTo(22.0);
            XWPFParagraph pageBreak = paragraphs.get(paragraphs.size() - 2);
            CTR breakRun = pageBreak.getRuns().get(0).getCTR();
            assertThat(breakRun.sizeOfBrArray()).isEqualTo(1);
            assertThat(breakRun.getBrArray(0).getType()).isEqualTo(STBrType.PAGE);
        }
    }

    @Test
    void testNothingHappensWithoutTitle() throws IOException {
        try (XWPFDocument doc = new XWPFDocument()) {
            doc.createParagraph().createRun().setText("Body");
            new GenericFrontmatterBuilder(DocxProfile.defaults()).build(doc, new ExportMetadata());

            assertThat(doc.getParagraphs()).hasSize(1);
        }
    }

    @Test
    void testBuilderSelection() {
        DocxProfile plain = DocxProfile.defaults();
        DocxProfile declarative = DocxProfile.defaults();
        declarative.getFrontmatter().setSections(List.of(new FrontmatterSectionConfig()));

        assertThat(FrontmatterBuilders.forProfile(plain)).isInstanceOf(GenericFrontmatterBuilder.class);
        assertThat(FrontmatterBuilders.forProfile(declarative)).isInstanceOf(DeclarativeFrontmatterBuilder.class);
    }

    private static List<String> texts(List<XWPFParagraph> paragraphs) {
        return paragraphs.stream()
            .map(XWPFParagraph::getText)
            .filter(t -> !t.isBlank())
            .collect(Collectors.toList());
    }
}
