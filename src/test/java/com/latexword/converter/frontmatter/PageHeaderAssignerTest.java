package com.latexword.converter.frontmatter;

import com.latexword.converter.convert.LatexToDocxConverter;
import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.BodySectionBreakConfig;
import com.latexword.converter.profile.model.FrontmatterElementConfig;
import com.latexword.converter.profile.model.FrontmatterSectionConfig;
import org.apache.poi.xwpf.model.XWPFHeaderFooterPolicy;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageNumber;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PageHeaderAssigner.
 */
class PageHeaderAssignerTest {

    private static final String THESIS = "\\documentclass{report}\n\\begin{document}\n"
        + "\\chapter*{摘要}\n摘要内容\n\\chapter{绪论}\n第一章正文\n\\end{document}\n";

    @TempDir
    Path tempDir;

    @Test
    void testCoverFrontmatterAndBodySections() throws IOException {
        DocxProfile profile = thesisProfile();
        ExportMetadata metadata = metadata();

        try (XWPFDocument doc = new LatexToDocxConverter(profile, null, tempDir, metadata).convert(THESIS)) {
            new DeclarativeFrontmatterBuilder(profile).build(doc, metadata);
            List<DocumentSection> sections = SectionBreaks.split(doc);
            assertThat(sections).hasSize(3);

            XWPFHeaderFooterPolicy cover = new XWPFHeaderFooterPolicy(doc, sections.get(0).getSectPr());
            assertThat(cover.getDefaultHeader().getText()).isBlank();
            assertThat(cover.getDefaultFooter().getText()).isBlank();
            assertThat(sections.get(0).getSectPr().isSetPgNumType()).isFalse();

            XWPFHeaderFooterPolicy front = new XWPFHeaderFooterPolicy(doc, sections.get(1).getSectPr());
            assertThat(front.getDefaultHeader().getText().strip()).isEqualTo("摘  要");
            assertThat(front.getEvenPageHeader().getText().strip()).isEqualTo("论文题目");
            XWPFParagraph frontFooter = front.getDefaultFooter().getParagraphs().get(0);
            assertThat(frontFooter.getCTP().xmlText()).contains("PAGE");
            assertThat(frontFooter.getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
            CTPageNumber frontNumbers = sections.get(1).getSectPr().getPgNumType();
            assertThat(frontNumbers.getFmt()).isEqualTo(STNumberFormat.UPPER_ROMAN);
            assertThat(frontNumbers.getStart().intValue()).isEqualTo(1);

            XWPFHeaderFooterPolicy body = new XWPFHeaderFooterPolicy(doc, sections.get(2).getSectPr());
            String headerXml = body.getDefaultHeader().getParagraphs().get(0).getCTP().xmlText();
            assertThat(headerXml).contains("STYLEREF", "第 1 章  绪论");
            assertThat(body.getDefaultFooter().getParagraphs().get(0).getAlignment()).isEqualTo(ParagraphAlignment.RIGHT);
            assertThat(body.getEvenPageFooter().getParagraphs().get(0).getAlignment()).isEqualTo(ParagraphAlignment.LEFT);
            CTPageNumber bodyNumbers = sections.get(2).getSectPr().getPgNumType();
            assertThat(bodyNumbers.getFmt()).isEqualTo(STNumberFormat.DECIMAL);
            assertThat(bodyNumbers.getStart().intValue()).isEqualTo(1);
        }
    }

    @Test
    void testMetadataPageFormatsOverrideProfile() throws IOException {
        DocxProfile profile = thesisProfile();
        profile.getPageHeaders().setOddEven(false);
        profile.getPageHeaders().setEnableStyleref(false);
        ExportMetadata metadata = metadata();
        metadata.setFrontmatterPageFormat("lowerRoman");

        try (XWPFDocument doc = new LatexToDocxConverter(profile, null, tempDir, metadata).convert(THESIS)) {
            new DeclarativeFrontmatterBuilder(profile).build(doc, metadata);
            List<DocumentSection> sections = SectionBreaks.split(doc);

            assertThat(sections.get(1).getSectPr().getPgNumType().getFmt()).isEqualTo(STNumberFormat.LOWER_ROMAN);
            XWPFHeaderFooterPolicy body = new XWPFHeaderFooterPolicy(doc, sections.get(2).getSectPr());
            assertThat(body.getDefaultHeader().getText().strip()).isEqualTo("第 1 章  绪论");
            assertThat(body.getEvenPageHeader()).isNull();
            assertThat(body.getDefaultFooter().getParagraphs().get(0).getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
        }
    }

    @Test
    void testFirstBodySectionSkipsFrontmatterTitles() throws IOException {
        DocxProfile profile = thesisProfile();
        ExportMetadata metadata = metadata();

        try (XWPFDocument doc = new LatexToDocxConverter(profile, null, tempDir, metadata).convert(THESIS)) {
            new DeclarativeFrontmatterBuilder(profile).applyBodySectionBreaks(doc);
            List<DocumentSection> sections = SectionBreaks.split(doc);

            PageHeaderAssigner assigner = new PageHeaderAssigner(profile);
            assertThat(assigner.firstBodySection(sections, 0)).isEqualTo(1);
            assertThat(assigner.firstBodySection(sections, 2)).isEqualTo(2);
            assertThat(assigner.frontmatterHeading(sections.get(0))).isEqualTo("摘  要");
        }
    }

    @Test
    void testUnknownPageFormatFallsBackToDecimal() throws IOException {
        try (XWPFDocument doc = new XWPFDocument()) {
            doc.createParagraph();
            DocumentSection section = SectionBreaks.split(doc).get(0);

            PageHeaderAssigner.pageNumberFormat(section.getSectPr(), "klingon", false);

            assertThat(section.getSectPr().getPgNumType().getFmt()).isEqualTo(STNumberFormat.DECIMAL);
            assertThat(section.getSectPr().getPgNumType().isSetStart()).isFalse();
        }
    }

    private static DocxProfile thesisProfile() {
        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setSections(List.of(
            FrontmatterSectionConfig.builder()
                .id("cover")
                .elements(List.of(FrontmatterElementConfig.builder().field("title").sizePt(22).build()))
                .breakAfter("oddPage")
                .build()));
        profile.getFrontmatter().setBodySectionBreaks(List.of(
            BodySectionBreakConfig.builder().beforeHeadingPattern("第\\s*\\d+\\s*章").firstOnly(true).build()));
        return profile;
    }

    private static ExportMetadata metadata() {
        ExportMetadata metadata = new ExportMetadata();
        metadata.set(ExportMetadata.TITLE, "论文题目");
        return metadata;
    }
}
