package com.latexword.converter.frontmatter;

import com.latexword.converter.convert.LatexToDocxConverter;
import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.AutoTocConfig;
import com.latexword.converter.profile.model.BodySectionBreakConfig;
import com.latexword.converter.profile.model.FrontmatterElementConfig;
import com.latexword.converter.profile.model.FrontmatterSectionConfig;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STSectionMark;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DeclarativeFrontmatterBuilder.
 */
class DeclarativeFrontmatterBuilderTest {

    private static final String THESIS = "\\documentclass{report}\n\\begin{document}\n"
        + "\\chapter*{摘要}\n摘要内容\n\\chapter{绪论}\n第一章正文\n\\chapter{方法}\n第二章正文\n\\end{document}\n";

    @TempDir
    Path tempDir;

    @Test
    void testCoverSectionIsInsertedBeforeBody() throws IOException {
        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setSections(List.of(
            FrontmatterSectionConfig.builder()
                .id("cover")
                .elements(List.of(
                    FrontmatterElementConfig.builder().field("title").sizePt(22).bold(true).align("center").build(),
                    FrontmatterElementConfig.builder().type("info_table")
                        .rows(List.of(List.of("作者", "{author}"), List.of("incomplete")))
                        .spaceBeforePt(24.0)
                        .build()))
                .breakAfter("oddPage")
                .build(),
            FrontmatterSectionConfig.builder()
                .id("declaration")
                .condition("has_cover")
                .elements(List.of(FrontmatterElementConfig.builder().content("原创性声明").build()))
                .breakAfter("oddPage")
                .build()));
        ExportMetadata metadata = metadata();

        try (XWPFDocument doc = convert(profile, metadata)) {
            int breaks = new DeclarativeFrontmatterBuilder(profile).buildSections(doc, metadata);

            assertThat(breaks).isEqualTo(1);
            List<IBodyElement> body = doc.getBodyElements();
            XWPFParagraph title = (XWPFParagraph) body.get(0);
            assertThat(title.getText()).isEqualTo("论文题目");
            assertThat(title.getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
            XWPFRun run = title.getRuns().get(0);
            assertThat(run.isBold()).isTrue();
            assertThat(run.getFontSizeAsDouble()).isEqualTo(22.0);

            XWPFParagraph spacer = (XWPFParagraph) body.get(1);
            assertThat(spacer.getText()).isEmpty();
            assertThat(spacer.getSpacingAfter()).isEqualTo(480);

            XWPFTable table = (XWPFTable) body.get(2);
            assertThat(table.getNumberOfRows()).isEqualTo(1);
            assertThat(table.getRow(0).getCell(0).getText()).isEqualTo("作者：");
            assertThat(table.getRow(0).getCell(1).getText()).isEqualTo("张三");

            CTSectPr sectPr = SectionBreaks.sectionPropertiesOf((XWPFParagraph) body.get(3));
            assertThat(sectPr).isNotNull();
            assertThat(sectPr.getType().getVal()).isEqualTo(STSectionMark.ODD_PAGE);
            assertThat(texts(doc)).startsWith("论文题目", "摘要").doesNotContain("原创性声明");
        }
    }

    @Test
    void testConditionalSectionAppearsWhenMetadataHasIt() throws IOException {
        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setSections(List.of(
            FrontmatterSectionConfig.builder()
                .condition("has_cover")
                .elements(List.of(
                    FrontmatterElementConfig.builder().type("boilerplate")
                        .rows(List.of(List.of("本人郑重声明：{title}"), List.of(""), List.of("特此声明")))
                        .build(),
                    FrontmatterElementConfig.builder().type("spacer").lines(2).build(),
                    FrontmatterElementConfig.builder().type("signature_block")
                        .rows(List.of(List.of("作者签名：")))
                        .build()))
                .build()));
        ExportMetadata metadata = metadata();
        metadata.setCoverDetected(true);

        try (XWPFDocument doc = convert(profile, metadata)) {
            int breaks = new DeclarativeFrontmatterBuilder(profile).buildSections(doc, metadata);

            assertThat(breaks).isZero();
            assertThat(texts(doc)).startsWith("本人郑重声明：论文题目", "特此声明", "作者签名：", "摘要");
        }
    }

    @Test
    void testBodySectionBreaksHonorFirstOnly() throws IOException {
        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setBodySectionBreaks(List.of(
            BodySectionBreakConfig.builder().beforeHeadingPattern("第\\s*\\d+\\s*章").firstOnly(true).build()));

        try (XWPFDocument doc = convert(profile, metadata())) {
            int inserted = new DeclarativeFrontmatterBuilder(profile).applyBodySectionBreaks(doc);

            assertThat(inserted).isEqualTo(1);
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            int chapterOne = indexOf(paragraphs, "第 1 章  绪论");
            int chapterTwo = indexOf(paragraphs, "第 2 章  方法");
            assertThat(SectionBreaks.sectionPropertiesOf(paragraphs.get(chapterOne - 1))).isNotNull();
            assertThat(SectionBreaks.sectionPropertiesOf(paragraphs.get(chapterTwo - 1))).isNull();
        }
    }

    @Test
    void testBreakRuleMatching() {
        BodySectionBreakConfig byText = BodySectionBreakConfig.builder().beforeHeadingText("摘要").build();
        BodySectionBreakConfig byPattern = BodySectionBreakConfig.builder().beforeHeadingPattern("第\\s*\\d+\\s*章").build();

        assertThat(DeclarativeFrontmatterBuilder.matches(byText, "摘要")).isTrue();
        assertThat(DeclarativeFrontmatterBuilder.matches(byText, "摘要一")).isFalse();
        assertThat(DeclarativeFrontmatterBuilder.matches(byPattern, "第 3 章  实验")).isTrue();
        assertThat(DeclarativeFrontmatterBuilder.matches(byPattern, "附录 第 3 章")).isFalse();
    }

    @Test
    void testInvalidPatternsDoNotFailTheBuild() throws IOException {
        BodySectionBreakConfig broken = BodySectionBreakConfig.builder().beforeHeadingPattern("第(").build();
        assertThat(DeclarativeFrontmatterBuilder.matches(broken, "第(")).isFalse();

        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setBodySectionBreaks(List.of(broken));
        profile.getFrontmatter().setAutoToc(new AutoTocConfig());
        try (XWPFDocument doc = convert(profile, metadata())) {
            profile.getPageHeaders().setChapterPattern("第(");
            DeclarativeFrontmatterBuilder builder = new DeclarativeFrontmatterBuilder(profile);

            assertThat(builder.applyBodySectionBreaks(doc)).isZero();
            assertThat(builder.insertAutoToc(doc)).isFalse();
        }
    }

    @Test
    void testAutoTocInsertedBeforeFirstChapter() throws IOException {
        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setAutoToc(new AutoTocConfig());

        try (XWPFDocument doc = convert(profile, metadata())) {
            DeclarativeFrontmatterBuilder builder = new DeclarativeFrontmatterBuilder(profile);

            assertThat(builder.insertAutoToc(doc)).isTrue();
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            int heading = indexOf(paragraphs, "目  录");
            int chapter = indexOf(paragraphs, "第 1 章  绪论");
            assertThat(heading).isLessThan(chapter);
            assertThat(SectionBreaks.sectionPropertiesOf(paragraphs.get(heading - 1))).isNotNull();
            assertThat(SectionBreaks.sectionPropertiesOf(paragraphs.get(chapter - 1))).isNotNull();
            assertThat(paragraphs.get(heading + 2).getCTP().xmlText()).contains("TOC \\o");

            assertThat(builder.insertAutoToc(doc)).isFalse();
        }
    }

    @Test
    void testLogoIsResolvedAndEmbedded() throws IOException {
        Path imgDir = Files.createDirectories(tempDir.resolve("template/Img"));
        ImageIO.write(new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB), "png", imgDir.resolve("logo.png").toFile());
        DocxProfile profile = DocxProfile.defaults();
        profile.setTemplateDir(tempDir.resolve("template"));
        profile.getFrontmatter().setSections(List.of(
            FrontmatterSectionConfig.builder()
                .elements(List.of(FrontmatterElementConfig.builder().type("logo").condition("school_logo").build()))
                .build()));
        ExportMetadata metadata = metadata();
        metadata.setSchoolLogo("logo");

        try (XWPFDocument doc = convert(profile, metadata)) {
            DeclarativeFrontmatterBuilder builder = new DeclarativeFrontmatterBuilder(profile);
            builder.buildSections(doc, metadata);

            assertThat(builder.resolveLogo(metadata)).contains(imgDir.resolve("logo.png"));
            assertThat(builder.logoWidthCm(imgDir.resolve("logo.png"), 0.5)).isEqualTo(10.0);
            assertThat(doc.getAllPictures()).hasSize(1);
            assertThat(doc.getParagraphs().get(0).getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
        }
    }

    @Test
    void testFullBuildAssignsHeaders() throws IOException {
        DocxProfile profile = DocxProfile.defaults();
        profile.getFrontmatter().setSections(List.of(
            FrontmatterSectionConfig.builder()
                .elements(List.of(FrontmatterElementConfig.builder().field("title").build()))
                .breakAfter("oddPage")
                .build()));
        profile.getFrontmatter().setBodySectionBreaks(List.of(
            BodySectionBreakConfig.builder().beforeHeadingPattern("第\\s*\\d+\\s*章").firstOnly(true).build()));

        try (XWPFDocument doc = convert(profile, metadata())) {
            new DeclarativeFrontmatterBuilder(profile).build(doc, metadata());

            List<DocumentSection> sections = SectionBreaks.split(doc);
            assertThat(sections).hasSize(3);
            assertThat(sections.get(2).getSectPr().getPgNumType().getStart().intValue()).isEqualTo(1);
        }
    }

    private XWPFDocument convert(DocxProfile profile, ExportMetadata metadata) {
        return new LatexToDocxConverter(profile, null, tempDir, metadata).convert(THESIS);
    }

    private static ExportMetadata metadata() {
        ExportMetadata metadata = new ExportMetadata();
        metadata.set(ExportMetadata.TITLE, "论文题目");
        metadata.set(ExportMetadata.AUTHOR, "张三");
        return metadata;
    }

    private static int indexOf(List<XWPFParagraph> paragraphs, String text) {
        for (int i = 0; i < paragraphs.size(); i++) {
            if (paragraphs.get(i).getText().strip().equals(text)) {
                return i;
            }
        }
        throw new AssertionError("No paragraph '" + text + "'");
    }

    private static List<String> texts(XWPFDocument doc) {
        return doc.getParagraphs().stream()
            .map(p -> p.getText().strip())
            .filter(t -> !t.isEmpty())
            .collect(Collectors.toList());
    }
}
