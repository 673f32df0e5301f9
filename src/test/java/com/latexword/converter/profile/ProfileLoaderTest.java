package com.latexword.converter.profile;

import com.latexword.converter.profile.model.HeadingStyleConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProfileLoader, TemplateRegistry and DocxProfile formatting.
 */
class ProfileLoaderTest {

    private static Path templatesDir() throws URISyntaxException {
        return Path.of(ProfileLoaderTest.class.getResource("/templates/ucas_thesis/meta.json").toURI())
            .getParent().getParent();
    }

    @Test
    void testDefaultsWithoutTemplate() {
        DocxProfile profile = new ProfileLoader(new TemplateRegistry(null)).load("");

        assertThat(profile.getLanguage()).isEqualTo("zh-CN");
        assertThat(profile.getLabels().getToc()).isEqualTo("目  录");
        assertThat(profile.getFonts().getBodyLatin()).isEqualTo("Times New Roman");
        assertThat(profile.getStyles().getNormal().getFirstLineIndentPt()).isEqualTo(24);
        assertThat(profile.getStyles().getHeadings()).hasSize(6);
        assertThat(profile.getPageHeaders().getFrontmatterPageFormat()).isEqualTo("upperRoman");
        assertThat(profile.getFrontmatter().getAutoToc()).isNull();
        assertThat(profile.isReport()).isTrue();
        assertThat(profile.isCjk()).isTrue();
    }

    @Test
    void testUnknownTemplateFallsBackToDefaults() {
        DocxProfile profile = new ProfileLoader(new TemplateRegistry(null)).load("missing");

        assertThat(profile.getNumbering().getChapterFormat()).isEqualTo("第 {n} 章  {title}");
    }

    @Test
    void testPartialTemplateKeepsDefaultsPerField() throws Exception {
        DocxProfile profile = new ProfileLoader(new TemplateRegistry(templatesDir())).load("ucas_thesis");

        assertThat(profile.getLabels().getAbstractLabel()).isEqualTo("摘  要");
        assertThat(profile.getLabels().getFigurePrefix()).isEqualTo("图");
        assertThat(profile.isReport()).isTrue();
        assertThat(profile.getTemplateDir()).endsWithRaw(Path.of("ucas_thesis"));

        assertThat(profile.getHeadingStyle(1).map(HeadingStyleConfig::getFontSizePt)).contains(16.0);
        assertThat(profile.getHeadingStyle(2).map(HeadingStyleConfig::isBold)).contains(false);
        assertThat(profile.getHeadingStyle(4)).isPresent();
        assertThat(profile.getHeadingStyle(3)).isEmpty();

        assertThat(profile.getPreprocessor().isTitleImpliesCover()).isTrue();
        assertThat(profile.getFrontmatter().getSections()).hasSize(3);
        assertThat(profile.getFrontmatter().getSections().get(0).getElements().get(2).getSizePt()).isEqualTo(22);
        assertThat(profile.getFrontmatter().getAutoToc().isInsertBeforeFirstChapter()).isTrue();
    }

    @Test
    void testArticleClassType() throws Exception {
        DocxProfile profile = new ProfileLoader(new TemplateRegistry(templatesDir())).load("plain_article");

        assertThat(profile.getDocClassType()).isEqualTo(DocxProfile.ARTICLE);
        assertThat(profile.getFonts().getMonospace()).isEqualTo("Courier New");
    }

    @Test
    void testFromJsonWithNullsKeepsDefaults() {
        DocxProfile profile = new ProfileLoader(new TemplateRegistry(null)).fromJson("""
            {"language": "en", "labels": null, "numbering": {"chapter_format": "Chapter {n}: {title}"},
             "unknown_key": 1}
            """);

        assertThat(profile.getLanguage()).isEqualTo("en");
        assertThat(profile.isCjk()).isFalse();
        assertThat(profile.getLabels().getToc()).isEqualTo("目  录");
        assertThat(profile.formatChapter(3, "Results")).isEqualTo("Chapter 3: Results");
    }

    @Test
    void testFormatHeadings() {
        DocxProfile profile = DocxProfile.defaults();

        assertThat(profile.formatChapter(1, "绪论")).isEqualTo("第 1 章  绪论");
        assertThat(profile.formatChapter(1, "参考文献")).isEqualTo("参考文献");
        assertThat(profile.formatSection(2, "背景", 1, 2, 0, 0)).isEqualTo("1.2  背景");
        assertThat(profile.formatSection(4, "细节", 2, 1, 3, 4)).isEqualTo("2.1.3.4  细节");
        assertThat(profile.formatSection(5, "深层", 1, 1, 1, 1)).isEqualTo("深层");
        assertThat(profile.formatSection(2, "Abstract", 1, 1, 0, 0)).isEqualTo("Abstract");
    }

    @Test
    void testCjkFontLookup() {
        DocxProfile profile = DocxProfile.defaults();

        assertThat(profile.getCjkFont("heiti")).contains("Heiti SC");
        assertThat(profile.getCjkFont("lishu")).isEmpty();
    }

    @Test
    void testRegistrySkipsBrokenMetaAndFindsBundledDefault(@TempDir Path tempDir) throws Exception {
        Files.createDirectories(tempDir.resolve("broken"));
        Files.writeString(tempDir.resolve("broken/meta.json"), "{ not json");
        Files.createDirectories(tempDir.resolve("custom/Img"));
        Files.writeString(tempDir.resolve("custom/meta.json"), """
            {"id": "custom", "doc_class_type": "report", "support_dirs": ["Img", "Missing"]}
            """);

        TemplateRegistry registry = new TemplateRegistry(tempDir);

        assertThat(registry.discover()).extracting(TemplateInfo::getId).containsExactly("custom", "default");
        assertThat(registry.find("default")).hasValueSatisfying(t -> assertThat(t.isBuiltin()).isTrue());
        assertThat(registry.getSupportDirs("custom")).containsExactly(tempDir.resolve("custom/Img"));
    }
}
