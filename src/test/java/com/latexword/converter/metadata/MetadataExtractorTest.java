package com.latexword.converter.metadata;

import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.ApprovalFieldConfig;
import com.latexword.converter.profile.model.CoverConfig;
import com.latexword.converter.profile.model.MetadataFieldRuleConfig;
import com.latexword.converter.profile.model.PreprocessorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MetadataExtractor.
 */
class MetadataExtractorTest {

    private static DocxProfile thesisProfile() {
        PreprocessorConfig preprocessor = PreprocessorConfig.builder()
            .titleImpliesCover(true)
            .preambleMetadataFields(List.of(
                MetadataFieldRuleConfig.builder().attr("advisor").command("advisor").build(),
                MetadataFieldRuleConfig.builder().attr("advisor_en").command("ADVISOR")
                    .stripPrefixRegex("^\\s*supervisor\\s*[:：]\\s*").build()))
            .stripBodyCommands(List.of("maketitle"))
            .build();
        return DocxProfile.builder().preprocessor(preprocessor).build();
    }

    @Test
    void testPreambleFields() {
        String latex = "\\documentclass[twoside,12pt]{ctexbook}\n"
            + "\\title{基于深度学习的研究}\n"
            + "\\author{张三}\n"
            + "\\advisor{李~四~教授}\n"
            + "\\ADVISOR{Supervisor: Prof. Li}\n"
            + "\\schoollogo[scale=0.5]{ucas_logo}\n"
            + "\\begin{document}\n\\maketitle\nText\n\\end{document}\n";

        PreparedSource prepared = new MetadataExtractor(thesisProfile()).prepare(latex, "ucas_thesis");
        ExportMetadata metadata = prepared.getMetadata();

        assertThat(metadata.getTitle()).isEqualTo("基于深度学习的研究");
        assertThat(metadata.getAuthor()).isEqualTo("张三");
        assertThat(metadata.get("advisor")).isEqualTo("李 四 教授");
        assertThat(metadata.get("advisor_en")).isEqualTo("Prof. Li");
        assertThat(metadata.getSchoolLogo()).isEqualTo("ucas_logo");
        assertThat(metadata.getSchoolLogoScale()).isEqualTo(0.5);
        assertThat(metadata.isTwoside()).isTrue();
        assertThat(metadata.isCoverDetected()).isTrue();
        assertThat(metadata.getTemplateId()).isEqualTo("ucas_thesis");
        assertThat(prepared.getLatex()).doesNotContain("\\maketitle").contains("Text");
    }

    @Test
    void testCommentedTitleIsIgnored() {
        String latex = "%\\title{Old}\n\\title{New}\n\\begin{document}\n\\end{document}\n";

        ExportMetadata metadata = new MetadataExtractor(DocxProfile.defaults()).extract(latex, null);

        assertThat(metadata.getTitle()).isEqualTo("New");
        assertThat(metadata.isCoverDetected()).isFalse();
    }

    @Test
    void testGeometryBlocksAreMerged() {
        String latex = "\\usepackage[a4paper]{geometry}\n"
            + "\\geometry{top=2.5cm, bottom=2cm}\n"
            + "\\newgeometry{left=30mm,bottom=1in}\n"
            + "\\begin{document}\n\\end{document}\n";

        ExportMetadata metadata = new MetadataExtractor(DocxProfile.defaults()).extract(latex, "");

        assertThat(metadata.getGeometry()).containsExactly(
            entry("top", "2.5cm"), entry("bottom", "1in"), entry("left", "30mm"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "\\pagenumbering{roman} x \\pagenumbering{arabic}   | lowerRoman | decimal",
        "\\pagenumbering{Roman} x \\mainmatter              | upperRoman | decimal",
        "\\pagenumbering{Alph} x \\pagenumbering{alph}      | upperLetter | lowerLetter"
    })
    void testPageNumbering(String body, String frontFormat, String bodyFormat) {
        String latex = "\\begin{document}\n" + body.replace(" x ", "\nx\n") + "\n\\end{document}\n";

        ExportMetadata metadata = new MetadataExtractor(DocxProfile.defaults()).extract(latex, "");

        assertThat(metadata.getFrontmatterPageFormat()).isEqualTo(frontFormat);
        assertThat(metadata.getBodyPageFormat()).isEqualTo(bodyFormat);
    }

    @Test
    void testCommentedPageNumberingIsIgnored() {
        String latex = "\\begin{document}\n% \\pagenumbering{roman}\n\\end{document}\n";

        ExportMetadata metadata = new MetadataExtractor(DocxProfile.defaults()).extract(latex, "");

        assertThat(metadata.getFrontmatterPageFormat()).isNull();
        assertThat(metadata.getBodyPageFormat()).isNull();
    }

    @Test
    void testCoverBlockIsParsedAndRemoved() {
        CoverConfig cover = CoverConfig.builder()
            .enabled(true)
            .detectionMarkers(List.of("项目名称"))
            .fieldPatterns(Map.of("project", "项目名称：\\s*(.*?)\\\\par"))
            .approvalFields(List.of(ApprovalFieldConfig.builder()
                .label("编写").nameAttr("writer").dateAttr("write_date").build()))
            .build();
        DocxProfile profile = DocxProfile.builder()
            .preprocessor(PreprocessorConfig.builder().cover(cover).build())
            .build();
        String latex = "\\begin{document}\n"
            + "\\thispagestyle{coverpage}\n"
            + "\\begingroup\n"
            + "{\\heiti\\fontsize{16pt}{20pt}\\selectfont 项目名称：\\textbf{星图}\\par}\n"
            + "编写 & \\centering 王五 & 2024-01-02 \\tabularnewline\n"
            + "\\vfill\n"
            + "{\\fontsize{14pt}{18pt}\\selectfont 二〇二四年一月\\par}\n"
            + "\\endgroup\n"
            + "Body text\n\\end{document}\n";

        PreparedSource prepared = new MetadataExtractor(profile).prepare(latex, "");
        ExportMetadata metadata = prepared.getMetadata();

        assertThat(metadata.isCoverDetected()).isTrue();
        assertThat(metadata.get("project")).isEqualTo("星图");
        assertThat(metadata.get("writer")).isEqualTo("王五");
        assertThat(metadata.get("write_date")).isEqualTo("2024-01-02");
        assertThat(metadata.get(ExportMetadata.REPORT_DATE)).isEqualTo("二〇二四年一月");
        assertThat(prepared.getLatex())
            .doesNotContain("\\begingroup", "coverpage", "项目名称")
            .contains("Body text");
    }

    @Test
    void testInvalidProfilePatternsAreSkipped() {
        CoverConfig cover = CoverConfig.builder()
            .enabled(true)
            .blockStart("\\\\begingroup(")
            .build();
        PreprocessorConfig preprocessor = PreprocessorConfig.builder()
            .cover(cover)
            .preambleMetadataFields(List.of(
                MetadataFieldRuleConfig.builder().attr("advisor").command("advisor").stripPrefixRegex("[").build()))
            .build();
        DocxProfile profile = DocxProfile.builder().preprocessor(preprocessor).build();
        String latex = "\\advisor{Li}\n\\begin{document}\n\\begingroup\nBody\n\\endgroup\n\\end{document}\n";

        PreparedSource prepared = new MetadataExtractor(profile).prepare(latex, "");

        assertThat(prepared.getMetadata().get("advisor")).isEqualTo("Li");
        assertThat(prepared.getMetadata().isCoverDetected()).isFalse();
        assertThat(prepared.getLatex()).contains("\\begingroup", "Body");
    }

    @Test
    void testRevisionTableIsRewritten() {
        String latex = "\\begin{document}\n"
            + "\\begin{center}\n{\\heiti 文档修改记录}\n"
            + "\\begin{tabularx}{\\textwidth}{|l|l|X|l|l|}\n"
            + "\\hline\n{\\heiti 版本} & {\\heiti 日期} & x & y & z \\tabularnewline\n"
            + "\\hline\n\\textbf{V1.0} & 2024-01-01 & 初稿 & 全部 & \\hline \\tabularnewline\n"
            + "V1.1 & 2024-02-01 & 修订 & 第2章 & 无 \\tabularnewline\n"
            + "\\end{tabularx}\n\\end{center}\n"
            + "\\chapter{引言}\n\\end{document}\n";

        PreparedSource prepared = new MetadataExtractor(DocxProfile.defaults()).prepare(latex, "");
        List<RevisionRecord> records = prepared.getMetadata().getRevisionRecords();

        assertThat(records).extracting(RevisionRecord::getVersion).containsExactly("V1.0", "V1.1");
        assertThat(records.get(0).getRemarks()).isEmpty();
        assertThat(records.get(1).getModifiedSections()).isEqualTo("第2章");
        assertThat(prepared.getMetadata().isPresent("revision_records")).isTrue();
        assertThat(prepared.getLatex())
            .contains("\\section*{文档修改记录}", "\\begin{tabular}{|l|l|p{5cm}|l|l|}", "\\clearpage", "\\chapter{引言}")
            .doesNotContain("tabularx");
    }

    @Test
    void testCleanCoverText() {
        assertThat(MetadataExtractor.cleanCoverText("\\heiti\\fontsize{12}{14}\\selectfont A\\quad \\textbf{B}"))
            .isEqualTo("A B");
    }

    @Test
    void testSourceWithoutDocumentIsReturnedAsIs() {
        PreparedSource prepared = new MetadataExtractor(DocxProfile.defaults()).prepare("just text", "");

        assertThat(prepared.getLatex()).isEqualTo("just text");
        assertThat(prepared.getMetadata().getTitle()).isEmpty();
    }
}
