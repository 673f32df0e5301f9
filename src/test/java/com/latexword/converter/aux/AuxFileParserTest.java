package com.latexword.converter.aux;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AuxFileParser and TexStructure lookups.
 */
class AuxFileParserTest {

    private static final String AUX = """
        \\relax
        \\@writefile{toc}{\\contentsline {chapter}{\\numberline {第1章}绪论}{1}{chapter.1}\\protected@file@percent }
        \\@writefile{toc}{\\contentsline {section}{\\numberline {1.1}研究背景}{2}{section.1.1}\\protected@file@percent }
        \\@writefile{toc}{\\contentsline {section}{\\numberline {1.2}研究\\hspace {.3em}方法}{3}{section.1.2}\\protected@file@percent }
        \\@writefile{toc}{\\contentsline {chapter}{参考文献}{40}{chapter*.5}\\protected@file@percent }
        \\@writefile{lof}{\\contentsline {figure}{\\numberline {1.1}{\\ignorespaces 系统架构图}}{5}{figure.1.1}\\protected@file@percent }
        \\@writefile{lot}{\\contentsline {table}{\\numberline {1.1}{\\ignorespaces 参数表}}{6}{table.1.1}\\protected@file@percent }
        \\newlabel{fig:arch}{{1.1}{5}{系统架构图}{figure.1.1}{}}
        \\newlabel{eq:main}{{1-2}{iv}{}{equation.1.2}{}}
        """;

    private final AuxFileParser parser = new AuxFileParser();

    @Test
    void testParseTocEntries() {
        TexStructure structure = parser.parse(AUX, null);

        assertThat(structure.getTocEntries()).hasSize(4);
        TocEntry chapter = structure.getTocEntries().get(0);
        assertThat(chapter.getLevel()).isEqualTo("chapter");
        assertThat(chapter.getNumber()).isEqualTo("第1章");
        assertThat(chapter.getTitle()).isEqualTo("绪论");
        assertThat(chapter.getPage()).isEqualTo(1);
        assertThat(chapter.getFullTitle()).isEqualTo("第1章 绪论");

        TocEntry unnumbered = structure.getTocEntries().get(3);
        assertThat(unnumbered.getNumber()).isEmpty();
        assertThat(unnumbered.getFullTitle()).isEqualTo("参考文献");
    }

    @Test
    void testParseFloatsAndLabels() {
        TexStructure structure = parser.parse(AUX, null);

        assertThat(structure.findFigure(1)).hasValueSatisfying(f -> {
            assertThat(f.getNumber()).isEqualTo("1.1");
            assertThat(f.getCaption()).isEqualTo("系统架构图");
            assertThat(f.getPage()).isEqualTo(5);
        });
        assertThat(structure.findTable(1).map(FloatEntry::getCaption)).contains("参数表");
        assertThat(structure.findFigure(2)).isEmpty();
        assertThat(structure.findFigure(0)).isEmpty();

        assertThat(structure.resolveRef("fig:arch")).contains("1.1");
        assertThat(structure.getLabel("eq:main").map(LabelInfo::getPage)).contains(0);
        assertThat(structure.resolveRef("missing")).isEmpty();
    }

    @Test
    void testHeadingCursorOnlyMovesForward() {
        TexStructure structure = parser.parse(AUX, null);

        assertThat(structure.findHeading("研究方法", "section").map(TocEntry::getNumber)).contains("1.2");
        // 1.1 lies before the cursor now
        assertThat(structure.findHeading("研究背景", "section")).isEmpty();
        assertThat(structure.findHeading("参考文献", "chapter")).isPresent();
    }

    @Test
    void testSameTitleAtDifferentLevelsMatchedInOrder() {
        String aux = """
            \\@writefile{toc}{\\contentsline {chapter}{\\numberline {1}Overview}{1}{}}
            \\@writefile{toc}{\\contentsline {section}{\\numberline {1.1}Overview}{1}{}}
            \\@writefile{toc}{\\contentsline {section}{\\numberline {1.2}Overview}{2}{}}
            """;
        TexStructure structure = parser.parse(aux, null);

        assertThat(structure.findHeading("Overview", "section").map(TocEntry::getNumber)).contains("1.1");
        assertThat(structure.findHeading("Overview", "chapter")).isEmpty();
        assertThat(structure.findHeading("Overview", "section").map(TocEntry::getNumber)).contains("1.2");
        assertThat(structure.findHeading("Overview", "section")).isEmpty();
    }

    @Test
    void testContainmentMatchesAfterNormalization() {
        TexStructure structure = parser.parse(AUX, null);

        assertThat(structure.findHeading("\\textbf{研究 背景}", "section")).isPresent();
    }

    @Test
    void testBibliographyOrderWinsOverAuxOrder() {
        String aux = """
            \\abx@aux@cite{0}{b}
            \\abx@aux@cite{0}{a}
            """;
        String bbl = """
            \\entry{a}{article}{}
            \\endentry
            \\entry{b}{book}{}
            \\endentry
            """;

        TexStructure structure = parser.parse(aux, bbl);

        assertThat(structure.resolveRef("a")).contains("1");
        assertThat(structure.resolveRef("b")).contains("2");
    }

    @Test
    void testAuxOrderUsedWithoutBibliography() {
        String aux = """
            \\citation{b,a}
            \\citation{b}
            \\citation{c}
            """;

        TexStructure structure = parser.parse(aux, null);

        assertThat(structure.resolveCitationKeys(List.of("a", "b", "c", "zz")))
            .containsExactly("2", "1", "3", "zz");
    }

    @Test
    void testBibciteTakesPriority() {
        String aux = """
            \\citation{a}
            \\citation{b}
            \\bibcite{b}{7}
            """;
        String bbl = """
            \\begin{thebibliography}{9}
            \\bibitem[Smith(2020)]{b} Smith.
            \\bibitem{a} Jones.
            \\end{thebibliography}
            """;

        TexStructure structure = parser.parse(aux, bbl);

        assertThat(structure.resolveRef("b")).contains("7");
        assertThat(structure.resolveRef("a")).contains("2");
    }

    @Test
    void testLaterLabelDoesNotReplaceBibciteNumber() {
        String aux = """
            \\bibcite{knuth}{3}
            \\newlabel{knuth}{{2.1}{5}{Knuth}{section.2.1}{}}
            \\bibcite{knuth}{9}
            """;

        TexStructure structure = parser.parse(aux, null);

        assertThat(structure.resolveCitationKeys(List.of("knuth"))).containsExactly("3");
        assertThat(structure.resolveRef("knuth")).contains("2.1");
    }

    @Test
    void testUnreadableAuxFileIsUnavailable(@TempDir Path tempDir) {
        assertThat(parser.parse(tempDir.resolve("document.aux"), tempDir.resolve("document.bbl"))).isEmpty();
    }

    @Test
    void testReadsFilesFromDisk(@TempDir Path tempDir) throws Exception {
        Path aux = tempDir.resolve("document.aux");
        Files.writeString(aux, AUX);

        assertThat(parser.parse(aux, tempDir.resolve("document.bbl")))
            .hasValueSatisfying(s -> assertThat(s.getLotEntries()).hasSize(1));
    }
}
