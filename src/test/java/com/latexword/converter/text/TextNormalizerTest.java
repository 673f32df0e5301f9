package com.latexword.converter.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TextNormalizer and SymbolTable.
 */
class TextNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "pages 1--10 | pages 1–10",
        "wait---what | wait—what",
        "``quoted'' | “quoted”",
        "it's fine | it's fine",
        "a----b | a—-b"
    })
    void testNormalizeTypography(String input, String expected) {
        assertThat(TextNormalizer.normalize(input)).isEqualTo(expected);
    }

    @Test
    void testCleanLatexTextStripsMarkup() {
        String cleaned = TextNormalizer.cleanLatexText(
            "\\ignorespaces 研究\\hspace {.3em}方法~与\\nobreakspace{}$x^2$\\,\\textbf{结论}\\protect\\relax");

        assertThat(cleaned).isEqualTo("研究 方法 与 x^2 结论");
    }

    @Test
    void testCleanLatexTextRemovesPenalties() {
        assertThat(TextNormalizer.cleanLatexText("A\\penalty\\@M\\ B")).isEqualTo("A B");
    }

    @Test
    void testNormalizeForMatchIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr"));
        try {
            assertThat(TextNormalizer.normalizeForMatch("INTRODUCTION")).isEqualTo("introduction");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testNormalizeForMatch() {
        assertThat(TextNormalizer.normalizeForMatch("  Related \\emph{Work} ")).isEqualTo("relatedwork");
    }

    @Test
    void testSymbolLookup() {
        assertThat(SymbolTable.lookup("alpha")).contains("α");
        assertThat(SymbolTable.lookup("%")).contains("%");
        assertThat(SymbolTable.lookup("textdegree")).contains("°");
        assertThat(SymbolTable.lookup("unknown")).isEmpty();
        assertThat(SymbolTable.isSymbol("LaTeX")).isTrue();
    }
}
