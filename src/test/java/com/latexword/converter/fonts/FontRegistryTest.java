package com.latexword.converter.fonts;

import com.latexword.converter.fonts.FontRegistry.Fontset;
import com.latexword.converter.fonts.FontRegistry.Role;
import com.latexword.converter.profile.model.FontsConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FontRegistry.
 */
class FontRegistryTest {

    @ParameterizedTest
    @CsvSource({
        "WINDOWS, STSong, SimSun",
        "WINDOWS, Heiti SC, SimHei",
        "LINUX, SimHei, FandolHei",
        "MAC, FandolKai, Kaiti SC",
        "MAC, STSong, STSong",
        "LINUX, Times New Roman, Times New Roman"
    })
    void testResolveTranslatesBetweenPlatforms(Fontset fontset, String input, String expected) {
        assertThat(FontRegistry.forFontset(fontset).resolve(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "MAC, FANGSONG, STFangsong",
        "WINDOWS, KAITI, KaiTi",
        "LINUX, SONGTI, FandolSong"
    })
    void testFontForRole(Fontset fontset, Role role, String expected) {
        assertThat(FontRegistry.forFontset(fontset).fontFor(role)).isEqualTo(expected);
    }

    @Test
    void testNullFontsetDefaultsToMac() {
        assertThat(FontRegistry.forFontset(null).getFontset()).isEqualTo(Fontset.MAC);
    }

    @Test
    void testLocalizeRewritesEveryFontRole() {
        FontsConfig fonts = new FontsConfig();

        FontRegistry.forFontset(Fontset.WINDOWS).localize(fonts);

        assertThat(fonts.getBodyEastAsian()).isEqualTo("SimSun");
        assertThat(fonts.getHeadingEastAsian()).isEqualTo("SimHei");
        assertThat(fonts.getCaptionEastAsian()).isEqualTo("SimHei");
        assertThat(fonts.getBodyLatin()).isEqualTo("Times New Roman");
        assertThat(fonts.getCjkFontCommands().values()).isNotEmpty().isSubsetOf("SimSun", "SimHei", "KaiTi", "FangSong");
    }
}
