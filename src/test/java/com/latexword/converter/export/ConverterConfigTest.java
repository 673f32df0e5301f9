package com.latexword.converter.export;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConverterConfig.
 */
class ConverterConfigTest {

    @Test
    void testDefaultsBuildFrontmatterForTemplateOrCover() {
        ConverterConfig config = ConverterConfig.defaults();

        assertThat(config.getFrontmatterMode()).isEqualTo(ConverterConfig.FrontmatterMode.AUTO);
        assertThat(config.shouldBuildFrontmatter("plain_report", false)).isTrue();
        assertThat(config.shouldBuildFrontmatter("", true)).isTrue();
        assertThat(config.shouldBuildFrontmatter("", false)).isFalse();
        assertThat(config.shouldBuildFrontmatter(null, false)).isFalse();
    }

    @Test
    void testDefaultsStripNumbering() {
        assertThat(ConverterConfig.defaults().isStripNumberingPart()).isTrue();
    }

    @Test
    void testExplicitModesOverrideDetection() {
        ConverterConfig always = ConverterConfig.builder().frontmatterMode(ConverterConfig.FrontmatterMode.ALWAYS).build();
        ConverterConfig never = ConverterConfig.builder().frontmatterMode(ConverterConfig.FrontmatterMode.NEVER).build();

        assertThat(always.shouldBuildFrontmatter("", false)).isTrue();
        assertThat(never.shouldBuildFrontmatter("plain_report", true)).isFalse();
    }
}
