package com.latexword.converter.profile;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FieldInterpolator.
 */
class FieldInterpolatorTest {

    private final FieldInterpolator interpolator = new FieldInterpolator();

    @Test
    void testSubstitutesPlaceholders() {
        assertThat(interpolator.interpolate("{chapter}.{section}  {title}",
            Map.of("chapter", 2, "section", 10, "title", "方法")))
            .isEqualTo("2.10  方法");
    }

    @Test
    void testLargeNumbersAreNotGrouped() {
        assertThat(interpolator.interpolate("No. {n}", "n", 12345)).isEqualTo("No. 12345");
    }

    @Test
    void testMissingValueRendersEmpty() {
        assertThat(interpolator.interpolate("By {author_en}!", Map.of())).isEqualTo("By !");
    }

    @Test
    void testLiteralTemplateSyntaxIsPreserved() {
        assertThat(interpolator.interpolate("[#if] costs $5 {x}", "x", "ok")).isEqualTo("[#if] costs $5 ok");
    }

    @Test
    void testValuesAreNotInterpreted() {
        assertThat(interpolator.interpolate("{title}", "title", "${evil} [#list]")).isEqualTo("${evil} [#list]");
    }

    @Test
    void testStringWithoutPlaceholdersReturnedAsIs() {
        assertThat(interpolator.interpolate("目  录", Map.of())).isEqualTo("目  录");
    }
}
