package com.latexword.converter.table;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ColumnSpecParser.
 */
class ColumnSpecParserTest {

    @Test
    void testAlignmentLettersAndPipes() {
        List<ColumnDef> columns = ColumnSpecParser.parse("|l|c|r|");

        assertThat(columns).extracting(ColumnDef::getAlign)
            .containsExactly(CellAlignment.LEFT, CellAlignment.CENTER, CellAlignment.RIGHT);
        assertThat(columns.get(0).isLeftBorder()).isTrue();
        assertThat(columns).allMatch(ColumnDef::isRightBorder);
        assertThat(columns).noneMatch(ColumnDef::hasFixedWidth);
    }

    @Test
    void testFixedWidthColumns() {
        List<ColumnDef> columns = ColumnSpecParser.parse("p{3cm}m{20mm}X");

        assertThat(columns).hasSize(3);
        assertThat(columns.get(0).getWidthCm()).isEqualTo(3.0);
        assertThat(columns.get(1).getWidthCm()).isCloseTo(2.0, within(1e-9));
        assertThat(columns.get(2).hasFixedWidth()).isFalse();
    }

    @Test
    void testRepeatAndSkipGroups() {
        List<ColumnDef> columns = ColumnSpecParser.parse("@{}l*{3}{c}>{\\centering\\arraybackslash}r@{}");

        assertThat(columns).extracting(ColumnDef::getAlign)
            .containsExactly(CellAlignment.LEFT, CellAlignment.CENTER, CellAlignment.CENTER,
                             CellAlignment.CENTER, CellAlignment.RIGHT);
    }

    @Test
    void testNullSpecYieldsNoColumns() {
        assertThat(ColumnSpecParser.parse(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "2cm, 2.0",
        "10mm, 1.0",
        "1in, 2.54",
        "72pt, 2.54",
        "0.5\\textwidth, 7.5",
        "\\linewidth, 15.0"
    })
    void testParseWidth(String width, double expectedCm) {
        assertThat(ColumnSpecParser.parseWidth(width)).isCloseTo(expectedCm, within(1e-6));
    }

    @Test
    void testUnsupportedWidthUnit() {
        assertThat(ColumnSpecParser.parseWidth("3em")).isNull();
    }
}
