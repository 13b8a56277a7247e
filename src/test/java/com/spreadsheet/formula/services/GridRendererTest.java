package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.Grid;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GridRendererTest {

    private final GridRenderer renderer = new GridRenderer(10, 5);

    @Test
    void testIntegralValuesHaveNoFraction() {
        assertEquals("7", renderer.formatValue(7.0));
        assertEquals("-3", renderer.formatValue(-3.0));
        assertEquals("0", renderer.formatValue(0.0));
        assertEquals("0", renderer.formatValue(-0.0));
        assertEquals("1200", renderer.formatValue(1200.0));
    }

    @Test
    void testFractionsAreRoundedAndTrimmed() {
        assertEquals("20.11111", renderer.formatValue(181.0 / 9.0));
        assertEquals("2.5", renderer.formatValue(2.5));
        assertEquals("0.66667", renderer.formatValue(2.0 / 3.0));
        assertEquals("0.1", renderer.formatValue(0.1));
        assertEquals("2.35", new GridRenderer(0, 2).formatValue(2.345));
    }

    @Test
    void testNonFiniteValues() {
        assertEquals("inf", renderer.formatValue(Double.POSITIVE_INFINITY));
        assertEquals("-inf", renderer.formatValue(Double.NEGATIVE_INFINITY));
        assertEquals("NaN", renderer.formatValue(Double.NaN));
    }

    @Test
    void testRenderPadsEachCellAndEndsWithSeparator() {
        Grid grid = GridLoader.load("1|2\n3");
        Map<CellCoordinate, Double> values = Map.of(
                CellCoordinate.parse("A0"), 1.0,
                CellCoordinate.parse("B0"), 2.5,
                CellCoordinate.parse("A1"), 3.0);

        assertEquals("1         |2.5       |\n3         |\n", renderer.render(grid, values));
    }

    @Test
    void testAbsentCellsRenderBlank() {
        Grid grid = GridLoader.load("1||3");
        Map<CellCoordinate, Double> values = Map.of(
                CellCoordinate.parse("A0"), 1.0,
                CellCoordinate.parse("C0"), 3.0);

        assertEquals("1         |          |3         |\n", renderer.render(grid, values));
    }

    @Test
    void testLongValuesAreNotTruncated() {
        GridRenderer narrow = new GridRenderer(3, 5);
        Grid grid = GridLoader.load("1");
        assertEquals("123456|\n", narrow.render(grid, Map.of(CellCoordinate.parse("A0"), 123456.0)));
    }
}
