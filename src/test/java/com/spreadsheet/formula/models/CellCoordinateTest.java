package com.spreadsheet.formula.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellCoordinateTest {

    @Test
    void testColumnNames() {
        assertEquals("A", CellCoordinate.columnName(0));
        assertEquals("Z", CellCoordinate.columnName(25));
        assertEquals("AA", CellCoordinate.columnName(26));
        assertEquals("AZ", CellCoordinate.columnName(51));
        assertEquals("BA", CellCoordinate.columnName(52));
        assertEquals("ZZ", CellCoordinate.columnName(701));
        assertEquals("AAA", CellCoordinate.columnName(702));
    }

    @Test
    void testColumnIndexIsInverseOfName() {
        for (int column = 0; column < 1000; column++) {
            assertEquals(column, CellCoordinate.columnIndex(CellCoordinate.columnName(column)));
        }
    }

    @Test
    void testParseAndRender() {
        CellCoordinate coordinate = CellCoordinate.parse("c7");
        assertEquals(2, coordinate.getColumn());
        assertEquals(7, coordinate.getRow());
        assertEquals("C7", coordinate.toString());
        assertEquals(CellCoordinate.of(27, 12), CellCoordinate.parse("AB12"));
    }

    @Test
    void testColumnIndexOverflowIsDetected() {
        assertThrows(ArithmeticException.class, () -> CellCoordinate.columnIndex("AAAAAAAAAAAAAAAA"));
        assertEquals(Integer.MAX_VALUE,
                CellCoordinate.columnIndex(CellCoordinate.columnName(Integer.MAX_VALUE - 1)) + 1);
    }

    @Test
    void testReferenceShape() {
        assertTrue(CellCoordinate.isReference("A0"));
        assertTrue(CellCoordinate.isReference("xy99"));
        assertFalse(CellCoordinate.isReference("sum"));
        assertFalse(CellCoordinate.isReference("A1B"));
        assertFalse(CellCoordinate.isReference("12"));
        assertThrows(IllegalArgumentException.class, () -> CellCoordinate.parse("max"));
    }

    @Test
    void testRowMajorOrdering() {
        List<CellCoordinate> coordinates = new ArrayList<>(List.of(
                CellCoordinate.parse("B1"), CellCoordinate.parse("A1"),
                CellCoordinate.parse("C0"), CellCoordinate.parse("A0")));
        Collections.sort(coordinates);
        assertEquals(List.of(
                CellCoordinate.parse("A0"), CellCoordinate.parse("C0"),
                CellCoordinate.parse("A1"), CellCoordinate.parse("B1")), coordinates);
    }
}
