package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.SpreadsheetProperties;
import com.spreadsheet.formula.exceptions.CellNotFoundException;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.LexException;
import com.spreadsheet.formula.exceptions.LiteralParseException;
import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.DependencyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SpreadsheetService logic, using an in-memory approach
 * (no HTTP or Spring context).
 */
class SpreadsheetServiceTest {

    private SpreadsheetService spreadsheetService;

    @BeforeEach
    void setUp() {
        SpreadsheetProperties properties = new SpreadsheetProperties();
        properties.setRandomSeed(7L);
        spreadsheetService = new SpreadsheetService(properties);
    }

    /**
     * Every row of the output mirrors the input row, values padded to 10 characters.
     */
    @Test
    void testRenderWholeGrid() {
        String input = "1|2|=A0 + B0 * 2\n"
                + "=sum(A0, B0, C0)|=average(15, 18, 2, 36, 12, 78, 5, 6, 9)|=if(0, 10, 20)\n"
                + "=((10 * 5) + (20 / 4)) - ((8 + 2) * 3)|=max(A1, 3)\n";

        String expected = "1         |2         |5         |\n"
                + "8         |20.11111  |20        |\n"
                + "25        |8         |\n";

        assertEquals(expected, spreadsheetService.render(input));
    }

    @Test
    void testValuesAreKeyedByCanonicalCoordinate() {
        Map<String, Double> values = spreadsheetService.getValues("1|=a0 + 1\n=B0 * 10");
        assertEquals(List.of("A0", "B0", "A1"), List.copyOf(values.keySet()));
        assertEquals(2.0, values.get("B0"));
        assertEquals(20.0, values.get("A1"));
    }

    /**
     * One cycle anywhere aborts the whole batch, even if other cells are fine.
     */
    @Test
    void testCycleAbortsBatch() {
        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> spreadsheetService.render("1|2\n=C1|=A1|=B1"));
        assertEquals("Cycle detected, \"A1 -> C1 -> B1 -> A1\"", ex.getMessage());
    }

    @Test
    void testOtherErrorsAbortBatch() {
        assertThrows(CellNotFoundException.class, () -> spreadsheetService.render("1|=C5"));
        assertThrows(LiteralParseException.class, () -> spreadsheetService.render("1|abc"));
        assertThrows(LexException.class, () -> spreadsheetService.render("1|=A0 % 2"));
    }

    @Test
    void testDependencies() {
        DependencyGraph graph = spreadsheetService.getDependencies("1|=A0 * 2|=A0 + B0");
        assertEquals(Set.of(CellCoordinate.parse("A0"), CellCoordinate.parse("B0")),
                graph.getDependencies(CellCoordinate.parse("C0")));
    }

    /**
     * The same seed gives the same sequence of random values.
     */
    @Test
    void testSeededRandomIsReproducible() {
        SpreadsheetProperties properties = new SpreadsheetProperties();
        properties.setRandomSeed(7L);
        SpreadsheetService other = new SpreadsheetService(properties);

        String input = "=random()|=randbetween(1, 100)";
        assertEquals(spreadsheetService.getValues(input), other.getValues(input));
    }
}
