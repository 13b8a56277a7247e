package com.spreadsheet.formula.services;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.CellCoordinate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationContextTest {

    private static CellCoordinate at(String text) {
        return CellCoordinate.parse(text);
    }

    @Test
    void testEnterAndExit() {
        EvaluationContext context = new EvaluationContext();
        context.enter(at("A0"));
        context.enter(at("B0"));
        assertEquals(2, context.depth());
        assertTrue(context.isInProgress(at("A0")));

        context.exit(at("B0"));
        context.exit(at("A0"));
        assertEquals(0, context.depth());
        assertFalse(context.isInProgress(at("A0")));
    }

    /**
     * The path starts at the first occurrence of the repeated cell, not at the root.
     */
    @Test
    void testCyclePathStartsAtRepeatedCell() {
        EvaluationContext context = new EvaluationContext();
        context.enter(at("A0"));
        context.enter(at("B0"));
        context.enter(at("C0"));

        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> context.enter(at("B0")));
        assertEquals(List.of(at("B0"), at("C0"), at("B0")), ex.getPath());
        assertEquals("Cycle detected, \"B0 -> C0 -> B0\"", ex.getMessage());
    }

    @Test
    void testReenteringAfterExitIsNotACycle() {
        EvaluationContext context = new EvaluationContext();
        context.enter(at("A0"));
        context.exit(at("A0"));
        assertDoesNotThrow(() -> context.enter(at("A0")));
    }

    @Test
    void testExitMustMatchInnermostCell() {
        EvaluationContext context = new EvaluationContext();
        context.enter(at("A0"));
        context.enter(at("B0"));
        assertThrows(IllegalStateException.class, () -> context.exit(at("A0")));
    }
}
