package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.models.CellCoordinate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when resolving a cell reference re-enters a cell that is
 * already being evaluated (a cell referencing itself, or a multi-cell loop).
 * The path starts and ends with the repeated cell, e.g. A0 -> C0 -> B0 -> A0.
 */
public class CircularReferenceException extends SpreadsheetException {

    private final List<CellCoordinate> path;

    public CircularReferenceException(List<CellCoordinate> path) {
        super("Cycle detected, \"" + renderPath(path) + "\"");
        this.path = List.copyOf(path);
    }

    public List<CellCoordinate> getPath() {
        return path;
    }

    public String getPathText() {
        return renderPath(path);
    }

    private static String renderPath(List<CellCoordinate> path) {
        return path.stream()
                .map(CellCoordinate::toString)
                .collect(Collectors.joining(" -> "));
    }

    @Override
    public String getCode() {
        return "CIRCULAR_REFERENCE";
    }
}
