package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.models.CellCoordinate;

/**
 * Thrown when a non-formula cell does not hold a number,
 * e.g. "hello" in a cell that has no leading '='.
 */
public class LiteralParseException extends SpreadsheetException {

    private final CellCoordinate coordinate;
    private final String text;

    public LiteralParseException(CellCoordinate coordinate, String text) {
        super("Cell " + coordinate + " holds a non-numeric literal: `" + text + "`");
        this.coordinate = coordinate;
        this.text = text;
    }

    public CellCoordinate getCoordinate() {
        return coordinate;
    }

    public String getText() {
        return text;
    }

    @Override
    public String getCode() {
        return "LITERAL_PARSE_ERROR";
    }
}
