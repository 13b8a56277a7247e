package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.models.CellCoordinate;

/**
 * Thrown when a formula references a coordinate that holds no cell,
 * including references too large to address at all (e.g. "A99999999999").
 * Missing cells are never treated as zero.
 */
public class CellNotFoundException extends SpreadsheetException {

    private final CellCoordinate coordinate;
    private final String reference;

    public CellNotFoundException(CellCoordinate coordinate) {
        super("Referring to an unknown cell: " + coordinate);
        this.coordinate = coordinate;
        this.reference = coordinate.toString();
    }

    public CellNotFoundException(String reference, Throwable cause) {
        super("Referring to an unknown cell: " + reference, cause);
        this.coordinate = null;
        this.reference = reference;
    }

    /**
     * The missing coordinate, or null when the reference is out of addressable range.
     */
    public CellCoordinate getCoordinate() {
        return coordinate;
    }

    public String getReference() {
        return reference;
    }

    @Override
    public String getCode() {
        return "CELL_NOT_FOUND";
    }
}
