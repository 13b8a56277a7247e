package com.spreadsheet.formula.models;

/**
 * Represents a single grid cell as loaded from input.
 * A cell is either:
 * - a literal number, or
 * - a formula, stored as its raw text without the leading '='
 * Cells never change after loading.
 */
public final class Cell {

    private final CellCoordinate coordinate;
    private final boolean formula;
    private final double literalValue;
    private final String formulaText;

    private Cell(CellCoordinate coordinate, boolean formula, double literalValue, String formulaText) {
        this.coordinate = coordinate;
        this.formula = formula;
        this.literalValue = literalValue;
        this.formulaText = formulaText;
    }

    public static Cell literal(CellCoordinate coordinate, double value) {
        return new Cell(coordinate, false, value, null);
    }

    public static Cell formula(CellCoordinate coordinate, String text) {
        return new Cell(coordinate, true, Double.NaN, text);
    }

    public CellCoordinate getCoordinate() {
        return coordinate;
    }

    public boolean isFormula() {
        return formula;
    }

    public double getLiteralValue() {
        if (formula) {
            throw new IllegalStateException("Cell " + coordinate + " holds a formula, not a literal");
        }
        return literalValue;
    }

    public String getFormulaText() {
        if (!formula) {
            throw new IllegalStateException("Cell " + coordinate + " holds a literal, not a formula");
        }
        return formulaText;
    }

    @Override
    public String toString() {
        return coordinate + "=" + (formula ? "=" + formulaText : String.valueOf(literalValue));
    }
}
