package com.spreadsheet.formula.parsing;

import com.spreadsheet.formula.models.CellCoordinate;

/**
 * A reference to another cell, e.g. "B3".
 */
public final class CellRefExpression implements Expression {

    private final CellCoordinate coordinate;

    public CellRefExpression(CellCoordinate coordinate) {
        this.coordinate = coordinate;
    }

    public CellCoordinate getCoordinate() {
        return coordinate;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellRefExpression
                && coordinate.equals(((CellRefExpression) o).coordinate);
    }

    @Override
    public int hashCode() {
        return coordinate.hashCode();
    }

    @Override
    public String toString() {
        return coordinate.toString();
    }
}
