package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.Grid;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Renders evaluated values back into the '|'-separated text layout.
 * Each cell is left-aligned, padded to the column width and followed by '|';
 * cells that were empty in the input print as blanks.
 *
 * Numbers print without a fraction when integral, otherwise rounded half-up to
 * at most {@code maxFractionDigits} digits with trailing zeros dropped.
 * Infinities and NaN print as "inf", "-inf" and "NaN".
 */
public class GridRenderer {

    private final int columnWidth;
    private final int maxFractionDigits;

    public GridRenderer(int columnWidth, int maxFractionDigits) {
        if (columnWidth < 0 || maxFractionDigits < 0) {
            throw new IllegalArgumentException("Column width and fraction digits must be non-negative");
        }
        this.columnWidth = columnWidth;
        this.maxFractionDigits = maxFractionDigits;
    }

    public String render(Grid grid, Map<CellCoordinate, Double> values) {
        StringBuilder output = new StringBuilder();
        for (int row = 0; row < grid.getRowCount(); row++) {
            for (int column = 0; column < grid.getColumnCount(row); column++) {
                Double value = values.get(CellCoordinate.of(column, row));
                output.append(pad(value == null ? "" : formatValue(value))).append('|');
            }
            output.append('\n');
        }
        return output.toString();
    }

    public String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return BigDecimal.valueOf(value)
                .setScale(maxFractionDigits, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }

    private String pad(String text) {
        if (text.length() >= columnWidth) {
            return text;
        }
        return text + " ".repeat(columnWidth - text.length());
    }
}
