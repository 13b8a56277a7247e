package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.CellNotFoundException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies a single cell by (column, row), both 0-indexed.
 * Column 0 renders as "A", 25 as "Z", 26 as "AA" and so on,
 * so the canonical text of (0, 0) is "A0".
 */
public final class CellCoordinate implements Comparable<CellCoordinate> {

    // Letters followed by digits, e.g. "A0" or "ab12"
    private static final Pattern REFERENCE_PATTERN = Pattern.compile("^([A-Za-z]+)([0-9]+)$");

    private final int column;
    private final int row;

    private CellCoordinate(int column, int row) {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("Coordinates must be non-negative, got column="
                    + column + ", row=" + row);
        }
        this.column = column;
        this.row = row;
    }

    public static CellCoordinate of(int column, int row) {
        return new CellCoordinate(column, row);
    }

    /**
     * Returns true if the text has the shape of a cell reference (letters then digits).
     */
    public static boolean isReference(String text) {
        return text != null && REFERENCE_PATTERN.matcher(text).matches();
    }

    /**
     * Parses "A0", "ab12", ... into a coordinate. Letters are case-insensitive.
     *
     * @throws CellNotFoundException if the column or row does not fit an int;
     *                               no grid can hold such a cell
     */
    public static CellCoordinate parse(String text) {
        Matcher matcher = text == null ? null : REFERENCE_PATTERN.matcher(text);
        if (matcher == null || !matcher.matches()) {
            throw new IllegalArgumentException("Not a cell reference: " + text);
        }
        try {
            int column = columnIndex(matcher.group(1));
            int row = Integer.parseInt(matcher.group(2));
            return new CellCoordinate(column, row);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new CellNotFoundException(text.toUpperCase(), e);
        }
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26.
     *
     * @throws ArithmeticException if the index does not fit an int
     */
    public static int columnIndex(String letters) {
        int sum = 0;
        for (char c : letters.toUpperCase().toCharArray()) {
            sum = Math.addExact(Math.multiplyExact(sum, 26), c - 'A' + 1);
        }
        return sum - 1;
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnName(int column) {
        StringBuilder name = new StringBuilder();
        long n = column + 1L;
        while (n > 0) {
            long remainder = (n - 1) % 26;
            name.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return name.toString();
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public String getColumnName() {
        return columnName(column);
    }

    // Row-major: rows first, then columns within a row
    @Override
    public int compareTo(CellCoordinate other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellCoordinate)) {
            return false;
        }
        CellCoordinate that = (CellCoordinate) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @Override
    public String toString() {
        return getColumnName() + row;
    }
}
