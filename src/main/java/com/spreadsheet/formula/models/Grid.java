package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.CellNotFoundException;
import com.spreadsheet.formula.parsing.Expression;
import com.spreadsheet.formula.parsing.FormulaParser;
import com.spreadsheet.formula.parsing.Tokenizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Represents a loaded grid:
 * - a map of coordinate -> Cell, ordered row-major
 * - the width (number of columns) of each input row, including empty positions
 * - a cache of parsed formulas, so each formula cell is parsed at most once per run
 *
 * Cells never change after construction; only the parse cache fills up.
 */
public class Grid {

    private final Map<CellCoordinate, Cell> cells;
    private final List<Integer> rowWidths;

    // Parsed formulas, keyed by the formula cell's coordinate
    private final Map<CellCoordinate, Expression> parsedFormulas = new HashMap<>();

    public Grid(Map<CellCoordinate, Cell> cells, List<Integer> rowWidths) {
        this.cells = Collections.unmodifiableMap(new TreeMap<>(cells));
        this.rowWidths = List.copyOf(rowWidths);
    }

    /**
     * Retrieves the cell at the given coordinate. Throws if nothing is there.
     */
    public Cell getCell(CellCoordinate coordinate) {
        Cell cell = cells.get(coordinate);
        if (cell == null) {
            throw new CellNotFoundException(coordinate);
        }
        return cell;
    }

    public boolean contains(CellCoordinate coordinate) {
        return cells.containsKey(coordinate);
    }

    /**
     * All populated coordinates in row-major order.
     */
    public List<CellCoordinate> getCoordinates() {
        return new ArrayList<>(cells.keySet());
    }

    public int getRowCount() {
        return rowWidths.size();
    }

    public int getColumnCount(int row) {
        return rowWidths.get(row);
    }

    /**
     * Returns the parsed expression of a formula cell, parsing it on first use.
     */
    public Expression getExpression(CellCoordinate coordinate) {
        Expression cached = parsedFormulas.get(coordinate);
        if (cached != null) {
            return cached;
        }
        Expression parsed = new FormulaParser(Tokenizer.ofBody(getCell(coordinate).getFormulaText())).parse();
        parsedFormulas.put(coordinate, parsed);
        return parsed;
    }
}
