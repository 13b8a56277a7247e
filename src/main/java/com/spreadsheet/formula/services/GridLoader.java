package com.spreadsheet.formula.services;

import com.spreadsheet.formula.exceptions.LiteralParseException;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds a {@link Grid} from raw text: one line per row, columns separated by '|'.
 * An entry starting with '=' becomes a formula, anything else must be a number.
 */
public final class GridLoader {

    private static final Logger logger = LoggerFactory.getLogger(GridLoader.class);

    private static final String COLUMN_SEPARATOR = "\\|";
    private static final char FORMULA_MARKER = '=';

    // Plain decimals only; rejects Java-specific forms such as "1d", "2f", "1_000" or "NaN"
    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private GridLoader() {
    }

    public static Grid load(String text) {
        List<String> lines = splitLines(text == null ? "" : text);
        Map<CellCoordinate, Cell> cells = new HashMap<>();
        List<Integer> rowWidths = new ArrayList<>();

        for (int row = 0; row < lines.size(); row++) {
            // -1 keeps trailing empty columns so positions stay stable
            String[] columns = lines.get(row).split(COLUMN_SEPARATOR, -1);
            rowWidths.add(columns.length);

            for (int column = 0; column < columns.length; column++) {
                String entry = columns[column].trim();
                if (entry.isEmpty()) {
                    continue; // absent cell
                }
                CellCoordinate coordinate = CellCoordinate.of(column, row);
                cells.put(coordinate, parseEntry(coordinate, entry));
            }
        }

        logger.debug("Loaded grid with {} rows and {} cells", rowWidths.size(), cells.size());
        return new Grid(cells, rowWidths);
    }

    private static Cell parseEntry(CellCoordinate coordinate, String entry) {
        if (entry.charAt(0) == FORMULA_MARKER) {
            return Cell.formula(coordinate, entry.substring(1));
        }
        if (!NUMBER_PATTERN.matcher(entry).matches()) {
            throw new LiteralParseException(coordinate, entry);
        }
        return Cell.literal(coordinate, Double.parseDouble(entry));
    }

    private static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        // A trailing newline does not open another row
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
