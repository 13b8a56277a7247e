package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.SpreadsheetProperties;
import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.DependencyGraph;
import com.spreadsheet.formula.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Main entry point to the formula engine: loading a grid from text,
 * evaluating every cell, rendering the result and deriving the reference graph.
 *
 * Each call works on its own freshly loaded grid; the only shared state is the
 * random source behind random()/randbetween(), which is created once per instance.
 * The first error raised while evaluating any cell aborts the whole batch.
 */
@Service
public class SpreadsheetService {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetService.class);

    private final Random random;
    private final GridRenderer renderer;

    public SpreadsheetService(SpreadsheetProperties properties) {
        this.random = properties.getRandomSeed() != null
                ? new Random(properties.getRandomSeed())
                : new Random();
        this.renderer = new GridRenderer(properties.getColumnWidth(), properties.getMaxFractionDigits());
    }

    public Grid load(String text) {
        return GridLoader.load(text);
    }

    /**
     * Evaluates every populated cell in row-major order.
     * Returns coordinate -> value in the same order.
     */
    public Map<CellCoordinate, Double> evaluateAll(Grid grid) {
        FormulaEvaluator evaluator = new FormulaEvaluator(grid, random);
        Map<CellCoordinate, Double> values = new LinkedHashMap<>();
        for (CellCoordinate coordinate : grid.getCoordinates()) {
            values.put(coordinate, evaluator.evaluate(coordinate));
        }
        logger.info("Evaluated {} cells across {} rows", values.size(), grid.getRowCount());
        return values;
    }

    /**
     * Returns a map of "A0" -> value for every populated cell.
     */
    public Map<String, Double> getValues(String text) {
        Map<String, Double> data = new LinkedHashMap<>();
        evaluateAll(load(text)).forEach((coordinate, value) -> data.put(coordinate.toString(), value));
        return data;
    }

    /**
     * Loads, evaluates and renders a grid in the '|'-separated output layout.
     */
    public String render(String text) {
        Grid grid = load(text);
        return renderer.render(grid, evaluateAll(grid));
    }

    public DependencyGraph getDependencies(String text) {
        return DependencyAnalyzer.analyze(load(text));
    }
}
