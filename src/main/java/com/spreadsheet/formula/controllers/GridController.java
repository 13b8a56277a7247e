package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.DependencyGraph;
import com.spreadsheet.formula.services.SpreadsheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST endpoints that evaluate a grid posted as plain text
 * (one line per row, columns separated by '|').
 * "/grid" is the base path.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private SpreadsheetService spreadsheetService;

    /**
     * POST /grid/render
     * Returns the evaluated grid in the same '|'-separated layout as the batch output.
     * Any engine error becomes a 4xx via the GlobalExceptionHandler.
     */
    @PostMapping(value = "/render", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> render(@RequestBody String grid) {
        return ResponseEntity.ok(spreadsheetService.render(grid));
    }

    /**
     * POST /grid/values
     * Returns a map of evaluated cell values, in the format: { "A0": 1.0, "B0": 7.0, ... }.
     */
    @PostMapping(value = "/values", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, Double>> values(@RequestBody String grid) {
        return ResponseEntity.ok(spreadsheetService.getValues(grid));
    }

    /**
     * POST /grid/dependencies
     * Returns both reference graphs without evaluating anything:
     * { "forward": { "B0": ["A0"], ... }, "reverse": { "A0": ["B0"], ... } }.
     */
    @PostMapping(value = "/dependencies", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, Map<String, Set<String>>>> dependencies(@RequestBody String grid) {
        DependencyGraph graph = spreadsheetService.getDependencies(grid);
        Map<String, Map<String, Set<String>>> body = new LinkedHashMap<>();
        body.put("forward", toText(graph.getForwardGraph()));
        body.put("reverse", toText(graph.getReverseGraph()));
        return ResponseEntity.ok(body);
    }

    private static Map<String, Set<String>> toText(Map<CellCoordinate, Set<CellCoordinate>> graph) {
        Map<String, Set<String>> text = new LinkedHashMap<>();
        graph.forEach((cell, edges) -> text.put(cell.toString(), edges.stream()
                .map(CellCoordinate::toString)
                .collect(Collectors.toCollection(LinkedHashSet::new))));
        return text;
    }
}
