package com.spreadsheet.formula.models;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reference graph of a grid, in both directions:
 * - forward: cell -> set of cells its formula references
 * - reverse: cell -> set of cells whose formulas reference it
 * Every populated cell appears as a key in both maps, possibly with an empty set.
 */
public class DependencyGraph {

    private final Map<CellCoordinate, Set<CellCoordinate>> forward = new TreeMap<>();
    private final Map<CellCoordinate, Set<CellCoordinate>> reverse = new TreeMap<>();

    /**
     * Registers a cell with no references yet.
     */
    public void addCell(CellCoordinate cell) {
        forward.computeIfAbsent(cell, k -> new TreeSet<>());
        reverse.computeIfAbsent(cell, k -> new TreeSet<>());
    }

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and 'target' -> 'source' in the reverse graph.
     */
    public void addDependency(CellCoordinate source, CellCoordinate target) {
        forward.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
        reverse.computeIfAbsent(target, k -> new TreeSet<>()).add(source);
        forward.computeIfAbsent(target, k -> new TreeSet<>());
        reverse.computeIfAbsent(source, k -> new TreeSet<>());
    }

    public Set<CellCoordinate> getDependencies(CellCoordinate cell) {
        return Collections.unmodifiableSet(forward.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellCoordinate> getDependents(CellCoordinate cell) {
        return Collections.unmodifiableSet(reverse.getOrDefault(cell, Collections.emptySet()));
    }

    public Map<CellCoordinate, Set<CellCoordinate>> getForwardGraph() {
        return Collections.unmodifiableMap(forward);
    }

    public Map<CellCoordinate, Set<CellCoordinate>> getReverseGraph() {
        return Collections.unmodifiableMap(reverse);
    }
}
