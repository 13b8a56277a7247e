package com.spreadsheet.formula.services;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.CellCoordinate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The chain of cells currently being evaluated for one top-level request.
 * Entering a cell that is already on the chain closes a cycle.
 */
public class EvaluationContext {

    // Entry order, for rendering the cycle path
    private final List<CellCoordinate> chain = new ArrayList<>();
    private final Set<CellCoordinate> inProgress = new HashSet<>();

    /**
     * Marks a cell as in progress.
     *
     * @throws CircularReferenceException if the cell is already in progress; the path runs
     *                                    from its first occurrence through the chain back to it
     */
    public void enter(CellCoordinate coordinate) {
        if (inProgress.contains(coordinate)) {
            List<CellCoordinate> path = new ArrayList<>(chain.subList(chain.indexOf(coordinate), chain.size()));
            path.add(coordinate);
            throw new CircularReferenceException(path);
        }
        chain.add(coordinate);
        inProgress.add(coordinate);
    }

    public void exit(CellCoordinate coordinate) {
        int last = chain.size() - 1;
        if (last < 0 || !chain.get(last).equals(coordinate)) {
            throw new IllegalStateException("Cell " + coordinate + " is not the innermost cell in progress");
        }
        chain.remove(last);
        inProgress.remove(coordinate);
    }

    public boolean isInProgress(CellCoordinate coordinate) {
        return inProgress.contains(coordinate);
    }

    public int depth() {
        return chain.size();
    }
}
