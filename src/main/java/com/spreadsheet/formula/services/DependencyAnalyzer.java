package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.DependencyGraph;
import com.spreadsheet.formula.models.Grid;
import com.spreadsheet.formula.parsing.BinaryExpression;
import com.spreadsheet.formula.parsing.CellRefExpression;
import com.spreadsheet.formula.parsing.Expression;
import com.spreadsheet.formula.parsing.ExpressionVisitor;
import com.spreadsheet.formula.parsing.FunctionCallExpression;
import com.spreadsheet.formula.parsing.NumberExpression;
import com.spreadsheet.formula.parsing.UnaryExpression;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Derives the reference graph of a grid from its parsed formulas, without evaluating anything.
 * References to missing cells are kept as edges; they only fail once evaluated.
 */
public final class DependencyAnalyzer {

    private DependencyAnalyzer() {
    }

    public static DependencyGraph analyze(Grid grid) {
        DependencyGraph graph = new DependencyGraph();
        for (CellCoordinate coordinate : grid.getCoordinates()) {
            graph.addCell(coordinate);
            if (grid.getCell(coordinate).isFormula()) {
                for (CellCoordinate target : references(grid.getExpression(coordinate))) {
                    graph.addDependency(coordinate, target);
                }
            }
        }
        return graph;
    }

    /**
     * Every cell an expression refers to, in order of first appearance.
     */
    public static Set<CellCoordinate> references(Expression expression) {
        Set<CellCoordinate> found = new LinkedHashSet<>();
        expression.accept(new ReferenceCollector(found));
        return found;
    }

    private static final class ReferenceCollector implements ExpressionVisitor<Void> {

        private final Set<CellCoordinate> found;

        private ReferenceCollector(Set<CellCoordinate> found) {
            this.found = found;
        }

        @Override
        public Void visitNumber(NumberExpression number) {
            return null;
        }

        @Override
        public Void visitCellRef(CellRefExpression cellRef) {
            found.add(cellRef.getCoordinate());
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpression unary) {
            return unary.getOperand().accept(this);
        }

        @Override
        public Void visitBinary(BinaryExpression binary) {
            binary.getLeft().accept(this);
            return binary.getRight().accept(this);
        }

        @Override
        public Void visitFunctionCall(FunctionCallExpression call) {
            for (Expression argument : call.getArguments()) {
                argument.accept(this);
            }
            return null;
        }
    }
}
