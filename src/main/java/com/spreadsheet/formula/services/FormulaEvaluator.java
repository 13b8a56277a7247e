package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellCoordinate;
import com.spreadsheet.formula.models.Grid;
import com.spreadsheet.formula.parsing.BinaryExpression;
import com.spreadsheet.formula.parsing.CellRefExpression;
import com.spreadsheet.formula.parsing.Expression;
import com.spreadsheet.formula.parsing.ExpressionVisitor;
import com.spreadsheet.formula.parsing.FunctionCallExpression;
import com.spreadsheet.formula.parsing.NumberExpression;
import com.spreadsheet.formula.parsing.UnaryExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Evaluates cells of one grid.
 *
 * Every top-level {@link #evaluate(CellCoordinate)} gets a fresh {@link EvaluationContext};
 * nested references made while evaluating it share that context, which is how cycles are caught.
 * Values are not memoized between top-level requests, but each formula is parsed only once
 * (the grid caches the parsed expression).
 */
public class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final Grid grid;
    private final Random random;

    public FormulaEvaluator(Grid grid, Random random) {
        this.grid = grid;
        this.random = random;
    }

    /**
     * Evaluates a single cell, following references as needed.
     */
    public double evaluate(CellCoordinate coordinate) {
        return new ContextualVisitor(new EvaluationContext()).resolve(coordinate);
    }

    private final class ContextualVisitor implements ExpressionVisitor<Double> {

        private final EvaluationContext context;

        private ContextualVisitor(EvaluationContext context) {
            this.context = context;
        }

        private double resolve(CellCoordinate coordinate) {
            context.enter(coordinate);
            try {
                Cell cell = grid.getCell(coordinate);
                if (!cell.isFormula()) {
                    return cell.getLiteralValue();
                }
                double value = grid.getExpression(coordinate).accept(this);
                logger.debug("{} = {} (depth {})", coordinate, value, context.depth());
                return value;
            } finally {
                context.exit(coordinate);
            }
        }

        @Override
        public Double visitNumber(NumberExpression number) {
            return number.getValue();
        }

        @Override
        public Double visitCellRef(CellRefExpression cellRef) {
            return resolve(cellRef.getCoordinate());
        }

        @Override
        public Double visitUnary(UnaryExpression unary) {
            return unary.getOperator().apply(unary.getOperand().accept(this));
        }

        @Override
        public Double visitBinary(BinaryExpression binary) {
            double left = binary.getLeft().accept(this);
            double right = binary.getRight().accept(this);
            return binary.getOperator().apply(left, right);
        }

        @Override
        public Double visitFunctionCall(FunctionCallExpression call) {
            BuiltinFunction function = BuiltinFunction.lookup(call.getName());
            List<Expression> arguments = call.getArguments();
            return function.call(new BuiltinFunction.Arguments() {
                @Override
                public int size() {
                    return arguments.size();
                }

                @Override
                public double get(int index) {
                    return arguments.get(index).accept(ContextualVisitor.this);
                }
            }, random);
        }
    }
}
