package com.spreadsheet.formula.parsing;

/**
 * Visitor over formula expression trees.
 *
 * @param <R> the result type of each visit
 */
public interface ExpressionVisitor<R> {

    R visitNumber(NumberExpression number);

    R visitCellRef(CellRefExpression cellRef);

    R visitUnary(UnaryExpression unary);

    R visitBinary(BinaryExpression binary);

    R visitFunctionCall(FunctionCallExpression call);
}
