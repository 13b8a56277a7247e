package com.spreadsheet.formula.parsing;

import java.util.Objects;

/**
 * A prefix sign applied to an operand, e.g. "-A0".
 */
public final class UnaryExpression implements Expression {

    private final SignOperator operator;
    private final Expression operand;

    public UnaryExpression(SignOperator operator, Expression operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public SignOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryExpression)) {
            return false;
        }
        UnaryExpression that = (UnaryExpression) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + operand + ")";
    }
}
