package com.spreadsheet.formula.parsing;

/**
 * Infix operators. All of them follow IEEE-754 double arithmetic;
 * dividing by zero yields an infinity or NaN rather than an error.
 */
public enum ArithmeticOperator {
    ADD('+') {
        @Override
        public double apply(double left, double right) {
            return left + right;
        }
    },
    SUBTRACT('-') {
        @Override
        public double apply(double left, double right) {
            return left - right;
        }
    },
    MULTIPLY('*') {
        @Override
        public double apply(double left, double right) {
            return left * right;
        }
    },
    DIVIDE('/') {
        @Override
        public double apply(double left, double right) {
            return left / right;
        }
    };

    private final char symbol;

    ArithmeticOperator(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public abstract double apply(double left, double right);
}
