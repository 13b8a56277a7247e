package com.spreadsheet.formula.parsing;

/**
 * Prefix operators.
 */
public enum SignOperator {
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    SignOperator(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public double apply(double operand) {
        return this == MINUS ? -operand : operand;
    }
}
