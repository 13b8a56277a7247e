package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a token sequence does not form a valid expression:
 * unexpected tokens, unbalanced parentheses, an empty formula, etc.
 */
public class FormulaParseException extends SpreadsheetException {

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String getCode() {
        return "PARSE_ERROR";
    }
}
