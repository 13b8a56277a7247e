package com.spreadsheet.formula.exceptions;

/**
 * Thrown when formula text contains a character no token can start with,
 * or a number is malformed (e.g. "1." with no digit after the point).
 */
public class LexException extends SpreadsheetException {

    private final char character;
    private final int position;

    public LexException(char character, int position) {
        this(character, position, "Unknown character '" + character + "' at position " + position);
    }

    public LexException(char character, int position, String message) {
        super(message);
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String getCode() {
        return "LEX_ERROR";
    }
}
