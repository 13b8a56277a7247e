package com.spreadsheet.formula.parsing;

import java.util.Objects;

/**
 * A single lexical token: its type, the text it was scanned from,
 * and the 0-based position of its first character in the formula.
 */
public final class Token {

    private final TokenType type;
    private final String lexeme;
    private final int position;

    public Token(TokenType type, String lexeme, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Human-readable form used in parse error messages.
     */
    public String describe() {
        return type == TokenType.END ? "end of formula" : "'" + lexeme + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token token = (Token) o;
        return position == token.position && type == token.type && lexeme.equals(token.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, position);
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ")@" + position;
    }
}
