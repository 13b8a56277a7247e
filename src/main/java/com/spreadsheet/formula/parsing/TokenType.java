package com.spreadsheet.formula.parsing;

/**
 * Kinds of tokens a formula can contain.
 */
public enum TokenType {
    NUMBER,
    IDENTIFIER,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LPAREN,
    RPAREN,
    COMMA,
    END
}
