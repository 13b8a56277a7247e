package com.spreadsheet.formula.parsing;

import com.spreadsheet.formula.exceptions.LexException;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lexical analyzer for formula text.
 *
 * The token sequence is lazy: characters are scanned only as tokens are
 * requested. It is also restartable, since every call to {@link #iterator()}
 * scans the text again from the start. The last token is always {@link TokenType#END}.
 *
 * A leading '=' is skipped, except by {@link #ofBody(String)} tokenizers. Signs are never part of a number; "-1" yields
 * MINUS followed by NUMBER, and the parser decides whether the minus is unary.
 */
public final class Tokenizer implements Iterable<Token> {

    private final String text;
    private final boolean skipFormulaMarker;

    public Tokenizer(String text) {
        this(text, true);
    }

    private Tokenizer(String text, boolean skipFormulaMarker) {
        this.text = text == null ? "" : text;
        this.skipFormulaMarker = skipFormulaMarker;
    }

    /**
     * Tokenizer for formula text whose '=' marker was already removed,
     * as stored in a formula cell. Any '=' in it is an unknown character.
     */
    public static Tokenizer ofBody(String body) {
        return new Tokenizer(body, false);
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    private final class Scanner implements Iterator<Token> {

        private int current;
        private boolean finished;

        private Scanner() {
            this.current = skipFormulaMarker();
        }

        private int skipFormulaMarker() {
            if (!skipFormulaMarker) {
                return 0;
            }
            int i = 0;
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            return i < text.length() && text.charAt(i) == '=' ? i + 1 : 0;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException("Formula has no more tokens");
            }
            skipWhitespace();
            if (current >= text.length()) {
                finished = true;
                return new Token(TokenType.END, "", text.length());
            }

            int start = current;
            char c = text.charAt(current);
            switch (c) {
                case '+':
                    return single(TokenType.PLUS, start);
                case '-':
                    return single(TokenType.MINUS, start);
                case '*':
                    return single(TokenType.STAR, start);
                case '/':
                    return single(TokenType.SLASH, start);
                case '(':
                    return single(TokenType.LPAREN, start);
                case ')':
                    return single(TokenType.RPAREN, start);
                case ',':
                    return single(TokenType.COMMA, start);
                default:
                    if (isDigit(c)) {
                        return number(start);
                    }
                    if (isAlpha(c)) {
                        return identifier(start);
                    }
                    throw new LexException(c, start);
            }
        }

        private Token single(TokenType type, int start) {
            current++;
            return new Token(type, text.substring(start, current), start);
        }

        private Token number(int start) {
            while (current < text.length() && isDigit(text.charAt(current))) {
                current++;
            }
            if (current < text.length() && text.charAt(current) == '.') {
                current++; // consume '.'
                if (current >= text.length() || !isDigit(text.charAt(current))) {
                    char offending = current < text.length() ? text.charAt(current) : '.';
                    int position = current < text.length() ? current : current - 1;
                    throw new LexException(offending, position,
                            "Malformed number `" + text.substring(start, current) + "` at position " + start);
                }
                while (current < text.length() && isDigit(text.charAt(current))) {
                    current++;
                }
            }
            return new Token(TokenType.NUMBER, text.substring(start, current), start);
        }

        private Token identifier(int start) {
            while (current < text.length()
                    && (isAlpha(text.charAt(current)) || isDigit(text.charAt(current)))) {
                current++;
            }
            return new Token(TokenType.IDENTIFIER, text.substring(start, current), start);
        }

        private void skipWhitespace() {
            while (current < text.length() && Character.isWhitespace(text.charAt(current))) {
                current++;
            }
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
