package com.spreadsheet.formula.parsing;

import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.models.CellCoordinate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Recursive-descent parser for formulas. Grammar, lowest precedence first:
 *
 * <pre>
 * expr           := additive
 * additive       := multiplicative ( ('+'|'-') multiplicative )*
 * multiplicative := unary ( ('*'|'/') unary )*
 * unary          := ('+'|'-') unary | primary
 * primary        := NUMBER | CellRef | FunctionCall | '(' expr ')'
 * CellRef        := IDENTIFIER shaped like Letter+Digit+
 * FunctionCall   := IDENTIFIER '(' (expr (',' expr)*)? ')'
 * </pre>
 *
 * Binary operators are left-associative. The whole token sequence must be
 * consumed; anything left over is an error. Function arity is not checked here.
 */
public final class FormulaParser {

    private final Iterator<Token> tokens;
    private Token current;

    public FormulaParser(Tokenizer tokenizer) {
        this.tokens = tokenizer.iterator();
        this.current = tokens.next();
    }

    /**
     * Tokenizes and parses formula text (a leading '=' is allowed).
     */
    public static Expression parse(String formula) {
        return new FormulaParser(new Tokenizer(formula)).parse();
    }

    public Expression parse() {
        if (current.is(TokenType.END)) {
            throw new FormulaParseException("Empty formula", current.getPosition());
        }
        Expression expression = expression();
        if (!current.is(TokenType.END)) {
            throw new FormulaParseException("Unexpected " + current.describe(), current.getPosition());
        }
        return expression;
    }

    private Expression expression() {
        return additive();
    }

    private Expression additive() {
        Expression expression = multiplicative();

        while (current.is(TokenType.PLUS) || current.is(TokenType.MINUS)) {
            ArithmeticOperator operator = consume().is(TokenType.PLUS)
                    ? ArithmeticOperator.ADD
                    : ArithmeticOperator.SUBTRACT;
            Expression right = multiplicative();
            expression = new BinaryExpression(operator, expression, right);
        }

        return expression;
    }

    private Expression multiplicative() {
        Expression expression = unary();

        while (current.is(TokenType.STAR) || current.is(TokenType.SLASH)) {
            ArithmeticOperator operator = consume().is(TokenType.STAR)
                    ? ArithmeticOperator.MULTIPLY
                    : ArithmeticOperator.DIVIDE;
            Expression right = unary();
            expression = new BinaryExpression(operator, expression, right);
        }

        return expression;
    }

    private Expression unary() {
        if (current.is(TokenType.PLUS) || current.is(TokenType.MINUS)) {
            SignOperator operator = consume().is(TokenType.PLUS) ? SignOperator.PLUS : SignOperator.MINUS;
            return new UnaryExpression(operator, unary());
        }
        return primary();
    }

    private Expression primary() {
        if (current.is(TokenType.NUMBER)) {
            return new NumberExpression(Double.parseDouble(consume().getLexeme()));
        }

        if (current.is(TokenType.LPAREN)) {
            Token open = consume();
            Expression inner = expression();
            expect(TokenType.RPAREN, "Expected ')' to close '(' opened at position " + open.getPosition());
            return inner;
        }

        if (current.is(TokenType.IDENTIFIER)) {
            Token identifier = consume();
            if (CellCoordinate.isReference(identifier.getLexeme())) {
                return new CellRefExpression(CellCoordinate.parse(identifier.getLexeme()));
            }
            if (current.is(TokenType.LPAREN)) {
                return functionCall(identifier);
            }
            throw new FormulaParseException("Identifier '" + identifier.getLexeme()
                    + "' is neither a cell reference nor a function call", identifier.getPosition());
        }

        throw new FormulaParseException("Unexpected " + current.describe(), current.getPosition());
    }

    private Expression functionCall(Token name) {
        consume(); // '('
        List<Expression> arguments = new ArrayList<>();

        if (!current.is(TokenType.RPAREN)) {
            arguments.add(expression());
            while (current.is(TokenType.COMMA)) {
                consume();
                arguments.add(expression());
            }
        }

        expect(TokenType.RPAREN, "Expected ',' or ')' in arguments of '" + name.getLexeme() + "'");
        return new FunctionCallExpression(name.getLexeme(), arguments);
    }

    private void expect(TokenType type, String message) {
        if (!current.is(type)) {
            throw new FormulaParseException(message + ", found " + current.describe(), current.getPosition());
        }
        consume();
    }

    private Token consume() {
        Token consumed = current;
        if (tokens.hasNext()) {
            current = tokens.next();
        }
        return consumed;
    }
}
