package com.spreadsheet.formula.parsing;

/**
 * A node of a parsed formula. Nodes are immutable and compare structurally,
 * so parsing the same text twice yields equal trees.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
