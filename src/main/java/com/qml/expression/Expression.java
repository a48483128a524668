package com.qml.expression;

/**
 * A node of a parsed Quantified Modal Logic formula.
 */
public interface Expression {

    /**
     * Get the node type.
     */
    ExpressionType getType();
}
