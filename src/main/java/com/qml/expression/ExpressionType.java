package com.qml.expression;

/**
 * Node variants of the formula tree.
 */
public enum ExpressionType {
    PREDICATION,
    IDENTITY,
    UNARY,
    BINARY,
    QUANTIFICATION
}
