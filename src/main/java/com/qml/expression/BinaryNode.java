package com.qml.expression;

import java.util.Objects;

/**
 * Binary connective node.
 */
public record BinaryNode(Operator operator, Expression lhs, Expression rhs) implements Expression {

    public BinaryNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
        if (!operator.isBinary()) {
            throw new IllegalArgumentException(operator + " is not a binary operator");
        }
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY;
    }

    @Override
    public String toString() {
        return operator + "(" + lhs + ", " + rhs + ")";
    }
}
