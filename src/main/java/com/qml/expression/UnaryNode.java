package com.qml.expression;

import java.util.Objects;

/**
 * Negation or modal operator applied to a single operand.
 */
public record UnaryNode(Operator operator, Expression operand) implements Expression {

    public UnaryNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
        if (!operator.isUnary()) {
            throw new IllegalArgumentException(operator + " is not a unary operator");
        }
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.UNARY;
    }

    @Override
    public String toString() {
        return operator + "(" + operand + ")";
    }
}
