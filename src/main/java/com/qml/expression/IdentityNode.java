package com.qml.expression;

import java.util.Objects;

/**
 * Identity statement between two terms.
 */
public record IdentityNode(Term lhs, Term rhs) implements Expression {

    public IdentityNode {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IDENTITY;
    }

    @Override
    public String toString() {
        return "ID(" + lhs + ", " + rhs + ")";
    }
}
