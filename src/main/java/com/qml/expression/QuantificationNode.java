package com.qml.expression;

import java.util.Objects;

/**
 * Quantified formula binding a variable in its body.
 *
 * @param quantifier Universal or existential
 * @param variable   Bound variable, always of type VARIABLE
 * @param body       Scope of the quantifier
 */
public record QuantificationNode(Quantifier quantifier, Term variable, Expression body) implements Expression {

    public QuantificationNode {
        Objects.requireNonNull(quantifier, "quantifier");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(body, "body");
        if (!variable.isVariable()) {
            throw new IllegalArgumentException("Cannot quantify over constant '" + variable.literal() + "'");
        }
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.QUANTIFICATION;
    }

    @Override
    public String toString() {
        return quantifier + " " + variable + " (" + body + ")";
    }
}
