package com.qml.expression;

import java.util.List;
import java.util.Objects;

/**
 * Application of a predicate to one or more terms, e.g. {@code Loves(john, x)}.
 *
 * @param predicate Predicate name
 * @param arguments Ordered argument terms, never empty
 */
public record PredicationNode(String predicate, List<Term> arguments) implements Expression {

    public PredicationNode {
        Objects.requireNonNull(predicate, "predicate");
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("Predication '" + predicate + "' needs at least one argument");
        }
        arguments = List.copyOf(arguments);
    }

    public static PredicationNode of(String predicate, Term... arguments) {
        return new PredicationNode(predicate, List.of(arguments));
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.PREDICATION;
    }

    @Override
    public String toString() {
        return predicate + arguments;
    }
}
