package com.qml.expression;

import java.util.Objects;

/**
 * A singular term: a variable or an individual constant.
 *
 * @param literal Name as written in the formula
 * @param type    Variable or constant
 */
public record Term(String literal, TermType type) {

    public Term {
        Objects.requireNonNull(literal, "literal");
        Objects.requireNonNull(type, "type");
    }

    public static Term variable(String literal) {
        return new Term(literal, TermType.VARIABLE);
    }

    public static Term constant(String literal) {
        return new Term(literal, TermType.CONSTANT);
    }

    public boolean isVariable() {
        return type == TermType.VARIABLE;
    }

    @Override
    public String toString() {
        return literal;
    }
}
