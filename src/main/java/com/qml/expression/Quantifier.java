package com.qml.expression;

/**
 * Quantifier kinds. Negated existentials are built as NEGATION over EXISTENTIAL.
 */
public enum Quantifier {
    UNIVERSAL,
    EXISTENTIAL
}
