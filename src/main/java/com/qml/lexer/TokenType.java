package com.qml.lexer;

/**
 * Token types for formula parsing.
 */
public enum TokenType {
    // Markers
    NIL,
    EOI,
    ILLEGAL,

    // Logical connectives
    NOT,
    AND,
    OR,
    IF,
    EQ,

    // Modal operators
    NEC,
    POS,

    // Quantifiers
    FORALL,
    EXISTS,
    NOT_EXISTS,

    // Identity and inequality
    ID,
    NEQ,

    // Terms
    VARIABLE,
    IDENTIFIER,

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA;

    /**
     * True for the token types that can start a term.
     */
    public boolean isTerm() {
        return this == VARIABLE || this == IDENTIFIER;
    }

    /**
     * True for ¬ □ ⋄, which take a unary operator.
     */
    public boolean isUnaryOperator() {
        return this == NOT || this == NEC || this == POS;
    }

    /**
     * True for ∧ ∨ → ↔, which take a binary operator.
     */
    public boolean isBinaryOperator() {
        return this == AND || this == OR || this == IF || this == EQ;
    }
}
