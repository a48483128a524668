package com.qml.lexer;

import java.util.Objects;

/**
 * Represents a token in a formula.
 *
 * @param type     Token type
 * @param literal  Original text of the token
 * @param position Byte offset of the token in the UTF-8 encoded input
 */
public record Token(TokenType type, String literal, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(literal, "literal");
    }

    public static Token eoi(int position) {
        return new Token(TokenType.EOI, "EOI", position);
    }

    @Override
    public String toString() {
        return type + "(" + literal + ")";
    }
}
