package com.qml.parser;

import java.util.Objects;

/**
 * Describes the first error met during a parse.
 *
 * @param kind     Error category
 * @param message  Human-readable description naming the offending symbol
 * @param position Byte offset of the offending token, or -1 if there is none
 */
public record ParseError(ErrorKind kind, String message, int position) {

    public static final String EMPTY_INPUT_MESSAGE = "Empty input string, nothing to do";

    public ParseError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ParseError emptyInput() {
        return new ParseError(ErrorKind.EMPTY_INPUT, EMPTY_INPUT_MESSAGE, -1);
    }

    public static ParseError syntax(String message, int position) {
        return new ParseError(ErrorKind.SYNTAX, message, position);
    }

    public static ParseError configuration(String message, int position) {
        return new ParseError(ErrorKind.CONFIGURATION, message, position);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EMPTY_INPUT -> message;
            case SYNTAX -> "Syntax error at position " + position + ": " + message;
            case CONFIGURATION -> "Configuration error at position " + position + ": " + message;
        };
    }
}
