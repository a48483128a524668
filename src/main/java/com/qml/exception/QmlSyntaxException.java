package com.qml.exception;

import com.qml.parser.ParseError;

/**
 * Exception thrown when a caller asks for the expression of a failed parse.
 */
public class QmlSyntaxException extends QmlException {

    private final transient ParseError error;

    public QmlSyntaxException(ParseError error) {
        super(error.toString());
        this.error = error;
    }

    public ParseError getError() {
        return error;
    }
}
