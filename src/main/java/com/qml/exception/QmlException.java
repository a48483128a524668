package com.qml.exception;

/**
 * Base exception for the QML parser library.
 */
public class QmlException extends RuntimeException {

    public QmlException(String message) {
        super(message);
    }

    public QmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
