package com.qml.exception;

/**
 * Exception thrown when the caller's configuration is invalid: an unreadable
 * config file, an unknown name, or an operator mapping that lacks an operator
 * the grammar needs.
 */
public class ConfigurationException extends QmlException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
