package com.qml.parser;

/**
 * Why a parse failed.
 */
public enum ErrorKind {
    /**
     * Nothing to parse: no tokens besides the end-of-input marker.
     */
    EMPTY_INPUT,

    /**
     * Malformed input.
     */
    SYNTAX,

    /**
     * The operator mapping has no operator for a token the grammar needs one for.
     */
    CONFIGURATION
}
