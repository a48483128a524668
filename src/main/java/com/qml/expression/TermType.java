package com.qml.expression;

/**
 * Kind of a singular term.
 */
public enum TermType {
    VARIABLE,
    CONSTANT
}
