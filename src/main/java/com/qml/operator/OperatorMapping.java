package com.qml.operator;

import com.qml.expression.Operator;
import com.qml.lexer.TokenType;

import java.util.Optional;

/**
 * Maps surface token types to semantic operators.
 * <p>
 * The grammar only asks whether a token type has an operator and which one,
 * so the same formulas can be read under different modal interpretations.
 */
@FunctionalInterface
public interface OperatorMapping {

    /**
     * Map a token type to its operator.
     *
     * @param type Token type of a connective or modal operator
     * @return The operator, or empty if this mapping does not cover the type; never null
     */
    Optional<Operator> map(TokenType type);
}
