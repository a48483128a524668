package com.qml.parser;

import com.qml.exception.ConfigurationException;
import com.qml.exception.QmlSyntaxException;
import com.qml.expression.Expression;

/**
 * Outcome of a parse: exactly one of expression and error is set.
 *
 * @param expression Parsed tree, null on failure
 * @param error      First error met, null on success
 */
public record ParseResult(Expression expression, ParseError error) {

    public ParseResult {
        if ((expression == null) == (error == null)) {
            throw new IllegalArgumentException("A parse result holds either an expression or an error");
        }
    }

    public static ParseResult success(Expression expression) {
        return new ParseResult(expression, null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return expression != null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Get the expression, or throw the failure as an exception.
     *
     * @return Parsed expression
     * @throws ConfigurationException if the operator mapping was incomplete
     * @throws QmlSyntaxException     if the input was empty or malformed
     */
    public Expression orElseThrow() {
        if (isSuccess()) {
            return expression;
        }
        if (error.kind() == ErrorKind.CONFIGURATION) {
            throw new ConfigurationException(error.toString());
        }
        throw new QmlSyntaxException(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult{" + expression + "}" : "ParseResult{" + error + "}";
    }
}
