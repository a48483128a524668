package com.qml.operator;

import com.qml.exception.ConfigurationException;
import com.qml.expression.Operator;
import com.qml.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operator mapping backed by an explicit table.
 * Token types missing from the table are not mapped.
 */
public final class TableOperatorMapping implements OperatorMapping {

    private final Map<TokenType, Operator> table;

    /**
     * @param table Operators per token type
     * @throws ConfigurationException if an operator's arity does not fit its token type
     */
    public TableOperatorMapping(Map<TokenType, Operator> table) {
        table.forEach(TableOperatorMapping::checkArity);
        this.table = table.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(table));
    }

    /**
     * Start from a stock modality and replace the given entries.
     *
     * @param base      Modality supplying the defaults
     * @param overrides Entries to replace or add
     * @return Combined mapping
     */
    public static TableOperatorMapping overriding(Modality base, Map<TokenType, Operator> overrides) {
        Map<TokenType, Operator> table = new EnumMap<>(TokenType.class);
        for (TokenType type : TokenType.values()) {
            base.map(type).ifPresent(op -> table.put(type, op));
        }
        table.putAll(overrides);
        return new TableOperatorMapping(table);
    }

    private static void checkArity(TokenType type, Operator operator) {
        boolean fits = operator.isUnary() ? type.isUnaryOperator() : type.isBinaryOperator();
        if (!fits) {
            throw new ConfigurationException("Cannot map " + type + " to "
                    + (operator.isUnary() ? "unary" : "binary") + " operator " + operator);
        }
    }

    @Override
    public Optional<Operator> map(TokenType type) {
        return Optional.ofNullable(table.get(type));
    }

    public Map<TokenType, Operator> table() {
        return table;
    }

    @Override
    public String toString() {
        return "TableOperatorMapping" + table;
    }
}
