package com.qml.operator;

import com.qml.config.ParserConfig;
import com.qml.exception.ConfigurationException;
import com.qml.expression.Operator;
import com.qml.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for operator mappings.
 */
public final class OperatorMappings {

    private static final Logger log = LoggerFactory.getLogger(OperatorMappings.class);

    private OperatorMappings() {
    }

    public static OperatorMapping alethic() {
        return Modality.ALETHIC;
    }

    public static OperatorMapping deontic() {
        return Modality.DEONTIC;
    }

    public static OperatorMapping epistemic() {
        return Modality.EPISTEMIC;
    }

    /**
     * Create the mapping described by a parser configuration.
     *
     * @param config Parser configuration
     * @return The modality itself, or a table when operators are overridden
     */
    public static OperatorMapping create(ParserConfig config) {
        if (config == null) {
            log.info("No parser config provided, defaulting to {}", Modality.ALETHIC);
            return Modality.ALETHIC;
        }

        Modality modality = config.modality() != null ? config.modality() : Modality.ALETHIC;
        if (config.operators() == null || config.operators().isEmpty()) {
            log.debug("Using {} operator mapping", modality);
            return modality;
        }

        log.info("Using {} operator mapping with {} override(s)", modality, config.operators().size());
        return TableOperatorMapping.overriding(modality, config.operators());
    }

    /**
     * Resolve a modality by name, case-insensitively.
     *
     * @param name Modality name, e.g. "deontic"
     * @return Matching modality
     */
    public static Modality modality(String name) {
        try {
            return Modality.valueOf(normalize(name));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown modality '" + name + "'", e);
        }
    }

    /**
     * Build an override table from names, e.g. {@code NEC -> DEONTIC_NECESSITY}.
     *
     * @param names Token type names mapped to operator names
     * @return Typed table
     */
    public static Map<TokenType, Operator> table(Map<String, String> names) {
        Map<TokenType, Operator> table = new EnumMap<>(TokenType.class);
        for (Map.Entry<String, String> entry : names.entrySet()) {
            TokenType type = parseTokenType(entry.getKey());
            Operator operator = parseOperator(entry.getValue());
            if (operator.isUnary() != type.isUnaryOperator()) {
                throw new ConfigurationException("Cannot map " + type + " to "
                        + (operator.isUnary() ? "unary" : "binary") + " operator " + operator);
            }
            table.put(type, operator);
        }
        return table;
    }

    private static TokenType parseTokenType(String name) {
        try {
            TokenType type = TokenType.valueOf(normalize(name));
            if (!type.isUnaryOperator() && !type.isBinaryOperator()) {
                throw new ConfigurationException("Token type " + type + " cannot carry an operator");
            }
            return type;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown token type '" + name + "'", e);
        }
    }

    private static Operator parseOperator(String name) {
        try {
            return Operator.valueOf(normalize(name));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown operator '" + name + "'", e);
        }
    }

    private static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("null name");
        }
        return name.trim().toUpperCase(Locale.ROOT).replace("-", "_");
    }
}
