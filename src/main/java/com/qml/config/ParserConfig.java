package com.qml.config;

import com.qml.expression.Operator;
import com.qml.lexer.TokenType;
import com.qml.operator.Modality;
import com.qml.parser.EntryRule;

import java.util.Map;

/**
 * Parser configuration.
 *
 * @param modality  Stock reading of □ and ⋄
 * @param entryRule Grammar rule parses start from
 * @param operators Per-token overrides on top of the modality, may be empty
 */
public record ParserConfig(
        Modality modality,
        EntryRule entryRule,
        Map<TokenType, Operator> operators
) {
    public ParserConfig {
        modality = modality != null ? modality : Modality.ALETHIC;
        entryRule = entryRule != null ? entryRule : EntryRule.EQUIVALENCE;
        operators = operators != null ? Map.copyOf(operators) : Map.of();
    }

    /**
     * Alethic reading, starting at equivalence.
     */
    public static ParserConfig defaults() {
        return new ParserConfig(Modality.ALETHIC, EntryRule.EQUIVALENCE, Map.of());
    }

    public static ParserConfig of(Modality modality) {
        return new ParserConfig(modality, EntryRule.EQUIVALENCE, Map.of());
    }
}
