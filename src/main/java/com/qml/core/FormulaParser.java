package com.qml.core;

import com.qml.QmlParser;
import com.qml.config.ParserConfig;
import com.qml.expression.Expression;
import com.qml.operator.OperatorMapping;
import com.qml.operator.OperatorMappings;
import com.qml.parser.EntryRule;
import com.qml.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses formulas with a fixed configuration.
 * Thread-safe: every call lexes and parses with its own parser.
 */
public class FormulaParser {

    private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

    private final ParserConfig config;
    private final OperatorMapping mapping;

    public FormulaParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapping = OperatorMappings.create(config);
        log.info("Created FormulaParser: modality={}, entryRule={}", config.modality(), config.entryRule());
    }

    public FormulaParser() {
        this(ParserConfig.defaults());
    }

    /**
     * Parse with the configured entry rule.
     */
    public ParseResult parse(String formula) {
        return parse(formula, config.entryRule());
    }

    /**
     * Parse with an explicit entry rule and the configured mapping.
     */
    public ParseResult parse(String formula, EntryRule entryRule) {
        return QmlParser.parse(formula, entryRule, mapping);
    }

    /**
     * Parse with the configured entry rule, throwing on failure.
     *
     * @param formula Formula text
     * @return Parsed expression
     */
    public Expression parseOrThrow(String formula) {
        return parse(formula).orElseThrow();
    }

    public ParserConfig getConfig() {
        return config;
    }

    public OperatorMapping getMapping() {
        return mapping;
    }
}
