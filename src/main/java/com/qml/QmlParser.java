package com.qml;

import com.qml.lexer.Lexer;
import com.qml.lexer.Token;
import com.qml.operator.Modality;
import com.qml.operator.OperatorMapping;
import com.qml.parser.EntryRule;
import com.qml.parser.ParseResult;
import com.qml.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Facade for turning QML formulas into expression trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Connectives: ¬ ∧ ∨ → ↔</li>
 *   <li>Modal operators: □ ⋄ (alethic, deontic or epistemic reading)</li>
 *   <li>Quantifiers: ∀ ∃ ∄</li>
 *   <li>Predication, identity (=) and inequality (≠)</li>
 *   <li>Parentheses and brackets for grouping</li>
 * </ul>
 * <p>
 * Precedence: unary and quantifiers > ∧ ∨ > → > ↔ (all binary levels left-associative)
 */
public final class QmlParser {

    private static final Logger log = LoggerFactory.getLogger(QmlParser.class);

    private QmlParser() {
    }

    /**
     * Tokenize a formula.
     *
     * @param formula Formula text
     * @return Tokens, terminated by EOI
     */
    public static List<Token> lex(String formula) {
        return Lexer.lex(formula);
    }

    /**
     * Parse a formula with the alethic reading, starting at equivalence.
     *
     * @param formula Formula text
     * @return Parsed expression or error
     */
    public static ParseResult parse(String formula) {
        return parse(formula, EntryRule.EQUIVALENCE, Modality.ALETHIC);
    }

    /**
     * Parse a formula with the alethic reading.
     *
     * @param formula   Formula text
     * @param entryRule Rule to start from
     * @return Parsed expression or error
     */
    public static ParseResult parse(String formula, EntryRule entryRule) {
        return parse(formula, entryRule, Modality.ALETHIC);
    }

    /**
     * Parse a formula starting at equivalence.
     *
     * @param formula Formula text
     * @param mapping Operator mapping
     * @return Parsed expression or error
     */
    public static ParseResult parse(String formula, OperatorMapping mapping) {
        return parse(formula, EntryRule.EQUIVALENCE, mapping);
    }

    /**
     * Parse a formula.
     *
     * @param formula   Formula text
     * @param entryRule Rule to start from
     * @param mapping   Operator mapping
     * @return Parsed expression or error
     */
    public static ParseResult parse(String formula, EntryRule entryRule, OperatorMapping mapping) {
        List<Token> tokens = lex(formula);
        log.debug("Lexed '{}' into {} token(s)", formula, tokens.size());

        ParseResult result = new Parser(tokens, mapping).parse(entryRule);
        if (result.isFailure()) {
            log.debug("Failed to parse '{}': {}", formula, result.error());
        }
        return result;
    }
}
