package com.qml;

import com.qml.expression.ExpressionType;
import com.qml.expression.IdentityNode;
import com.qml.expression.Operator;
import com.qml.expression.PredicationNode;
import com.qml.expression.Term;
import com.qml.expression.UnaryNode;
import com.qml.lexer.Token;
import com.qml.lexer.TokenType;
import com.qml.operator.Modality;
import com.qml.parser.EntryRule;
import com.qml.parser.ErrorKind;
import com.qml.parser.ParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the QmlParser facade.
 */
class QmlParserTest {

    @Test
    @DisplayName("lex returns tokens ending in EOI")
    void lex() {
        List<Token> tokens = QmlParser.lex("□P(a)");

        assertEquals(TokenType.NEC, tokens.get(0).type());
        assertEquals(TokenType.EOI, tokens.get(tokens.size() - 1).type());
    }

    @Test
    @DisplayName("Default parse uses the alethic reading")
    void parseDefault() {
        ParseResult result = QmlParser.parse("⋄Rain(today)");

        assertEquals(new UnaryNode(Operator.POSSIBILITY, PredicationNode.of("Rain", Term.constant("today"))),
                result.orElseThrow());
    }

    @Test
    @DisplayName("Overloads select rule and mapping")
    void overloads() {
        assertEquals(ExpressionType.IDENTITY,
                QmlParser.parse("a = b", EntryRule.IDENTITY).orElseThrow().getType());
        assertEquals(new UnaryNode(Operator.EPISTEMIC_NECESSITY, new IdentityNode(Term.variable("x"), Term.variable("x"))),
                QmlParser.parse("□x = x", Modality.EPISTEMIC).orElseThrow());
        assertEquals(ErrorKind.SYNTAX,
                QmlParser.parse("P(a) ∧ Q(a)", EntryRule.CLAUSE, Modality.DEONTIC).error().kind());
    }

    @Test
    @DisplayName("Same formula parses to equal trees")
    void deterministic() {
        String formula = "∀x ∃y (Loves(x, y) → ¬x = y)";

        assertEquals(QmlParser.parse(formula), QmlParser.parse(formula));
        assertEquals(QmlParser.parse("∀x"), QmlParser.parse("∀x"));
    }
}
