package com.qml.parser;

import java.util.function.Function;

/**
 * Grammar rule a parse starts from.
 * <p>
 * Bracketed subformulas recurse into the same rule rather than into
 * {@link #EQUIVALENCE}: starting at {@link #IMPLICATION}, {@code (P(a) ↔ Q(a))}
 * is rejected just like {@code P(a) ↔ Q(a)}, while {@code (P(a) → Q(a)) → R(a)}
 * still regroups.
 */
public enum EntryRule {
    EQUIVALENCE(Parser::equivalence),
    IMPLICATION(Parser::implication),
    CONJUNCTION_DISJUNCTION(Parser::conjunctionDisjunction),
    CLAUSE(Parser::clause),
    QUANTIFIED(Parser::quantified),
    UNARY(Parser::unary),
    ATOMIC(Parser::atomic),
    PREDICATION(Parser::predication),
    IDENTITY(Parser::identity),
    INEQUALITY(Parser::inequality);

    private final Function<Parser, ParseResult> rule;

    EntryRule(Function<Parser, ParseResult> rule) {
        this.rule = rule;
    }

    ParseResult apply(Parser parser) {
        return rule.apply(parser);
    }
}
