package com.qml.operator;

import com.qml.expression.Operator;
import com.qml.lexer.TokenType;

import java.util.Optional;

/**
 * Stock readings of the box and diamond.
 * All of them map ¬ ∧ ∨ → ↔ to the same truth-functional operators.
 */
public enum Modality implements OperatorMapping {

    /**
     * □ necessity, ⋄ possibility.
     */
    ALETHIC(Operator.NECESSITY, Operator.POSSIBILITY),

    /**
     * □ obligation, ⋄ permission.
     */
    DEONTIC(Operator.DEONTIC_NECESSITY, Operator.DEONTIC_POSSIBILITY),

    /**
     * □ knowledge, ⋄ epistemic possibility.
     */
    EPISTEMIC(Operator.EPISTEMIC_NECESSITY, Operator.EPISTEMIC_POSSIBILITY);

    private final Operator box;
    private final Operator diamond;

    Modality(Operator box, Operator diamond) {
        this.box = box;
        this.diamond = diamond;
    }

    @Override
    public Optional<Operator> map(TokenType type) {
        return Optional.ofNullable(switch (type) {
            case NOT -> Operator.NEGATION;
            case AND -> Operator.CONJUNCTION;
            case OR -> Operator.DISJUNCTION;
            case IF -> Operator.CONDITIONAL;
            case EQ -> Operator.BICONDITIONAL;
            case NEC -> box;
            case POS -> diamond;
            default -> null;
        });
    }
}
