package com.qml.expression;

/**
 * Semantic operators of the object language.
 * <p>
 * The modal pairs come in three flavours so that one surface grammar can be
 * read alethically, deontically or epistemically.
 */
public enum Operator {
    // Truth-functional
    NEGATION(1),
    CONJUNCTION(2),
    DISJUNCTION(2),
    CONDITIONAL(2),
    BICONDITIONAL(2),

    // Alethic
    NECESSITY(1),
    POSSIBILITY(1),

    // Deontic
    DEONTIC_NECESSITY(1),
    DEONTIC_POSSIBILITY(1),

    // Epistemic
    EPISTEMIC_NECESSITY(1),
    EPISTEMIC_POSSIBILITY(1);

    private final int arity;

    Operator(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }
}
