package com.qml.lexer;

/**
 * Recognizes variable names: {@code x|y|z}, optionally followed by digits or
 * by an underscore and digits.
 * <pre>
 *   0 --x,y,z--> 1 --_--> 2 --digit--> 3
 *                1 --digit----------> 3 --digit--> 3
 * </pre>
 * States 1 and 3 accept.
 */
public final class VariableAutomaton {

    private static final int START = 0;
    private static final int LETTER = 1;
    private static final int UNDERSCORE = 2;
    private static final int DIGITS = 3;
    private static final int REJECT = -1;

    private VariableAutomaton() {
    }

    public static boolean accepts(CharSequence run) {
        int state = START;
        for (int i = 0; i < run.length() && state != REJECT; i++) {
            state = next(state, run.charAt(i));
        }
        return state == LETTER || state == DIGITS;
    }

    private static int next(int state, char c) {
        boolean digit = c >= '0' && c <= '9';
        return switch (state) {
            case START -> (c == 'x' || c == 'y' || c == 'z') ? LETTER : REJECT;
            case LETTER -> c == '_' ? UNDERSCORE : digit ? DIGITS : REJECT;
            case UNDERSCORE, DIGITS -> digit ? DIGITS : REJECT;
            default -> REJECT;
        };
    }
}
