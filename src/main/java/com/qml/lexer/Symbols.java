package com.qml.lexer;

import java.util.Map;

/**
 * UTF-8 encodings of the formula alphabet.
 * <pre>
 * =  IDENTITY      U+003D  3D
 * ¬  NEGATION      U+00AC  C2 AC
 * →  IMPLICATION   U+2192  E2 86 92
 * ↔  EQUIVALENCE   U+2194  E2 86 94
 * ∀  FORALL        U+2200  E2 88 80
 * ∃  EXISTS        U+2203  E2 88 83
 * ∄  NOT_EXISTS    U+2204  E2 88 84
 * ∧  CONJUNCTION   U+2227  E2 88 A7
 * ∨  DISJUNCTION   U+2228  E2 88 A8
 * ≠  INEQUALITY    U+2260  E2 89 A0
 * ⋄  DIAMOND       U+22C4  E2 8B 84
 * □  SQUARE        U+25A1  E2 96 A1
 * </pre>
 */
public final class Symbols {

    private Symbols() {
    }

    /**
     * Lead bytes.
     */
    public static final class Lead {
        public static final int NEGATION = 0xC2;
        public static final int OPERATOR = 0xE2;

        private Lead() {
        }
    }

    /**
     * Second bytes of the three-byte operators.
     */
    public static final class Middle {
        public static final int ARROW = 0x86;
        public static final int MATH = 0x88;
        public static final int INEQUALITY = 0x89;
        public static final int DIAMOND = 0x8B;
        public static final int SQUARE = 0x96;

        private Middle() {
        }
    }

    /**
     * Final bytes. {@link #SHARED_84} ends both ∄ and ⋄.
     */
    public static final class Last {
        public static final int NEGATION = 0xAC;
        public static final int IMPLICATION = 0x92;
        public static final int EQUIVALENCE = 0x94;
        public static final int FORALL = 0x80;
        public static final int EXISTS = 0x83;
        public static final int SHARED_84 = 0x84;
        public static final int CONJUNCTION = 0xA7;
        public static final int DISJUNCTION = 0xA8;
        public static final int INEQUALITY = 0xA0;
        public static final int SQUARE = 0xA1;

        private Last() {
        }
    }

    /**
     * Single-byte symbols.
     */
    public static final class Ascii {
        public static final char SPACE = ' ';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char IDENTITY = '=';
        public static final char UNDERSCORE = '_';
        public static final char DOT = '.';

        private Ascii() {
        }
    }

    /**
     * Printable form of each fixed symbol, used in diagnostics.
     */
    public static final Map<TokenType, String> DISPLAY = Map.ofEntries(
            Map.entry(TokenType.NOT, "¬"),
            Map.entry(TokenType.AND, "∧"),
            Map.entry(TokenType.OR, "∨"),
            Map.entry(TokenType.IF, "→"),
            Map.entry(TokenType.EQ, "↔"),
            Map.entry(TokenType.NEC, "□"),
            Map.entry(TokenType.POS, "⋄"),
            Map.entry(TokenType.FORALL, "∀"),
            Map.entry(TokenType.EXISTS, "∃"),
            Map.entry(TokenType.NOT_EXISTS, "∄"),
            Map.entry(TokenType.ID, "="),
            Map.entry(TokenType.NEQ, "≠"),
            Map.entry(TokenType.LPAREN, "("),
            Map.entry(TokenType.RPAREN, ")"),
            Map.entry(TokenType.LBRACKET, "["),
            Map.entry(TokenType.RBRACKET, "]"),
            Map.entry(TokenType.COMMA, ",")
    );

    public static boolean isIdentifierByte(int b) {
        return b == Ascii.UNDERSCORE
                || b == Ascii.DOT
                || (b >= '0' && b <= '9')
                || (b >= 'A' && b <= 'Z')
                || (b >= 'a' && b <= 'z');
    }
}
