package com.qml.lexer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.qml.lexer.Symbols.*;

/**
 * Tokenizer for QML formulas.
 * <p>
 * Scans the UTF-8 bytes of the input once, left to right. Runs of identifier
 * bytes and partial multi-byte operators are buffered until a byte decides
 * them. Never fails: bytes that fit no symbol become {@link TokenType#ILLEGAL}
 * tokens and are left for the parser to report. The returned list always ends
 * with a single {@link TokenType#EOI} token.
 */
public final class Lexer {

    private static final int MAX_OPERATOR_BYTES = 3;

    private final byte[] input;
    private int pos;

    private final StringBuilder identifier = new StringBuilder();
    private int identifierStart;

    private final byte[] operator = new byte[MAX_OPERATOR_BYTES];
    private int operatorLength;
    private int operatorStart;

    public Lexer(String input) {
        this(Objects.requireNonNull(input, "input").getBytes(StandardCharsets.UTF_8));
    }

    public Lexer(byte[] input) {
        this.input = Objects.requireNonNull(input, "input").clone();
        this.pos = 0;
    }

    /**
     * Tokenize a formula.
     *
     * @param formula Formula text
     * @return Tokens, terminated by EOI
     */
    public static List<Token> lex(String formula) {
        return new Lexer(formula).tokenize();
    }

    /**
     * Tokenize raw UTF-8 bytes.
     *
     * @param formula Encoded formula
     * @return Tokens, terminated by EOI
     */
    public static List<Token> lex(byte[] formula) {
        return new Lexer(formula).tokenize();
    }

    /**
     * Tokenize the input.
     *
     * @return List of tokens
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;
        identifier.setLength(0);
        operatorLength = 0;

        while (!isAtEnd()) {
            int start = pos;
            int b = advance();

            switch (b) {
                case Ascii.SPACE -> flush(tokens);
                case Ascii.LEFT_PAREN -> single(tokens, TokenType.LPAREN, "(", start);
                case Ascii.RIGHT_PAREN -> single(tokens, TokenType.RPAREN, ")", start);
                case Ascii.LEFT_BRACKET -> single(tokens, TokenType.LBRACKET, "[", start);
                case Ascii.RIGHT_BRACKET -> single(tokens, TokenType.RBRACKET, "]", start);
                case Ascii.COMMA -> single(tokens, TokenType.COMMA, ",", start);
                case Ascii.IDENTITY -> single(tokens, TokenType.ID, "=", start);

                case Lead.NEGATION, Lead.OPERATOR -> startOperator(tokens, b, start);

                case Middle.ARROW, Middle.MATH, Middle.INEQUALITY, Middle.DIAMOND, Middle.SQUARE ->
                        continueOperator(tokens, b, Lead.OPERATOR, start);

                case Last.NEGATION -> completeOperator(tokens, b, Lead.NEGATION, TokenType.NOT, start);
                case Last.IMPLICATION -> completeOperator(tokens, b, Middle.ARROW, TokenType.IF, start);
                case Last.EQUIVALENCE -> completeOperator(tokens, b, Middle.ARROW, TokenType.EQ, start);
                case Last.FORALL -> completeOperator(tokens, b, Middle.MATH, TokenType.FORALL, start);
                case Last.EXISTS -> completeOperator(tokens, b, Middle.MATH, TokenType.EXISTS, start);
                case Last.CONJUNCTION -> completeOperator(tokens, b, Middle.MATH, TokenType.AND, start);
                case Last.DISJUNCTION -> completeOperator(tokens, b, Middle.MATH, TokenType.OR, start);
                case Last.INEQUALITY -> completeOperator(tokens, b, Middle.INEQUALITY, TokenType.NEQ, start);
                case Last.SQUARE -> completeOperator(tokens, b, Middle.SQUARE, TokenType.NEC, start);

                // ∄ (E2 88 84) and ⋄ (E2 8B 84) share their last byte
                case Last.SHARED_84 -> {
                    if (pendingEndsWith(Middle.MATH)) {
                        completeOperator(tokens, b, Middle.MATH, TokenType.NOT_EXISTS, start);
                    } else {
                        completeOperator(tokens, b, Middle.DIAMOND, TokenType.POS, start);
                    }
                }

                default -> {
                    if (isIdentifierByte(b)) {
                        appendIdentifier(tokens, b, start);
                    } else {
                        reject(tokens, b, start);
                    }
                }
            }
        }

        flush(tokens);
        tokens.add(Token.eoi(input.length));
        return tokens;
    }

    private void single(List<Token> tokens, TokenType type, String literal, int start) {
        flush(tokens);
        tokens.add(new Token(type, literal, start));
    }

    private void startOperator(List<Token> tokens, int b, int start) {
        flush(tokens);
        operator[0] = (byte) b;
        operatorLength = 1;
        operatorStart = start;
    }

    private void continueOperator(List<Token> tokens, int b, int expectedPrevious, int start) {
        if (pendingEndsWith(expectedPrevious)) {
            operator[operatorLength++] = (byte) b;
        } else {
            reject(tokens, b, start);
        }
    }

    private void completeOperator(List<Token> tokens, int b, int expectedPrevious, TokenType type, int start) {
        if (pendingEndsWith(expectedPrevious)) {
            operator[operatorLength++] = (byte) b;
            emitOperator(tokens, type);
        } else {
            reject(tokens, b, start);
        }
    }

    private boolean pendingEndsWith(int expected) {
        if (operatorLength == 0 || operatorLength >= MAX_OPERATOR_BYTES) {
            return false;
        }
        int last = operator[operatorLength - 1] & 0xFF;
        // lead bytes only ever sit at index 0, middle bytes at index 1
        int expectedIndex = (expected == Lead.NEGATION || expected == Lead.OPERATOR) ? 0 : 1;
        return last == expected && operatorLength - 1 == expectedIndex;
    }

    private void appendIdentifier(List<Token> tokens, int b, int start) {
        if (operatorLength > 0) {
            emitOperator(tokens, TokenType.ILLEGAL);
        }
        if (identifier.length() == 0) {
            identifierStart = start;
        }
        identifier.append((char) b);
    }

    /**
     * Flushes whatever is pending, then emits the offending byte on its own.
     */
    private void reject(List<Token> tokens, int b, int start) {
        flush(tokens);
        tokens.add(new Token(TokenType.ILLEGAL, decode(new byte[]{(byte) b}, 1), start));
    }

    private void flush(List<Token> tokens) {
        if (identifier.length() > 0) {
            String run = identifier.toString();
            TokenType type = VariableAutomaton.accepts(run) ? TokenType.VARIABLE : TokenType.IDENTIFIER;
            tokens.add(new Token(type, run, identifierStart));
            identifier.setLength(0);
        }
        if (operatorLength > 0) {
            emitOperator(tokens, TokenType.ILLEGAL);
        }
    }

    private void emitOperator(List<Token> tokens, TokenType type) {
        tokens.add(new Token(type, decode(operator, operatorLength), operatorStart));
        operatorLength = 0;
    }

    private static String decode(byte[] bytes, int length) {
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    private int advance() {
        return input[pos++] & 0xFF;
    }

    private boolean isAtEnd() {
        return pos >= input.length;
    }
}
