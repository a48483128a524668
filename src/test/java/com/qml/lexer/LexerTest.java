package com.qml.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Lexer.
 */
class LexerTest {

    // =====================================================================
    // Symbol table
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Each symbol lexes to exactly one token of its type")
    @CsvSource({
            "=, ID",
            "¬, NOT",
            "→, IF",
            "↔, EQ",
            "∀, FORALL",
            "∃, EXISTS",
            "∄, NOT_EXISTS",
            "∧, AND",
            "∨, OR",
            "≠, NEQ",
            "⋄, POS",
            "□, NEC"
    })
    void lexSymbol(String symbol, TokenType expected) {
        List<Token> tokens = Lexer.lex(symbol);

        assertEquals(2, tokens.size());
        assertEquals(expected, tokens.get(0).type());
        assertEquals(symbol, tokens.get(0).literal());
        assertEquals(0, tokens.get(0).position());
        assertEquals(TokenType.EOI, tokens.get(1).type());
    }

    @Test
    @DisplayName("Symbols are matched byte-exactly")
    void symbolBytes() {
        assertEquals(TokenType.NOT, types(bytes(0xC2, 0xAC)).get(0));
        assertEquals(TokenType.IF, types(bytes(0xE2, 0x86, 0x92)).get(0));
        assertEquals(TokenType.EQ, types(bytes(0xE2, 0x86, 0x94)).get(0));
        assertEquals(TokenType.FORALL, types(bytes(0xE2, 0x88, 0x80)).get(0));
        assertEquals(TokenType.EXISTS, types(bytes(0xE2, 0x88, 0x83)).get(0));
        assertEquals(TokenType.NOT_EXISTS, types(bytes(0xE2, 0x88, 0x84)).get(0));
        assertEquals(TokenType.AND, types(bytes(0xE2, 0x88, 0xA7)).get(0));
        assertEquals(TokenType.OR, types(bytes(0xE2, 0x88, 0xA8)).get(0));
        assertEquals(TokenType.NEQ, types(bytes(0xE2, 0x89, 0xA0)).get(0));
        assertEquals(TokenType.POS, types(bytes(0xE2, 0x8B, 0x84)).get(0));
        assertEquals(TokenType.NEC, types(bytes(0xE2, 0x96, 0xA1)).get(0));
    }

    @Test
    @DisplayName("Shared last byte 0x84 is decided by the middle byte")
    void sharedLastByte() {
        assertEquals(List.of(TokenType.NOT_EXISTS, TokenType.POS, TokenType.EOI),
                types(bytes(0xE2, 0x88, 0x84, 0xE2, 0x8B, 0x84)));
        assertEquals(List.of(TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.EOI),
                types(bytes(0xE2, 0x96, 0x84)));
    }

    @Test
    @DisplayName("Punctuation becomes single-character tokens")
    void punctuation() {
        assertEquals(List.of(TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACKET,
                        TokenType.RBRACKET, TokenType.COMMA, TokenType.ID, TokenType.EOI),
                types("()[],="));
    }

    // =====================================================================
    // Broken sequences
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Truncated operators never produce a false match")
    @ValueSource(strings = {"¬", "→", "↔", "∀", "∃", "∄", "∧", "∨", "≠", "⋄", "□"})
    void truncatedOperator(String symbol) {
        byte[] full = symbol.getBytes(StandardCharsets.UTF_8);
        byte[] truncated = new byte[full.length - 1];
        System.arraycopy(full, 0, truncated, 0, truncated.length);

        List<TokenType> types = types(truncated);

        assertEquals(List.of(TokenType.ILLEGAL, TokenType.EOI), types);
    }

    @Test
    @DisplayName("Reordered bytes are illegal")
    void reorderedBytes() {
        List<TokenType> types = types(bytes(0x88, 0xE2, 0x80));

        assertEquals(TokenType.EOI, types.get(types.size() - 1));
        assertTrue(types.subList(0, types.size() - 1).stream().allMatch(t -> t == TokenType.ILLEGAL));
        assertFalse(types.contains(TokenType.FORALL));
    }

    @Test
    @DisplayName("Unexpected continuation flushes the pending bytes and the byte itself")
    void unexpectedContinuation() {
        // ∀ lead and middle followed by the last byte of →
        List<Token> tokens = Lexer.lex(bytes(0xE2, 0x88, 0x92));

        assertEquals(3, tokens.size());
        assertEquals(TokenType.ILLEGAL, tokens.get(0).type());
        assertEquals(0, tokens.get(0).position());
        assertEquals(TokenType.ILLEGAL, tokens.get(1).type());
        assertEquals(2, tokens.get(1).position());
    }

    @Test
    @DisplayName("Pending operator interrupted by an identifier is illegal")
    void interruptedOperator() {
        List<Token> tokens = Lexer.lex(bytes(0xE2, 0x88, 'a'));

        assertEquals(List.of(TokenType.ILLEGAL, TokenType.IDENTIFIER, TokenType.EOI), typesOf(tokens));
        assertEquals("a", tokens.get(1).literal());
        assertEquals(2, tokens.get(1).position());
    }

    @ParameterizedTest
    @DisplayName("Bytes outside the alphabet are illegal")
    @ValueSource(strings = {"$", "\t", "é", "!", "-"})
    void illegalCharacters(String input) {
        List<TokenType> types = types(input);

        assertTrue(types.size() >= 2);
        assertTrue(types.subList(0, types.size() - 1).stream().allMatch(t -> t == TokenType.ILLEGAL));
    }

    // =====================================================================
    // Identifiers and variables
    // =====================================================================

    @Test
    @DisplayName("Identifier runs are classified by the variable automaton")
    void classifyRuns() {
        List<Token> tokens = Lexer.lex("x y_1 z2 x_ y__2 zz2");

        assertEquals(List.of(TokenType.VARIABLE, TokenType.VARIABLE, TokenType.VARIABLE,
                        TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOI),
                typesOf(tokens));
        assertEquals("y__2", tokens.get(4).literal());
    }

    @Test
    @DisplayName("Identifiers may contain dots, digits and underscores")
    void identifierAlphabet() {
        List<Token> tokens = Lexer.lex("a.b_1.C2");

        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("a.b_1.C2", tokens.get(0).literal());
    }

    @Test
    @DisplayName("Operators split identifiers without whitespace")
    void operatorsSplitIdentifiers() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AND, TokenType.IDENTIFIER, TokenType.EOI),
                types("a∧b"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ID, TokenType.IDENTIFIER, TokenType.EOI),
                types("John=Mary"));
        assertEquals(List.of(TokenType.VARIABLE, TokenType.NEQ, TokenType.VARIABLE, TokenType.EOI),
                types("x≠y"));
    }

    @Test
    @DisplayName("Tokens carry byte positions")
    void positions() {
        List<Token> tokens = Lexer.lex("∃x Walk(x)");

        assertEquals(List.of(TokenType.EXISTS, TokenType.VARIABLE, TokenType.IDENTIFIER, TokenType.LPAREN,
                TokenType.VARIABLE, TokenType.RPAREN, TokenType.EOI), typesOf(tokens));
        assertEquals(0, tokens.get(0).position());
        assertEquals(3, tokens.get(1).position());
        assertEquals(5, tokens.get(2).position());
        assertEquals(9, tokens.get(3).position());
        assertEquals(10, tokens.get(4).position());
        assertEquals(11, tokens.get(5).position());
        assertEquals(12, tokens.get(6).position());
    }

    // =====================================================================
    // Totality
    // =====================================================================

    @Test
    @DisplayName("Empty input yields only EOI")
    void emptyInput() {
        List<Token> tokens = Lexer.lex("");

        assertEquals(1, tokens.size());
        assertEquals(Token.eoi(0), tokens.get(0));
        assertEquals("EOI", tokens.get(0).literal());
    }

    @Test
    @DisplayName("Spaces only yield only EOI")
    void spacesOnly() {
        assertEquals(List.of(TokenType.EOI), types("   "));
    }

    @Test
    @DisplayName("Any byte sequence ends with exactly one EOI")
    void totality() {
        Random random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            byte[] input = new byte[random.nextInt(48)];
            random.nextBytes(input);

            List<TokenType> types = types(input);

            assertFalse(types.isEmpty());
            assertEquals(TokenType.EOI, types.get(types.size() - 1));
            assertEquals(1, types.stream().filter(t -> t == TokenType.EOI).count());
        }
    }

    @Test
    @DisplayName("Tokenizing twice gives the same tokens")
    void repeatable() {
        Lexer lexer = new Lexer("∀x (P(x) → □Q(x))");

        assertEquals(lexer.tokenize(), lexer.tokenize());
    }

    @Test
    @DisplayName("Caller's byte array is not retained")
    void inputCopied() {
        byte[] input = "ab".getBytes(StandardCharsets.UTF_8);
        Lexer lexer = new Lexer(input);
        input[0] = '$';

        assertEquals("ab", lexer.tokenize().get(0).literal());
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static byte[] bytes(int... values) {
        byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    private static List<TokenType> types(String input) {
        return typesOf(Lexer.lex(input));
    }

    private static List<TokenType> types(byte[] input) {
        return typesOf(Lexer.lex(input));
    }

    private static List<TokenType> typesOf(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }
}
