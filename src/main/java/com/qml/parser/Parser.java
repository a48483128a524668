package com.qml.parser;

import com.qml.expression.BinaryNode;
import com.qml.expression.Expression;
import com.qml.expression.IdentityNode;
import com.qml.expression.Operator;
import com.qml.expression.PredicationNode;
import com.qml.expression.QuantificationNode;
import com.qml.expression.Quantifier;
import com.qml.expression.Term;
import com.qml.expression.TermType;
import com.qml.expression.UnaryNode;
import com.qml.lexer.Symbols;
import com.qml.lexer.Token;
import com.qml.lexer.TokenType;
import com.qml.operator.Modality;
import com.qml.operator.OperatorMapping;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Parser for QML formulas.
 * Converts tokens into an expression tree using recursive descent parsing.
 * <p>
 * Grammar (binding tightens downwards, binary levels are left-associative):
 * <pre>
 * equivalence := implication ('↔' implication)*
 * implication := conj_disj ('→' conj_disj)*
 * conj_disj   := clause (('∧' | '∨') clause)*
 * clause      := atomic | unary | quantified | '(' entry ')' | '[' entry ']'
 * unary       := ('¬' | '□' | '⋄') clause
 * quantified  := ('∀' | '∃' | '∄') VARIABLE clause
 * atomic      := predication | identity | inequality
 * predication := IDENTIFIER '(' term (',' term)* ')'
 * identity    := term '=' term
 * inequality  := term '≠' term
 * term        := IDENTIFIER | VARIABLE
 * </pre>
 * where {@code entry} is the rule the parse was started with.
 * <p>
 * Alternatives are chosen from the lookahead token alone. Errors are returned
 * as {@link ParseResult} values and the first one aborts the parse.
 * <p>
 * Not thread-safe: the cursor is reset by each {@link #parse} call, so one
 * instance may be reused sequentially but not shared between threads.
 * <p>
 * Nesting depth is bounded by the thread stack: every bracket, unary operator
 * or quantifier adds a few frames, so inputs nested thousands deep end in a
 * {@link StackOverflowError}.
 */
public final class Parser {

    private final List<Token> tokens;
    private final OperatorMapping mapping;
    private EntryRule entryRule;
    private int index;
    private Token lookahead;

    public Parser(List<Token> tokens) {
        this(tokens, Modality.ALETHIC);
    }

    public Parser(List<Token> tokens, OperatorMapping mapping) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.entryRule = EntryRule.EQUIVALENCE;
        reset();
    }

    /**
     * Parse the token stream starting at the equivalence rule.
     *
     * @return Root expression or the first error
     */
    public ParseResult parse() {
        return parse(EntryRule.EQUIVALENCE);
    }

    /**
     * Parse the token stream starting at the given rule.
     *
     * @param entryRule Rule to start from, also used for bracketed subformulas
     * @return Root expression or the first error
     */
    public ParseResult parse(EntryRule entryRule) {
        this.entryRule = Objects.requireNonNull(entryRule, "entryRule");
        reset();

        if (tokens.isEmpty() || tokens.get(0).type() == TokenType.EOI) {
            return ParseResult.failure(ParseError.emptyInput());
        }

        return sentence();
    }

    private ParseResult sentence() {
        ParseResult result = entryRule.apply(this);
        if (result.isFailure()) {
            return result;
        }
        if (!check(TokenType.EOI)) {
            return syntaxError("Unexpected symbol '" + lookahead.literal() + "'");
        }
        return result;
    }

    // Binary levels

    ParseResult equivalence() {
        return leftAssociative(this::implication, TokenType.EQ);
    }

    ParseResult implication() {
        return leftAssociative(this::conjunctionDisjunction, TokenType.IF);
    }

    ParseResult conjunctionDisjunction() {
        return leftAssociative(this::clause, TokenType.AND, TokenType.OR);
    }

    private ParseResult leftAssociative(Supplier<ParseResult> operand, TokenType... operators) {
        ParseResult first = operand.get();
        if (first.isFailure()) {
            return first;
        }
        Expression lhs = first.expression();

        while (checkAny(operators)) {
            Optional<Operator> operator = operatorFor(lookahead.type(), Operator::isBinary);
            if (operator.isEmpty()) {
                return missingOperator(lookahead, "binary");
            }
            advance();

            ParseResult rhs = operand.get();
            if (rhs.isFailure()) {
                return rhs;
            }
            lhs = new BinaryNode(operator.get(), lhs, rhs.expression());
        }

        return ParseResult.success(lhs);
    }

    // Clauses

    ParseResult clause() {
        return switch (lookahead.type()) {
            case IDENTIFIER, VARIABLE -> atomic();
            case NOT, NEC, POS -> unary();
            case FORALL, EXISTS, NOT_EXISTS -> quantified();
            case LPAREN -> bracketed(TokenType.RPAREN);
            case LBRACKET -> bracketed(TokenType.RBRACKET);
            default -> syntaxError(expected("clause"));
        };
    }

    private ParseResult bracketed(TokenType closing) {
        advance(); // opening bracket

        ParseResult inner = entryRule.apply(this);
        if (inner.isFailure()) {
            return inner;
        }
        if (!check(closing)) {
            return syntaxError("Expected '" + Symbols.DISPLAY.get(closing) + "' but got " + describe(lookahead));
        }
        advance();
        return inner;
    }

    ParseResult unary() {
        if (!checkAny(TokenType.NOT, TokenType.NEC, TokenType.POS)) {
            return syntaxError("Expected '¬', '□' or '⋄' but got " + describe(lookahead));
        }

        Optional<Operator> operator = operatorFor(lookahead.type(), Operator::isUnary);
        if (operator.isEmpty()) {
            return missingOperator(lookahead, "unary");
        }
        advance();

        ParseResult operand = clause();
        if (operand.isFailure()) {
            return operand;
        }
        return ParseResult.success(new UnaryNode(operator.get(), operand.expression()));
    }

    ParseResult quantified() {
        if (!checkAny(TokenType.FORALL, TokenType.EXISTS, TokenType.NOT_EXISTS)) {
            return syntaxError("Expected '∀', '∃' or '∄' but got " + describe(lookahead));
        }
        if (peek(1).type() != TokenType.VARIABLE) {
            return errorAt(1, "Expected variable after '" + lookahead.literal() + "' but got "
                    + describe(peek(1)));
        }

        Token quantifierToken = advance();
        Term variable = toTerm(advance());

        ParseResult body = clause();
        if (body.isFailure()) {
            return body;
        }

        Quantifier quantifier = quantifierToken.type() == TokenType.FORALL
                ? Quantifier.UNIVERSAL
                : Quantifier.EXISTENTIAL;
        Expression quantification = new QuantificationNode(quantifier, variable, body.expression());

        if (quantifierToken.type() != TokenType.NOT_EXISTS) {
            return ParseResult.success(quantification);
        }
        // ∄x φ is ¬∃x φ
        return negate(quantification, quantifierToken);
    }

    // Atomic formulas

    ParseResult atomic() {
        if (!lookahead.type().isTerm()) {
            return syntaxError(expected("term"));
        }

        return switch (peek(1).type()) {
            case LPAREN -> predication();
            case ID -> identity();
            case NEQ -> inequality();
            default -> errorAt(1, "Expected '(', '=' or '≠' after '" + lookahead.literal() + "' but got "
                    + describe(peek(1)));
        };
    }

    ParseResult predication() {
        if (!check(TokenType.IDENTIFIER)) {
            return syntaxError("Expected predicate name but got " + describe(lookahead));
        }
        if (peek(1).type() != TokenType.LPAREN) {
            return errorAt(1, "Expected '(' after predicate '" + lookahead.literal() + "' but got "
                    + describe(peek(1)));
        }
        if (!peek(2).type().isTerm()) {
            return errorAt(2, "Expected term after '(' but got " + describe(peek(2)));
        }
        if (peek(3).type() != TokenType.RPAREN && peek(3).type() != TokenType.COMMA) {
            return errorAt(3, "Expected ',' or ')' after term '" + peek(2).literal() + "' but got "
                    + describe(peek(3)));
        }

        int rollback = index;
        String predicate = advance().literal();
        advance(); // (

        List<Term> arguments = new ArrayList<>();
        arguments.add(toTerm(advance()));

        while (check(TokenType.COMMA)) {
            if (!peek(1).type().isTerm()) {
                Token offending = peek(1);
                restore(rollback);
                return ParseResult.failure(ParseError.syntax(
                        "Expected term after ',' but got " + describe(offending), offending.position()));
            }
            advance(); // ,
            arguments.add(toTerm(advance()));
        }

        if (!check(TokenType.RPAREN)) {
            Token offending = lookahead;
            restore(rollback);
            return ParseResult.failure(ParseError.syntax(
                    "Expected ')' after argument list but got " + describe(offending), offending.position()));
        }
        advance();

        return ParseResult.success(new PredicationNode(predicate, arguments));
    }

    ParseResult identity() {
        Optional<ParseResult> failure = relationFailure(TokenType.ID);
        if (failure.isPresent()) {
            return failure.get();
        }
        return ParseResult.success(identityOf());
    }

    ParseResult inequality() {
        Optional<ParseResult> failure = relationFailure(TokenType.NEQ);
        if (failure.isPresent()) {
            return failure.get();
        }
        Token inequalityToken = peek(1);
        IdentityNode identity = identityOf();
        return negate(identity, inequalityToken);
    }

    /**
     * Checks {@code term <relation> term} without consuming anything.
     */
    private Optional<ParseResult> relationFailure(TokenType relation) {
        String symbol = Symbols.DISPLAY.get(relation);
        if (!lookahead.type().isTerm()) {
            return Optional.of(syntaxError(expected("term")));
        }
        if (peek(1).type() != relation) {
            return Optional.of(errorAt(1, "Expected '" + symbol + "' after '" + lookahead.literal()
                    + "' but got " + describe(peek(1))));
        }
        if (!peek(2).type().isTerm()) {
            return Optional.of(errorAt(2, "Expected singular term after '" + symbol + "' but got "
                    + describe(peek(2))));
        }
        return Optional.empty();
    }

    private IdentityNode identityOf() {
        Term lhs = toTerm(advance());
        advance(); // = or ≠
        Term rhs = toTerm(advance());
        return new IdentityNode(lhs, rhs);
    }

    // Helpers

    private ParseResult negate(Expression expression, Token origin) {
        Optional<Operator> negation = operatorFor(TokenType.NOT, Operator::isUnary);
        if (negation.isEmpty()) {
            return ParseResult.failure(ParseError.configuration(
                    "No unary operator mapped for NOT, needed by '" + origin.literal() + "'", origin.position()));
        }
        return ParseResult.success(new UnaryNode(negation.get(), expression));
    }

    /**
     * Operator the mapping gives for a token type, empty when there is none or its arity is wrong.
     */
    private Optional<Operator> operatorFor(TokenType type, Predicate<Operator> arity) {
        return Objects.requireNonNullElse(mapping.map(type), Optional.<Operator>empty()).filter(arity);
    }

    private ParseResult missingOperator(Token token, String arity) {
        return ParseResult.failure(ParseError.configuration(
                "No " + arity + " operator mapped for " + token.type() + " '" + token.literal() + "'",
                token.position()));
    }

    private ParseResult syntaxError(String message) {
        return ParseResult.failure(ParseError.syntax(message, lookahead.position()));
    }

    private ParseResult errorAt(int offset, String message) {
        return ParseResult.failure(ParseError.syntax(message, peek(offset).position()));
    }

    private String expected(String construct) {
        if (lookahead.type() == TokenType.EOI && index > 0) {
            return "Expected " + construct + " after '" + tokens.get(index - 1).literal() + "' but got end of input";
        }
        return "Expected " + construct + " but got " + describe(lookahead);
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case EOI -> "end of input";
            case ILLEGAL -> "illegal symbol '" + token.literal() + "'";
            default -> "'" + token.literal() + "'";
        };
    }

    private static Term toTerm(Token token) {
        TermType type = token.type() == TokenType.VARIABLE ? TermType.VARIABLE : TermType.CONSTANT;
        return new Term(token.literal(), type);
    }

    private boolean check(TokenType type) {
        return lookahead.type() == type;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                return true;
            }
        }
        return false;
    }

    private Token peek(int offset) {
        int target = index + offset;
        if (target < tokens.size()) {
            return tokens.get(target);
        }
        return endOfInput();
    }

    private Token advance() {
        Token consumed = lookahead;
        if (lookahead.type() != TokenType.EOI) {
            index++;
            lookahead = peek(0);
        }
        return consumed;
    }

    private void restore(int savedIndex) {
        index = savedIndex;
        lookahead = peek(0);
    }

    private void reset() {
        restore(0);
    }

    private Token endOfInput() {
        if (tokens.isEmpty()) {
            return Token.eoi(0);
        }
        Token last = tokens.get(tokens.size() - 1);
        return last.type() == TokenType.EOI
                ? last
                : Token.eoi(last.position() + last.literal().getBytes(StandardCharsets.UTF_8).length);
    }

    /**
     * Cursor position, exposed for tests.
     */
    int cursor() {
        return index;
    }
}
