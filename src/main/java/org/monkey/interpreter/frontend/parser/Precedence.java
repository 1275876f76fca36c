package org.monkey.interpreter.frontend.parser;

import org.monkey.interpreter.frontend.lexer.TokenType;

import java.util.Map;

/**
 * Binding strength of operators, from weakest to strongest.
 * The declaration order is significant: {@link #compareTo} decides grouping.
 */
public enum Precedence {
    LOWEST,
    /** {@code ==} and {@code !=}. */
    EQUALS,
    /** {@code <} and {@code >}. */
    LESSGREATER,
    /** {@code +} and {@code -}. */
    SUM,
    /** {@code *} and {@code /}. */
    PRODUCT,
    /** Unary {@code !} and {@code -}. */
    PREFIX,
    /** Reserved for call expressions; no operator binds at this level yet. */
    CALL;

    private static final Map<TokenType, Precedence> INFIX_PRECEDENCES = Map.of(
            TokenType.EQ, EQUALS,
            TokenType.NOT_EQ, EQUALS,
            TokenType.LT, LESSGREATER,
            TokenType.GT, LESSGREATER,
            TokenType.PLUS, SUM,
            TokenType.MINUS, SUM,
            TokenType.SLASH, PRODUCT,
            TokenType.ASTERISK, PRODUCT
    );

    /**
     * Gets the precedence a token has when it appears in infix position.
     * @param type The token type.
     * @return Its precedence, or {@link #LOWEST} for tokens that are not infix operators.
     */
    public static Precedence ofInfix(TokenType type) {
        return INFIX_PRECEDENCES.getOrDefault(type, LOWEST);
    }
}
