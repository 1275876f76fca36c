package org.monkey.interpreter.frontend.parser;

import org.monkey.interpreter.frontend.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry of the prefix and infix parse functions, keyed by the token type they start with.
 */
public class ParseRuleRegistry {
    private final Map<TokenType, IPrefixParseFunction> prefixRules = new EnumMap<>(TokenType.class);
    private final Map<TokenType, IInfixParseFunction> infixRules = new EnumMap<>(TokenType.class);

    /**
     * Registers the rule for tokens that begin an expression.
     * @param type The token type.
     * @param function The parse function.
     */
    public void registerPrefix(TokenType type, IPrefixParseFunction function) {
        prefixRules.put(type, function);
    }

    /**
     * Registers the rule for tokens that continue an expression.
     * @param type The token type.
     * @param function The parse function.
     */
    public void registerInfix(TokenType type, IInfixParseFunction function) {
        infixRules.put(type, function);
    }

    /**
     * Gets the prefix rule for a token type.
     * @param type The token type.
     * @return An {@link Optional} containing the rule if it exists, otherwise empty.
     */
    public Optional<IPrefixParseFunction> getPrefix(TokenType type) {
        return Optional.ofNullable(prefixRules.get(type));
    }

    /**
     * Gets the infix rule for a token type.
     * @param type The token type.
     * @return An {@link Optional} containing the rule if it exists, otherwise empty.
     */
    public Optional<IInfixParseFunction> getInfix(TokenType type) {
        return Optional.ofNullable(infixRules.get(type));
    }
}
