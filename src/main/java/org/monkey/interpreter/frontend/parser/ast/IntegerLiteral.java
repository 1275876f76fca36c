package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A decimal integer literal.
 *
 * @param token The token containing the digits.
 * @param value The parsed 64-bit value.
 */
public record IntegerLiteral(
        Token token,
        long value
) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return token.literal();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitIntegerLiteral(this);
    }
}
