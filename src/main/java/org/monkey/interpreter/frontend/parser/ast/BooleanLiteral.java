package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A {@code true} or {@code false} literal.
 *
 * @param token The keyword token.
 * @param value The boolean value.
 */
public record BooleanLiteral(
        Token token,
        boolean value
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
        return visitor.visitBooleanLiteral(this);
    }
}
