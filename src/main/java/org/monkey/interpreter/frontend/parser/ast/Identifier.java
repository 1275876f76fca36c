package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A name, either bound by a {@code let} or used inside an expression.
 *
 * @param token The identifier token.
 * @param value The name.
 */
public record Identifier(
        Token token,
        String value
) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return value;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitIdentifier(this);
    }
}
