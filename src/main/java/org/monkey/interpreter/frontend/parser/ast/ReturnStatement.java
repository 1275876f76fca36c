package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A {@code return <value>;} statement.
 *
 * @param token The {@code return} token.
 * @param returnValue The returned expression; null if it could not be parsed.
 */
public record ReturnStatement(
        Token token,
        Expression returnValue
) implements Statement {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return tokenLiteral() + " " + AstNode.renderNullable(returnValue) + ";";
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
