package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A {@code let <name> = <value>;} binding.
 *
 * @param token The {@code let} token.
 * @param name The bound identifier.
 * @param value The bound expression; null if it could not be parsed.
 */
public record LetStatement(
        Token token,
        Identifier name,
        Expression value
) implements Statement {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return tokenLiteral() + " " + name.render() + " = " + AstNode.renderNullable(value) + ";";
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitLetStatement(this);
    }
}
