package org.monkey.interpreter.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The root of the AST: the statements of a source text in source order.
 *
 * @param statements The parsed statements.
 */
public record Program(
        List<Statement> statements
) implements AstNode {

    /**
     * Compact constructor to ensure the statement list is never null and cannot change.
     */
    public Program {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public String tokenLiteral() {
        return statements.isEmpty() ? "" : statements.get(0).tokenLiteral();
    }

    @Override
    public String render() {
        return statements.stream()
                .map(Statement::render)
                .collect(Collectors.joining());
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitProgram(this);
    }
}
