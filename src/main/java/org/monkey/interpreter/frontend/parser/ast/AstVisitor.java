package org.monkey.interpreter.frontend.parser.ast;

/**
 * A visitor for the Abstract Syntax Tree.
 * There is one method per node kind, so every operation on the tree
 * has to decide what to do for each of them.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {
    T visitProgram(Program node);
    T visitLetStatement(LetStatement node);
    T visitReturnStatement(ReturnStatement node);
    T visitExpressionStatement(ExpressionStatement node);
    T visitIdentifier(Identifier node);
    T visitIntegerLiteral(IntegerLiteral node);
    T visitBooleanLiteral(BooleanLiteral node);
    T visitPrefixExpression(PrefixExpression node);
    T visitInfixExpression(InfixExpression node);
}
