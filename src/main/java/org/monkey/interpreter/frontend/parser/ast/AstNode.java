package org.monkey.interpreter.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node kinds is closed: {@link Program}, the {@link Statement} family and the
 * {@link Expression} family. Operations over the tree are written as an {@link AstVisitor},
 * which has to handle every kind.
 */
public sealed interface AstNode permits Program, Statement, Expression {

    /**
     * Gets the literal text of the token this node was created from.
     * @return The token literal.
     */
    String tokenLiteral();

    /**
     * Renders the node as source-like text with every prefix and infix
     * expression fully parenthesized, e.g. {@code ((-a) * b)}.
     * @return The canonical rendering.
     */
    String render();

    /**
     * Dispatches to the visitor method for this node kind.
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @return The visitor's result.
     */
    <T> T accept(AstVisitor<T> visitor);

    /**
     * Renders a child node that may be absent after a syntax error.
     * @param node The child node, or null.
     * @return The rendering of the node, or the empty string.
     */
    static String renderNullable(AstNode node) {
        return node == null ? "" : node.render();
    }
}
