package me.christianrobert.hogql.ast;

/**
 * Base interface for all HogQL AST nodes.
 *
 * <p>Nodes are immutable and built bottom-up in a single pass over the parse tree.
 * The only link between siblings is {@code JoinExpr.getNextJoin()}, a forward edge
 * of the left-deep join chain.
 */
public interface AstNode {

    /**
     * Dispatches to the matching {@link AstVisitor} method.
     */
    <T> T accept(AstVisitor<T> visitor);
}
