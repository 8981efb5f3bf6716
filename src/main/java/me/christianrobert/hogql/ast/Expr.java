package me.christianrobert.hogql.ast;

/**
 * Marker for nodes that may appear where a value expression is expected
 * (select list, WHERE, function arguments, subqueries, JOIN sources).
 */
public interface Expr extends AstNode {
}
