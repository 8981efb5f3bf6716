package me.christianrobert.hogql.ast.expression;

/**
 * Binary arithmetic operators.
 */
public enum ArithmeticOperationOp {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    MOD("%");

    private final String symbol;

    ArithmeticOperationOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
