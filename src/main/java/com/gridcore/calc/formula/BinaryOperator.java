package com.gridcore.calc.formula;

/**
 * Infix operators with their binding power. Higher binds tighter; prefix
 * unary operators sit at 5 and postfix {@code %} at 6.
 */
public enum BinaryOperator {
    CONCAT("&", 0),
    EQUAL("=", 1),
    NOT_EQUAL("<>", 1),
    LESS_THAN("<", 1),
    LESS_THAN_OR_EQUAL("<=", 1),
    GREATER_THAN(">", 1),
    GREATER_THAN_OR_EQUAL(">=", 1),
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 3),
    DIVIDE("/", 3),
    POWER("^", 4);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    public boolean isComparison() {
        return precedence == 1;
    }

    /** Operator for an operator token's text, or null. */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol))
                return op;
        }
        return null;
    }
}
