package com.gridcore.calc.formula;

public enum UnaryOperator {
    NEGATE("-"),
    PLUS("+"),
    PERCENT("%");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPostfix() {
        return this == PERCENT;
    }
}
