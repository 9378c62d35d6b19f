package com.gridcore.calc.formula;

/**
 * A lexical token of formula text. {@code position} is the offset of the first
 * character in the source.
 */
public record Token(Type type, String text, int position) {

    public enum Type {
        NUMBER,
        STRING,
        BOOLEAN,
        ERROR,
        /** {@code $?letters$?digits}, text kept verbatim. */
        CELL_REF,
        /** Identifier followed by {@code (}. */
        FUNCTION,
        OPERATOR,
        LPAREN,
        RPAREN,
        COMMA,
        COLON,
        EOF
    }

    public boolean is(Type t) {
        return type == t;
    }

    public boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }
}
