package com.gridcore.calc.model;

/**
 * Spreadsheet error codes surfaced as {@link CellValue.Error} values.
 */
public enum ErrorCode {
    DIV0("#DIV/0!", "Division by zero"),
    REF("#REF!", "Invalid cell reference"),
    NAME("#NAME?", "Unknown function name"),
    VALUE("#VALUE!", "Wrong type of argument or operand"),
    CIRC("#CIRC!", "Circular reference"),
    NUM("#NUM!", "Invalid numeric result");

    private final String code;
    private final String description;

    ErrorCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    /** Resolves a code string such as {@code "#REF!"}; null when unknown. */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode e : values()) {
            if (e.code.equalsIgnoreCase(code))
                return e;
        }
        return null;
    }

    @Override
    public String toString() {
        return code;
    }
}
