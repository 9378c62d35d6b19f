package com.gridcore.calc.exception;

import com.gridcore.calc.model.ErrorCode;

/**
 * Thrown for malformed formula syntax. Carries the character offset at which
 * the tokenizer or parser gave up, and the error code the cell shows:
 * {@code #NAME?} for unknown identifiers, {@code #VALUE!} for everything else.
 */
public class FormulaParseException extends SpreadsheetException {
    private final int position;
    private final ErrorCode errorCode;

    public FormulaParseException(String message, int position) {
        this(ErrorCode.VALUE, message, position);
    }

    public FormulaParseException(ErrorCode errorCode, String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
        this.errorCode = errorCode;
    }

    public FormulaParseException(String message) {
        super(message);
        this.position = -1;
        this.errorCode = ErrorCode.VALUE;
    }

    public int position() {
        return position;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
