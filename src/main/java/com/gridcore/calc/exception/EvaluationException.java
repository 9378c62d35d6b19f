package com.gridcore.calc.exception;

import com.gridcore.calc.model.ErrorCode;

/**
 * A runtime evaluation failure that maps onto one of the spreadsheet error
 * codes, e.g. an unknown function name ({@code #NAME?}) or a bare range
 * outside a function call ({@code #VALUE!}).
 */
public class EvaluationException extends SpreadsheetException {
    private final ErrorCode errorCode;

    public EvaluationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
