package com.gridcore.calc.exception;

import com.gridcore.calc.model.ErrorCode;

/**
 * Thrown when a cell address lies outside the supported grid
 * (16,384 columns by 1,048,576 rows).
 */
public class InvalidReferenceException extends SpreadsheetException {
    public InvalidReferenceException(String message) {
        super(ErrorCode.REF.code() + " " + message);
    }
}
