package com.gridcore.calc.exception;

/**
 * Root of the engine's unchecked exception hierarchy.
 *
 * <p>
 * None of these escape a cell edit: the edit path records the failure on the
 * cell (its {@code error} message and an error value) and keeps going.
 */
public class SpreadsheetException extends RuntimeException {
    public SpreadsheetException(String message) {
        super(message);
    }

    public SpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
