package com.gridcore.calc.exception;

import com.gridcore.calc.model.CellAddress;

/**
 * Thrown by an evaluation context when a cell is requested while it is still
 * being evaluated higher up the call stack.
 */
public class CircularDependencyException extends SpreadsheetException {
    private final CellAddress address;

    public CircularDependencyException(CellAddress address) {
        super("Circular dependency at " + address);
        this.address = address;
    }

    public CellAddress address() {
        return address;
    }
}
