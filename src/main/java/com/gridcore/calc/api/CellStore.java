package com.gridcore.calc.api;

import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;

import java.util.Set;

/**
 * Storage backing a sheet. The engine only needs keyed lookup and iteration;
 * thread safety, if any, is the implementation's concern.
 */
public interface CellStore {

    /** The cell at {@code address}, or null when nothing was written there. */
    Cell get(CellAddress address);

    void put(CellAddress address, Cell cell);

    /** Removes and returns the cell, or null if absent. */
    Cell remove(CellAddress address);

    /** Snapshot of the occupied addresses. */
    Set<CellAddress> addresses();

    int size();
}
