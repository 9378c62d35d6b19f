package com.gridcore.calc;

import com.gridcore.calc.api.CellStore;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Default {@link CellStore}: a hash map, not thread safe. */
public final class MapCellStore implements CellStore {
    private final Map<CellAddress, Cell> cells = new HashMap<>();

    @Override
    public Cell get(CellAddress address) {
        return cells.get(address);
    }

    @Override
    public void put(CellAddress address, Cell cell) {
        cells.put(address, cell);
    }

    @Override
    public Cell remove(CellAddress address) {
        return cells.remove(address);
    }

    @Override
    public Set<CellAddress> addresses() {
        return new TreeSet<>(cells.keySet());
    }

    @Override
    public int size() {
        return cells.size();
    }
}
