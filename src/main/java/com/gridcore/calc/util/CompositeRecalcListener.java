package com.gridcore.calc.util;

import com.gridcore.calc.api.RecalcListener;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

import java.util.Arrays;

/**
 * Fans every callback out to several {@link RecalcListener}s, in the order they
 * were added.
 */
public class CompositeRecalcListener implements RecalcListener {
    private RecalcListener[] listeners = new RecalcListener[0];

    public CompositeRecalcListener add(RecalcListener listener) {
        RecalcListener[] old = listeners;
        RecalcListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRecalcStart(long epoch, int cells) {
        for (RecalcListener l : listeners)
            l.onRecalcStart(epoch, cells);
    }

    @Override
    public void onCellEvaluated(long epoch, CellAddress cell, CellValue value, long durationNanos) {
        for (RecalcListener l : listeners)
            l.onCellEvaluated(epoch, cell, value, durationNanos);
    }

    @Override
    public void onCellError(long epoch, CellAddress cell, Throwable error) {
        for (RecalcListener l : listeners)
            l.onCellError(epoch, cell, error);
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
        for (RecalcListener l : listeners)
            l.onRecalcEnd(epoch, cellsEvaluated);
    }
}
