package com.gridcore.calc.engine;

import com.gridcore.calc.api.RecalcListener;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives recalculation passes over an ordered list of cells.
 *
 * <p>
 * A pass marks every formula cell of the list stale, then visits the list in
 * order and evaluates each cell that is still stale. Cells evaluated earlier in
 * the pass (pulled in by a dependent, which happens around cycles) are not
 * evaluated twice.
 *
 * <p>
 * A pass never aborts. A failure is captured at its cell, reported to the
 * listener and the remaining cells carry on; error values then flow to
 * dependents as ordinary operands.
 */
public final class RecalculationEngine {
    private static final Logger log = LogManager.getLogger(RecalculationEngine.class);

    private final SheetEvaluationContext context;

    private int lastEvaluatedCount;
    private long epoch;
    private RecalcListener listener;

    public RecalculationEngine(SheetEvaluationContext context) {
        this.context = context;
    }

    public void setListener(RecalcListener listener) {
        this.listener = listener;
    }

    /**
     * Run one pass over {@code order}.
     *
     * @return the number of formula cells evaluated
     */
    public int recalculate(List<CellAddress> order) {
        epoch++;
        int evaluated = 0;
        final RecalcListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener)
            l.onRecalcStart(epoch, order.size());

        context.beginPass(order);
        try {
            for (CellAddress cell : order) {
                if (!context.isPending(cell))
                    continue;

                long start = hasListener ? System.nanoTime() : 0L;
                CellValue value = context.evaluateCell(cell);
                evaluated++;

                Throwable failure = context.failureOf(cell);
                if (failure != null && log.isDebugEnabled())
                    log.debug("{} failed in epoch {}: {}", cell, epoch, failure.getMessage());

                if (hasListener) {
                    l.onCellEvaluated(epoch, cell, value, System.nanoTime() - start);
                    if (failure != null)
                        l.onCellError(epoch, cell, failure);
                }
            }
        } finally {
            context.endPass();
            this.lastEvaluatedCount = evaluated;
            if (hasListener)
                l.onRecalcEnd(epoch, evaluated);
        }
        return evaluated;
    }

    public long epoch() {
        return epoch;
    }

    public int lastEvaluatedCount() {
        return lastEvaluatedCount;
    }
}
