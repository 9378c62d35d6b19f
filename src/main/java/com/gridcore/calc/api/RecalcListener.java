package com.gridcore.calc.api;

import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

/**
 * Observability hook for recalculation passes.
 *
 * <p>
 * Callbacks run synchronously inside the pass, so implementations should stay
 * cheap.
 */
public interface RecalcListener {

    /**
     * Called before the first cell of a pass is evaluated.
     *
     * @param epoch  pass counter, incremented once per pass
     * @param cells  number of cells scheduled in this pass
     */
    void onRecalcStart(long epoch, int cells);

    /**
     * Called after a cell's value was computed. Error values such as
     * {@code #DIV/0!} are reported here too.
     */
    void onCellEvaluated(long epoch, CellAddress cell, CellValue value, long durationNanos);

    /** Called when evaluating a cell raised an exception that was captured at the cell. */
    void onCellError(long epoch, CellAddress cell, Throwable error);

    void onRecalcEnd(long epoch, int cellsEvaluated);
}
