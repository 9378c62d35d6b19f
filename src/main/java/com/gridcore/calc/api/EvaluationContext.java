package com.gridcore.calc.api;

import com.gridcore.calc.exception.CircularDependencyException;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

/**
 * Value lookup and circularity tracking consumed by the evaluator.
 *
 * <p>
 * Implementations keep a set of cells currently under evaluation. Callers
 * bracket every cell evaluation with {@link #pushEvaluation} and
 * {@link #popEvaluation}, the latter in a {@code finally} block, so the set
 * never keeps stale entries after an error.
 */
public interface EvaluationContext {

    /**
     * Current value of a cell; {@link CellValue#EMPTY} for cells never written.
     *
     * @throws CircularDependencyException if resolving the value re-enters a cell
     *                                     that is already being evaluated.
     */
    CellValue getCellValue(CellAddress address);

    /** True while {@code address} is on the evaluation stack. */
    boolean checkCircular(CellAddress address);

    void pushEvaluation(CellAddress address);

    void popEvaluation(CellAddress address);
}
