package com.gridcore.calc.engine;

import com.gridcore.calc.api.CellStore;
import com.gridcore.calc.api.EvaluationContext;
import com.gridcore.calc.exception.CircularDependencyException;
import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.exception.InvalidReferenceException;
import com.gridcore.calc.exception.SpreadsheetException;
import com.gridcore.calc.fn.FunctionRegistry;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;
import com.gridcore.calc.util.ErrorRateLimiter;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link EvaluationContext} over a {@link CellStore}.
 *
 * <p>
 * During a recalculation pass the context knows which formula cells are
 * stale. Reading a stale cell evaluates it on the spot (recursively, bounded by
 * {@code maxDepth}), so a cell always sees current inputs even when the pass
 * order could not be made topological. The evaluation stack turns any
 * re-entry into {@code #CIRC!}.
 *
 * <p>
 * Every failure is captured at the cell: its computed value becomes the error
 * value and its {@code error} field the message.
 */
public final class SheetEvaluationContext implements EvaluationContext {
    private static final Logger log = LogManager.getLogger(SheetEvaluationContext.class);

    private final CellStore store;
    private final Evaluator evaluator;
    private final int maxDepth;

    private final Set<CellAddress> evaluating = new LinkedHashSet<>();
    private final Set<CellAddress> pending = new HashSet<>();
    private final Map<CellAddress, Throwable> failures = new HashMap<>();
    private final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    public SheetEvaluationContext(CellStore store, FunctionRegistry functions, int maxDepth) {
        this.store = store;
        this.evaluator = new Evaluator(this, functions);
        this.maxDepth = maxDepth;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    @Override
    public CellValue getCellValue(CellAddress address) {
        if (evaluating.contains(address))
            throw new CircularDependencyException(address);
        Cell cell = store.get(address);
        if (cell == null)
            return CellValue.EMPTY;
        if (pending.contains(address))
            evaluateCell(address);
        return cell.getComputedValue();
    }

    @Override
    public boolean checkCircular(CellAddress address) {
        return evaluating.contains(address);
    }

    @Override
    public void pushEvaluation(CellAddress address) {
        if (!evaluating.add(address))
            throw new CircularDependencyException(address);
    }

    @Override
    public void popEvaluation(CellAddress address) {
        evaluating.remove(address);
    }

    /** Marks the formula cells among {@code cells} stale for the coming pass. */
    public void beginPass(Collection<CellAddress> cells) {
        pending.clear();
        failures.clear();
        for (CellAddress a : cells) {
            Cell cell = store.get(a);
            if (cell != null && cell.hasFormula())
                pending.add(a);
        }
    }

    public void endPass() {
        pending.clear();
        evaluating.clear();
    }

    public boolean isPending(CellAddress address) {
        return pending.contains(address);
    }

    /** The exception captured for {@code address} in the current pass, or null. */
    public Throwable failureOf(CellAddress address) {
        return failures.get(address);
    }

    /**
     * Evaluates the formula of {@code address} and stores the result on the
     * cell. Value cells are left untouched.
     *
     * @return the cell's computed value afterwards
     */
    public CellValue evaluateCell(CellAddress address) {
        Cell cell = store.get(address);
        pending.remove(address);
        if (cell == null)
            return CellValue.EMPTY;
        if (!cell.hasFormula())
            return cell.getComputedValue();
        if (evaluating.size() >= maxDepth) {
            log.warn("Evaluation depth limit {} reached at {}", maxDepth, address);
            cell.setError(CellValue.error(ErrorCode.NUM), "Evaluation depth limit " + maxDepth + " exceeded");
            return cell.getComputedValue();
        }
        pushEvaluation(address);
        try {
            CellValue v = evaluator.evaluate(cell.getFormula());
            if (v instanceof CellValue.Error err) {
                ErrorCode code = err.errorCode();
                cell.setError(v, code != null ? code.description() : "Error value " + err.code());
            } else {
                cell.setComputedValue(v);
            }
        } catch (SpreadsheetException e) {
            failures.put(address, e);
            cell.setError(CellValue.error(codeFor(e)), e.getMessage());
        } catch (RuntimeException e) {
            // host functions that bypass AbstractCellFunction
            failures.put(address, e);
            limiter.log("Unexpected failure evaluating " + address, e);
            cell.setError(CellValue.error(ErrorCode.VALUE), String.valueOf(e.getMessage()));
        } finally {
            popEvaluation(address);
        }
        return cell.getComputedValue();
    }

    static ErrorCode codeFor(SpreadsheetException e) {
        if (e instanceof EvaluationException ee)
            return ee.errorCode();
        if (e instanceof CircularDependencyException)
            return ErrorCode.CIRC;
        if (e instanceof InvalidReferenceException)
            return ErrorCode.REF;
        return ErrorCode.VALUE;
    }
}
