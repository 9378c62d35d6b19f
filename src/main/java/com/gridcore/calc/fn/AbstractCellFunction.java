package com.gridcore.calc.fn;

import com.gridcore.calc.api.CellFunction;
import com.gridcore.calc.engine.Operators;
import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.exception.SpreadsheetException;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;
import com.gridcore.calc.util.ErrorRateLimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for built-in functions. Checks arity, propagates error
 * arguments, and turns unexpected failures into {@code #VALUE!} with a
 * rate-limited log line.
 */
public abstract class AbstractCellFunction implements CellFunction {
    /** {@code maxArgs} value for variadic functions. */
    protected static final int UNBOUNDED = -1;

    private final Logger log = LogManager.getLogger(this.getClass());
    private final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    private final String name;
    private final int minArgs;
    private final int maxArgs;

    protected AbstractCellFunction(String name, int minArgs, int maxArgs) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public String name() {
        return name;
    }

    @Override
    public final CellValue apply(List<CellValue> args) {
        int n = args.size();
        if (n < minArgs || (maxArgs != UNBOUNDED && n > maxArgs))
            throw new EvaluationException(ErrorCode.VALUE, name + " expects " + arityText() + ", got " + n);
        if (propagatesErrors()) {
            CellValue err = firstError(args);
            if (err != null)
                return err;
        }
        try {
            return calculate(args);
        } catch (SpreadsheetException e) {
            throw e;
        } catch (RuntimeException e) {
            limiter.log("Error evaluating " + name, e);
            return CellValue.error(ErrorCode.VALUE);
        }
    }

    /** Subclasses implement the function here; arity is already checked. */
    protected abstract CellValue calculate(List<CellValue> args);

    /** Whether an error among the arguments (or inside a range) short-circuits the call. */
    protected boolean propagatesErrors() {
        return true;
    }

    private String arityText() {
        if (maxArgs == minArgs)
            return minArgs + " argument" + (minArgs == 1 ? "" : "s");
        if (maxArgs == UNBOUNDED)
            return "at least " + minArgs + " argument" + (minArgs == 1 ? "" : "s");
        return minArgs + " to " + maxArgs + " arguments";
    }

    protected static CellValue firstError(List<CellValue> args) {
        for (CellValue v : args) {
            if (v.isError())
                return v;
            if (v instanceof CellValue.Array a) {
                for (CellValue inner : a.values())
                    if (inner.isError())
                        return inner;
            }
        }
        return null;
    }

    /**
     * Numbers taken from the arguments. Range cells count only when they hold
     * numbers; direct arguments are coerced (booleans, numeric text) and
     * blanks are skipped.
     *
     * @throws EvaluationException {@code #VALUE!} for a direct argument that is not numeric.
     */
    protected List<Double> numbers(List<CellValue> args) {
        List<Double> out = new ArrayList<>();
        for (CellValue v : args) {
            if (v instanceof CellValue.Array a) {
                for (CellValue inner : a.values())
                    if (inner instanceof CellValue.Number num)
                        out.add(num.value());
            } else if (!v.isEmpty()) {
                out.add(Operators.requireNumber(v, name));
            }
        }
        return out;
    }

    /** Single scalar argument as a number; a range argument is rejected. */
    protected double number(CellValue v) {
        if (v instanceof CellValue.Array)
            throw new EvaluationException(ErrorCode.VALUE, name + " does not accept a range here");
        return Operators.requireNumber(v, name);
    }

    protected String text(CellValue v) {
        if (v instanceof CellValue.Array)
            throw new EvaluationException(ErrorCode.VALUE, name + " does not accept a range here");
        return Operators.toText(v);
    }

    /** Truth values of the arguments; blanks and text inside ranges are skipped. */
    protected List<Boolean> booleans(List<CellValue> args) {
        List<Boolean> out = new ArrayList<>();
        for (CellValue v : args) {
            if (v instanceof CellValue.Array a) {
                for (CellValue inner : a.values()) {
                    if (inner instanceof CellValue.Bool || inner instanceof CellValue.Number)
                        out.add(Operators.toBoolean(inner));
                }
            } else {
                out.add(Operators.toBoolean(v));
            }
        }
        return out;
    }

    protected static CellValue numberOrNum(double result) {
        if (Double.isNaN(result) || Double.isInfinite(result))
            return CellValue.error(ErrorCode.NUM);
        return CellValue.number(result);
    }
}
