package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.engine.Operators;
import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.List;

/**
 * {@code IF(condition, then[, else])}. Only an error in the condition
 * propagates; an error in the branch not taken is ignored. A missing else
 * branch yields FALSE. A range is not a value a cell can hold, so choosing
 * one is {@code #VALUE!}.
 */
public class If extends AbstractCellFunction {
    public If() {
        super("IF", 2, 3);
    }

    @Override
    protected boolean propagatesErrors() {
        return false;
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        CellValue condition = args.get(0);
        if (condition.isError())
            return condition;
        CellValue branch = Operators.toBoolean(condition) ? args.get(1)
                : args.size() > 2 ? args.get(2) : CellValue.FALSE;
        if (branch instanceof CellValue.Array)
            throw new EvaluationException(ErrorCode.VALUE, "IF cannot return a range");
        return branch;
    }
}
