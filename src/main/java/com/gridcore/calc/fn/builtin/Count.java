package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.engine.Operators;
import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/**
 * Counts numbers. Errors and text are not counted and do not propagate; a
 * direct argument counts when it coerces to a number.
 */
public class Count extends AbstractCellFunction {
    public Count() {
        super("COUNT", 0, UNBOUNDED);
    }

    @Override
    protected boolean propagatesErrors() {
        return false;
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        int count = 0;
        for (CellValue v : args) {
            if (v instanceof CellValue.Array a) {
                for (CellValue inner : a.values())
                    if (inner.isNumber())
                        count++;
            } else if (!v.isEmpty() && !v.isError() && Operators.toNumber(v).isPresent()) {
                count++;
            }
        }
        return CellValue.number(count);
    }
}
