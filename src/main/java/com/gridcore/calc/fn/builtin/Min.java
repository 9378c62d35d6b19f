package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/** Smallest numeric argument, 0 when there are none. */
public class Min extends AbstractCellFunction {
    public Min() {
        super("MIN", 1, UNBOUNDED);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        List<Double> values = numbers(args);
        if (values.isEmpty())
            return CellValue.number(0);
        double min = Double.POSITIVE_INFINITY;
        for (double d : values)
            min = Math.min(min, d);
        return CellValue.number(min);
    }
}
