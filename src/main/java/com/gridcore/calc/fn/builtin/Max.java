package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/** Largest numeric argument, 0 when there are none. */
public class Max extends AbstractCellFunction {
    public Max() {
        super("MAX", 1, UNBOUNDED);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        List<Double> values = numbers(args);
        if (values.isEmpty())
            return CellValue.number(0);
        double max = Double.NEGATIVE_INFINITY;
        for (double d : values)
            max = Math.max(max, d);
        return CellValue.number(max);
    }
}
