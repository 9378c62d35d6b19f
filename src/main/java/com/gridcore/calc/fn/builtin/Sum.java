package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

public class Sum extends AbstractCellFunction {
    public Sum() {
        super("SUM", 0, UNBOUNDED);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        double sum = 0.0;
        for (double d : numbers(args))
            sum += d;
        return numberOrNum(sum);
    }
}
