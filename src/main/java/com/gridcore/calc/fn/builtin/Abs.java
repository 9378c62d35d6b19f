package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

public class Abs extends AbstractCellFunction {
    public Abs() {
        super("ABS", 1, 1);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        return CellValue.number(Math.abs(number(args.get(0))));
    }
}
