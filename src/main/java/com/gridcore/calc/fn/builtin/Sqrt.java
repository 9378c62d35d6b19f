package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.List;

public class Sqrt extends AbstractCellFunction {
    public Sqrt() {
        super("SQRT", 1, 1);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        double x = number(args.get(0));
        if (x < 0)
            return CellValue.error(ErrorCode.NUM);
        return CellValue.number(Math.sqrt(x));
    }
}
