package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

public class And extends AbstractCellFunction {
    public And() {
        super("AND", 1, UNBOUNDED);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        for (boolean b : booleans(args))
            if (!b)
                return CellValue.FALSE;
        return CellValue.TRUE;
    }
}
