package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.engine.Operators;
import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

public class Not extends AbstractCellFunction {
    public Not() {
        super("NOT", 1, 1);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        return CellValue.bool(!Operators.toBoolean(args.get(0)));
    }
}
