package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

public class Len extends AbstractCellFunction {
    public Len() {
        super("LEN", 1, 1);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        String s = text(args.get(0));
        return CellValue.number(s.codePointCount(0, s.length()));
    }
}
