package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;
import java.util.Locale;

public class Upper extends AbstractCellFunction {
    public Upper() {
        super("UPPER", 1, 1);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        return CellValue.text(text(args.get(0)).toUpperCase(Locale.ROOT));
    }
}
