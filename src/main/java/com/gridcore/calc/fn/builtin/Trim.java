package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/** Strips leading and trailing whitespace and collapses inner runs to a single space. */
public class Trim extends AbstractCellFunction {
    public Trim() {
        super("TRIM", 1, 1);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        return CellValue.text(text(args.get(0)).trim().replaceAll("\\s+", " "));
    }
}
