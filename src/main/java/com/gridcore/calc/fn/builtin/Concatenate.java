package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/** Joins the display text of every argument; range cells are joined in row order. */
public class Concatenate extends AbstractCellFunction {
    public Concatenate() {
        super("CONCATENATE", 1, UNBOUNDED);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        StringBuilder sb = new StringBuilder();
        for (CellValue v : args) {
            if (v instanceof CellValue.Array a) {
                for (CellValue inner : a.values())
                    sb.append(inner.toDisplayString());
            } else {
                sb.append(v.toDisplayString());
            }
        }
        return CellValue.text(sb.toString());
    }
}
