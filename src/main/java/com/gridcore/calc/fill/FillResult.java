package com.gridcore.calc.fill;

import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/**
 * Output of a fill. Every target cell appears in exactly one of the two lists.
 */
public record FillResult(List<FilledValue> affectedCells, List<FilledFormula> formulasAdjusted) {

    public FillResult {
        affectedCells = List.copyOf(affectedCells);
        formulasAdjusted = List.copyOf(formulasAdjusted);
    }

    public record FilledValue(CellAddress address, CellValue value) {
    }

    /** {@code formula} includes the leading {@code =}. */
    public record FilledFormula(CellAddress address, String formula) {
    }

    public int size() {
        return affectedCells.size() + formulasAdjusted.size();
    }
}
