package com.gridcore.calc.api;

import com.gridcore.calc.fill.FillDirection;
import com.gridcore.calc.model.CellAddress;

/**
 * Rewrites formula text that is being copied from one cell to another.
 */
public interface FormulaAdjuster {

    /**
     * @param formula   formula text, with or without the leading {@code =}
     * @param from      cell the formula was written for
     * @param to        cell the formula is being copied to
     * @param direction fill direction, when the copy is part of a fill
     * @return the rewritten formula text
     */
    String adjustFormula(String formula, CellAddress from, CellAddress to, FillDirection direction);
}
