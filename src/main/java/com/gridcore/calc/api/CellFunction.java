package com.gridcore.calc.api;

import com.gridcore.calc.model.CellValue;

import java.util.List;

/**
 * A spreadsheet function such as {@code SUM}. Arguments arrive already
 * evaluated; a range argument arrives as a single {@link CellValue.Array}.
 */
@FunctionalInterface
public interface CellFunction {
    CellValue apply(List<CellValue> args);
}
