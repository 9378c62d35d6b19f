package com.gridcore.calc.fill;

import com.gridcore.calc.model.CellRange;

/**
 * A fill request. {@code pattern} is null when the engine should detect it.
 */
public record FillOperation(CellRange sourceRange, CellRange targetRange, FillDirection direction,
        PatternType pattern) {

    public FillOperation {
        if (sourceRange == null || targetRange == null || direction == null)
            throw new IllegalArgumentException("Source, target and direction are required");
    }

    public static FillOperation of(CellRange source, CellRange target, FillDirection direction) {
        return new FillOperation(source, target, direction, null);
    }
}
