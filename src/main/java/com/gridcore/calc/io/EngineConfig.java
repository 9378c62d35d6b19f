package com.gridcore.calc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gridcore.calc.fill.CopyFormulaMode;

import lombok.Data;

/**
 * Engine settings, read from {@code gridcalc.json}. Unknown keys are ignored;
 * missing keys keep their defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    /** Deepest chain of stale formula cells evaluated recursively before {@code #NUM!}. */
    private int maxEvaluationDepth = 512;
    private CopyFormulaMode copyFormulaMode = CopyFormulaMode.ADJUST;
    /** Log a warning when an edit closes a reference cycle. */
    private boolean warnOnCycle = true;
    private boolean recalculateOnStructuralChange = true;
    /** Most cells one formula may read through its ranges; larger formulas show {@code #REF!}. */
    private long maxRangeCells = 1_048_576;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /** @throws IllegalArgumentException if a setting is out of range */
    public EngineConfig validate() {
        if (maxEvaluationDepth < 1)
            throw new IllegalArgumentException("maxEvaluationDepth must be at least 1, got " + maxEvaluationDepth);
        if (copyFormulaMode == null)
            throw new IllegalArgumentException("copyFormulaMode must be ADJUST or VERBATIM");
        if (maxRangeCells < 1)
            throw new IllegalArgumentException("maxRangeCells must be at least 1, got " + maxRangeCells);
        return this;
    }
}
