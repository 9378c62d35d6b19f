package com.gridcore.calc.fill;

/**
 * What a {@link PatternType.Copy} fill does with formula cells in its source.
 */
public enum CopyFormulaMode {
    /** Shift relative references by the copy offset, as every other pattern does. */
    ADJUST,
    /** Duplicate the formula text unchanged. */
    VERBATIM
}
