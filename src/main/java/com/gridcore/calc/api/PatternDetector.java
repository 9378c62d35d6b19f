package com.gridcore.calc.api;

import com.gridcore.calc.fill.PatternType;
import com.gridcore.calc.model.CellValue;

import java.util.List;
import java.util.Optional;

/**
 * Infers an extrapolation rule from the sampled values of a fill source.
 */
public interface PatternDetector {

    /** Cheap eligibility filter run before {@link #detect}. */
    boolean canHandle(List<CellValue> values);

    Optional<PatternType> detect(List<CellValue> values);

    /** Higher runs first. */
    int priority();
}
