package com.gridcore.calc.fill.patterns;

import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.fill.PatternType;
import com.gridcore.calc.model.CellValue;

import java.util.List;
import java.util.Optional;

/** Fallback: matches any non-empty sample. */
public class CopyPatternDetector implements PatternDetector {

    @Override
    public boolean canHandle(List<CellValue> values) {
        return !values.isEmpty();
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        return values.isEmpty() ? Optional.empty() : Optional.of(new PatternType.Copy());
    }

    @Override
    public int priority() {
        return 10;
    }
}
