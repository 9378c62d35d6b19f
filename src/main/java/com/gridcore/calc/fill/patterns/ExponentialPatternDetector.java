package com.gridcore.calc.fill.patterns;

import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.fill.PatternType;
import com.gridcore.calc.model.CellValue;

import java.util.List;
import java.util.Optional;

/**
 * Non-zero numbers with a constant ratio other than 1, e.g. {@code 1, 2, 4, 8}.
 */
public class ExponentialPatternDetector implements PatternDetector {

    @Override
    public boolean canHandle(List<CellValue> values) {
        if (values.size() < 2)
            return false;
        for (CellValue v : values)
            if (!(v instanceof CellValue.Number n) || n.value() == 0.0)
                return false;
        return true;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        double[] n = LinearPatternDetector.numbers(values);
        double rate = n[1] / n[0];
        for (int i = 2; i < n.length; i++)
            if (Math.abs(n[i] / n[i - 1] - rate) > LinearPatternDetector.TOLERANCE)
                return Optional.empty();
        if (Math.abs(rate - 1.0) <= LinearPatternDetector.TOLERANCE)
            return Optional.empty();
        return Optional.of(new PatternType.Exponential(rate));
    }

    @Override
    public int priority() {
        return 70;
    }
}
