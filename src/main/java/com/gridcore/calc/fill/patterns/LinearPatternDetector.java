package com.gridcore.calc.fill.patterns;

import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.fill.PatternType;
import com.gridcore.calc.model.CellValue;

import java.util.List;
import java.util.Optional;

/**
 * Numbers with a constant difference, e.g. {@code 1, 2, 3} or {@code 10, 7, 4}.
 */
public class LinearPatternDetector implements PatternDetector {
    static final double TOLERANCE = 1e-10;

    @Override
    public boolean canHandle(List<CellValue> values) {
        if (values.size() < 2)
            return false;
        for (CellValue v : values)
            if (!v.isNumber())
                return false;
        return true;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        double[] n = numbers(values);
        double slope = n[1] - n[0];
        for (int i = 2; i < n.length; i++)
            if (Math.abs((n[i] - n[i - 1]) - slope) > TOLERANCE)
                return Optional.empty();
        return Optional.of(new PatternType.Linear(slope));
    }

    @Override
    public int priority() {
        return 80;
    }

    static double[] numbers(List<CellValue> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = ((CellValue.Number) values.get(i)).value();
        return out;
    }
}
