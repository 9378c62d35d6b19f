package com.gridcore.calc.fill.patterns;

import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.fill.PatternType;
import com.gridcore.calc.model.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dates (text in a supported layout, or serial numbers) a constant, non-zero
 * number of days apart.
 */
public class DatePatternDetector implements PatternDetector {

    @Override
    public boolean canHandle(List<CellValue> values) {
        if (values.size() < 2)
            return false;
        for (CellValue v : values)
            if (FillDate.parse(v).isEmpty())
                return false;
        return true;
    }

    @Override
    public Optional<PatternType> detect(List<CellValue> values) {
        List<FillDate> dates = new ArrayList<>(values.size());
        for (CellValue v : values) {
            Optional<FillDate> d = FillDate.parse(v);
            if (d.isEmpty())
                return Optional.empty();
            dates.add(d.get());
        }
        long interval = dates.get(0).daysUntil(dates.get(1));
        if (interval == 0)
            return Optional.empty();
        for (int i = 2; i < dates.size(); i++)
            if (dates.get(i - 1).daysUntil(dates.get(i)) != interval)
                return Optional.empty();
        return Optional.of(new PatternType.Date(interval));
    }

    @Override
    public int priority() {
        return 60;
    }
}
