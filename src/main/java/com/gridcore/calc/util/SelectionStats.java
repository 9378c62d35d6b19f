package com.gridcore.calc.util;

import com.gridcore.calc.Spreadsheet;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/**
 * Status-bar statistics over a selection.
 *
 * <p>
 * {@code count} covers every non-empty cell, {@code numericCount} only the
 * numbers. The numeric fields are NaN when the selection holds no number.
 */
public record SelectionStats(int count, int numericCount, double sum, double average, double min, double max) {

    public static SelectionStats of(Spreadsheet sheet, CellRange range) {
        return of(sheet.evaluateRange(range));
    }

    /** Statistics over several selections taken together. */
    public static SelectionStats of(Spreadsheet sheet, List<CellRange> ranges) {
        Accumulator acc = new Accumulator();
        for (CellRange r : ranges)
            for (CellValue v : sheet.evaluateRange(r))
                acc.add(v);
        return acc.result();
    }

    public static SelectionStats of(List<CellValue> values) {
        Accumulator acc = new Accumulator();
        for (CellValue v : values)
            acc.add(v);
        return acc.result();
    }

    public boolean hasNumbers() {
        return numericCount > 0;
    }

    private static final class Accumulator {
        int count;
        int numeric;
        double sum;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        void add(CellValue v) {
            if (v.isEmpty())
                return;
            count++;
            if (v instanceof CellValue.Number n) {
                numeric++;
                sum += n.value();
                min = Math.min(min, n.value());
                max = Math.max(max, n.value());
            }
        }

        SelectionStats result() {
            if (numeric == 0)
                return new SelectionStats(count, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
            return new SelectionStats(count, numeric, sum, sum / numeric, min, max);
        }
    }
}
