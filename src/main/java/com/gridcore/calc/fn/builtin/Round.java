package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * {@code ROUND(number, digits)}, half away from zero. Negative digits round to
 * tens, hundreds and so on.
 */
public class Round extends AbstractCellFunction {
    // Beyond these a double has no digit left to round.
    private static final int MIN_DIGITS = -308;
    private static final int MAX_DIGITS = 340;

    public Round() {
        super("ROUND", 2, 2);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        double value = number(args.get(0));
        int digits = (int) Math.max(MIN_DIGITS, Math.min(MAX_DIGITS, number(args.get(1))));
        if (Double.isNaN(value) || Double.isInfinite(value))
            return numberOrNum(value);
        BigDecimal rounded = new BigDecimal(Double.toString(value)).setScale(digits, RoundingMode.HALF_UP);
        return CellValue.number(rounded.doubleValue());
    }
}
