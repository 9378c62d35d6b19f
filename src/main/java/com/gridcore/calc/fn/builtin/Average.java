package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.fn.AbstractCellFunction;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.List;

/**
 * Arithmetic mean of the numeric arguments; {@code #DIV/0!} when there are none.
 */
public class Average extends AbstractCellFunction {
    public Average() {
        super("AVERAGE", 1, UNBOUNDED);
    }

    @Override
    protected CellValue calculate(List<CellValue> args) {
        List<Double> values = numbers(args);
        if (values.isEmpty())
            return CellValue.error(ErrorCode.DIV0);
        double sum = 0.0;
        for (double d : values)
            sum += d;
        return numberOrNum(sum / values.size());
    }
}
