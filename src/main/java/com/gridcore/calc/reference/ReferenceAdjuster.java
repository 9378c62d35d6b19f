package com.gridcore.calc.reference;

import com.gridcore.calc.api.FormulaAdjuster;
import com.gridcore.calc.fill.FillDirection;
import com.gridcore.calc.model.CellAddress;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shifts the cell references of copied formula text.
 *
 * <p>
 * Every {@code $?letters$?digits} token outside a string literal moves by
 * {@code to - from} on each axis that has no {@code $} anchor. Shifted indices
 * are clamped to the grid (never below A1); anchors and all other text are
 * kept as written. Function names that happen to end in digits ({@code LOG10(})
 * are left alone.
 */
public final class ReferenceAdjuster implements FormulaAdjuster {
    private static final Pattern REFERENCE = Pattern
            .compile("(?<![A-Za-z0-9_$.])(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]+)(?![A-Za-z0-9_(.])");

    @Override
    public String adjustFormula(String formula, CellAddress from, CellAddress to, FillDirection direction) {
        return adjust(formula, to.col() - from.col(), to.row() - from.row());
    }

    /** Shifts relative axes of every reference in {@code formula} by the given deltas. */
    public String adjust(String formula, int colDelta, int rowDelta) {
        StringBuilder out = new StringBuilder(formula.length() + 8);
        int i = 0;
        while (i < formula.length()) {
            int quote = formula.indexOf('"', i);
            if (quote < 0) {
                shiftSegment(out, formula.substring(i), colDelta, rowDelta);
                break;
            }
            shiftSegment(out, formula.substring(i, quote), colDelta, rowDelta);
            int close = closingQuote(formula, quote);
            out.append(formula, quote, close);
            i = close;
        }
        return out.toString();
    }

    // Index just past the literal that opens at 'open'; "" inside is an escaped quote.
    private static int closingQuote(String s, int open) {
        int i = open + 1;
        while (i < s.length()) {
            if (s.charAt(i) == '"') {
                if (i + 1 < s.length() && s.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static void shiftSegment(StringBuilder out, String segment, int colDelta, int rowDelta) {
        Matcher m = REFERENCE.matcher(segment);
        int last = 0;
        while (m.find()) {
            out.append(segment, last, m.start());
            boolean absCol = !m.group(1).isEmpty();
            boolean absRow = !m.group(3).isEmpty();
            int col = CellAddress.columnToNumber(m.group(2));
            long row = Long.parseLong(m.group(4)) - 1;
            if (row < 0 || col >= CellAddress.MAX_COLUMNS || row >= CellAddress.MAX_ROWS) {
                out.append(m.group());
            } else {
                int newCol = absCol ? col : clamp(col + colDelta, CellAddress.MAX_COLUMNS);
                int newRow = absRow ? (int) row : clamp((int) row + rowDelta, CellAddress.MAX_ROWS);
                if (absCol)
                    out.append('$');
                out.append(numberToColumn(newCol));
                if (absRow)
                    out.append('$');
                out.append(newRow + 1);
            }
            last = m.end();
        }
        out.append(segment, last, segment.length());
    }

    private static int clamp(int v, int limit) {
        return Math.max(0, Math.min(v, limit - 1));
    }

    public static String numberToColumn(int col) {
        return CellAddress.numberToColumn(col);
    }

    public static int columnToNumber(String label) {
        return CellAddress.columnToNumber(label);
    }
}
