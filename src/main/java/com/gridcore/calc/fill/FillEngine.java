package com.gridcore.calc.fill;

import com.gridcore.calc.api.CellStore;
import com.gridcore.calc.api.FormulaAdjuster;
import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.engine.Operators;
import com.gridcore.calc.fill.FillResult.FilledFormula;
import com.gridcore.calc.fill.FillResult.FilledValue;
import com.gridcore.calc.fill.patterns.CopyPatternDetector;
import com.gridcore.calc.fill.patterns.DatePatternDetector;
import com.gridcore.calc.fill.patterns.ExponentialPatternDetector;
import com.gridcore.calc.fill.patterns.FillDate;
import com.gridcore.calc.fill.patterns.LinearPatternDetector;
import com.gridcore.calc.fill.patterns.NumberedText;
import com.gridcore.calc.fill.patterns.TextPatternDetector;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import lombok.extern.log4j.Log4j2;

/**
 * Extends the values of a source range into a target range.
 *
 * <p>
 * The target is filled line by line along the fill axis: a vertical fill
 * treats each target column separately, reading the matching source column
 * (cyclically when the target is wider). Each line gets its own pattern
 * unless the operation names one. DOWN and RIGHT continue from the last
 * source value; UP and LEFT walk away from the source starting at the cell
 * nearest to it and continue backwards from the first source value.
 *
 * <p>
 * Target cell {@code k} of a line (counting from the source) corresponds to
 * source cell {@code k mod n} in fill order. When that source cell holds a
 * formula the target receives the formula, with references shifted by the
 * {@link FormulaAdjuster}, instead of a generated value.
 */
@Log4j2
public final class FillEngine {
    private final CellStore store;
    private final FormulaAdjuster adjuster;
    private final CopyFormulaMode copyFormulaMode;
    private final List<PatternDetector> detectors = new ArrayList<>();

    public FillEngine(CellStore store, FormulaAdjuster adjuster, CopyFormulaMode copyFormulaMode) {
        this.store = store;
        this.adjuster = adjuster;
        this.copyFormulaMode = copyFormulaMode;
        addDetector(new LinearPatternDetector());
        addDetector(new ExponentialPatternDetector());
        addDetector(new DatePatternDetector());
        addDetector(new TextPatternDetector());
        addDetector(new CopyPatternDetector());
    }

    /** Adds a detector; detectors run highest priority first, ties in insertion order. */
    public void addDetector(PatternDetector detector) {
        detectors.add(detector);
        detectors.sort(Comparator.comparingInt(PatternDetector::priority).reversed());
    }

    public List<PatternDetector> detectors() {
        return List.copyOf(detectors);
    }

    /**
     * Runs the fill.
     *
     * @throws IllegalArgumentException if the source range holds no data.
     */
    public FillResult fill(FillOperation op) {
        if (isBlank(op.sourceRange()))
            throw new IllegalArgumentException("No source values in " + op.sourceRange());
        List<FilledValue> values = new ArrayList<>();
        List<FilledFormula> formulas = new ArrayList<>();
        run(op, values, formulas);
        log.debug("Filled {} from {} ({}): {} value(s), {} formula(s)", op.targetRange(), op.sourceRange(),
                op.direction(), values.size(), formulas.size());
        return new FillResult(values, formulas);
    }

    /** Generated values for every target cell, formulas ignored; empty for a blank source. */
    public List<FilledValue> preview(FillOperation op) {
        List<FilledValue> values = new ArrayList<>();
        if (!isBlank(op.sourceRange()))
            run(op, values, null);
        return values;
    }

    /** First detector that accepts {@code values}; Copy when none does. */
    public PatternType detectPattern(List<CellValue> values) {
        for (PatternDetector d : detectors) {
            if (!d.canHandle(values))
                continue;
            Optional<PatternType> p = d.detect(values);
            if (p.isPresent())
                return p.get();
        }
        return new PatternType.Copy();
    }

    private void run(FillOperation op, List<FilledValue> values, List<FilledFormula> formulas) {
        CellRange source = op.sourceRange().normalized();
        CellRange target = op.targetRange().normalized();
        FillDirection dir = op.direction();
        boolean vertical = dir.isVertical();
        int lineStart = vertical ? target.minCol() : target.minRow();
        int lineEnd = vertical ? target.maxCol() : target.maxRow();
        for (int line = lineStart; line <= lineEnd; line++) {
            List<CellAddress> sourceCells = sourceLine(source, line, vertical);
            List<CellValue> sample = new ArrayList<>(sourceCells.size());
            for (CellAddress a : sourceCells)
                sample.add(valueAt(a));
            PatternType pattern = op.pattern() != null ? op.pattern() : detectPattern(sample);
            if (log.isDebugEnabled())
                log.debug("Fill line {} uses {}", line, pattern);
            List<CellAddress> targetCells = targetLine(target, line, vertical, dir.isForward());
            for (int k = 0; k < targetCells.size(); k++) {
                CellAddress to = targetCells.get(k);
                int si = sourceIndex(k, sample.size(), dir.isForward());
                if (formulas != null) {
                    CellAddress from = sourceCells.get(si);
                    Cell cell = store.get(from);
                    if (cell != null && cell.isFormulaText()) {
                        formulas.add(new FilledFormula(to, formulaFor(cell.formulaText(), from, to, dir, pattern)));
                        continue;
                    }
                }
                values.add(new FilledValue(to, generate(pattern, sample, k + 1, dir.isForward())));
            }
        }
    }

    private String formulaFor(String formula, CellAddress from, CellAddress to, FillDirection dir, PatternType p) {
        if (p instanceof PatternType.Copy && copyFormulaMode == CopyFormulaMode.VERBATIM)
            return formula;
        return adjuster.adjustFormula(formula, from, to, dir);
    }

    /** Value {@code step} cells away from the source (1 = adjacent). */
    static CellValue generate(PatternType pattern, List<CellValue> sample, int step, boolean forward) {
        CellValue anchor = forward ? sample.get(sample.size() - 1) : sample.get(0);
        int signed = forward ? step : -step;
        if (pattern instanceof PatternType.Linear lin) {
            OptionalDouble n = Operators.toNumber(anchor);
            if (n.isPresent())
                return CellValue.number(n.getAsDouble() + signed * lin.slope());
        } else if (pattern instanceof PatternType.Exponential exp) {
            OptionalDouble n = Operators.toNumber(anchor);
            if (n.isPresent())
                return CellValue.number(n.getAsDouble() * Math.pow(exp.rate(), signed));
        } else if (pattern instanceof PatternType.Date date) {
            Optional<FillDate> d = FillDate.parse(anchor);
            if (d.isPresent())
                return d.get().plusDays(signed * date.incrementDays());
        } else if (pattern instanceof PatternType.Text) {
            if (anchor instanceof CellValue.Text t) {
                Optional<NumberedText> nt = NumberedText.parse(t.value());
                if (nt.isPresent())
                    return CellValue.text(nt.get().withNumber(nt.get().number() + signed));
            }
        }
        // Copy, Custom, and any pattern the anchor cannot carry.
        return sample.get(sourceIndex(step - 1, sample.size(), forward));
    }

    private static int sourceIndex(int k, int size, boolean forward) {
        int i = k % size;
        return forward ? i : size - 1 - i;
    }

    private static List<CellAddress> sourceLine(CellRange source, int line, boolean vertical) {
        int first = vertical ? source.minCol() : source.minRow();
        int width = vertical ? source.width() : source.height();
        int fixed = first + Math.floorMod(line - first, width);
        List<CellAddress> cells = new ArrayList<>();
        if (vertical) {
            for (int r = source.minRow(); r <= source.maxRow(); r++)
                cells.add(CellAddress.of(fixed, r));
        } else {
            for (int c = source.minCol(); c <= source.maxCol(); c++)
                cells.add(CellAddress.of(c, fixed));
        }
        return cells;
    }

    private static List<CellAddress> targetLine(CellRange target, int line, boolean vertical, boolean forward) {
        int lo = vertical ? target.minRow() : target.minCol();
        int hi = vertical ? target.maxRow() : target.maxCol();
        List<CellAddress> cells = new ArrayList<>(hi - lo + 1);
        for (int i = 0; i <= hi - lo; i++) {
            int v = forward ? lo + i : hi - i;
            cells.add(vertical ? CellAddress.of(line, v) : CellAddress.of(v, line));
        }
        return cells;
    }

    private CellValue valueAt(CellAddress a) {
        Cell cell = store.get(a);
        return cell == null ? CellValue.EMPTY : cell.getComputedValue();
    }

    private boolean isBlank(CellRange range) {
        for (CellAddress a : range.cells()) {
            Cell cell = store.get(a);
            if (cell != null && (!cell.getComputedValue().isEmpty() || cell.isFormulaText()))
                return false;
        }
        return true;
    }
}
