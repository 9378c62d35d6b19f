package com.gridcore.calc.fill;

import com.gridcore.calc.MapCellStore;
import com.gridcore.calc.api.PatternDetector;
import com.gridcore.calc.fill.FillResult.FilledFormula;
import com.gridcore.calc.fill.FillResult.FilledValue;
import com.gridcore.calc.formula.FormulaParser;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.reference.ReferenceAdjuster;
import org.junit.Before;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class FillEngineTest {

    private MapCellStore store;
    private FillEngine engine;

    @Before
    public void setUp() {
        store = new MapCellStore();
        engine = new FillEngine(store, new ReferenceAdjuster(), CopyFormulaMode.ADJUST);
    }

    private void value(String a1, CellValue v) {
        store.put(CellAddress.fromA1(a1), Cell.ofValue(v));
    }

    private void formula(String a1, String text, CellValue computed) {
        Cell cell = Cell.ofFormula(text, FormulaParser.parse(text));
        cell.setComputedValue(computed);
        store.put(CellAddress.fromA1(a1), cell);
    }

    private static FillOperation op(String source, String target, FillDirection dir) {
        return FillOperation.of(CellRange.parse(source), CellRange.parse(target), dir);
    }

    private static FilledValue filled(String a1, CellValue v) {
        return new FilledValue(CellAddress.fromA1(a1), v);
    }

    @Test
    public void testFillDownContinuesLinearSeries() {
        value("A1", CellValue.number(1));
        value("A2", CellValue.number(2));
        value("A3", CellValue.number(3));

        FillResult result = engine.fill(op("A1:A3", "A4:A6", FillDirection.DOWN));

        assertEquals(List.of(
                filled("A4", CellValue.number(4)),
                filled("A5", CellValue.number(5)),
                filled("A6", CellValue.number(6))), result.affectedCells());
        assertTrue(result.formulasAdjusted().isEmpty());
    }

    @Test
    public void testFillUpWalksAwayFromSource() {
        value("A4", CellValue.number(10));
        value("A5", CellValue.number(20));
        value("A6", CellValue.number(30));

        FillResult result = engine.fill(op("A4:A6", "A1:A3", FillDirection.UP));

        // nearest cell first, extrapolated backwards from the first source value
        assertEquals(List.of(
                filled("A3", CellValue.number(0)),
                filled("A2", CellValue.number(-10)),
                filled("A1", CellValue.number(-20))), result.affectedCells());
    }

    @Test
    public void testFillRightWithNumberedText() {
        value("A1", CellValue.text("Item 1"));
        value("B1", CellValue.text("Item 2"));

        FillResult result = engine.fill(op("A1:B1", "C1:D1", FillDirection.RIGHT));

        assertEquals(List.of(
                filled("C1", CellValue.text("Item 3")),
                filled("D1", CellValue.text("Item 4"))), result.affectedCells());
    }

    @Test
    public void testFillLeftWithDates() {
        value("C1", CellValue.text("2024-03-01"));
        value("D1", CellValue.text("2024-03-02"));

        FillResult result = engine.fill(op("C1:D1", "A1:B1", FillDirection.LEFT));

        assertEquals(List.of(
                filled("B1", CellValue.text("2024-02-29")),
                filled("A1", CellValue.text("2024-02-28"))), result.affectedCells());
    }

    @Test
    public void testEachColumnGetsItsOwnPattern() {
        value("A1", CellValue.number(1));
        value("A2", CellValue.number(2));
        value("B1", CellValue.number(3));
        value("B2", CellValue.number(9));

        FillResult result = engine.fill(op("A1:B2", "A3:B4", FillDirection.DOWN));

        assertEquals(List.of(
                filled("A3", CellValue.number(3)),
                filled("A4", CellValue.number(4)),
                filled("B3", CellValue.number(15)),
                filled("B4", CellValue.number(21))), result.affectedCells());
    }

    @Test
    public void testCopyRepeatsCyclically() {
        value("A1", CellValue.text("x"));
        value("A2", CellValue.TRUE);

        List<FilledValue> values = engine.fill(op("A1:A2", "A3:A6", FillDirection.DOWN)).affectedCells();

        assertEquals(CellValue.text("x"), values.get(0).value());
        assertEquals(CellValue.TRUE, values.get(1).value());
        assertEquals(CellValue.text("x"), values.get(2).value());
        assertEquals(CellValue.TRUE, values.get(3).value());
    }

    @Test
    public void testExplicitPatternOverridesDetection() {
        value("A1", CellValue.number(1));

        FillOperation fillOp = new FillOperation(CellRange.parse("A1"), CellRange.parse("A2:A3"),
                FillDirection.DOWN, new PatternType.Linear(10));
        List<FilledValue> values = engine.fill(fillOp).affectedCells();

        assertEquals(CellValue.number(11), values.get(0).value());
        assertEquals(CellValue.number(21), values.get(1).value());
    }

    @Test
    public void testFormulaSourcesAreShifted() {
        formula("B1", "=A1*2", CellValue.EMPTY);
        formula("B2", "=A2*2", CellValue.EMPTY);

        FillResult result = engine.fill(op("B1:B2", "B3:B4", FillDirection.DOWN));

        assertTrue(result.affectedCells().isEmpty());
        assertEquals(List.of(
                new FilledFormula(CellAddress.fromA1("B3"), "=A3*2"),
                new FilledFormula(CellAddress.fromA1("B4"), "=A4*2")), result.formulasAdjusted());
    }

    @Test
    public void testVerbatimModeKeepsCopiedFormulas() {
        engine = new FillEngine(store, new ReferenceAdjuster(), CopyFormulaMode.VERBATIM);
        formula("B1", "=A1*2", CellValue.EMPTY);

        FillResult result = engine.fill(op("B1", "B2:B3", FillDirection.DOWN));

        assertEquals("=A1*2", result.formulasAdjusted().get(0).formula());
        assertEquals("=A1*2", result.formulasAdjusted().get(1).formula());
    }

    @Test
    public void testMixedSourceSplitsValuesAndFormulas() {
        value("A1", CellValue.number(1));
        formula("A2", "=A1+1", CellValue.number(2));

        FillResult result = engine.fill(op("A1:A2", "A3:A6", FillDirection.DOWN));

        assertEquals(4, result.size());
        Set<CellAddress> seen = new HashSet<>();
        for (FilledValue v : result.affectedCells())
            assertTrue(seen.add(v.address()));
        for (FilledFormula f : result.formulasAdjusted())
            assertTrue(seen.add(f.address()));
        assertEquals(4, seen.size());

        assertEquals(List.of(filled("A3", CellValue.number(3)), filled("A5", CellValue.number(5))),
                result.affectedCells());
        assertEquals(new FilledFormula(CellAddress.fromA1("A4"), "=A3+1"), result.formulasAdjusted().get(0));
        assertEquals(new FilledFormula(CellAddress.fromA1("A6"), "=A5+1"), result.formulasAdjusted().get(1));
    }

    @Test
    public void testBlankSourceIsRejected() {
        try {
            engine.fill(op("A1:A3", "A4:A6", FillDirection.DOWN));
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("No source values"));
        }
        assertTrue(engine.preview(op("A1:A3", "A4:A6", FillDirection.DOWN)).isEmpty());
    }

    @Test
    public void testPreviewIgnoresFormulas() {
        value("A1", CellValue.number(5));
        formula("A2", "=A1*2", CellValue.number(10));

        List<FilledValue> preview = engine.preview(op("A1:A2", "A3:A4", FillDirection.DOWN));

        assertEquals(List.of(filled("A3", CellValue.number(15)), filled("A4", CellValue.number(20))), preview);
    }

    @Test
    public void testDetectionPriority() {
        // two points fit both linear and exponential; linear wins
        assertEquals(new PatternType.Linear(2), engine.detectPattern(List.of(CellValue.number(2), CellValue.number(4))));
        assertEquals(new PatternType.Exponential(2), engine.detectPattern(
                List.of(CellValue.number(1), CellValue.number(2), CellValue.number(4), CellValue.number(8))));
        assertEquals(new PatternType.Copy(), engine.detectPattern(List.of(CellValue.text("a"), CellValue.text("b"))));
        assertEquals(5, engine.detectors().size());
    }

    @Test
    public void testCustomDetectorRunsByPriority() {
        engine.addDetector(new PatternDetector() {
            @Override
            public boolean canHandle(List<CellValue> values) {
                return true;
            }

            @Override
            public Optional<PatternType> detect(List<CellValue> values) {
                return Optional.of(new PatternType.Custom("weekdays"));
            }

            @Override
            public int priority() {
                return 100;
            }
        });

        assertEquals(new PatternType.Custom("weekdays"),
                engine.detectPattern(List.of(CellValue.number(1), CellValue.number(2))));
        assertEquals(100, engine.detectors().get(0).priority());
    }

    @Test
    public void testGenerateFallsBackToCopyWhenAnchorDoesNotFit() {
        List<CellValue> sample = List.of(CellValue.text("abc"));
        assertEquals(CellValue.text("abc"), FillEngine.generate(new PatternType.Linear(1), sample, 3, true));
    }
}
