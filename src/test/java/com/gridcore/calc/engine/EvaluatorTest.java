package com.gridcore.calc.engine;

import com.gridcore.calc.MapCellStore;
import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.fn.FunctionRegistry;
import com.gridcore.calc.formula.FormulaParser;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class EvaluatorTest {

    private MapCellStore store;
    private SheetEvaluationContext context;
    private Evaluator evaluator;

    @Before
    public void setUp() {
        store = new MapCellStore();
        context = new SheetEvaluationContext(store, new FunctionRegistry(), 512);
        evaluator = context.evaluator();
        put("A1", CellValue.number(10));
        put("A2", CellValue.number(20));
        put("A3", CellValue.number(30));
        put("B1", CellValue.text("hello"));
    }

    private void put(String a1, CellValue v) {
        store.put(CellAddress.fromA1(a1), Cell.ofValue(v));
    }

    private CellValue eval(String formula) {
        return evaluator.evaluate(FormulaParser.parse(formula));
    }

    @Test
    public void testLiteralsAndArithmetic() {
        assertEquals(CellValue.number(2), eval("=1+1"));
        assertEquals(CellValue.number(7), eval("=1+2*3"));
        assertEquals(CellValue.number(4), eval("=-2^2"));
        assertEquals(CellValue.number(0.5), eval("=50%"));
    }

    @Test
    public void testReferences() {
        assertEquals(CellValue.number(30), eval("=A1+A2"));
        assertEquals(CellValue.text("hello world"), eval("=B1&\" world\""));
        // unwritten cells read as empty
        assertEquals(CellValue.number(10), eval("=A1+Z99"));
    }

    @Test
    public void testFunctionsOverRanges() {
        assertEquals(CellValue.number(60), eval("=SUM(A1:A3)"));
        assertEquals(CellValue.number(20), eval("=AVERAGE(A1:A3)"));
        assertEquals(CellValue.text("big"), eval("=IF(SUM(A1:A3)>50,\"big\",\"small\")"));
    }

    @Test
    public void testDivisionByZeroIsAValue() {
        assertEquals(CellValue.error(ErrorCode.DIV0), eval("=1/0"));
        assertEquals(CellValue.error(ErrorCode.DIV0), eval("=(1/0)+A1"));
    }

    @Test
    public void testUnknownFunction() {
        try {
            eval("=FOO(1)");
            fail("Expected #NAME?");
        } catch (EvaluationException e) {
            assertEquals(ErrorCode.NAME, e.errorCode());
            assertTrue(e.getMessage().contains("FOO"));
        }
    }

    @Test
    public void testBareRangeIsValueError() {
        try {
            eval("=A1:A3");
            fail("Expected #VALUE!");
        } catch (EvaluationException e) {
            assertEquals(ErrorCode.VALUE, e.errorCode());
        }
    }

    @Test
    public void testCellOnEvaluationStackReadsAsCircular() {
        CellAddress a1 = CellAddress.fromA1("A1");
        context.pushEvaluation(a1);
        try {
            assertEquals(CellValue.error(ErrorCode.CIRC), eval("=A1+1"));
        } finally {
            context.popEvaluation(a1);
        }
        assertFalse(context.checkCircular(a1));
        assertEquals(CellValue.number(11), eval("=A1+1"));
    }

    @Test
    public void testEvaluateRange() {
        List<CellValue> values = evaluator.evaluateRange(CellRange.parse("A1:B2"));
        assertEquals(List.of(CellValue.number(10), CellValue.text("hello"), CellValue.number(20), CellValue.EMPTY),
                values);
    }
}
