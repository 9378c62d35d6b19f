package com.gridcore.calc.fn.builtin;

import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.fn.FunctionRegistry;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class BuiltinFunctionsTest {

    private final FunctionRegistry registry = new FunctionRegistry();

    private CellValue call(String name, CellValue... args) {
        return registry.get(name).apply(Arrays.asList(args));
    }

    private static CellValue n(double v) {
        return CellValue.number(v);
    }

    private static CellValue s(String v) {
        return CellValue.text(v);
    }

    private static CellValue range(CellValue... values) {
        return CellValue.array(List.of(values));
    }

    @Test
    public void testSum() {
        assertEquals(n(6), call("SUM", n(1), n(2), n(3)));
        assertEquals(n(0), call("SUM"));
        // text and blanks inside a range are skipped
        assertEquals(n(5), call("SUM", range(n(2), s("x"), CellValue.EMPTY, n(3))));
        assertEquals(n(3), call("SUM", s("1"), CellValue.TRUE, n(1)));
    }

    @Test
    public void testSumRejectsNonNumericText() {
        try {
            call("SUM", n(1), s("abc"));
            fail("Expected #VALUE!");
        } catch (EvaluationException e) {
            assertEquals(ErrorCode.VALUE, e.errorCode());
        }
    }

    @Test
    public void testErrorsInRangesPropagate() {
        CellValue div = CellValue.error(ErrorCode.DIV0);
        assertEquals(div, call("SUM", range(n(1), div)));
        assertEquals(div, call("MAX", n(1), div));
    }

    @Test
    public void testAverageMinMax() {
        assertEquals(n(2), call("AVERAGE", range(n(1), n(2), n(3))));
        assertEquals(CellValue.error(ErrorCode.DIV0), call("AVERAGE", range(s("a"))));
        assertEquals(n(-4), call("MIN", n(3), range(n(-4), n(7))));
        assertEquals(n(7), call("MAX", n(3), range(n(-4), n(7))));
        assertEquals(n(0), call("MAX", range(s("a"))));
    }

    @Test
    public void testCount() {
        assertEquals(n(2), call("COUNT", range(n(1), s("x"), n(2), CellValue.error(ErrorCode.REF))));
        assertEquals(n(2), call("COUNT", s("3"), s("x"), n(1), CellValue.EMPTY));
    }

    @Test
    public void testRoundAbsSqrt() {
        assertEquals(n(2.35), call("ROUND", n(2.345), n(2)));
        assertEquals(n(-3), call("ROUND", n(-2.5), n(0)));
        assertEquals(n(1200), call("ROUND", n(1234), n(-2)));
        // digit counts past what a double can hold are clamped
        assertEquals(n(1.5), call("ROUND", n(1.5), n(50_000_000)));
        assertEquals(n(0), call("ROUND", n(1.5), n(-50_000_000)));
        assertEquals(n(0), call("ROUND", n(1e300), n(-400)));
        assertEquals(n(5), call("ABS", n(-5)));
        assertEquals(n(3), call("SQRT", n(9)));
        assertEquals(CellValue.error(ErrorCode.NUM), call("SQRT", n(-1)));
    }

    @Test
    public void testText() {
        assertEquals(s("ab1"), call("CONCATENATE", s("a"), range(s("b"), n(1))));
        assertEquals(n(5), call("LEN", s("hello")));
        assertEquals(n(1), call("LEN", n(7)));
        assertEquals(s("ABC"), call("UPPER", s("aBc")));
        assertEquals(s("abc"), call("LOWER", s("aBc")));
        assertEquals(s("a b c"), call("TRIM", s("  a   b c ")));
    }

    @Test
    public void testIf() {
        assertEquals(s("yes"), call("IF", CellValue.TRUE, s("yes"), s("no")));
        assertEquals(s("no"), call("IF", n(0), s("yes"), s("no")));
        assertEquals(CellValue.FALSE, call("IF", CellValue.FALSE, s("yes")));
        // the branch not taken may hold an error
        assertEquals(s("ok"), call("IF", CellValue.TRUE, s("ok"), CellValue.error(ErrorCode.DIV0)));
        assertEquals(CellValue.error(ErrorCode.REF), call("IF", CellValue.error(ErrorCode.REF), n(1), n(2)));
        // an unchosen range branch is fine, a chosen one is not
        assertEquals(n(2), call("IF", CellValue.FALSE, range(n(1), n(2)), n(2)));
        try {
            call("IF", CellValue.TRUE, range(n(1), n(2)));
            fail("Expected #VALUE!");
        } catch (EvaluationException e) {
            assertEquals(ErrorCode.VALUE, e.errorCode());
            assertTrue(e.getMessage().contains("range"));
        }
    }

    @Test
    public void testLogical() {
        assertEquals(CellValue.TRUE, call("AND", CellValue.TRUE, n(1)));
        assertEquals(CellValue.FALSE, call("AND", CellValue.TRUE, n(0)));
        assertEquals(CellValue.TRUE, call("OR", CellValue.FALSE, range(CellValue.TRUE, s("x"))));
        assertEquals(CellValue.FALSE, call("OR", CellValue.FALSE));
        assertEquals(CellValue.TRUE, call("NOT", CellValue.FALSE));
    }

    @Test
    public void testScalarFunctionsRejectRanges() {
        try {
            call("ABS", range(n(1)));
            fail("Expected #VALUE!");
        } catch (EvaluationException e) {
            assertEquals(ErrorCode.VALUE, e.errorCode());
        }
    }
}
