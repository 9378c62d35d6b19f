package com.gridcore.calc.fn;

import com.gridcore.calc.api.CellFunction;
import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FunctionRegistryTest {

    @Test
    public void testBuiltInsAreRegistered() {
        FunctionRegistry registry = new FunctionRegistry();
        for (String name : List.of("SUM", "AVERAGE", "MIN", "MAX", "COUNT", "ROUND", "ABS", "SQRT",
                "CONCATENATE", "LEN", "UPPER", "LOWER", "TRIM", "IF", "AND", "OR", "NOT"))
            assertTrue(name, registry.contains(name));
        assertEquals(17, registry.names().size());
    }

    @Test
    public void testLookupIsCaseInsensitive() {
        FunctionRegistry registry = new FunctionRegistry();
        assertSame(registry.get("SUM"), registry.get("sum"));
        assertNull(registry.get("NOPE"));
    }

    @Test
    public void testCustomFunction() {
        FunctionRegistry registry = new FunctionRegistry();
        CellFunction twice = args -> CellValue.number(2 * ((CellValue.Number) args.get(0)).value());
        registry.register("twice", twice);
        assertEquals(CellValue.number(8), registry.get("TWICE").apply(List.of(CellValue.number(4))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankNameRejected() {
        new FunctionRegistry().register(" ", args -> CellValue.EMPTY);
    }

    @Test
    public void testArityIsChecked() {
        CellFunction abs = new FunctionRegistry().get("ABS");
        try {
            abs.apply(List.of());
            fail("Expected #VALUE!");
        } catch (EvaluationException e) {
            assertEquals(ErrorCode.VALUE, e.errorCode());
            assertEquals("ABS expects 1 argument, got 0", e.getMessage());
        }
    }

    @Test
    public void testUnexpectedFailureBecomesValueError() {
        AbstractCellFunction broken = new AbstractCellFunction("BROKEN", 0, 0) {
            @Override
            protected CellValue calculate(List<CellValue> args) {
                throw new IllegalStateException("boom");
            }
        };
        assertEquals(CellValue.error(ErrorCode.VALUE), broken.apply(List.of()));
    }
}
