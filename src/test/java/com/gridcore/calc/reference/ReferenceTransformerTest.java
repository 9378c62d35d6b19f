package com.gridcore.calc.reference;

import com.gridcore.calc.formula.Expr;
import com.gridcore.calc.formula.FormulaParser;
import com.gridcore.calc.formula.FormulaWriter;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import org.junit.Test;

import static org.junit.Assert.*;

public class ReferenceTransformerTest {

    private static String apply(String formula, StructuralOperation op) {
        return FormulaWriter.write(ReferenceTransformer.transform(FormulaParser.parse(formula), op));
    }

    @Test
    public void testInsertRowsShiftsReferencesAtOrBelow() {
        StructuralOperation op = new StructuralOperation.InsertRows(1, 2); // before row 2
        assertEquals("A1+A4+$B$5", apply("A1+A2+$B$3", op));
        assertEquals("SUM(A1:A5)", apply("SUM(A1:A3)", op));
    }

    @Test
    public void testInsertColumns() {
        StructuralOperation op = new StructuralOperation.InsertColumns(0, 1);
        assertEquals("B1+C1", apply("A1+B1", op));
    }

    @Test
    public void testDeletedReferenceBecomesRefError() {
        StructuralOperation op = new StructuralOperation.DeleteRows(1, 1); // row 2
        assertEquals("A1+#REF!+A2", apply("A1+A2+A3", op));
    }

    @Test
    public void testRangeShrinksOnPartialDelete() {
        StructuralOperation op = new StructuralOperation.DeleteRows(1, 1);
        assertEquals("SUM(A1:A2)", apply("SUM(A1:A3)", op));
        assertEquals("SUM(A1:A1)", apply("SUM(A1:A2)", op));
        assertEquals("SUM(A2:A4)", apply("SUM(A3:A5)", op));
    }

    @Test
    public void testRangeFullyDeletedBecomesRefError() {
        StructuralOperation op = new StructuralOperation.DeleteColumns(1, 2); // B:C
        assertEquals("SUM(#REF!)", apply("SUM(B1:C9)", op));
        assertEquals("SUM(B1:B9)", apply("SUM(B1:D9)", op));
    }

    @Test
    public void testReversedRangeKeepsWrittenOrder() {
        StructuralOperation op = new StructuralOperation.InsertRows(0, 1);
        assertEquals("SUM(B4:A2)", apply("SUM(B3:A1)", op));
    }

    @Test
    public void testUnaffectedTreeIsReturnedAsIs() {
        Expr e = FormulaParser.parse("SUM(A1:A3)*B1");
        assertSame(e, ReferenceTransformer.transform(e, new StructuralOperation.InsertRows(10, 1)));
    }

    @Test
    public void testMoveRange() {
        StructuralOperation.MoveRange op = new StructuralOperation.MoveRange(CellRange.parse("A1:B2"),
                CellAddress.fromA1("D5"));
        assertEquals(3, op.colOffset());
        assertEquals(4, op.rowOffset());
        assertEquals(CellRange.parse("D5:E6"), op.destination());
        assertEquals("D5+C3+SUM(D5:E6)", apply("A1+C3+SUM(A1:B2)", op));
    }

    @Test
    public void testRelocate() {
        StructuralOperation.AxisOperation del = new StructuralOperation.DeleteRows(2, 3);
        assertEquals(CellAddress.of(0, 1), del.relocate(CellAddress.of(0, 1)));
        assertNull(del.relocate(CellAddress.of(0, 4)));
        assertEquals(CellAddress.of(0, 2), del.relocate(CellAddress.of(0, 5)));
        assertNull(new StructuralOperation.InsertRows(0, 1).relocate(CellAddress.of(0, CellAddress.MAX_ROWS - 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCountRejected() {
        new StructuralOperation.DeleteColumns(0, 0);
    }
}
