package com.gridcore.calc.util;

import com.gridcore.calc.Spreadsheet;
import com.gridcore.calc.io.EngineConfig;
import com.gridcore.calc.model.CellAddress;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SheetExplainTest {

    private Spreadsheet sheet;
    private SheetExplain explain;

    @Before
    public void setUp() {
        sheet = new Spreadsheet(EngineConfig.defaults());
        sheet.setCell("A1", "1");
        sheet.setCell("B1", "=A1+1");
        sheet.setCell("C1", "=B1*2");
        explain = new SheetExplain(sheet);
    }

    @Test
    public void testExplainCell() {
        String out = explain.explainCell(CellAddress.fromA1("B1"));
        assertTrue(out.contains("Cell: B1"));
        assertTrue(out.contains("Raw: =A1+1"));
        assertTrue(out.contains("Formula: true"));
        assertTrue(out.contains("Value: 2 (number)"));
        assertTrue(out.contains("Reads (1): A1"));
        assertTrue(out.contains("Read by (1): C1"));
        assertFalse(out.contains("Error:"));
    }

    @Test
    public void testExplainErrorAndEmptyCells() {
        sheet.setCell("D1", "=1/0");
        assertTrue(explain.explainCell(CellAddress.fromA1("D1")).contains("Error: Division by zero"));
        assertTrue(explain.explainCell(CellAddress.fromA1("Z9")).contains("(empty)"));
    }

    @Test
    public void testDumpDependencies() {
        String out = explain.dumpDependencies();
        assertTrue(out.startsWith("Dependencies (3 cells):"));
        assertTrue(out.contains("[0] A1 (SRC) -> B1"));
        assertTrue(out.contains("[1] B1 -> C1"));
        assertTrue(out.contains("[2] C1\n"));
    }

    @Test
    public void testDumpMarksCycles() {
        sheet.setCell("E1", "=F1");
        sheet.setCell("F1", "=E1");
        String out = explain.dumpDependencies();
        assertTrue(out.contains("2 cyclic"));
        assertTrue(out.contains("E1 (CYCLE)"));
    }

    @Test
    public void testMermaid() {
        String out = explain.toMermaid();
        assertTrue(out.startsWith("graph TD;\n"));
        assertTrue(out.contains("A1[\"A1: 1\"];"));
        assertTrue(out.contains("C1[\"C1: 4\"];"));
        assertTrue(out.contains("A1 --> B1;"));
        assertTrue(out.contains("B1 --> C1;"));
    }

    @Test
    public void testExplainLastRecalc() {
        assertEquals("Epoch: 3, Cells: 3, Edges: 2", explain.explainLastRecalc());
    }
}
