package com.gridcore.calc.util;

import com.gridcore.calc.Spreadsheet;
import com.gridcore.calc.engine.CalculationOrder;
import com.gridcore.calc.engine.DependencyGraph;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

import java.util.Set;

/**
 * Diagnostic text for a sheet: single cells, the calculation order and a
 * Mermaid diagram of the dependency graph.
 *
 * <p>
 * Intended for debugging and logging. Do <b>not</b> call it inside a
 * recalculation listener (it allocates and walks the whole graph).
 */
public final class SheetExplain {
    private final Spreadsheet sheet;

    public SheetExplain(Spreadsheet sheet) {
        this.sheet = sheet;
    }

    /**
     * Dumps the state of a single cell.
     */
    public String explainCell(CellAddress address) {
        Cell cell = sheet.cells().get(address);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Cell: ").append(address).append('\n');
        if (cell == null) {
            sb.append("  (empty)\n");
        } else {
            sb.append("  Raw: ").append(cell.getRawValue().toDisplayString()).append('\n')
                    .append("  Formula: ").append(cell.hasFormula() || cell.isFormulaText()).append('\n')
                    .append("  Value: ").append(cell.getComputedValue().toDisplayString())
                    .append(" (").append(cell.getComputedValue().typeName()).append(")\n");
            if (cell.hasError())
                sb.append("  Error: ").append(cell.getError()).append('\n');
        }
        appendList(sb, "Reads", sheet.getDependencies(address));
        appendList(sb, "Read by", sheet.getDependents(address));
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, Set<CellAddress> cells) {
        sb.append("  ").append(label).append(" (").append(cells.size()).append("): ");
        int i = 0;
        for (CellAddress c : cells) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(c);
        }
        sb.append('\n');
    }

    /** Summary of the last recalculation pass. */
    public String explainLastRecalc() {
        return "Epoch: " + sheet.epoch() + ", Cells: " + sheet.cells().size()
                + ", Edges: " + sheet.dependencyGraph().edgeCount();
    }

    /**
     * Dumps the calculation order, one cell per line, with the cells that read
     * it. Cells on or behind a cycle are marked.
     */
    public String dumpDependencies() {
        CalculationOrder order = sheet.dependencyGraph().calculationOrder();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Dependencies (").append(order.nodeCount()).append(" cells");
        if (order.hasCycles())
            sb.append(", ").append(order.nodeCount() - order.acyclicCount()).append(" cyclic");
        sb.append("):\n");
        for (int i = 0; i < order.nodeCount(); i++) {
            sb.append("  [").append(i).append("] ").append(order.cell(i));
            if (order.isCyclic(i))
                sb.append(" (CYCLE)");
            else if (order.parentCount(i) == 0)
                sb.append(" (SRC)");
            int cc = order.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(order.cell(order.child(i, j)));
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph with an arrow from every cell to each cell that
     * reads it.
     */
    public String toMermaid() {
        DependencyGraph graph = sheet.dependencyGraph();
        CalculationOrder order = graph.calculationOrder();
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        for (int i = 0; i < order.nodeCount(); i++) {
            CellAddress a = order.cell(i);
            Cell cell = sheet.cells().get(a);
            String value = cell == null ? "" : escape(cell.getComputedValue());
            sb.append("  ").append(a).append("[\"").append(a);
            if (!value.isEmpty())
                sb.append(": ").append(value);
            sb.append("\"];\n");
        }
        for (int i = 0; i < order.nodeCount(); i++) {
            CellAddress a = order.cell(i);
            for (int j = 0; j < order.childCount(i); j++)
                sb.append("  ").append(a).append(" --> ").append(order.cell(order.child(i, j))).append(";\n");
        }
        return sb.toString();
    }

    private static String escape(CellValue value) {
        return value.toDisplayString().replace("\"", "#quot;");
    }
}
