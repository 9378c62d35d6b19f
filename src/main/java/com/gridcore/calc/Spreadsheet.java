package com.gridcore.calc;

import com.gridcore.calc.api.CellStore;
import com.gridcore.calc.api.RecalcListener;
import com.gridcore.calc.engine.DependencyAnalyzer;
import com.gridcore.calc.engine.DependencyGraph;
import com.gridcore.calc.engine.RecalculationEngine;
import com.gridcore.calc.engine.SheetEvaluationContext;
import com.gridcore.calc.exception.FormulaParseException;
import com.gridcore.calc.exception.InvalidReferenceException;
import com.gridcore.calc.fill.FillEngine;
import com.gridcore.calc.fill.FillOperation;
import com.gridcore.calc.fill.FillResult;
import com.gridcore.calc.fn.FunctionRegistry;
import com.gridcore.calc.formula.Expr;
import com.gridcore.calc.formula.FormulaParser;
import com.gridcore.calc.formula.FormulaWriter;
import com.gridcore.calc.io.EngineConfig;
import com.gridcore.calc.io.EngineConfigLoader;
import com.gridcore.calc.model.Cell;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;
import com.gridcore.calc.reference.ReferenceAdjuster;
import com.gridcore.calc.reference.ReferenceTransformer;
import com.gridcore.calc.reference.StructuralOperation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import lombok.extern.log4j.Log4j2;

/**
 * A single sheet: cell storage, formula evaluation and dependency tracking
 * behind one facade.
 *
 * <h2>Editing</h2>
 * <p>
 * {@link #setCell} stores the text, parses it when it starts with {@code =},
 * replaces the cell's edges in the dependency graph and recalculates the cell
 * and everything that transitively reads it, dependencies first. Formula
 * problems never escape as exceptions: a formula that does not parse shows
 * {@code #VALUE!} (or {@code #NAME?} / {@code #REF!}), and one that fails at
 * evaluation shows the matching error value, with the message on
 * {@link Cell#getError()}.
 *
 * <h2>Structural edits</h2>
 * <p>
 * Row and column inserts and deletes, and range moves, relocate the stored
 * cells and rewrite every formula that refers to shifted cells. References to
 * deleted cells become {@code #REF!}; ranges shrink when only part of them is
 * deleted. The graph is rebuilt afterwards and, unless configured otherwise,
 * the whole sheet recalculated.
 *
 * <p>
 * Not thread safe: drive it from one thread.
 */
@Log4j2
public final class Spreadsheet {
    private final EngineConfig config;
    private final CellStore store;
    private final DependencyGraph graph = new DependencyGraph();
    private final FunctionRegistry functions = new FunctionRegistry();
    private final SheetEvaluationContext context;
    private final RecalculationEngine engine;
    private final FillEngine fillEngine;

    /** A sheet configured from the classpath {@code gridcalc.json}, or defaults. */
    public Spreadsheet() {
        this(EngineConfigLoader.load());
    }

    public Spreadsheet(EngineConfig config) {
        this(config, new MapCellStore());
    }

    public Spreadsheet(EngineConfig config, CellStore store) {
        this.config = config.validate();
        this.store = store;
        this.context = new SheetEvaluationContext(store, functions, config.getMaxEvaluationDepth());
        this.engine = new RecalculationEngine(context);
        this.fillEngine = new FillEngine(store, new ReferenceAdjuster(), config.getCopyFormulaMode());
    }

    // --- Cells ---

    /**
     * Writes {@code text} to {@code address} and recalculates what depends on
     * it. Text starting with {@code =} is a formula; anything else is parsed as
     * a number, a boolean or kept as text. Null or empty text clears the cell.
     *
     * @return the stored cell, or an empty value cell when the cell was cleared
     */
    public Cell setCell(CellAddress address, String text) {
        if (text == null || text.isEmpty()) {
            deleteCell(address);
            return Cell.ofValue(CellValue.EMPTY);
        }
        Cell cell = write(address, text);
        recalculate(Set.of(address));
        return cell;
    }

    /** {@link #setCell(CellAddress, String)} with an A1-style address. */
    public Cell setCell(String a1, String text) {
        return setCell(CellAddress.fromA1(a1), text);
    }

    public Optional<CellValue> getCellValue(CellAddress address) {
        return getCell(address).map(Cell::getComputedValue);
    }

    public Optional<CellValue> getCellValue(String a1) {
        return getCellValue(CellAddress.fromA1(a1));
    }

    public Optional<Cell> getCell(CellAddress address) {
        return Optional.ofNullable(store.get(address));
    }

    /**
     * Removes the cell and recalculates its dependents, which now read it as
     * empty.
     *
     * @return true if a cell was stored there
     */
    public boolean deleteCell(CellAddress address) {
        Cell removed = store.remove(address);
        graph.removeDependenciesFor(address);
        recalculate(Set.of(address));
        return removed != null;
    }

    /** Removes every stored cell inside {@code range}; returns how many were removed. */
    public int clearRange(CellRange range) {
        CellRange r = range.normalized();
        Set<CellAddress> cleared = new LinkedHashSet<>();
        for (CellAddress a : store.addresses()) {
            if (r.contains(a)) {
                store.remove(a);
                graph.removeDependenciesFor(a);
                cleared.add(a);
            }
        }
        if (!cleared.isEmpty())
            recalculate(cleared);
        return cleared.size();
    }

    /** Values of {@code range}, row by row; empty slots are {@link CellValue#EMPTY}. */
    public List<CellValue> evaluateRange(CellRange range) {
        return context.evaluator().evaluateRange(range.normalized());
    }

    // --- Dependencies ---

    public Set<CellAddress> getDependents(CellAddress address) {
        return graph.getDependents(address);
    }

    public Set<CellAddress> getDependencies(CellAddress address) {
        return graph.getDependencies(address);
    }

    /** {@code address} and everything that transitively reads it, in evaluation order. */
    public List<CellAddress> getAffectedCells(CellAddress address) {
        return graph.getAffectedCells(Set.of(address));
    }

    /** The changed cells and everything that transitively reads any of them, in evaluation order. */
    public List<CellAddress> getAffectedCells(Set<CellAddress> changed) {
        return graph.getAffectedCells(changed);
    }

    /** Whether making {@code from} read {@code to} would close a reference cycle. */
    public boolean wouldCreateCycle(CellAddress from, CellAddress to) {
        return graph.wouldCreateCycle(from, to);
    }

    // --- Structural edits ---

    public void insertRows(int beforeRow, int count) {
        applyStructural(new StructuralOperation.InsertRows(beforeRow, count));
    }

    public void deleteRows(int startRow, int count) {
        applyStructural(new StructuralOperation.DeleteRows(startRow, count));
    }

    public void insertColumns(int beforeCol, int count) {
        applyStructural(new StructuralOperation.InsertColumns(beforeCol, count));
    }

    public void deleteColumns(int startCol, int count) {
        applyStructural(new StructuralOperation.DeleteColumns(startCol, count));
    }

    /**
     * Moves the cells of {@code from} so its top-left corner lands on
     * {@code to}. Cells already in the destination are overwritten, and
     * references into the moved block follow it.
     */
    public void moveRange(CellRange from, CellAddress to) {
        applyStructural(new StructuralOperation.MoveRange(from, to));
    }

    private void applyStructural(StructuralOperation op) {
        Map<CellAddress, Cell> relocated = new TreeMap<>();
        List<CellAddress> moving = new ArrayList<>();
        int dropped = 0;
        int rewritten = 0;

        // Cells that stay put go first so that moved cells overwrite them.
        for (CellAddress a : store.addresses()) {
            CellAddress target = op.relocate(a);
            if (target == null) {
                dropped++;
            } else if (target.equals(a)) {
                Cell cell = store.get(a);
                Cell updated = rewrite(cell, op);
                if (updated != cell)
                    rewritten++;
                relocated.put(a, updated);
            } else {
                moving.add(a);
            }
        }
        for (CellAddress a : moving) {
            Cell cell = store.get(a);
            Cell updated = rewrite(cell, op);
            if (updated != cell)
                rewritten++;
            relocated.put(op.relocate(a), updated);
        }

        for (CellAddress a : store.addresses())
            store.remove(a);
        graph.clear();
        for (Map.Entry<CellAddress, Cell> e : relocated.entrySet()) {
            Cell cell = e.getValue();
            if (cell.hasFormula()) {
                Cell oversized = checkRangeSize(e.getKey(), cell.formulaText(), cell.getFormula());
                if (oversized != null)
                    cell = oversized;
                else
                    graph.setDependencies(e.getKey(), DependencyAnalyzer.extractDependencies(cell.getFormula()));
            }
            store.put(e.getKey(), cell);
        }
        log.info("{}: {} cell(s) relocated, {} dropped, {} formula(s) rewritten", op, moving.size(), dropped,
                rewritten);

        if (config.isRecalculateOnStructuralChange())
            recalculate();
    }

    /** The cell with its formula rewritten for {@code op}, or the same cell when nothing changed. */
    private static Cell rewrite(Cell cell, StructuralOperation op) {
        if (!cell.hasFormula())
            return cell;
        Expr expr = ReferenceTransformer.transform(cell.getFormula(), op);
        if (expr == cell.getFormula())
            return cell;
        Cell updated = Cell.ofFormula("=" + FormulaWriter.write(expr), expr);
        if (cell.hasError())
            updated.setError(cell.getComputedValue(), cell.getError());
        else
            updated.setComputedValue(cell.getComputedValue());
        return updated;
    }

    // --- Fill ---

    /** Computes a fill without touching the sheet. */
    public FillResult fill(FillOperation op) {
        return fillEngine.fill(op);
    }

    /** Computes a fill, writes its values and formulas, then recalculates the targets. */
    public FillResult applyFill(FillOperation op) {
        FillResult result = fillEngine.fill(op);
        Set<CellAddress> written = new LinkedHashSet<>();
        for (FillResult.FilledValue v : result.affectedCells()) {
            graph.removeDependenciesFor(v.address());
            store.put(v.address(), Cell.ofValue(v.value()));
            written.add(v.address());
        }
        for (FillResult.FilledFormula f : result.formulasAdjusted()) {
            write(f.address(), f.formula());
            written.add(f.address());
        }
        recalculate(written);
        return result;
    }

    // --- Recalculation ---

    /**
     * Re-evaluates every formula cell, dependencies first.
     *
     * @return the number of formula cells evaluated
     */
    public int recalculate() {
        List<CellAddress> order = new ArrayList<>(graph.calculationOrder().cells());
        Set<CellAddress> scheduled = new HashSet<>(order);
        for (CellAddress a : store.addresses()) {
            Cell cell = store.get(a);
            if (cell.hasFormula() && !scheduled.contains(a))
                order.add(a);
        }
        int n = engine.recalculate(order);
        log.info("Full recalculation evaluated {} formula cell(s) in epoch {}", n, engine.epoch());
        return n;
    }

    private void recalculate(Set<CellAddress> changed) {
        engine.recalculate(graph.getAffectedCells(changed));
    }

    public void setListener(RecalcListener listener) {
        engine.setListener(listener);
    }

    /** Number of recalculation passes run so far. */
    public long epoch() {
        return engine.epoch();
    }

    // --- Internals ---

    /** Stores {@code text} at {@code address} and updates its graph edges, without recalculating. */
    private Cell write(CellAddress address, String text) {
        graph.removeDependenciesFor(address);
        Cell cell = text.startsWith("=") ? formulaCell(address, text) : Cell.ofValue(CellValue.parseLiteral(text));
        store.put(address, cell);
        return cell;
    }

    private Cell formulaCell(CellAddress address, String text) {
        Expr expr;
        try {
            expr = FormulaParser.parse(text);
        } catch (InvalidReferenceException e) {
            log.debug("{}: {}", address, e.getMessage());
            return Cell.ofParseFailure(text, ErrorCode.REF, e.getMessage());
        } catch (FormulaParseException e) {
            log.debug("{}: {}", address, e.getMessage());
            return Cell.ofParseFailure(text, e.errorCode(), e.getMessage());
        }
        Cell oversized = checkRangeSize(address, text, expr);
        if (oversized != null)
            return oversized;
        Set<CellAddress> deps = DependencyAnalyzer.extractDependencies(expr);
        if (config.isWarnOnCycle()) {
            for (CellAddress dep : deps) {
                if (graph.wouldCreateCycle(address, dep)) {
                    log.warn("{} closes a reference cycle through {}", address, dep);
                    break;
                }
            }
        }
        graph.setDependencies(address, deps);
        return Cell.ofFormula(text, expr);
    }

    /** A {@code #REF!} cell when {@code expr} reads more cells than configured, otherwise null. */
    private Cell checkRangeSize(CellAddress address, String text, Expr expr) {
        long cells = DependencyAnalyzer.countRangeCells(expr);
        if (cells <= config.getMaxRangeCells())
            return null;
        String message = "Formula reads " + cells + " cells, more than the limit of " + config.getMaxRangeCells();
        log.warn("{}: {}", address, message);
        return Cell.ofParseFailure(text, ErrorCode.REF, message);
    }

    public EngineConfig config() {
        return config;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public DependencyGraph dependencyGraph() {
        return graph;
    }

    public CellStore cells() {
        return store;
    }

    public FillEngine fillEngine() {
        return fillEngine;
    }
}
