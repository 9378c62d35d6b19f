package com.gridcore.calc.engine;

import com.gridcore.calc.formula.Expr;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the cell references out of an expression tree.
 */
public final class DependencyAnalyzer {

    private DependencyAnalyzer() {
    }

    /** Every address read by {@code expr}; ranges contribute each of their cells. */
    public static Set<CellAddress> extractDependencies(Expr expr) {
        Set<CellAddress> out = new LinkedHashSet<>();
        collect(expr, out);
        return out;
    }

    private static void collect(Expr expr, Set<CellAddress> out) {
        if (expr instanceof Expr.Reference ref) {
            out.add(ref.address());
        } else if (expr instanceof Expr.Range r) {
            out.addAll(r.range().cells());
        } else if (expr instanceof Expr.UnaryOp u) {
            collect(u.operand(), out);
        } else if (expr instanceof Expr.BinaryOp b) {
            collect(b.left(), out);
            collect(b.right(), out);
        } else if (expr instanceof Expr.FunctionCall call) {
            for (Expr arg : call.args())
                collect(arg, out);
        }
    }

    /** True if {@code expr} reads {@code cell}, directly or through a range. */
    public static boolean referencesCell(Expr expr, CellAddress cell) {
        if (expr instanceof Expr.Reference ref)
            return ref.address().equals(cell);
        if (expr instanceof Expr.Range r)
            return r.range().contains(cell);
        if (expr instanceof Expr.UnaryOp u)
            return referencesCell(u.operand(), cell);
        if (expr instanceof Expr.BinaryOp b)
            return referencesCell(b.left(), cell) || referencesCell(b.right(), cell);
        if (expr instanceof Expr.FunctionCall call) {
            for (Expr arg : call.args())
                if (referencesCell(arg, cell))
                    return true;
        }
        return false;
    }

    /** True if {@code expr} reads any cell inside {@code range}. */
    public static boolean referencesRange(Expr expr, CellRange range) {
        if (expr instanceof Expr.Reference ref)
            return range.contains(ref.address());
        if (expr instanceof Expr.Range r)
            return r.range().intersects(range);
        if (expr instanceof Expr.UnaryOp u)
            return referencesRange(u.operand(), range);
        if (expr instanceof Expr.BinaryOp b)
            return referencesRange(b.left(), range) || referencesRange(b.right(), range);
        if (expr instanceof Expr.FunctionCall call) {
            for (Expr arg : call.args())
                if (referencesRange(arg, range))
                    return true;
        }
        return false;
    }

    /** Number of distinct cells read by {@code expr}. */
    public static int countDependencies(Expr expr) {
        return extractDependencies(expr).size();
    }

    /**
     * Cells covered by the ranges in {@code expr}, counted without listing
     * them. Overlapping ranges count twice.
     */
    public static long countRangeCells(Expr expr) {
        if (expr instanceof Expr.Range r)
            return r.range().size();
        if (expr instanceof Expr.UnaryOp u)
            return countRangeCells(u.operand());
        if (expr instanceof Expr.BinaryOp b)
            return countRangeCells(b.left()) + countRangeCells(b.right());
        long total = 0;
        if (expr instanceof Expr.FunctionCall call) {
            for (Expr arg : call.args())
                total += countRangeCells(arg);
        }
        return total;
    }

    public static boolean hasDependencies(Expr expr) {
        if (expr instanceof Expr.Reference || expr instanceof Expr.Range)
            return true;
        if (expr instanceof Expr.UnaryOp u)
            return hasDependencies(u.operand());
        if (expr instanceof Expr.BinaryOp b)
            return hasDependencies(b.left()) || hasDependencies(b.right());
        if (expr instanceof Expr.FunctionCall call) {
            for (Expr arg : call.args())
                if (hasDependencies(arg))
                    return true;
        }
        return false;
    }
}
