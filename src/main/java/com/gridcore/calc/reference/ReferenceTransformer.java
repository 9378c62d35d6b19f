package com.gridcore.calc.reference;

import com.gridcore.calc.formula.Expr;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the references of an expression tree for a {@link StructuralOperation}.
 *
 * <p>
 * Structural edits move cells, so anchored and relative references are moved
 * alike. A single reference to a deleted cell becomes the {@code #REF!} literal;
 * a range loses only its deleted part and becomes {@code #REF!} once nothing
 * of it survives.
 */
public final class ReferenceTransformer {
    private static final Expr REF_ERROR = new Expr.Literal(CellValue.error(ErrorCode.REF));

    private final StructuralOperation operation;

    public ReferenceTransformer(StructuralOperation operation) {
        this.operation = operation;
    }

    public static Expr transform(Expr expr, StructuralOperation operation) {
        return new ReferenceTransformer(operation).transform(expr);
    }

    public Expr transform(Expr expr) {
        if (expr instanceof Expr.Reference ref)
            return reference(ref);
        if (expr instanceof Expr.Range r)
            return range(r);
        if (expr instanceof Expr.UnaryOp u) {
            Expr operand = transform(u.operand());
            return operand == u.operand() ? u : new Expr.UnaryOp(u.op(), operand);
        }
        if (expr instanceof Expr.BinaryOp b) {
            Expr left = transform(b.left());
            Expr right = transform(b.right());
            return left == b.left() && right == b.right() ? b : new Expr.BinaryOp(b.op(), left, right);
        }
        if (expr instanceof Expr.FunctionCall call) {
            List<Expr> args = new ArrayList<>(call.args().size());
            boolean changed = false;
            for (Expr arg : call.args()) {
                Expr t = transform(arg);
                changed |= t != arg;
                args.add(t);
            }
            return changed ? new Expr.FunctionCall(call.name(), args) : call;
        }
        return expr;
    }

    private Expr reference(Expr.Reference ref) {
        CellAddress moved = operation.relocate(ref.address());
        if (moved == null)
            return REF_ERROR;
        if (moved.equals(ref.address()))
            return ref;
        return new Expr.Reference(moved, ref.absoluteCol(), ref.absoluteRow());
    }

    private Expr range(Expr.Range r) {
        CellAddress start = r.range().start();
        CellAddress end = r.range().end();
        CellAddress newStart;
        CellAddress newEnd;
        if (operation instanceof StructuralOperation.AxisOperation axis) {
            boolean rows = axis.isRowAxis();
            int s = rows ? start.row() : start.col();
            int e = rows ? end.row() : end.col();
            int[] span = axis.mapSpan(Math.min(s, e), Math.max(s, e));
            int limit = rows ? CellAddress.MAX_ROWS : CellAddress.MAX_COLUMNS;
            if (span == null || span[0] >= limit)
                return REF_ERROR;
            int hi = Math.min(span[1], limit - 1);
            // Keep the endpoints in the order they were written.
            int ns = s <= e ? span[0] : hi;
            int ne = s <= e ? hi : span[0];
            newStart = rows ? CellAddress.of(start.col(), ns) : CellAddress.of(ns, start.row());
            newEnd = rows ? CellAddress.of(end.col(), ne) : CellAddress.of(ne, end.row());
        } else {
            newStart = operation.relocate(start);
            newEnd = operation.relocate(end);
            if (newStart == null || newEnd == null)
                return REF_ERROR;
        }
        if (newStart.equals(start) && newEnd.equals(end))
            return r;
        return new Expr.Range(CellRange.of(newStart, newEnd), r.absoluteStartCol(), r.absoluteStartRow(),
                r.absoluteEndCol(), r.absoluteEndRow());
    }
}
