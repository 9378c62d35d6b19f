package com.gridcore.calc.formula;

import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

/**
 * Renders an {@link Expr} back to formula text (without the leading {@code =}).
 * {@code $} anchors are kept and parentheses are emitted only where the
 * operator binding requires them, so {@code parse(write(e))} yields an
 * equivalent tree.
 */
public final class FormulaWriter {

    private FormulaWriter() {
    }

    public static String write(Expr expr) {
        StringBuilder sb = new StringBuilder(32);
        append(sb, expr);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Expr expr) {
        if (expr instanceof Expr.Literal lit) {
            literal(sb, lit.value());
        } else if (expr instanceof Expr.Reference ref) {
            address(sb, ref.address(), ref.absoluteCol(), ref.absoluteRow());
        } else if (expr instanceof Expr.Range r) {
            address(sb, r.range().start(), r.absoluteStartCol(), r.absoluteStartRow());
            sb.append(':');
            address(sb, r.range().end(), r.absoluteEndCol(), r.absoluteEndRow());
        } else if (expr instanceof Expr.UnaryOp u) {
            if (u.op().isPostfix()) {
                boolean wrap = u.operand() instanceof Expr.BinaryOp
                        || (u.operand() instanceof Expr.UnaryOp inner && !inner.op().isPostfix());
                operand(sb, u.operand(), wrap);
                sb.append(u.op().symbol());
            } else {
                sb.append(u.op().symbol());
                operand(sb, u.operand(), u.operand() instanceof Expr.BinaryOp);
            }
        } else if (expr instanceof Expr.BinaryOp b) {
            int prec = b.op().precedence();
            boolean wrapLeft = b.left() instanceof Expr.BinaryOp l
                    && (l.op().precedence() < prec || (l.op().precedence() == prec && b.op().isRightAssociative()));
            boolean wrapRight = b.right() instanceof Expr.BinaryOp r
                    && (r.op().precedence() < prec || (r.op().precedence() == prec && !b.op().isRightAssociative()));
            operand(sb, b.left(), wrapLeft);
            sb.append(b.op().symbol());
            operand(sb, b.right(), wrapRight);
        } else if (expr instanceof Expr.FunctionCall call) {
            sb.append(call.name()).append('(');
            for (int i = 0; i < call.args().size(); i++) {
                if (i > 0)
                    sb.append(',');
                append(sb, call.args().get(i));
            }
            sb.append(')');
        } else {
            throw new IllegalArgumentException("Unknown expression node: " + expr);
        }
    }

    private static void operand(StringBuilder sb, Expr e, boolean parenthesize) {
        if (parenthesize)
            sb.append('(');
        append(sb, e);
        if (parenthesize)
            sb.append(')');
    }

    private static void literal(StringBuilder sb, CellValue v) {
        if (v instanceof CellValue.Text t) {
            sb.append('"').append(t.value().replace("\"", "\"\"")).append('"');
        } else if (v instanceof CellValue.Number n && n.value() < 0) {
            sb.append('(').append(v.toDisplayString()).append(')');
        } else if (v instanceof CellValue.Array) {
            throw new IllegalArgumentException("Array values have no formula syntax");
        } else if (v.isEmpty()) {
            sb.append("\"\"");
        } else {
            sb.append(v.toDisplayString());
        }
    }

    static void address(StringBuilder sb, CellAddress a, boolean absCol, boolean absRow) {
        if (absCol)
            sb.append('$');
        sb.append(CellAddress.numberToColumn(a.col()));
        if (absRow)
            sb.append('$');
        sb.append(a.row() + 1);
    }
}
