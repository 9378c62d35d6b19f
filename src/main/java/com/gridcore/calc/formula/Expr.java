package com.gridcore.calc.formula;

import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;

import java.util.List;

/**
 * Formula expression tree produced by {@link FormulaParser}.
 *
 * <p>
 * Nodes are immutable records; a cell's tree is rebuilt, never patched, when the
 * cell is edited or its formula text is rewritten by a structural change.
 */
public interface Expr {

    record Literal(CellValue value) implements Expr {
    }

    /** A single-cell reference; the flags record which axes carry a {@code $} anchor. */
    record Reference(CellAddress address, boolean absoluteCol, boolean absoluteRow) implements Expr {
        public static Reference relative(CellAddress address) {
            return new Reference(address, false, false);
        }
    }

    /** A range reference such as {@code $A1:B$10}. Only legal as a function argument. */
    record Range(CellRange range, boolean absoluteStartCol, boolean absoluteStartRow,
            boolean absoluteEndCol, boolean absoluteEndRow) implements Expr {
        public static Range relative(CellRange range) {
            return new Range(range, false, false, false, false);
        }
    }

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
    }

    record BinaryOp(BinaryOperator op, Expr left, Expr right) implements Expr {
    }

    /** Function call; {@code name} is upper-cased by the parser. */
    record FunctionCall(String name, List<Expr> args) implements Expr {
        public FunctionCall {
            args = List.copyOf(args);
        }
    }
}
