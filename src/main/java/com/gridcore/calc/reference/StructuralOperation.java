package com.gridcore.calc.reference;

import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;

/**
 * A row/column insertion or deletion, or a block move.
 *
 * <p>
 * {@link #relocate} says where a cell ends up; {@code null} means the cell
 * was deleted or pushed beyond the grid.
 */
public interface StructuralOperation {

    CellAddress relocate(CellAddress address);

    /** Insert/delete operations act on a single axis; see {@link AxisOperation}. */
    interface AxisOperation extends StructuralOperation {
        boolean isRowAxis();

        /** New index of a single row/column, or -1 when it no longer exists. */
        int mapIndex(int index);

        /**
         * New bounds of the span {@code [lo, hi]}, or null when every index in it
         * was deleted. Bounds inside a deleted band are pulled to the surviving
         * edge.
         */
        int[] mapSpan(int lo, int hi);

        @Override
        default CellAddress relocate(CellAddress a) {
            int limit = isRowAxis() ? CellAddress.MAX_ROWS : CellAddress.MAX_COLUMNS;
            int mapped = mapIndex(isRowAxis() ? a.row() : a.col());
            if (mapped < 0 || mapped >= limit)
                return null;
            return isRowAxis() ? CellAddress.of(a.col(), mapped) : CellAddress.of(mapped, a.row());
        }
    }

    record InsertRows(int beforeRow, int count) implements AxisOperation {
        public InsertRows {
            requireValid(beforeRow, count);
        }

        @Override
        public boolean isRowAxis() {
            return true;
        }

        @Override
        public int mapIndex(int index) {
            return insertIndex(index, beforeRow, count);
        }

        @Override
        public int[] mapSpan(int lo, int hi) {
            return new int[] { mapIndex(lo), mapIndex(hi) };
        }
    }

    record InsertColumns(int beforeCol, int count) implements AxisOperation {
        public InsertColumns {
            requireValid(beforeCol, count);
        }

        @Override
        public boolean isRowAxis() {
            return false;
        }

        @Override
        public int mapIndex(int index) {
            return insertIndex(index, beforeCol, count);
        }

        @Override
        public int[] mapSpan(int lo, int hi) {
            return new int[] { mapIndex(lo), mapIndex(hi) };
        }
    }

    record DeleteRows(int startRow, int count) implements AxisOperation {
        public DeleteRows {
            requireValid(startRow, count);
        }

        @Override
        public boolean isRowAxis() {
            return true;
        }

        @Override
        public int mapIndex(int index) {
            return deleteIndex(index, startRow, count);
        }

        @Override
        public int[] mapSpan(int lo, int hi) {
            return deleteSpan(lo, hi, startRow, count);
        }
    }

    record DeleteColumns(int startCol, int count) implements AxisOperation {
        public DeleteColumns {
            requireValid(startCol, count);
        }

        @Override
        public boolean isRowAxis() {
            return false;
        }

        @Override
        public int mapIndex(int index) {
            return deleteIndex(index, startCol, count);
        }

        @Override
        public int[] mapSpan(int lo, int hi) {
            return deleteSpan(lo, hi, startCol, count);
        }
    }

    /** Moves the block {@code from} so that its top-left corner lands on {@code to}. */
    record MoveRange(CellRange from, CellAddress to) implements StructuralOperation {
        public MoveRange {
            from = from.normalized();
        }

        public int colOffset() {
            return to.col() - from.start().col();
        }

        public int rowOffset() {
            return to.row() - from.start().row();
        }

        @Override
        public CellAddress relocate(CellAddress a) {
            if (!from.contains(a))
                return a;
            int col = a.col() + colOffset();
            int row = a.row() + rowOffset();
            if (col < 0 || row < 0 || col >= CellAddress.MAX_COLUMNS || row >= CellAddress.MAX_ROWS)
                return null;
            return CellAddress.of(col, row);
        }

        /** The block's footprint after the move. */
        public CellRange destination() {
            return CellRange.of(to, CellAddress.of(to.col() + from.width() - 1, to.row() + from.height() - 1));
        }
    }

    private static void requireValid(int index, int count) {
        if (index < 0)
            throw new IllegalArgumentException("Negative index: " + index);
        if (count <= 0)
            throw new IllegalArgumentException("Count must be positive: " + count);
    }

    private static int insertIndex(int index, int at, int count) {
        return index >= at ? index + count : index;
    }

    private static int deleteIndex(int index, int at, int count) {
        if (index < at)
            return index;
        return index >= at + count ? index - count : -1;
    }

    private static int[] deleteSpan(int lo, int hi, int at, int count) {
        int end = at + count;
        if (lo >= at && hi < end)
            return null;
        int newLo = lo < at ? lo : (lo >= end ? lo - count : at);
        int newHi = hi >= end ? hi - count : (hi >= at ? at - 1 : hi);
        return new int[] { newLo, newHi };
    }
}
