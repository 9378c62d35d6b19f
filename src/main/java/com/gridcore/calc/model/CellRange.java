package com.gridcore.calc.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangular block of cells. The endpoints are stored as written (e.g.
 * {@code B5:A1} keeps B5 as start); every accessor that iterates or tests
 * membership works on the normalised bounds.
 */
public record CellRange(CellAddress start, CellAddress end) {

    public static CellRange of(CellAddress start, CellAddress end) {
        return new CellRange(start, end);
    }

    /** Parses {@code "A1:B3"}; a single address yields a one-cell range. */
    public static CellRange parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            CellAddress a = CellAddress.fromA1(text);
            return new CellRange(a, a);
        }
        return new CellRange(CellAddress.fromA1(text.substring(0, colon)),
                CellAddress.fromA1(text.substring(colon + 1)));
    }

    public int minCol() {
        return Math.min(start.col(), end.col());
    }

    public int maxCol() {
        return Math.max(start.col(), end.col());
    }

    public int minRow() {
        return Math.min(start.row(), end.row());
    }

    public int maxRow() {
        return Math.max(start.row(), end.row());
    }

    public int width() {
        return maxCol() - minCol() + 1;
    }

    public int height() {
        return maxRow() - minRow() + 1;
    }

    public CellRange normalized() {
        return new CellRange(new CellAddress(minCol(), minRow()), new CellAddress(maxCol(), maxRow()));
    }

    public boolean contains(CellAddress addr) {
        return addr.col() >= minCol() && addr.col() <= maxCol()
                && addr.row() >= minRow() && addr.row() <= maxRow();
    }

    public boolean intersects(CellRange other) {
        return minCol() <= other.maxCol() && other.minCol() <= maxCol()
                && minRow() <= other.maxRow() && other.minRow() <= maxRow();
    }

    public long size() {
        return (long) width() * height();
    }

    /** All cells, row by row, left to right. */
    public List<CellAddress> cells() {
        List<CellAddress> out = new ArrayList<>((int) Math.min(size(), 1 << 16));
        for (int r = minRow(); r <= maxRow(); r++)
            for (int c = minCol(); c <= maxCol(); c++)
                out.add(new CellAddress(c, r));
        return out;
    }

    @Override
    public String toString() {
        return start.toA1() + ":" + end.toA1();
    }
}
