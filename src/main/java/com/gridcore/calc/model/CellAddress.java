package com.gridcore.calc.model;

import com.gridcore.calc.exception.FormulaParseException;
import com.gridcore.calc.exception.InvalidReferenceException;

/**
 * Zero-based (column, row) coordinate of a cell.
 *
 * <p>
 * A1 text uses base-26 column letters with a 1-indexed digit alphabet
 * (A=1 .. Z=26 internally) mapped to zero-based column numbers, so
 * {@code A -> 0}, {@code Z -> 25}, {@code AA -> 26}, {@code ZZ -> 701}.
 * Ordering is row-major.
 */
public record CellAddress(int col, int row) implements Comparable<CellAddress> {
    /** Column count of the grid (A .. XFD). */
    public static final int MAX_COLUMNS = 16_384;
    /** Row count of the grid. */
    public static final int MAX_ROWS = 1_048_576;

    public CellAddress {
        if (col < 0 || row < 0)
            throw new IllegalArgumentException("Negative cell coordinate: (" + col + ", " + row + ")");
    }

    public static CellAddress of(int col, int row) {
        return new CellAddress(col, row);
    }

    /** Converts a zero-based column number to its letters (0 -> "A", 26 -> "AA"). */
    public static String numberToColumn(int col) {
        if (col < 0)
            throw new IllegalArgumentException("Negative column: " + col);
        StringBuilder sb = new StringBuilder(4);
        int n = col + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Converts column letters to a zero-based column number ("A" -> 0,
     * "AA" -> 26). Letters are case-insensitive.
     *
     * @throws FormulaParseException if the label is empty or not alphabetic.
     */
    public static int columnToNumber(String label) {
        if (label == null || label.isEmpty())
            throw new FormulaParseException("Empty column label");
        long result = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = Character.toUpperCase(label.charAt(i));
            if (c < 'A' || c > 'Z')
                throw new FormulaParseException("Invalid character in column label: " + label.charAt(i), i);
            result = result * 26 + (c - 'A' + 1);
            if (result > Integer.MAX_VALUE)
                throw new InvalidReferenceException("Column out of range: " + label);
        }
        return (int) (result - 1);
    }

    /**
     * Parses A1 notation (optionally with {@code $} anchors, which are ignored).
     *
     * @throws InvalidReferenceException if the address is beyond the grid.
     * @throws FormulaParseException     if the text is not an address.
     */
    public static CellAddress fromA1(String text) {
        if (text == null)
            throw new FormulaParseException("Null address");
        String s = text.trim().replace("$", "");
        int i = 0;
        while (i < s.length() && Character.isLetter(s.charAt(i)))
            i++;
        if (i == 0 || i == s.length())
            throw new FormulaParseException("Invalid address format: " + text);
        String letters = s.substring(0, i);
        String digits = s.substring(i);
        for (int j = 0; j < digits.length(); j++) {
            if (!Character.isDigit(digits.charAt(j)))
                throw new FormulaParseException("Invalid character in address: " + text, i + j);
        }
        return checked(columnToNumber(letters), digits, text);
    }

    /** Builds an address from already-split letters and row digits, enforcing the grid bounds. */
    public static CellAddress checked(int col, String rowDigits, String source) {
        long row;
        try {
            row = Long.parseLong(rowDigits);
        } catch (NumberFormatException e) {
            throw new InvalidReferenceException("Row out of range: " + source);
        }
        if (row == 0)
            throw new FormulaParseException("Row number must be greater than 0: " + source);
        if (col >= MAX_COLUMNS || row > MAX_ROWS)
            throw new InvalidReferenceException("Address outside grid: " + source);
        return new CellAddress(col, (int) row - 1);
    }

    public String toA1() {
        return numberToColumn(col) + (row + 1);
    }

    /**
     * Returns this address moved by the given deltas.
     *
     * @throws IllegalArgumentException if the result would be negative.
     */
    public CellAddress offset(int colDelta, int rowDelta) {
        return new CellAddress(col + colDelta, row + rowDelta);
    }

    public boolean isWithinGrid() {
        return col < MAX_COLUMNS && row < MAX_ROWS;
    }

    @Override
    public int compareTo(CellAddress o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
