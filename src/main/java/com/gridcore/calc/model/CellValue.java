package com.gridcore.calc.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The value held by, or computed for, a cell.
 *
 * <p>
 * One of {@link Empty}, {@link Number}, {@link Text}, {@link Bool},
 * {@link Error} or {@link Array}. Arrays only appear as the expansion of a range
 * argument inside a function call; they are never stored in a cell.
 */
public interface CellValue {

    CellValue EMPTY = new Empty();
    CellValue TRUE = new Bool(true);
    CellValue FALSE = new Bool(false);

    // Plain decimal notation only; Double.parseDouble alone would also accept "NaN" or "1d".
    Pattern NUMERIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    static CellValue number(double value) {
        return new Number(value);
    }

    static CellValue text(String value) {
        return new Text(value);
    }

    static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    static CellValue error(ErrorCode code) {
        return new Error(code.code());
    }

    static CellValue error(String code) {
        return new Error(code);
    }

    static CellValue array(List<CellValue> values) {
        return new Array(values);
    }

    /** Converts plain (non-formula) input text into a typed value. */
    static CellValue parseLiteral(String input) {
        if (input == null || input.isEmpty())
            return EMPTY;
        String trimmed = input.trim();
        if (NUMERIC.matcher(trimmed).matches())
            return new Number(Double.parseDouble(trimmed));
        if (trimmed.equalsIgnoreCase("TRUE"))
            return TRUE;
        if (trimmed.equalsIgnoreCase("FALSE"))
            return FALSE;
        return new Text(input);
    }

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    default boolean isNumber() {
        return this instanceof Number;
    }

    default boolean isText() {
        return this instanceof Text;
    }

    default boolean isError() {
        return this instanceof Error;
    }

    /** Rendering used for concatenation and display. */
    String toDisplayString();

    String typeName();

    record Empty() implements CellValue {
        @Override
        public String toDisplayString() {
            return "";
        }

        @Override
        public String typeName() {
            return "empty";
        }
    }

    record Number(double value) implements CellValue {
        @Override
        public String toDisplayString() {
            return formatNumber(value);
        }

        @Override
        public String typeName() {
            return "number";
        }
    }

    record Text(String value) implements CellValue {
        public Text {
            value = value == null ? "" : value;
        }

        @Override
        public String toDisplayString() {
            return value;
        }

        @Override
        public String typeName() {
            return "text";
        }
    }

    record Bool(boolean value) implements CellValue {
        @Override
        public String toDisplayString() {
            return value ? "TRUE" : "FALSE";
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record Error(String code) implements CellValue {
        public ErrorCode errorCode() {
            return ErrorCode.fromCode(code);
        }

        @Override
        public String toDisplayString() {
            return code;
        }

        @Override
        public String typeName() {
            return "error";
        }
    }

    record Array(List<CellValue> values) implements CellValue {
        public Array {
            values = List.copyOf(values);
        }

        @Override
        public String toDisplayString() {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0)
                    sb.append(',');
                sb.append(values.get(i).toDisplayString());
            }
            return sb.append('}').toString();
        }

        @Override
        public String typeName() {
            return "array";
        }
    }

    /** Integral values print without a fraction ("3", not "3.0"). */
    static String formatNumber(double n) {
        if (n == Math.rint(n) && !Double.isInfinite(n) && Math.abs(n) < 1e15)
            return Long.toString((long) n);
        return Double.toString(n);
    }
}
