package com.gridcore.calc.model;

import com.gridcore.calc.formula.Expr;

import lombok.Getter;

/**
 * Stored state of one cell.
 *
 * <p>
 * For a formula cell {@code rawValue} is the formula text (with its leading
 * {@code =}) and {@code formula} the parsed tree; {@code computedValue} always
 * reflects the last evaluation, whether it succeeded or produced an error.
 * {@code error} holds the message of the last failure and is null otherwise.
 */
@Getter
public final class Cell {
    private final CellValue rawValue;
    private final Expr formula;
    private CellValue computedValue;
    private String error;

    private Cell(CellValue rawValue, Expr formula, CellValue computedValue, String error) {
        this.rawValue = rawValue;
        this.formula = formula;
        this.computedValue = computedValue;
        this.error = error;
    }

    /** A plain value cell; its computed value is the value itself. */
    public static Cell ofValue(CellValue value) {
        return new Cell(value, null, value, null);
    }

    /** A formula cell awaiting its first evaluation. */
    public static Cell ofFormula(String formulaText, Expr formula) {
        return new Cell(CellValue.text(formulaText), formula, CellValue.EMPTY, null);
    }

    /** A formula cell whose text could not be parsed. */
    public static Cell ofParseFailure(String formulaText, ErrorCode code, String message) {
        return new Cell(CellValue.text(formulaText), null, CellValue.error(code), message);
    }

    public boolean hasFormula() {
        return formula != null;
    }

    /** True when the raw text starts with {@code =}, parsed or not. */
    public boolean isFormulaText() {
        return rawValue instanceof CellValue.Text t && t.value().startsWith("=");
    }

    public boolean hasError() {
        return error != null;
    }

    /** Formula text including {@code =}, or null for value cells. */
    public String formulaText() {
        return isFormulaText() ? ((CellValue.Text) rawValue).value() : null;
    }

    public void setComputedValue(CellValue value) {
        this.computedValue = value;
        this.error = null;
    }

    public void setError(CellValue errorValue, String message) {
        this.computedValue = errorValue;
        this.error = message;
    }

    @Override
    public String toString() {
        return "Cell{raw=" + rawValue.toDisplayString() + ", value=" + computedValue.toDisplayString()
                + (error != null ? ", error=" + error : "") + "}";
    }
}
