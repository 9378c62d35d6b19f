package com.gridcore.calc.engine;

import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.formula.BinaryOperator;
import com.gridcore.calc.formula.UnaryOperator;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.OptionalDouble;

/**
 * Operator semantics and value coercions.
 *
 * <p>
 * Error operands propagate unchanged (left operand first). Arithmetic faults
 * come back as error values, never as exceptions.
 */
public final class Operators {
    private static final double EQUALITY_EPSILON = Math.ulp(1.0);

    private Operators() {
    }

    public static CellValue unary(UnaryOperator op, CellValue operand) {
        if (operand.isError())
            return operand;
        OptionalDouble n = toNumber(operand);
        if (n.isEmpty())
            return CellValue.error(ErrorCode.VALUE);
        return switch (op) {
            case NEGATE -> CellValue.number(-n.getAsDouble());
            case PLUS -> CellValue.number(n.getAsDouble());
            case PERCENT -> CellValue.number(n.getAsDouble() / 100.0);
        };
    }

    public static CellValue binary(BinaryOperator op, CellValue left, CellValue right) {
        if (left.isError())
            return left;
        if (right.isError())
            return right;
        return switch (op) {
            case ADD -> add(left, right);
            case SUBTRACT, MULTIPLY, DIVIDE, POWER -> arithmetic(op, left, right);
            case CONCAT -> CellValue.text(toText(left) + toText(right));
            case EQUAL -> CellValue.bool(valuesEqual(left, right));
            case NOT_EQUAL -> CellValue.bool(!valuesEqual(left, right));
            case LESS_THAN -> CellValue.bool(compare(left, right) < 0);
            case LESS_THAN_OR_EQUAL -> CellValue.bool(compare(left, right) <= 0);
            case GREATER_THAN -> CellValue.bool(compare(left, right) > 0);
            case GREATER_THAN_OR_EQUAL -> CellValue.bool(compare(left, right) >= 0);
        };
    }

    // Numeric addition when both sides coerce, otherwise text concatenation.
    private static CellValue add(CellValue left, CellValue right) {
        OptionalDouble l = toNumber(left);
        OptionalDouble r = toNumber(right);
        if (l.isPresent() && r.isPresent())
            return CellValue.number(l.getAsDouble() + r.getAsDouble());
        if (left.isText() || right.isText())
            return CellValue.text(toText(left) + toText(right));
        return CellValue.error(ErrorCode.VALUE);
    }

    private static CellValue arithmetic(BinaryOperator op, CellValue left, CellValue right) {
        OptionalDouble l = toNumber(left);
        OptionalDouble r = toNumber(right);
        if (l.isEmpty() || r.isEmpty())
            return CellValue.error(ErrorCode.VALUE);
        double a = l.getAsDouble();
        double b = r.getAsDouble();
        switch (op) {
            case SUBTRACT:
                return CellValue.number(a - b);
            case MULTIPLY:
                return CellValue.number(a * b);
            case DIVIDE:
                if (b == 0.0)
                    return CellValue.error(ErrorCode.DIV0);
                return CellValue.number(a / b);
            case POWER: {
                double p = Math.pow(a, b);
                if (Double.isNaN(p) || Double.isInfinite(p))
                    return CellValue.error(ErrorCode.NUM);
                return CellValue.number(p);
            }
            default:
                throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        }
    }

    static boolean valuesEqual(CellValue left, CellValue right) {
        if (left instanceof CellValue.Number l && right instanceof CellValue.Number r)
            return Math.abs(l.value() - r.value()) < EQUALITY_EPSILON;
        if (left.getClass() != right.getClass())
            return false;
        return left.equals(right);
    }

    /**
     * Total order used by comparison operators: empty sorts first, same-typed
     * values compare naturally (false before true), mixed types compare
     * numerically when both coerce and as text otherwise.
     */
    static int compare(CellValue left, CellValue right) {
        if (left instanceof CellValue.Number l && right instanceof CellValue.Number r)
            return Double.compare(l.value(), r.value());
        if (left instanceof CellValue.Text l && right instanceof CellValue.Text r)
            return Integer.signum(l.value().compareTo(r.value()));
        if (left instanceof CellValue.Bool l && right instanceof CellValue.Bool r)
            return Boolean.compare(l.value(), r.value());
        if (left.isEmpty() || right.isEmpty())
            return left.isEmpty() == right.isEmpty() ? 0 : (left.isEmpty() ? -1 : 1);
        OptionalDouble l = toNumber(left);
        OptionalDouble r = toNumber(right);
        if (l.isPresent() && r.isPresent())
            return Double.compare(l.getAsDouble(), r.getAsDouble());
        return Integer.signum(toText(left).compareTo(toText(right)));
    }

    /**
     * Numeric view of a scalar: numbers as-is, booleans as 1/0, empty as 0,
     * numeric text parsed. Errors, arrays and other text have none.
     */
    public static OptionalDouble toNumber(CellValue v) {
        if (v instanceof CellValue.Number n)
            return OptionalDouble.of(n.value());
        if (v instanceof CellValue.Bool b)
            return OptionalDouble.of(b.value() ? 1.0 : 0.0);
        if (v.isEmpty())
            return OptionalDouble.of(0.0);
        if (v instanceof CellValue.Text t) {
            String s = t.value().trim();
            if (CellValue.NUMERIC.matcher(s).matches())
                return OptionalDouble.of(Double.parseDouble(s));
        }
        return OptionalDouble.empty();
    }

    /** Like {@link #toNumber} but fails with {@code #VALUE!}. */
    public static double requireNumber(CellValue v, String what) {
        OptionalDouble n = toNumber(v);
        if (n.isEmpty())
            throw new EvaluationException(ErrorCode.VALUE, "Cannot convert " + v.typeName() + " to number in " + what);
        return n.getAsDouble();
    }

    public static String toText(CellValue v) {
        return v.toDisplayString();
    }

    /**
     * Truth value: booleans as-is, non-zero numbers, {@code "TRUE"}/{@code "FALSE"}
     * text in any case, empty as false.
     *
     * @throws EvaluationException {@code #VALUE!} for anything else.
     */
    public static boolean toBoolean(CellValue v) {
        if (v instanceof CellValue.Bool b)
            return b.value();
        if (v instanceof CellValue.Number n)
            return n.value() != 0.0;
        if (v.isEmpty())
            return false;
        if (v instanceof CellValue.Text t) {
            if (t.value().equalsIgnoreCase("TRUE"))
                return true;
            if (t.value().equalsIgnoreCase("FALSE"))
                return false;
        }
        throw new EvaluationException(ErrorCode.VALUE, "Cannot convert " + v.typeName() + " to boolean");
    }
}
