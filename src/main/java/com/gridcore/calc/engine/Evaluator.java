package com.gridcore.calc.engine;

import com.gridcore.calc.api.CellFunction;
import com.gridcore.calc.api.EvaluationContext;
import com.gridcore.calc.exception.CircularDependencyException;
import com.gridcore.calc.exception.EvaluationException;
import com.gridcore.calc.fn.FunctionRegistry;
import com.gridcore.calc.formula.Expr;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking evaluator.
 *
 * <p>
 * Circular references come back as the {@code #CIRC!} value rather than an
 * exception, so expressions built around them degrade like any other error
 * operand. Exceptions are reserved for {@code #NAME?} (unknown function),
 * {@code #VALUE!} (bare range, bad arity) and the like, which the caller
 * records on the cell.
 */
public final class Evaluator {
    private static final CellValue CIRC = CellValue.error(ErrorCode.CIRC);

    private final EvaluationContext context;
    private final FunctionRegistry functions;

    public Evaluator(EvaluationContext context, FunctionRegistry functions) {
        this.context = context;
        this.functions = functions;
    }

    public CellValue evaluate(Expr expr) {
        if (expr instanceof Expr.Literal lit)
            return lit.value();
        if (expr instanceof Expr.Reference ref)
            return lookup(ref.address());
        if (expr instanceof Expr.Range r)
            throw new EvaluationException(ErrorCode.VALUE,
                    "Range " + r.range() + " can only be used as a function argument");
        if (expr instanceof Expr.UnaryOp u)
            return Operators.unary(u.op(), evaluate(u.operand()));
        if (expr instanceof Expr.BinaryOp b)
            return Operators.binary(b.op(), evaluate(b.left()), evaluate(b.right()));
        if (expr instanceof Expr.FunctionCall call)
            return call(call);
        throw new IllegalArgumentException("Unknown expression node: " + expr);
    }

    /** Values of every cell in {@code range}, row by row, with {@code #CIRC!} for circular slots. */
    public List<CellValue> evaluateRange(CellRange range) {
        List<CellAddress> cells = range.cells();
        List<CellValue> out = new ArrayList<>(cells.size());
        for (CellAddress cell : cells)
            out.add(lookup(cell));
        return out;
    }

    private CellValue lookup(CellAddress address) {
        if (context.checkCircular(address))
            return CIRC;
        try {
            return context.getCellValue(address);
        } catch (CircularDependencyException e) {
            return CIRC;
        }
    }

    private CellValue call(Expr.FunctionCall call) {
        CellFunction fn = functions.get(call.name());
        if (fn == null)
            throw new EvaluationException(ErrorCode.NAME, "Unknown function: " + call.name());
        List<CellValue> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            if (arg instanceof Expr.Range r)
                args.add(CellValue.array(evaluateRange(r.range())));
            else
                args.add(evaluate(arg));
        }
        return fn.apply(args);
    }
}
