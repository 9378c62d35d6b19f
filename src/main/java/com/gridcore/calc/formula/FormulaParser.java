package com.gridcore.calc.formula;

import com.gridcore.calc.exception.FormulaParseException;
import com.gridcore.calc.exception.InvalidReferenceException;
import com.gridcore.calc.formula.Token.Type;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellRange;
import com.gridcore.calc.model.CellValue;
import com.gridcore.calc.model.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing parser from formula text to {@link Expr}.
 *
 * <p>
 * Binding, tightest first: postfix {@code %}, prefix {@code -}/{@code +},
 * {@code ^} (right-associative), {@code * /}, {@code + -}, comparisons, then
 * {@code &}. A leading {@code =} is optional.
 *
 * <p>
 * Only two exceptions ever leave {@link #parse(String)}:
 * {@link InvalidReferenceException} for addresses outside the grid and
 * {@link FormulaParseException} for everything else.
 */
public final class FormulaParser {
    private final List<Token> tokens;
    private int index;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Expr parse(String formula) {
        if (formula == null)
            throw new FormulaParseException("Null formula", 0);
        String body = formula.startsWith("=") ? formula.substring(1) : formula;
        if (body.isBlank())
            throw new FormulaParseException("Empty formula", 0);
        FormulaParser parser = new FormulaParser(Tokenizer.tokenize(body));
        Expr expr = parser.expression(0);
        Token trailing = parser.peek();
        if (!trailing.is(Type.EOF))
            throw new FormulaParseException("Unexpected token '" + trailing.text() + "'", trailing.position());
        return expr;
    }

    private Expr expression(int minPrecedence) {
        Expr left = unary();
        while (true) {
            Token t = peek();
            if (!t.is(Type.OPERATOR))
                return left;
            BinaryOperator op = BinaryOperator.fromSymbol(t.text());
            if (op == null || op.precedence() < minPrecedence)
                return left;
            index++;
            int next = op.isRightAssociative() ? op.precedence() : op.precedence() + 1;
            left = new Expr.BinaryOp(op, left, expression(next));
        }
    }

    // Prefix operators bind tighter than every binary operator: -2^2 is (-2)^2.
    private Expr unary() {
        Token t = peek();
        if (t.isOperator("-")) {
            index++;
            return new Expr.UnaryOp(UnaryOperator.NEGATE, unary());
        }
        if (t.isOperator("+")) {
            index++;
            return new Expr.UnaryOp(UnaryOperator.PLUS, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr e = primary();
        while (peek().isOperator("%")) {
            index++;
            e = new Expr.UnaryOp(UnaryOperator.PERCENT, e);
        }
        return e;
    }

    private Expr primary() {
        Token t = advance();
        switch (t.type()) {
            case NUMBER:
                return new Expr.Literal(CellValue.number(Double.parseDouble(t.text())));
            case STRING:
                return new Expr.Literal(CellValue.text(t.text()));
            case BOOLEAN:
                return new Expr.Literal(CellValue.bool(t.text().equals("TRUE")));
            case ERROR: {
                ErrorCode code = ErrorCode.fromCode(t.text());
                if (code == null)
                    throw new FormulaParseException("Unknown error literal '" + t.text() + "'", t.position());
                return new Expr.Literal(CellValue.error(code));
            }
            case CELL_REF:
                return referenceOrRange(t);
            case FUNCTION:
                return call(t);
            case LPAREN: {
                Expr inner = expression(0);
                expect(Type.RPAREN, "')'");
                return inner;
            }
            case EOF:
                throw new FormulaParseException("Unexpected end of formula", t.position());
            default:
                throw new FormulaParseException("Unexpected token '" + t.text() + "'", t.position());
        }
    }

    private Expr referenceOrRange(Token first) {
        Expr.Reference start = reference(first);
        if (!peek().is(Type.COLON))
            return start;
        index++;
        Token second = advance();
        if (!second.is(Type.CELL_REF))
            throw new FormulaParseException("Expected cell reference after ':'", second.position());
        Expr.Reference end = reference(second);
        return new Expr.Range(CellRange.of(start.address(), end.address()),
                start.absoluteCol(), start.absoluteRow(), end.absoluteCol(), end.absoluteRow());
    }

    /** Splits {@code $?letters$?digits} and validates it against the grid. */
    static Expr.Reference reference(Token t) {
        String text = t.text();
        int i = 0;
        boolean absCol = text.charAt(i) == '$';
        if (absCol)
            i++;
        int lettersStart = i;
        while (Character.isLetter(text.charAt(i)))
            i++;
        String letters = text.substring(lettersStart, i);
        boolean absRow = text.charAt(i) == '$';
        if (absRow)
            i++;
        String digits = text.substring(i);
        CellAddress address;
        try {
            address = CellAddress.checked(CellAddress.columnToNumber(letters), digits, text);
        } catch (FormulaParseException e) {
            throw new FormulaParseException(e.getMessage(), t.position());
        }
        return new Expr.Reference(address, absCol, absRow);
    }

    private Expr call(Token name) {
        expect(Type.LPAREN, "'('");
        List<Expr> args = new ArrayList<>();
        if (peek().is(Type.RPAREN)) {
            index++;
            return new Expr.FunctionCall(name.text(), args);
        }
        while (true) {
            args.add(expression(0));
            Token sep = advance();
            if (sep.is(Type.RPAREN))
                return new Expr.FunctionCall(name.text(), args);
            if (!sep.is(Type.COMMA))
                throw new FormulaParseException("Expected ',' or ')' in call to " + name.text(), sep.position());
        }
    }

    private void expect(Type type, String what) {
        Token t = advance();
        if (!t.is(type))
            throw new FormulaParseException("Expected " + what, t.position());
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (!t.is(Type.EOF))
            index++;
        return t;
    }
}
