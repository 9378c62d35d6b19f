package com.gridcore.calc.formula;

import com.gridcore.calc.exception.FormulaParseException;
import com.gridcore.calc.formula.Token.Type;
import com.gridcore.calc.model.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits formula text into {@link Token}s. Whitespace between tokens is
 * skipped; whitespace inside string literals is kept.
 */
public final class Tokenizer {
    private static final Pattern CELL_REF = Pattern.compile("\\$?[A-Za-z]+\\$?[0-9]+");

    private final String src;
    private int pos;

    public Tokenizer(String src) {
        this.src = src;
    }

    public static List<Token> tokenize(String src) {
        return new Tokenizer(src).all();
    }

    private List<Token> all() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                out.add(new Token(Type.EOF, "", pos));
                return out;
            }
            out.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = src.charAt(pos);
        if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1))))
            return number();
        switch (c) {
            case '"':
                return string();
            case '#':
                return errorLiteral();
            case '(':
                pos++;
                return new Token(Type.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(Type.RPAREN, ")", start);
            case ',':
                pos++;
                return new Token(Type.COMMA, ",", start);
            case ':':
                pos++;
                return new Token(Type.COLON, ":", start);
            case '<':
                if (peek(1) == '=' || peek(1) == '>') {
                    pos += 2;
                    return new Token(Type.OPERATOR, src.substring(start, pos), start);
                }
                pos++;
                return new Token(Type.OPERATOR, "<", start);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(Type.OPERATOR, ">=", start);
                }
                pos++;
                return new Token(Type.OPERATOR, ">", start);
            case '+', '-', '*', '/', '^', '&', '%', '=':
                pos++;
                return new Token(Type.OPERATOR, String.valueOf(c), start);
            default:
                break;
        }
        if (Character.isLetter(c) || c == '$' || c == '_')
            return word();
        throw new FormulaParseException("Unexpected character '" + c + "'", start);
    }

    private Token number() {
        int start = pos;
        while (pos < src.length() && Character.isDigit(src.charAt(pos)))
            pos++;
        if (peek(0) == '.') {
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                pos++;
        }
        char e = peek(0);
        if (e == 'e' || e == 'E') {
            int digitsAt = pos + 1;
            if (digitsAt < src.length() && (src.charAt(digitsAt) == '+' || src.charAt(digitsAt) == '-'))
                digitsAt++;
            if (digitsAt < src.length() && Character.isDigit(src.charAt(digitsAt))) {
                pos = digitsAt;
                while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                    pos++;
            }
        }
        return new Token(Type.NUMBER, src.substring(start, pos), start);
    }

    private Token string() {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < src.length()) {
            char c = src.charAt(pos++);
            if (c == '"') {
                if (peek(0) == '"') {
                    sb.append('"');
                    pos++;
                } else {
                    return new Token(Type.STRING, sb.toString(), start);
                }
            } else {
                sb.append(c);
            }
        }
        throw new FormulaParseException("Unterminated string literal", start);
    }

    private Token errorLiteral() {
        int start = pos;
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos++);
            if (c == '!' || c == '?')
                return new Token(Type.ERROR, src.substring(start, pos).toUpperCase(), start);
            if (!Character.isLetterOrDigit(c) && c != '/')
                break;
        }
        throw new FormulaParseException("Malformed error literal", start);
    }

    private Token word() {
        int start = pos;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '$' || c == '_' || c == '.')
                pos++;
            else
                break;
        }
        String text = src.substring(start, pos);
        int look = pos;
        while (look < src.length() && Character.isWhitespace(src.charAt(look)))
            look++;
        if (look < src.length() && src.charAt(look) == '(' && text.indexOf('$') < 0)
            return new Token(Type.FUNCTION, text.toUpperCase(), start);
        if (text.equalsIgnoreCase("TRUE") || text.equalsIgnoreCase("FALSE"))
            return new Token(Type.BOOLEAN, text.toUpperCase(), start);
        if (CELL_REF.matcher(text).matches())
            return new Token(Type.CELL_REF, text, start);
        throw new FormulaParseException(ErrorCode.NAME, "Unknown identifier '" + text + "'", start);
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos)))
            pos++;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < src.length() ? src.charAt(i) : '\0';
    }
}
