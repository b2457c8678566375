package org.hpn.expression;

import java.util.ArrayList;
import java.util.List;

import org.hpn.exceptions.ExpressionParseException;

/**
 * Splits expression text into tokens.
 *
 * Numbers accept a fraction and an exponent ({@code 1.5e-3}); identifiers are
 * {@code [A-Za-z_][A-Za-z0-9_]*}. Keywords (and, or, not, if, else) come out
 * as identifiers and are recognised by the parser. A single {@code =} only
 * appears in named function arguments.
 */
public class ExpressionLexer {

    private static final String[] TWO_CHAR_OPERATORS = {"**", "<=", ">=", "==", "!=", "&&", "||"};
    private static final String ONE_CHAR_OPERATORS = "+-*/%^<>!=";

    private final String source;
    private int pos = 0;

    public ExpressionLexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() throws ExpressionParseException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", 0.0, pos));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() throws ExpressionParseException {
        char c = source.charAt(pos);
        int start = pos;

        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(Token.Type.IDENTIFIER, source.substring(start, pos), 0.0, start);
        }
        if (c == '(') {
            pos++;
            return new Token(Token.Type.LPAREN, "(", 0.0, start);
        }
        if (c == ')') {
            pos++;
            return new Token(Token.Type.RPAREN, ")", 0.0, start);
        }
        if (c == ',') {
            pos++;
            return new Token(Token.Type.COMMA, ",", 0.0, start);
        }
        for (String op : TWO_CHAR_OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += 2;
                return new Token(Token.Type.OPERATOR, op, 0.0, start);
            }
        }
        if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
            pos++;
            return new Token(Token.Type.OPERATOR, String.valueOf(c), 0.0, start);
        }
        throw new ExpressionParseException("Unexpected character '" + c + "'", source, start);
    }

    private Token readNumber() throws ExpressionParseException {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) pos++;
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            } else {
                // not an exponent, leave the 'e' for the next token
                pos = mark;
            }
        }
        String text = source.substring(start, pos);
        try {
            return new Token(Token.Type.NUMBER, text, Double.parseDouble(text), start);
        } catch (NumberFormatException e) {
            throw new ExpressionParseException("Malformed number '" + text + "'", source, start);
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
