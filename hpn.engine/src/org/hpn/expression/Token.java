package org.hpn.expression;

/**
 * Lexical token of an expression.
 */
public class Token {

    public enum Type {
        NUMBER,
        IDENTIFIER,
        OPERATOR,
        LPAREN,
        RPAREN,
        COMMA,
        EOF
    }

    private final Type type;
    private final String text;
    private final double number;
    private final int position;

    public Token(Type type, String text, double number, int position) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.position = position;
    }

    public Type getType() { return type; }
    public String getText() { return text; }
    public double getNumber() { return number; }
    public int getPosition() { return position; }

    public boolean is(Type expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + position;
    }
}
