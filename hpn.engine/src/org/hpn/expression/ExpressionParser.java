package org.hpn.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.hpn.exceptions.ExpressionParseException;

/**
 * Recursive-descent parser for rate and guard expressions.
 *
 * Grammar, lowest precedence first:
 * <pre>
 *   conditional := or ( "if" or "else" conditional )?
 *   or          := and ( ("or" | "||") and )*
 *   and         := not ( ("and" | "&amp;&amp;") not )*
 *   not         := "not" not | comparison
 *   comparison  := additive ( ("&lt;" | "&lt;=" | "&gt;" | "&gt;=" | "==" | "!=") additive )*
 *   additive    := term ( ("+" | "-") term )*
 *   term        := unary ( ("*" | "/" | "%") unary )*
 *   unary       := ("-" | "+" | "!") unary | power
 *   power       := primary ( ("**" | "^") unary )?
 *   primary     := number | constant | identifier | function "(" args ")" | "(" conditional ")"
 *   args        := ( conditional "," )* ( name "=" conditional "," )*
 * </pre>
 * Chained comparisons ({@code 0 < P1 < 10}) mean each adjacent pair holds.
 * Function calls are resolved against {@link FunctionCatalog}; an unknown
 * function or a wrong argument count is a parse error.
 */
public class ExpressionParser {

    private static final Set<String> RESERVED_WORDS = new HashSet<>(Arrays.asList(
        "and", "or", "not", "if", "else", "true", "false", "True", "False", "pi", "e", "inf"));

    private final String source;
    private List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
    }

    /**
     * Parse expression text into an expression tree
     */
    public static Expression parse(String source) throws ExpressionParseException {
        if (source == null || source.trim().isEmpty()) {
            throw new ExpressionParseException("Empty expression", source, 0);
        }
        ExpressionParser parser = new ExpressionParser(source);
        parser.tokens = new ExpressionLexer(source).tokenize();
        parser.index = 0;

        Expression expression = parser.parseConditional();
        Token trailing = parser.peek();
        if (trailing.getType() != Token.Type.EOF) {
            throw parser.error("Unexpected '" + trailing.getText() + "'", trailing);
        }
        return expression;
    }

    public static boolean isReservedWord(String word) {
        return RESERVED_WORDS.contains(word);
    }

    // ========== Grammar ==========

    private Expression parseConditional() throws ExpressionParseException {
        Expression value = parseOr();
        if (peek().is(Token.Type.IDENTIFIER, "if")) {
            next();
            Expression condition = parseOr();
            expectKeyword("else");
            Expression otherwise = parseConditional();
            return new ConditionalExpression(condition, value, otherwise);
        }
        return value;
    }

    private Expression parseOr() throws ExpressionParseException {
        Expression left = parseAnd();
        while (peek().is(Token.Type.IDENTIFIER, "or") || peek().is(Token.Type.OPERATOR, "||")) {
            next();
            left = new BinaryExpression(BinaryExpression.Operator.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() throws ExpressionParseException {
        Expression left = parseNot();
        while (peek().is(Token.Type.IDENTIFIER, "and") || peek().is(Token.Type.OPERATOR, "&&")) {
            next();
            left = new BinaryExpression(BinaryExpression.Operator.AND, left, parseNot());
        }
        return left;
    }

    private Expression parseNot() throws ExpressionParseException {
        if (peek().is(Token.Type.IDENTIFIER, "not")) {
            next();
            return new UnaryExpression(UnaryExpression.Operator.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() throws ExpressionParseException {
        Expression left = parseAdditive();
        Expression chain = null;
        while (isComparison(peek())) {
            BinaryExpression.Operator op = BinaryExpression.Operator.forSymbol(next().getText());
            Expression right = parseAdditive();
            Expression pair = new BinaryExpression(op, left, right);
            chain = chain == null ? pair : new BinaryExpression(BinaryExpression.Operator.AND, chain, pair);
            left = right;
        }
        return chain != null ? chain : left;
    }

    private Expression parseAdditive() throws ExpressionParseException {
        Expression left = parseTerm();
        while (peek().is(Token.Type.OPERATOR, "+") || peek().is(Token.Type.OPERATOR, "-")) {
            BinaryExpression.Operator op = BinaryExpression.Operator.forSymbol(next().getText());
            left = new BinaryExpression(op, left, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() throws ExpressionParseException {
        Expression left = parseUnary();
        while (peek().is(Token.Type.OPERATOR, "*") || peek().is(Token.Type.OPERATOR, "/")
                || peek().is(Token.Type.OPERATOR, "%")) {
            BinaryExpression.Operator op = BinaryExpression.Operator.forSymbol(next().getText());
            left = new BinaryExpression(op, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() throws ExpressionParseException {
        Token token = peek();
        if (token.is(Token.Type.OPERATOR, "-")) {
            next();
            return new UnaryExpression(UnaryExpression.Operator.NEGATE, parseUnary());
        }
        if (token.is(Token.Type.OPERATOR, "+")) {
            next();
            return new UnaryExpression(UnaryExpression.Operator.PLUS, parseUnary());
        }
        if (token.is(Token.Type.OPERATOR, "!")) {
            next();
            return new UnaryExpression(UnaryExpression.Operator.NOT, parseUnary());
        }
        return parsePower();
    }

    private Expression parsePower() throws ExpressionParseException {
        Expression base = parsePrimary();
        if (peek().is(Token.Type.OPERATOR, "**") || peek().is(Token.Type.OPERATOR, "^")) {
            next();
            // right associative, binds tighter than a unary minus on its left
            return new BinaryExpression(BinaryExpression.Operator.POWER, base, parseUnary());
        }
        return base;
    }

    private Expression parsePrimary() throws ExpressionParseException {
        Token token = next();
        switch (token.getType()) {
            case NUMBER:
                return new ConstantExpression(token.getNumber());
            case LPAREN: {
                Expression inner = parseConditional();
                expect(Token.Type.RPAREN, ")");
                return inner;
            }
            case IDENTIFIER:
                return parseIdentifier(token);
            case EOF:
                throw error("Unexpected end of expression", token);
            default:
                throw error("Unexpected '" + token.getText() + "'", token);
        }
    }

    private Expression parseIdentifier(Token token) throws ExpressionParseException {
        String name = token.getText();
        if (peek().getType() == Token.Type.LPAREN) {
            return parseCall(token);
        }
        switch (name) {
            case "true":
            case "True":
                return new ConstantExpression(1.0);
            case "false":
            case "False":
                return new ConstantExpression(0.0);
            case "pi":
                return new ConstantExpression(Math.PI);
            case "e":
                return new ConstantExpression(Math.E);
            case "inf":
                return new ConstantExpression(Double.POSITIVE_INFINITY);
            case "and":
            case "or":
            case "not":
            case "if":
            case "else":
                throw error("Unexpected keyword '" + name + "'", token);
            default:
                return new VariableExpression(name);
        }
    }

    private Expression parseCall(Token nameToken) throws ExpressionParseException {
        String name = nameToken.getText();
        FunctionCatalog.CatalogFunction function = FunctionCatalog.getFunction(name);
        if (function == null) {
            throw error("Unknown function '" + name + "'", nameToken);
        }
        expect(Token.Type.LPAREN, "(");

        List<Expression> positional = new ArrayList<>();
        Map<String, Expression> named = new LinkedHashMap<>();
        if (peek().getType() != Token.Type.RPAREN) {
            parseArgument(positional, named);
            while (peek().getType() == Token.Type.COMMA) {
                next();
                parseArgument(positional, named);
            }
        }
        expect(Token.Type.RPAREN, ")");

        List<Expression> arguments;
        try {
            arguments = function.bindArguments(positional, named);
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage(), nameToken);
        }
        if (!function.acceptsArgumentCount(arguments.size())) {
            throw error(String.format("%s takes %s, got %d argument(s)",
                name, function.getSignature(), arguments.size()), nameToken);
        }
        return new FunctionCallExpression(function, arguments);
    }

    private void parseArgument(List<Expression> positional, Map<String, Expression> named)
            throws ExpressionParseException {
        Token token = peek();
        if (token.getType() == Token.Type.IDENTIFIER && tokens.get(index + 1).is(Token.Type.OPERATOR, "=")) {
            next();
            next();
            if (named.containsKey(token.getText())) {
                throw error("Repeated argument '" + token.getText() + "'", token);
            }
            named.put(token.getText(), parseConditional());
            return;
        }
        if (!named.isEmpty()) {
            throw error("Positional argument after named argument", token);
        }
        positional.add(parseConditional());
    }

    // ========== Helper Methods ==========

    private static boolean isComparison(Token token) {
        if (token.getType() != Token.Type.OPERATOR) {
            return false;
        }
        switch (token.getText()) {
            case "<":
            case "<=":
            case ">":
            case ">=":
            case "==":
            case "!=":
                return true;
            default:
                return false;
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.getType() != Token.Type.EOF) {
            index++;
        }
        return token;
    }

    private void expect(Token.Type type, String text) throws ExpressionParseException {
        Token token = next();
        if (token.getType() != type) {
            throw error("Expected '" + text + "' but found '" + token.getText() + "'", token);
        }
    }

    private void expectKeyword(String keyword) throws ExpressionParseException {
        Token token = next();
        if (!token.is(Token.Type.IDENTIFIER, keyword)) {
            throw error("Expected '" + keyword + "' but found '" + token.getText() + "'", token);
        }
    }

    private ExpressionParseException error(String message, Token token) {
        return new ExpressionParseException(message, source, token.getPosition());
    }
}
