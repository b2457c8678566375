package org.hpn.expression;

import java.util.Set;
import java.util.TreeSet;

public class BinaryExpression extends Expression {

    public enum Operator {
        ADD("+", false),
        SUBTRACT("-", false),
        MULTIPLY("*", false),
        DIVIDE("/", false),
        MODULO("%", false),
        POWER("**", false),
        LESS("<", true),
        LESS_OR_EQUAL("<=", true),
        GREATER(">", true),
        GREATER_OR_EQUAL(">=", true),
        EQUALS("==", true),
        NOT_EQUALS("!=", true),
        AND("and", true),
        OR("or", true);

        public final String symbol;
        public final boolean returnsBoolean;

        Operator(String symbol, boolean returnsBoolean) {
            this.symbol = symbol;
            this.returnsBoolean = returnsBoolean;
        }

        /**
         * @return the operator written as {@code symbol}, or null
         */
        public static Operator forSymbol(String symbol) {
            switch (symbol) {
                case "^":
                    return POWER;
                case "&&":
                    return AND;
                case "||":
                    return OR;
                default:
                    for (Operator candidate : values()) {
                        if (candidate.symbol.equals(symbol)) {
                            return candidate;
                        }
                    }
                    return null;
            }
        }
    }

    private final Operator op;
    private final Expression left;
    private final Expression right;
    private final Set<String> variables;

    public BinaryExpression(Operator op, Expression left, Expression right) {
        this.op = op;
        this.left = left;
        this.right = right;
        TreeSet<String> vs = new TreeSet<>(left.getReferencedVariables());
        vs.addAll(right.getReferencedVariables());
        this.variables = Set.copyOf(vs);
    }

    public Operator getOperator() {
        return op;
    }

    @Override
    public Set<String> getReferencedVariables() {
        return variables;
    }

    @Override
    public double evaluate(EvaluationContext context) {
        double l = left.evaluate(context);

        // and/or short-circuit
        if (op == Operator.AND) {
            return isTrue(l) ? truth(isTrue(right.evaluate(context))) : 0.0;
        }
        if (op == Operator.OR) {
            return isTrue(l) ? 1.0 : truth(isTrue(right.evaluate(context)));
        }

        double r = right.evaluate(context);
        switch (op) {
            case ADD:
                return l + r;
            case SUBTRACT:
                return l - r;
            case MULTIPLY:
                return l * r;
            case DIVIDE:
                if (r == 0.0) {
                    throw new EvaluationException("Division by zero in " + this);
                }
                return l / r;
            case MODULO:
                if (r == 0.0) {
                    throw new EvaluationException("Modulo by zero in " + this);
                }
                // result takes the sign of the divisor
                return l - r * Math.floor(l / r);
            case POWER:
                return Math.pow(l, r);
            case LESS:
                return truth(l < r);
            case LESS_OR_EQUAL:
                return truth(l <= r);
            case GREATER:
                return truth(l > r);
            case GREATER_OR_EQUAL:
                return truth(l >= r);
            case EQUALS:
                return truth(l == r);
            case NOT_EQUALS:
                return truth(l != r);
            default:
                throw new IllegalStateException("Unhandled operator " + op);
        }
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.symbol + " " + right + ")";
    }
}
