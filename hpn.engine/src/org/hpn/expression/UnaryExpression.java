package org.hpn.expression;

import java.util.Set;

public class UnaryExpression extends Expression {

    public enum Operator {
        NEGATE("-"),
        PLUS("+"),
        NOT("not");

        public final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }
    }

    private final Operator op;
    private final Expression operand;

    public UnaryExpression(Operator op, Expression operand) {
        this.op = op;
        this.operand = operand;
    }

    public Operator getOperator() {
        return op;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public Set<String> getReferencedVariables() {
        return operand.getReferencedVariables();
    }

    @Override
    public double evaluate(EvaluationContext context) {
        double value = operand.evaluate(context);
        switch (op) {
            case NEGATE:
                return -value;
            case PLUS:
                return value;
            case NOT:
                return truth(!isTrue(value));
            default:
                throw new IllegalStateException("Unhandled operator " + op);
        }
    }

    @Override
    public String toString() {
        return op == Operator.NOT ? "(not " + operand + ")" : "(" + op.symbol + operand + ")";
    }
}
