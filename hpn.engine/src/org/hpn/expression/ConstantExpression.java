package org.hpn.expression;

public class ConstantExpression extends Expression {

    private final double value;

    public ConstantExpression(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public double evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
