package org.hpn.expression;

import java.util.Set;
import java.util.TreeSet;

/**
 * {@code then if condition else otherwise}. Only the selected branch is evaluated.
 */
public class ConditionalExpression extends Expression {

    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;
    private final Set<String> variables;

    public ConditionalExpression(Expression condition, Expression thenExpr, Expression elseExpr) {
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
        TreeSet<String> vs = new TreeSet<>(condition.getReferencedVariables());
        vs.addAll(thenExpr.getReferencedVariables());
        vs.addAll(elseExpr.getReferencedVariables());
        this.variables = Set.copyOf(vs);
    }

    @Override
    public Set<String> getReferencedVariables() {
        return variables;
    }

    @Override
    public double evaluate(EvaluationContext context) {
        if (isTrue(condition.evaluate(context))) {
            return thenExpr.evaluate(context);
        }
        return elseExpr.evaluate(context);
    }

    @Override
    public String toString() {
        return "(" + thenExpr + " if " + condition + " else " + elseExpr + ")";
    }
}
