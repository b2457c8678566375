package org.hpn.expression;

import java.util.Collections;
import java.util.Set;

/**
 * Node of a parsed rate or guard expression.
 *
 * Every node evaluates to a double; comparisons and logical operators yield
 * 1.0 for true and 0.0 for false.
 */
public abstract class Expression {

    /**
     * Names that must be bound in the evaluation context for this expression
     * to evaluate.
     */
    public Set<String> getReferencedVariables() {
        return Collections.emptySet();
    }

    public abstract double evaluate(EvaluationContext context);

    static double truth(boolean value) {
        return value ? 1.0 : 0.0;
    }

    static boolean isTrue(double value) {
        return value != 0.0 && !Double.isNaN(value);
    }
}
