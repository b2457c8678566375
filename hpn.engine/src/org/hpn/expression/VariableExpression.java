package org.hpn.expression;

import java.util.Collections;
import java.util.Set;

/**
 * Reference to a place symbol, place name, kinetic parameter or the clock.
 */
public class VariableExpression extends Expression {

    private final String name;

    public VariableExpression(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Set<String> getReferencedVariables() {
        return Collections.singleton(name);
    }

    @Override
    public double evaluate(EvaluationContext context) {
        return context.getVariable(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
