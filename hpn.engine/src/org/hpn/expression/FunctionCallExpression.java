package org.hpn.expression;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Call of a {@link FunctionCatalog} entry. The function and its arity are
 * resolved when the expression is parsed.
 */
public class FunctionCallExpression extends Expression {

    private final FunctionCatalog.CatalogFunction function;
    private final List<Expression> arguments;
    private final Set<String> variables;

    public FunctionCallExpression(FunctionCatalog.CatalogFunction function, List<Expression> arguments) {
        this.function = function;
        this.arguments = List.copyOf(arguments);
        TreeSet<String> vs = new TreeSet<>();
        for (Expression argument : arguments) {
            vs.addAll(argument.getReferencedVariables());
        }
        this.variables = Set.copyOf(vs);
    }

    public String getFunctionName() {
        return function.getName();
    }

    @Override
    public Set<String> getReferencedVariables() {
        return variables;
    }

    @Override
    public double evaluate(EvaluationContext context) {
        double[] values = new double[arguments.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = arguments.get(i).evaluate(context);
        }
        return function.invoke(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(function.getName()).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
