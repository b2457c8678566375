package org.hpn.expression;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.hpn.model.Place;

/**
 * Names visible to an expression at one instant.
 *
 * Bindings, later ones shadowing earlier ones:
 * - place names that are valid identifiers (aliases)
 * - kinetic parameters of the transition
 * - place symbols P&lt;id&gt;
 * - {@code time} and {@code t}, the current logical time
 *
 * Looking up any other name is an {@link EvaluationException}.
 */
public class EvaluationContext {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final double time;
    private final Map<String, Double> variables;

    private EvaluationContext(double time, Map<String, Double> variables) {
        this.time = time;
        this.variables = variables;
    }

    public static EvaluationContext of(double time, Collection<Place> places, Map<String, Double> parameters) {
        Map<String, Double> variables = new LinkedHashMap<>();
        if (places != null) {
            for (Place place : places) {
                String name = place.getName();
                if (name != null && IDENTIFIER.matcher(name).matches()
                        && !ExpressionParser.isReservedWord(name)) {
                    variables.put(name, place.getTokens());
                }
            }
        }
        if (parameters != null) {
            variables.putAll(parameters);
        }
        if (places != null) {
            for (Place place : places) {
                variables.put(place.getSymbol(), place.getTokens());
            }
        }
        variables.put("time", time);
        variables.put("t", time);
        return new EvaluationContext(time, variables);
    }

    public static EvaluationContext ofTime(double time) {
        return of(time, null, null);
    }

    public double getTime() {
        return time;
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public double getVariable(String name) {
        Double value = variables.get(name);
        if (value == null) {
            throw new EvaluationException("Unknown identifier '" + name + "'");
        }
        return value;
    }

    /**
     * Tokens of a place by id or symbol
     */
    public double getTokens(String placeId) {
        return getVariable(Place.symbolFor(placeId));
    }

    public Map<String, Double> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public String toString() {
        return "EvaluationContext[time=" + time + ", " + variables + "]";
    }
}
