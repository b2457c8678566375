package org.hpn.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Transition - the node a firing behavior is attached to
 *
 * Configuration consumed by the behaviors:
 * ========================================
 * - transitionType: tag naming the firing semantics (null means continuous)
 * - rate: a number, an expression string or a rate function
 * - guard: null, a boolean, a number, an expression string or a guard condition
 * - source / sink: a source needs no input tokens, a sink produces nothing
 * - properties: free-form key/value settings (earliest, latest, max_burst, ...)
 * - kineticParameters: named constants visible to rate and guard expressions
 */
public class Transition implements NetNode {

    private final String id;
    private final String name;
    private String transitionType;
    private Object rate;
    private Object guard;
    private boolean source;
    private boolean sink;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, Double> kineticParameters = new LinkedHashMap<>();

    public Transition(String id, String name, String transitionType) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = name != null ? name : id;
        this.transitionType = transitionType;
    }

    public Transition(String id, String transitionType) {
        this(id, null, transitionType);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getTransitionType() {
        return transitionType;
    }

    public void setTransitionType(String transitionType) {
        this.transitionType = transitionType;
    }

    public Object getRate() {
        return rate;
    }

    public Transition setRate(Object rate) {
        this.rate = rate;
        return this;
    }

    public Object getGuard() {
        return guard;
    }

    public Transition setGuard(Object guard) {
        this.guard = guard;
        return this;
    }

    public boolean isSource() {
        return source;
    }

    public Transition setSource(boolean source) {
        this.source = source;
        return this;
    }

    public boolean isSink() {
        return sink;
    }

    public Transition setSink(boolean sink) {
        this.sink = sink;
        return this;
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object getProperty(String key) {
        return properties.get(key);
    }

    public Transition setProperty(String key, Object value) {
        if (value == null) {
            properties.remove(key);
        } else {
            properties.put(key, value);
        }
        return this;
    }

    public Map<String, Double> getKineticParameters() {
        return Collections.unmodifiableMap(kineticParameters);
    }

    public Transition setKineticParameter(String name, double value) {
        kineticParameters.put(name, value);
        return this;
    }

    @Override
    public String toString() {
        return String.format("Transition[%s '%s']: type=%s, rate=%s, guard=%s, source=%s, sink=%s",
            id, name, transitionType, rate, guard, source, sink);
    }
}
