package org.hpn.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.hpn.config.EngineSettings;
import org.hpn.logger.TransitionEventLogger;

/**
 * In-memory Petri net and simulation clock
 *
 * Holds places, transitions and arcs in insertion order and implements
 * {@link SimulationContext} for the behaviors attached to its transitions.
 * Completed firings are forwarded to the model's {@link TransitionEventLogger}.
 *
 * Usage:
 * ======
 *   PetriNetModel net = new PetriNetModel();
 *   Place p1 = net.addPlace(new Place("1", 5));
 *   Transition t = net.addTransition(new Transition("T1", "immediate"));
 *   net.connect(p1, t, 1);
 *   net.advanceTime(0.5);
 */
public class PetriNetModel implements SimulationContext {

    private static final Logger logger = Logger.getLogger(PetriNetModel.class);

    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();
    private final TransitionEventLogger eventLogger;

    private double logicalTime = 0.0;

    /**
     * Model with an event logger configured from {@link EngineSettings#load()}
     */
    public PetriNetModel() {
        this(EngineSettings.load());
    }

    public PetriNetModel(EngineSettings settings) {
        this(settings.newEventLogger());
    }

    public PetriNetModel(TransitionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    // ========== Structure ==========

    public Place addPlace(Place place) {
        if (places.containsKey(place.getId())) {
            throw new IllegalArgumentException("Duplicate place id: " + place.getId());
        }
        places.put(place.getId(), place);
        return place;
    }

    public Transition addTransition(Transition transition) {
        if (transitions.containsKey(transition.getId())) {
            throw new IllegalArgumentException("Duplicate transition id: " + transition.getId());
        }
        transitions.put(transition.getId(), transition);
        return transition;
    }

    public Arc addArc(Arc arc) {
        arcs.add(arc);
        return arc;
    }

    public Arc connect(NetNode source, NetNode target, double weight) {
        return addArc(new Arc(source, target, weight, ArcKind.NORMAL));
    }

    public Arc connect(NetNode source, NetNode target, double weight, ArcKind kind) {
        return addArc(new Arc(source, target, weight, kind));
    }

    public Transition getTransition(String transitionId) {
        return transitions.get(transitionId);
    }

    public Collection<Transition> getTransitions() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    // ========== Clock ==========

    /**
     * Advance the clock by dt (must be non-negative)
     */
    public double advanceTime(double dt) {
        if (dt < 0 || Double.isNaN(dt)) {
            throw new IllegalArgumentException("Cannot advance time by " + dt);
        }
        logicalTime += dt;
        return logicalTime;
    }

    public void setLogicalTime(double logicalTime) {
        this.logicalTime = logicalTime;
    }

    // ========== SimulationContext ==========

    @Override
    public double getLogicalTime() {
        return logicalTime;
    }

    @Override
    public Collection<Place> getPlaces() {
        return Collections.unmodifiableCollection(places.values());
    }

    @Override
    public Place getPlace(String placeId) {
        return places.get(placeId);
    }

    @Override
    public List<Arc> getInputArcs(Transition transition) {
        List<Arc> inputs = new ArrayList<>();
        for (Arc arc : arcs) {
            if (arc.getTarget() == transition) {
                inputs.add(arc);
            }
        }
        return inputs;
    }

    @Override
    public List<Arc> getOutputArcs(Transition transition) {
        List<Arc> outputs = new ArrayList<>();
        for (Arc arc : arcs) {
            if (arc.getSource() == transition) {
                outputs.add(arc);
            }
        }
        return outputs;
    }

    @Override
    public void recordTransitionEvent(String transitionId, Map<String, Double> consumed,
                                      Map<String, Double> produced, String mode,
                                      Map<String, Object> metadata) {
        if (eventLogger == null) {
            logger.debug(String.format("Firing of %s not recorded, no event logger attached", transitionId));
            return;
        }
        eventLogger.logTransitionFired(transitionId, mode, logicalTime, consumed, produced, metadata);
    }

    @Override
    public TransitionEventLogger getEventLogger() {
        return eventLogger;
    }

    /**
     * Token count of every place, keyed by place id
     */
    public Map<String, Double> getMarking() {
        Map<String, Double> marking = new LinkedHashMap<>();
        for (Place place : places.values()) {
            marking.put(place.getId(), place.getTokens());
        }
        return marking;
    }

    public double getTotalTokens() {
        double total = 0.0;
        for (Place place : places.values()) {
            total += place.getTokens();
        }
        return total;
    }
}
