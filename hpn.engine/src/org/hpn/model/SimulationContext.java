package org.hpn.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.hpn.logger.TransitionEventLogger;

/**
 * What a firing behavior may ask of the simulation driving it.
 *
 * The driver owns the clock and the net structure; behaviors read the current
 * time, enumerate arcs, look up places and report completed firings here.
 */
public interface SimulationContext {

    /**
     * Current logical (simulation) time
     */
    double getLogicalTime();

    /**
     * All places of the net, in a stable order
     */
    Collection<Place> getPlaces();

    /**
     * @return the place with the given id, or null
     */
    Place getPlace(String placeId);

    /**
     * Arcs whose target is the given transition
     */
    List<Arc> getInputArcs(Transition transition);

    /**
     * Arcs whose source is the given transition
     */
    List<Arc> getOutputArcs(Transition transition);

    /**
     * Record a completed firing or integration step. Implementations may throw;
     * the behaviors log such failures and carry on.
     */
    void recordTransitionEvent(String transitionId, Map<String, Double> consumed,
                               Map<String, Double> produced, String mode,
                               Map<String, Object> metadata);

    /**
     * @return the event logger of this simulation, or null when none is attached
     */
    TransitionEventLogger getEventLogger();
}
