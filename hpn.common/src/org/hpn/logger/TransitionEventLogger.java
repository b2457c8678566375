package org.hpn.logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.hpn.json.JsonEventBuilder;

/**
 * Transition Event Logger
 *
 * Central log for everything the firing engine does to a net. Logs events for:
 * - Behavior lifecycle (creation)
 * - Scheduling (enablement set / cleared, stochastic delay sampled)
 * - Firing (successful firings and integration steps, with consumed/produced maps)
 * - Rejected firings
 * - Expression evaluation fallbacks
 * - Errors
 *
 * Events can be used for:
 * - Replaying the token flow of a run
 * - Firing statistics per transition
 * - Debugging rate and guard formulas
 *
 * One logger is owned by each simulation model; all behaviors of that model
 * report to it.
 */
public class TransitionEventLogger {

    private static final Logger logger = Logger.getLogger(TransitionEventLogger.class);

    public static final String EVENT_BEHAVIOR_CREATED = "BEHAVIOR_CREATED";
    public static final String EVENT_ENABLEMENT_SET = "ENABLEMENT_SET";
    public static final String EVENT_ENABLEMENT_CLEARED = "ENABLEMENT_CLEARED";
    public static final String EVENT_DELAY_SCHEDULED = "DELAY_SCHEDULED";
    public static final String EVENT_TRANSITION_FIRED = "TRANSITION_FIRED";
    public static final String EVENT_FIRING_REJECTED = "FIRING_REJECTED";
    public static final String EVENT_EVALUATION_FALLBACK = "EVALUATION_FALLBACK";
    public static final String EVENT_ERROR = "ERROR";

    // Event storage for analysis
    private final List<TransitionEvent> eventHistory = new ArrayList<>();

    private boolean enableEventStorage = true;
    private boolean enableLogging = true;

    public TransitionEventLogger() {
        logger.debug("=== TRANSITION EVENT LOGGER INITIALIZED ===");
    }

    public TransitionEventLogger(boolean enableEventStorage) {
        this();
        this.enableEventStorage = enableEventStorage;
    }

    // ========== Behavior Lifecycle Events ==========

    /**
     * Log behavior creation for a transition
     */
    public void logBehaviorCreated(String transitionId, String typeName) {
        String message = String.format(
            "BEHAVIOR_CREATED: transitionId=%s, type=%s",
            transitionId, typeName
        );
        log(message);
        storeEvent(new TransitionEvent(EVENT_BEHAVIOR_CREATED, transitionId, Double.NaN, message, null));
    }

    // ========== Scheduling Events ==========

    /**
     * Log enablement time being recorded
     */
    public void logEnablementSet(String transitionId, double time) {
        String message = String.format(
            "ENABLEMENT_SET: transitionId=%s, enablementTime=%.6f",
            transitionId, time
        );
        log(message);
        storeEvent(new TransitionEvent(EVENT_ENABLEMENT_SET, transitionId, time, message, null));
    }

    /**
     * Log scheduling state being discarded
     */
    public void logEnablementCleared(String transitionId, double time) {
        String message = String.format(
            "ENABLEMENT_CLEARED: transitionId=%s, time=%.6f",
            transitionId, time
        );
        log(message);
        storeEvent(new TransitionEvent(EVENT_ENABLEMENT_CLEARED, transitionId, time, message, null));
    }

    /**
     * Log a sampled stochastic delay and burst
     */
    public void logDelayScheduled(String transitionId, double enablementTime, double scheduledFireTime,
                                  int burst, double rate) {
        String message = String.format(
            "DELAY_SCHEDULED: transitionId=%s, enablementTime=%.6f, scheduledFireTime=%.6f, burst=%d, rate=%.6f",
            transitionId, enablementTime, scheduledFireTime, burst, rate
        );
        log(message);
        storeEvent(new TransitionEvent(EVENT_DELAY_SCHEDULED, transitionId, enablementTime, message, null));
    }

    // ========== Firing Events ==========

    /**
     * Log a successful firing or integration step
     */
    public void logTransitionFired(String transitionId, String mode, double time,
                                   Map<String, Double> consumed, Map<String, Double> produced,
                                   Map<String, ?> metadata) {
        String json = new JsonEventBuilder()
            .setTransitionId(transitionId)
            .setSuccess(true)
            .setMode(mode)
            .setTime(time)
            .setConsumed(consumed)
            .setProduced(produced)
            .setDetails(metadata)
            .toJsonString();

        String message = String.format(
            "TRANSITION_FIRED: transitionId=%s, mode=%s, time=%.6f, consumed=%s, produced=%s",
            transitionId, mode, time, consumed, produced
        );
        log(message);
        storeEvent(new TransitionEvent(EVENT_TRANSITION_FIRED, transitionId, time, message, json));
    }

    /**
     * Log a firing attempt that was refused
     */
    public void logFiringRejected(String transitionId, double time, String reason) {
        String message = String.format(
            "FIRING_REJECTED: transitionId=%s, time=%.6f, reason=%s",
            transitionId, time, reason
        );
        log(message);
        storeEvent(new TransitionEvent(EVENT_FIRING_REJECTED, transitionId, time, message, null));
    }

    // ========== Evaluation Events ==========

    /**
     * Log an expression that degraded to its safe default
     */
    public void logEvaluationFallback(String transitionId, String expression, String error, Object fallback) {
        String message = String.format(
            "EVALUATION_FALLBACK: transitionId=%s, expression='%s', error=%s, fallback=%s",
            transitionId, expression, error, fallback
        );
        logWarn(message);
        storeEvent(new TransitionEvent(EVENT_EVALUATION_FALLBACK, transitionId, Double.NaN, message, null));
    }

    /**
     * Log an unexpected error caught at the firing boundary
     */
    public void logError(String transitionId, double time, String context, Exception e) {
        String message = String.format(
            "ERROR: transitionId=%s, time=%.6f, context=%s, error=%s",
            transitionId, time, context, e.getMessage()
        );
        logError(message, e);
        storeEvent(new TransitionEvent(EVENT_ERROR, transitionId, time, message, null));
    }

    // ========== Helper Methods ==========

    private void log(String message) {
        if (enableLogging) {
            logger.debug(message);
        }
    }

    private void logWarn(String message) {
        if (enableLogging) {
            logger.warn(message);
        }
    }

    private void logError(String message, Exception e) {
        if (enableLogging) {
            logger.error(message, e);
        }
    }

    private void storeEvent(TransitionEvent event) {
        if (enableEventStorage) {
            eventHistory.add(event);
        }
    }

    // ========== Query Methods ==========

    /**
     * Get all events
     */
    public List<TransitionEvent> getEventHistory() {
        return Collections.unmodifiableList(new ArrayList<>(eventHistory));
    }

    /**
     * Get events for a specific transition
     */
    public List<TransitionEvent> getEventsForTransition(String transitionId) {
        List<TransitionEvent> transitionEvents = new ArrayList<>();
        for (TransitionEvent event : eventHistory) {
            if (transitionId.equals(event.getTransitionId())) {
                transitionEvents.add(event);
            }
        }
        return transitionEvents;
    }

    /**
     * Get events of one type (e.g. EVENT_TRANSITION_FIRED)
     */
    public List<TransitionEvent> getEventsOfType(String eventType) {
        List<TransitionEvent> typedEvents = new ArrayList<>();
        for (TransitionEvent event : eventHistory) {
            if (event.getEventType().equals(eventType)) {
                typedEvents.add(event);
            }
        }
        return typedEvents;
    }

    /**
     * Number of successful firings per transition id, in first-fired order
     */
    public Map<String, Integer> getFiringCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TransitionEvent event : eventHistory) {
            if (EVENT_TRANSITION_FIRED.equals(event.getEventType())) {
                counts.merge(event.getTransitionId(), 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Clear event history
     */
    public void clearEventHistory() {
        eventHistory.clear();
    }

    /**
     * Enable/disable event storage
     */
    public void setEnableEventStorage(boolean enable) {
        this.enableEventStorage = enable;
    }

    /**
     * Enable/disable logging
     */
    public void setEnableLogging(boolean enable) {
        this.enableLogging = enable;
    }

    public boolean isEventStorageEnabled() {
        return enableEventStorage;
    }

    // ========== Inner Classes ==========

    /**
     * Transition Event
     */
    public static class TransitionEvent {
        private final String eventType;
        private final String transitionId;
        private final double simulationTime;
        private final String message;
        private final String json;
        private final long timestamp;

        public TransitionEvent(String eventType, String transitionId, double simulationTime,
                               String message, String json) {
            this.eventType = eventType;
            this.transitionId = transitionId;
            this.simulationTime = simulationTime;
            this.message = message;
            this.json = json;
            this.timestamp = System.currentTimeMillis();
        }

        public String getEventType() { return eventType; }
        public String getTransitionId() { return transitionId; }
        public double getSimulationTime() { return simulationTime; }
        public String getMessage() { return message; }
        public long getTimestamp() { return timestamp; }

        /**
         * JSON payload for firing events, null for the other event types
         */
        public String getJson() { return json; }

        @Override
        public String toString() {
            return String.format("[%d] %s: %s", timestamp, eventType, message);
        }
    }
}
