package org.hpn.behavior;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.hpn.config.EngineSettings;
import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.expression.EvaluationContext;
import org.hpn.expression.RateFunction;
import org.hpn.guard.GuardDecision;
import org.hpn.guard.GuardEvaluator;
import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.Arc;
import org.hpn.model.ArcKind;
import org.hpn.model.Place;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;
import org.hpn.model.TransitionType;

/**
 * Firing Behavior - base class of the four transition semantics
 *
 * A behavior is attached to one transition and answers two questions for the
 * driver: may the transition fire now ({@link #canFire()}), and what happens
 * when it does ({@link #fire(List, List)}). Neither call blocks or spawns
 * threads; all waiting is state the driver polls.
 *
 * Contract:
 * =========
 * - canFire() has no side effects; repeated calls give the same answer
 *   until the marking, the clock or the scheduling state changes
 * - fire() only touches token counts and scheduling state, and reports
 *   every place it consumed from or produced into
 * - a firing that is not enabled mutates nothing
 * - unexpected runtime errors come back as a failed {@link FiringResult}
 *   with reason "&lt;type&gt;-error", never as an exception
 *
 * Structural enablement (discrete behaviors):
 * ============================================
 *   normal input arc    : tokens &gt;= weight x multiplier (skipped for sources)
 *   test input arc      : tokens &gt;= weight, never consumed
 *   inhibitor input arc : tokens &lt; weight
 */
public abstract class FiringBehavior {

    private static final Logger logger = Logger.getLogger(FiringBehavior.class);

    // Transition property consulted when the guard field is empty
    public static final String PROP_GUARD_FUNCTION = "guard_function";

    protected final Transition transition;
    protected final SimulationContext context;
    protected final EngineSettings settings;
    protected final GuardEvaluator guard;

    private boolean fallbackReported = false;

    /**
     * @param guarded whether this behavior evaluates the transition's guard
     */
    protected FiringBehavior(Transition transition, SimulationContext context, EngineSettings settings,
                             boolean guarded) throws BehaviorConfigurationException {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.transition = transition;
        this.context = context;
        this.settings = settings != null ? settings : EngineSettings.defaults();

        if (guarded) {
            Object guardSetting = transition.getGuard();
            if (guardSetting == null) {
                guardSetting = transition.getProperty(PROP_GUARD_FUNCTION);
            }
            this.guard = GuardEvaluator.create(guardSetting, transition.getId(), getEventLogger());
        } else {
            this.guard = null;
        }
    }

    // ========== Contract ==========

    public abstract EnablementResult canFire();

    /**
     * Fire once, moving tokens along the given arcs
     */
    public abstract FiringResult fire(List<Arc> inputArcs, List<Arc> outputArcs);

    /**
     * Human readable name of the semantics, e.g. "Timed (TPN)"
     */
    public abstract String getTypeName();

    public abstract TransitionType getTransitionType();

    // ========== Shared Utilities ==========

    public Transition getTransition() {
        return transition;
    }

    public SimulationContext getContext() {
        return context;
    }

    public List<Arc> getInputArcs() {
        return context.getInputArcs(transition);
    }

    public List<Arc> getOutputArcs() {
        return context.getOutputArcs(transition);
    }

    protected double currentTime() {
        return context.getLogicalTime();
    }

    protected Place getPlace(String placeId) {
        return context.getPlace(placeId);
    }

    protected TransitionEventLogger getEventLogger() {
        return context.getEventLogger();
    }

    /**
     * Names visible to this transition's expressions right now
     */
    protected EvaluationContext evaluationContext(double time) {
        return EvaluationContext.of(time, context.getPlaces(), transition.getKineticParameters());
    }

    /**
     * @return the guard evaluator, or null when this behavior ignores guards
     */
    public GuardEvaluator getGuard() {
        return guard;
    }

    protected GuardDecision evaluateGuard() {
        if (guard == null) {
            return new GuardDecision(true, EngineConstants.REASON_NO_GUARD);
        }
        return guard.evaluate(evaluationContext(currentTime()));
    }

    protected FiringResult.Builder resultBuilder() {
        return FiringResult.builder(transition.getId(), getTransitionType().getTag()).time(currentTime());
    }

    // ========== Discrete Enablement and Transfer ==========

    /**
     * Check input arcs for a firing that moves weight x multiplier tokens
     *
     * @return null when every arc allows the firing, otherwise the failure
     */
    protected EnablementResult checkInputArcs(List<Arc> inputArcs, int multiplier, String insufficientReason) {
        // arcs from the same place add up
        Map<Place, Double> required = new LinkedHashMap<>();
        if (!transition.isSource()) {
            for (Arc arc : inputArcs) {
                Place place = arc.getSourcePlace();
                if (arc.getKind() == ArcKind.NORMAL && place != null) {
                    required.merge(place, arc.getWeight() * multiplier, Double::sum);
                }
            }
        }

        for (Arc arc : inputArcs) {
            Place place = arc.getSourcePlace();
            if (place == null) {
                return EnablementResult.disabled(EngineConstants.placeReason(
                    EngineConstants.REASON_MISSING_SOURCE_PLACE, arc.getSource().getId()));
            }
            switch (arc.getKind()) {
                case NORMAL:
                    if (!transition.isSource() && place.getTokens() < required.get(place)) {
                        return EnablementResult.disabled(
                            EngineConstants.placeReason(insufficientReason, place.getSymbol()));
                    }
                    break;
                case TEST:
                    if (place.getTokens() < arc.getWeight()) {
                        return EnablementResult.disabled(EngineConstants.placeReason(
                            EngineConstants.REASON_INSUFFICIENT_TOKENS, place.getSymbol()));
                    }
                    break;
                case INHIBITOR:
                    if (place.getTokens() >= arc.getWeight()) {
                        return EnablementResult.disabled(
                            EngineConstants.placeReason(EngineConstants.REASON_INHIBITED, place.getSymbol()));
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled arc kind " + arc.getKind());
            }
        }
        return null;
    }

    /**
     * Validate, then consume weight x multiplier from each normal input and
     * produce weight x multiplier into each output place. Nothing is mutated
     * when validation fails.
     *
     * @return null on success (the maps are filled), otherwise the failure
     */
    protected EnablementResult transferTokens(List<Arc> inputArcs, List<Arc> outputArcs, int multiplier,
                                              String insufficientReason,
                                              Map<String, Double> consumed, Map<String, Double> produced) {
        EnablementResult failure = checkInputArcs(inputArcs, multiplier, insufficientReason);
        if (failure != null) {
            return failure;
        }

        if (!transition.isSource()) {
            for (Arc arc : inputArcs) {
                if (arc.getKind() != ArcKind.NORMAL) {
                    continue;
                }
                Place place = arc.getSourcePlace();
                double amount = arc.getWeight() * multiplier;
                place.setTokens(place.getTokens() - amount);
                consumed.merge(place.getId(), amount, Double::sum);
            }
        }

        if (!transition.isSink()) {
            for (Arc arc : outputArcs) {
                Place place = arc.getTargetPlace();
                if (place == null) {
                    logger.debug(String.format("Output arc %s of %s has no target place, skipped", arc, transition.getId()));
                    continue;
                }
                double amount = arc.getWeight() * multiplier;
                place.setTokens(place.getTokens() + amount);
                produced.merge(place.getId(), amount, Double::sum);
            }
        }
        return null;
    }

    // ========== Event Reporting ==========

    /**
     * Hand a completed firing to the simulation. Recording problems are logged
     * and never undo or fail the firing.
     */
    protected void recordEvent(String mode, Map<String, Double> consumed, Map<String, Double> produced,
                               Map<String, Object> metadata) {
        try {
            context.recordTransitionEvent(transition.getId(), consumed, produced, mode, metadata);
        } catch (RuntimeException e) {
            logger.warn(String.format("Could not record firing of %s: %s", transition.getId(), e.getMessage()));
        }
    }

    protected FiringResult reject(FiringResult.Builder builder, String reason) {
        TransitionEventLogger eventLogger = getEventLogger();
        if (eventLogger != null) {
            eventLogger.logFiringRejected(transition.getId(), currentTime(), reason);
        }
        return builder.failure(reason);
    }

    /**
     * Convert an unexpected exception into a failed result
     */
    protected FiringResult errorResult(String operation, RuntimeException e) {
        TransitionEventLogger eventLogger = getEventLogger();
        if (eventLogger != null) {
            eventLogger.logError(transition.getId(), currentTime(), operation, e);
        } else {
            logger.error(String.format("%s of %s failed: %s", operation, transition.getId(), e), e);
        }
        return resultBuilder().error(EngineConstants.errorReason(getTransitionType().getTag()), e);
    }

    /**
     * Evaluate a rate, returning the fallback when evaluation throws. The first
     * fallback of a behavior is logged as a warning, later ones at debug.
     */
    protected double evaluateRate(RateFunction rateFunction, String source, double time, double fallback) {
        try {
            return rateFunction.rate(evaluationContext(time));
        } catch (RuntimeException e) {
            if (!fallbackReported) {
                fallbackReported = true;
                TransitionEventLogger eventLogger = getEventLogger();
                if (eventLogger != null) {
                    eventLogger.logEvaluationFallback(transition.getId(), source, e.getMessage(), fallback);
                } else {
                    logger.warn(String.format("Rate '%s' of %s failed (%s), using %s",
                        source, transition.getId(), e.getMessage(), fallback));
                }
            } else {
                logger.debug(String.format("Rate '%s' of %s failed again: %s", source, transition.getId(), e.getMessage()));
            }
            return fallback;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + transition.getId() + "]";
    }
}
