package org.hpn.behavior;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.hpn.config.ContinuousConfig;
import org.hpn.config.EngineSettings;
import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.guard.GuardDecision;
import org.hpn.model.Arc;
import org.hpn.model.ArcKind;
import org.hpn.model.Place;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;
import org.hpn.model.TransitionType;

/**
 * Continuous Behavior - rate-driven token flow
 *
 * Enabled while every normal input place holds a strictly positive amount
 * (test arcs still need their weight, inhibitor arcs still inhibit). Source
 * transitions skip the normal-arc check only; their test and inhibitor arcs
 * still gate them.
 *
 * Integration step (forward Euler, one rate evaluation per step):
 * ================================================================
 *   rate   = clamp(rate_function(marking, now), min_rate, max_rate)
 *   flow   = rate x dt, reduced to min(tokens / total weight) over normal input places
 *   input  : tokens -= total weight x flow   (skipped for sources)
 *   output : tokens += total weight x flow   (skipped for sinks)
 *
 * Weights of parallel arcs between the same place and transition add up.
 *
 * Accuracy is first order in dt; drivers wanting higher order should take
 * smaller steps. {@link #fire(List, List)} is not used by continuous
 * transitions; drivers call {@link #integrateStep(double, List, List)}.
 */
public class ContinuousBehavior extends FiringBehavior {

    private static final Logger logger = Logger.getLogger(ContinuousBehavior.class);

    public static final String INTEGRATION_METHOD = "euler";

    private final ContinuousConfig config;

    public ContinuousBehavior(Transition transition, SimulationContext context, EngineSettings settings)
            throws BehaviorConfigurationException {
        super(transition, context, settings, true);
        this.config = ContinuousConfig.from(transition, getEventLogger());
        logger.debug(String.format("Continuous %s: %s", transition.getId(), config));
    }

    public ContinuousBehavior(Transition transition, SimulationContext context)
            throws BehaviorConfigurationException {
        this(transition, context, EngineSettings.defaults());
    }

    @Override
    public EnablementResult canFire() {
        GuardDecision decision = evaluateGuard();
        if (!decision.passes()) {
            return EnablementResult.disabled(decision.getReason(), decision.getDetail());
        }
        List<Arc> inputArcs = getInputArcs();
        if (inputArcs.isEmpty()) {
            return EnablementResult.enabled(transition.isSource()
                ? EngineConstants.REASON_ENABLED_SOURCE
                : EngineConstants.REASON_ENABLED_CONTINUOUS_NO_INPUTS);
        }

        for (Arc arc : inputArcs) {
            Place place = arc.getSourcePlace();
            if (place == null) {
                return EnablementResult.disabled(EngineConstants.placeReason(
                    EngineConstants.REASON_MISSING_SOURCE_PLACE, arc.getSource().getId()));
            }
            switch (arc.getKind()) {
                case NORMAL:
                    if (!transition.isSource() && place.getTokens() <= 0) {
                        return EnablementResult.disabled(
                            EngineConstants.placeReason(EngineConstants.REASON_INPUT_PLACE_EMPTY, place.getSymbol()));
                    }
                    break;
                case TEST:
                    if (place.getTokens() < arc.getWeight()) {
                        return EnablementResult.disabled(
                            EngineConstants.placeReason(EngineConstants.REASON_INSUFFICIENT_TOKENS, place.getSymbol()));
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
        if (transition.isSource()) {
            return EnablementResult.enabled(EngineConstants.REASON_ENABLED_SOURCE);
        }
        return EnablementResult.enabled(EngineConstants.REASON_ENABLED_CONTINUOUS);
    }

    /**
     * Continuous transitions move tokens only through integration steps
     */
    @Override
    public FiringResult fire(List<Arc> inputArcs, List<Arc> outputArcs) {
        return resultBuilder().mode(EngineConstants.MODE_CONTINUOUS)
            .failure(EngineConstants.REASON_USE_INTEGRATE_STEP);
    }

    /**
     * Advance the flow of this transition by dt
     */
    public FiringResult integrateStep(double dt, List<Arc> inputArcs, List<Arc> outputArcs) {
        try {
            FiringResult.Builder builder = resultBuilder().mode(EngineConstants.MODE_CONTINUOUS);
            if (!(dt > 0) || Double.isInfinite(dt)) {
                return reject(builder, EngineConstants.REASON_INVALID_TIME_STEP);
            }

            EnablementResult enablement = canFire();
            if (!enablement.canFire()) {
                return reject(builder, enablement.getReason());
            }

            FlowPrediction flow = computeFlow(dt, evaluateCurrentRate(), inputArcs, outputArcs);
            builder.detail("rate", flow.getRate())
                .detail("actualRate", flow.getActualFlow() / dt)
                .detail("dt", dt)
                .detail("method", INTEGRATION_METHOD)
                .detail("clamped", flow.isClamped());

            if (flow.getRate() <= 0) {
                return builder.success();
            }

            Set<String> outputSeen = new HashSet<>();

            // one update per place, with the amounts already summed over parallel arcs
            for (Place place : inputPlaces(inputArcs).values()) {
                Double amount = flow.getConsumed().get(place.getId());
                if (amount != null) {
                    place.setTokens(Math.max(0.0, place.getTokens() - amount));
                }
            }
            for (Arc arc : outputArcs) {
                Place place = arc.getTargetPlace();
                if (place == null || !flow.getProduced().containsKey(place.getId())) {
                    continue;
                }
                if (outputSeen.add(place.getId())) {
                    place.setTokens(place.getTokens() + flow.getProduced().get(place.getId()));
                }
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("transitionType", getTransitionType().getTag());
            metadata.put("rate", flow.getRate());
            metadata.put("actualRate", flow.getActualFlow() / dt);
            metadata.put("dt", dt);
            metadata.put("method", INTEGRATION_METHOD);
            metadata.put("clamped", flow.isClamped());
            recordEvent(EngineConstants.MODE_CONTINUOUS, flow.getConsumed(), flow.getProduced(), metadata);

            return builder.consumed(flow.getConsumed()).produced(flow.getProduced()).success();
        } catch (RuntimeException e) {
            return errorResult("integrateStep", e);
        }
    }

    // Flow of one step at the given clamped rate, without touching the marking
    private FlowPrediction computeFlow(double dt, double rate, List<Arc> inputArcs, List<Arc> outputArcs) {
        Map<String, Double> consumed = new LinkedHashMap<>();
        Map<String, Double> produced = new LinkedHashMap<>();
        if (rate <= 0) {
            return new FlowPrediction(rate, dt, 0.0, 0.0, consumed, produced);
        }

        double intendedFlow = rate * dt;
        double actualFlow = intendedFlow;
        Map<Place, Double> inputWeights = new LinkedHashMap<>();
        if (!transition.isSource()) {
            for (Arc arc : inputArcs) {
                Place place = arc.getSourcePlace();
                if (arc.getKind() == ArcKind.NORMAL && place != null) {
                    inputWeights.merge(place, arc.getWeight(), Double::sum);
                }
            }
            for (Map.Entry<Place, Double> entry : inputWeights.entrySet()) {
                actualFlow = Math.min(actualFlow, entry.getKey().getTokens() / entry.getValue());
            }
            actualFlow = Math.max(0.0, actualFlow);
        }

        if (actualFlow > 0) {
            for (Map.Entry<Place, Double> entry : inputWeights.entrySet()) {
                consumed.put(entry.getKey().getId(), entry.getValue() * actualFlow);
            }
            if (!transition.isSink()) {
                for (Arc arc : outputArcs) {
                    Place place = arc.getTargetPlace();
                    if (place != null) {
                        produced.merge(place.getId(), arc.getWeight() * actualFlow, Double::sum);
                    }
                }
            }
        }
        return new FlowPrediction(rate, dt, intendedFlow, actualFlow, consumed, produced);
    }

    private static Map<String, Place> inputPlaces(List<Arc> inputArcs) {
        Map<String, Place> places = new LinkedHashMap<>();
        for (Arc arc : inputArcs) {
            Place place = arc.getSourcePlace();
            if (arc.getKind() == ArcKind.NORMAL && place != null) {
                places.putIfAbsent(place.getId(), place);
            }
        }
        return places;
    }

    // ========== Diagnostics ==========

    public ContinuousConfig getConfig() {
        return config;
    }

    /**
     * Rate at the current marking and time, clamped to [min_rate, max_rate].
     * A failing rate function counts as rate 0 before clamping.
     */
    public double evaluateCurrentRate() {
        double raw = evaluateRate(config.getRateFunction(), config.getRateSource(), currentTime(), 0.0);
        return config.clamp(raw);
    }

    /**
     * Flow a step of dt would move now, without changing any place
     */
    public FlowPrediction predictFlow(double dt) {
        if (!(dt > 0) || Double.isInfinite(dt)) {
            throw new IllegalArgumentException("dt must be positive and finite: " + dt);
        }
        return computeFlow(dt, evaluateCurrentRate(), getInputArcs(), getOutputArcs());
    }

    public Map<String, Object> getContinuousInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("rateFunction", config.getRateSource());
        info.put("minRate", config.getMinRate());
        info.put("maxRate", config.getMaxRate());
        info.put("currentRate", evaluateCurrentRate());
        info.put("currentTime", currentTime());
        info.put("method", INTEGRATION_METHOD);
        info.put("source", transition.isSource());
        info.put("sink", transition.isSink());
        return info;
    }

    @Override
    public String getTypeName() {
        return "Continuous (SHPN)";
    }

    @Override
    public TransitionType getTransitionType() {
        return TransitionType.CONTINUOUS;
    }

    // ========== Inner Classes ==========

    /**
     * Amounts one integration step moves at a given rate
     */
    public static final class FlowPrediction {
        private final double rate;
        private final double dt;
        private final double intendedFlow;
        private final double actualFlow;
        private final Map<String, Double> consumed;
        private final Map<String, Double> produced;

        FlowPrediction(double rate, double dt, double intendedFlow, double actualFlow,
                       Map<String, Double> consumed, Map<String, Double> produced) {
            this.rate = rate;
            this.dt = dt;
            this.intendedFlow = intendedFlow;
            this.actualFlow = actualFlow;
            this.consumed = Collections.unmodifiableMap(consumed);
            this.produced = Collections.unmodifiableMap(produced);
        }

        public double getRate() { return rate; }
        public double getDt() { return dt; }
        public double getIntendedFlow() { return intendedFlow; }
        public double getActualFlow() { return actualFlow; }
        public Map<String, Double> getConsumed() { return consumed; }
        public Map<String, Double> getProduced() { return produced; }

        /**
         * True when input availability cut the flow below rate x dt
         */
        public boolean isClamped() {
            return actualFlow < intendedFlow;
        }

        @Override
        public String toString() {
            return String.format("FlowPrediction[rate=%s, dt=%s, flow=%s, consumed=%s, produced=%s]",
                rate, dt, actualFlow, consumed, produced);
        }
    }
}
