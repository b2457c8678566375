package org.hpn.behavior;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.log4j.Logger;
import org.hpn.config.EngineSettings;
import org.hpn.config.StochasticConfig;
import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.exceptions.InvalidRateException;
import org.hpn.guard.GuardDecision;
import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.Arc;
import org.hpn.model.ArcKind;
import org.hpn.model.Place;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;
import org.hpn.model.TransitionType;

/**
 * Stochastic Behavior - exponential delay, burst firing
 *
 * On enablement at time t:
 *   rate      lambda = constant rate, or the rate expression evaluated at t
 *   delay     d = -ln(U) / lambda,  U ~ Uniform(0, 1]
 *   fire time t + d
 *   burst     B ~ DiscreteUniform(1, max_burst)
 *
 * The transition may fire once the clock reaches the fire time and every
 * normal input place holds weight x B tokens (test arcs need only weight).
 * Firing moves weight x B along every arc and clears the schedule. A source
 * transition instead draws a new delay and burst at the firing time, which
 * makes it a Poisson arrival process.
 *
 * A rate that evaluates to zero, a negative value or a non-finite value is a
 * modelling error and raises {@link InvalidRateException}.
 */
public class StochasticBehavior extends ScheduledFiringBehavior {

    private static final Logger logger = Logger.getLogger(StochasticBehavior.class);

    private final StochasticConfig config;
    private final Random random;

    public StochasticBehavior(Transition transition, SimulationContext context, EngineSettings settings,
                              Random random) throws BehaviorConfigurationException {
        super(transition, context, settings);
        this.config = StochasticConfig.from(transition, this.settings, getEventLogger());
        this.random = random != null ? random : this.settings.newRandom();
        logger.debug(String.format("Stochastic %s: %s", transition.getId(), config));
    }

    public StochasticBehavior(Transition transition, SimulationContext context, Random random)
            throws BehaviorConfigurationException {
        this(transition, context, EngineSettings.defaults(), random);
    }

    public StochasticBehavior(Transition transition, SimulationContext context)
            throws BehaviorConfigurationException {
        this(transition, context, EngineSettings.defaults(), null);
    }

    // ========== Scheduling ==========

    @Override
    public void setEnablementTime(double time) throws InvalidRateException {
        double rate = resolveRate(time);

        // 1 - nextDouble() lies in (0, 1], so the log is finite
        double u = 1.0 - random.nextDouble();
        double delay = -Math.log(u) / rate;
        int burst = 1 + random.nextInt(config.getMaxBurst());

        schedulingState.enable(time);
        schedulingState.schedule(time + delay, burst, rate);

        logEnablementSet(time);
        TransitionEventLogger eventLogger = getEventLogger();
        if (eventLogger != null) {
            eventLogger.logDelayScheduled(transition.getId(), time, time + delay, burst, rate);
        }
    }

    private double resolveRate(double time) throws InvalidRateException {
        double rate;
        if (config.isConstantRate()) {
            rate = config.getConstantRate();
        } else {
            rate = evaluateRate(config.getRateFunction(), config.getRateSource(), time, 0.0);
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new InvalidRateException(transition.getId(), config.getRateSource(), rate);
        }
        return rate;
    }

    // ========== Firing ==========

    @Override
    public EnablementResult canFire() {
        GuardDecision decision = evaluateGuard();
        if (!decision.passes()) {
            return EnablementResult.disabled(decision.getReason(), decision.getDetail());
        }

        if (!schedulingState.isScheduled()) {
            return EnablementResult.disabled(EngineConstants.REASON_NOT_SCHEDULED);
        }
        if (currentTime() + settings.getTimingEpsilon() < schedulingState.getScheduledFireTime()) {
            return EnablementResult.disabled(EngineConstants.REASON_TOO_EARLY);
        }

        EnablementResult failure = checkInputArcs(getInputArcs(), schedulingState.getSampledBurst(),
            EngineConstants.REASON_INSUFFICIENT_TOKENS_FOR_BURST);
        if (failure != null) {
            return failure;
        }
        return EnablementResult.enabled(EngineConstants.REASON_ENABLED_STOCHASTIC);
    }

    @Override
    public FiringResult fire(List<Arc> inputArcs, List<Arc> outputArcs) {
        try {
            FiringResult.Builder builder = resultBuilder().mode(EngineConstants.MODE_STOCHASTIC);

            EnablementResult enablement = canFire();
            if (!enablement.canFire()) {
                return reject(builder, enablement.getReason());
            }

            int burst = schedulingState.getSampledBurst();
            double rate = schedulingState.getSampledRate();
            double scheduledFireTime = schedulingState.getScheduledFireTime();

            Map<String, Double> consumed = new LinkedHashMap<>();
            Map<String, Double> produced = new LinkedHashMap<>();
            EnablementResult failure = transferTokens(inputArcs, outputArcs, burst,
                EngineConstants.REASON_INSUFFICIENT_TOKENS_FOR_BURST, consumed, produced);
            if (failure != null) {
                return reject(builder, failure.getReason());
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("transitionType", getTransitionType().getTag());
            metadata.put("burst", burst);
            metadata.put("rate", rate);
            metadata.put("scheduledFireTime", scheduledFireTime);

            if (transition.isSource()) {
                double now = currentTime();
                try {
                    setEnablementTime(now);
                    metadata.put("nextFireTime", schedulingState.getScheduledFireTime());
                } catch (InvalidRateException e) {
                    schedulingState.clear();
                    metadata.put("rescheduleError", e.getMessage());
                    TransitionEventLogger eventLogger = getEventLogger();
                    if (eventLogger != null) {
                        eventLogger.logError(transition.getId(), now, "reschedule", e);
                    } else {
                        logger.error(String.format("Cannot reschedule source %s: %s", transition.getId(), e.getMessage()), e);
                    }
                }
            } else {
                schedulingState.clear();
            }

            recordEvent(EngineConstants.MODE_STOCHASTIC, consumed, produced, metadata);

            logger.debug(String.format("%s fired burst %d: consumed=%s, produced=%s",
                transition.getId(), burst, consumed, produced));
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                builder.detail(entry.getKey(), entry.getValue());
            }
            return builder.consumed(consumed).produced(produced).success();
        } catch (RuntimeException e) {
            return errorResult("fire", e);
        }
    }

    // ========== Diagnostics ==========

    public StochasticConfig getConfig() {
        return config;
    }

    public int getMaxBurst() {
        return config.getMaxBurst();
    }

    /**
     * @return the sampled fire time, or null when not scheduled
     */
    public Double getScheduledFireTime() {
        return schedulingState.getScheduledFireTime();
    }

    /**
     * @return the sampled burst, or null when not scheduled
     */
    public Integer getSampledBurst() {
        return schedulingState.getSampledBurst();
    }

    /**
     * @return the rate used for the current schedule, or null when not scheduled
     */
    public Double getLastSampledRate() {
        return schedulingState.getSampledRate();
    }

    /**
     * @return time left until the scheduled fire time (0 once reached), or null
     */
    public Double getTimeUntilFire() {
        Double fireTime = schedulingState.getScheduledFireTime();
        return fireTime == null ? null : Math.max(0.0, fireTime - currentTime());
    }

    /**
     * Draw a new burst for the current schedule, keeping the fire time
     *
     * @return the new burst, or null when not scheduled
     */
    public Integer resampleBurst() {
        if (!schedulingState.isScheduled()) {
            return null;
        }
        int burst = 1 + random.nextInt(config.getMaxBurst());
        schedulingState.setSampledBurst(burst);
        return burst;
    }

    /**
     * Tokens each normal input place must hold for the sampled burst (or
     * max_burst when nothing is sampled), keyed by place id
     */
    public Map<String, Double> getRequiredTokensForBurst() {
        Integer sampled = schedulingState.getSampledBurst();
        int burst = sampled != null ? sampled : config.getMaxBurst();
        Map<String, Double> required = new LinkedHashMap<>();
        for (Arc arc : getInputArcs()) {
            Place place = arc.getSourcePlace();
            if (place != null && arc.getKind() == ArcKind.NORMAL) {
                required.merge(place.getId(), arc.getWeight() * burst, Double::sum);
            }
        }
        return required;
    }

    public Map<String, Object> getStochasticInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("rate", config.getRateSource());
        info.put("maxBurst", config.getMaxBurst());
        info.put("enablementTime", schedulingState.getEnablementTime());
        info.put("scheduledFireTime", schedulingState.getScheduledFireTime());
        info.put("sampledBurst", schedulingState.getSampledBurst());
        info.put("sampledRate", schedulingState.getSampledRate());
        info.put("currentTime", currentTime());
        info.put("timeUntilFire", getTimeUntilFire());
        info.put("source", transition.isSource());
        return info;
    }

    @Override
    public String getTypeName() {
        return "Stochastic (FSPN)";
    }

    @Override
    public TransitionType getTransitionType() {
        return TransitionType.STOCHASTIC;
    }
}
