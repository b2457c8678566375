package org.hpn.behavior;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.hpn.config.EngineSettings;
import org.hpn.config.TimedConfig;
import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.guard.GuardDecision;
import org.hpn.model.Arc;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;
import org.hpn.model.TransitionType;

/**
 * Timed Behavior - Time Petri Net interval semantics
 *
 * Once enabled at time t_e the transition may fire while
 *   t_e + earliest &lt;= now &lt;= t_e + latest
 * with both bounds widened by the timing epsilon. Firing moves tokens like an
 * immediate transition and then clears the enablement, so the driver must
 * re-enable the transition before it can fire again.
 *
 * States:
 * =======
 *   not enabled   : no enablement time              -&gt; "not-enabled-yet"
 *   early         : elapsed &lt; earliest             -&gt; "too-early"
 *   in window     : earliest &lt;= elapsed &lt;= latest  -&gt; fireable
 *   late          : elapsed &gt; latest               -&gt; "too-late"
 *
 * The latest bound is not enforced by the engine; {@link #isUrgent()} tells
 * the driver when a deadline is about to pass.
 */
public class TimedBehavior extends ScheduledFiringBehavior {

    private static final Logger logger = Logger.getLogger(TimedBehavior.class);

    private final TimedConfig config;

    public TimedBehavior(Transition transition, SimulationContext context, EngineSettings settings)
            throws BehaviorConfigurationException {
        super(transition, context, settings);
        this.config = TimedConfig.from(transition);
        logger.debug(String.format("Timed %s window [%s, %s]", transition.getId(), config.getEarliest(), config.getLatest()));
    }

    public TimedBehavior(Transition transition, SimulationContext context)
            throws BehaviorConfigurationException {
        this(transition, context, EngineSettings.defaults());
    }

    @Override
    public void setEnablementTime(double time) {
        schedulingState.enable(time);
        logEnablementSet(time);
    }

    @Override
    public EnablementResult canFire() {
        GuardDecision decision = evaluateGuard();
        if (!decision.passes()) {
            return EnablementResult.disabled(decision.getReason(), decision.getDetail());
        }

        EnablementResult failure = checkInputArcs(getInputArcs(), 1, EngineConstants.REASON_INSUFFICIENT_TOKENS);
        if (failure != null) {
            return failure;
        }

        Double enablementTime = schedulingState.getEnablementTime();
        if (enablementTime == null) {
            return EnablementResult.disabled(EngineConstants.REASON_NOT_ENABLED_YET);
        }

        double elapsed = currentTime() - enablementTime;
        double epsilon = settings.getTimingEpsilon();
        if (elapsed + epsilon < config.getEarliest()) {
            return EnablementResult.disabled(EngineConstants.REASON_TOO_EARLY);
        }
        if (elapsed > config.getLatest() + epsilon) {
            return EnablementResult.disabled(EngineConstants.REASON_TOO_LATE);
        }
        return EnablementResult.enabled(EngineConstants.REASON_ENABLED_IN_WINDOW);
    }

    @Override
    public FiringResult fire(List<Arc> inputArcs, List<Arc> outputArcs) {
        try {
            FiringResult.Builder builder = resultBuilder().mode(EngineConstants.MODE_LOGICAL);

            EnablementResult enablement = canFire();
            if (!enablement.canFire()) {
                return reject(builder, enablement.getReason());
            }

            Map<String, Double> consumed = new LinkedHashMap<>();
            Map<String, Double> produced = new LinkedHashMap<>();
            EnablementResult failure = transferTokens(inputArcs, outputArcs, 1,
                EngineConstants.REASON_INSUFFICIENT_TOKENS, consumed, produced);
            if (failure != null) {
                return reject(builder, failure.getReason());
            }

            double enablementTime = schedulingState.getEnablementTime();
            double elapsed = currentTime() - enablementTime;
            schedulingState.clear();

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("transitionType", getTransitionType().getTag());
            metadata.put("enablementTime", enablementTime);
            metadata.put("elapsed", elapsed);
            metadata.put("earliest", config.getEarliest());
            metadata.put("latest", config.getLatest());
            recordEvent(EngineConstants.MODE_LOGICAL, consumed, produced, metadata);

            logger.debug(String.format("%s fired after %.6f: consumed=%s, produced=%s",
                transition.getId(), elapsed, consumed, produced));
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                builder.detail(entry.getKey(), entry.getValue());
            }
            return builder.consumed(consumed).produced(produced).success();
        } catch (RuntimeException e) {
            return errorResult("fire", e);
        }
    }

    // ========== Diagnostics ==========

    public double getEarliest() {
        return config.getEarliest();
    }

    public double getLatest() {
        return config.getLatest();
    }

    public TimedConfig getConfig() {
        return config;
    }

    /**
     * @return time since enablement, or null when not enabled
     */
    public Double getElapsed() {
        Double enablementTime = schedulingState.getEnablementTime();
        return enablementTime == null ? null : currentTime() - enablementTime;
    }

    /**
     * @return time left until the window opens (0 once open), or null when not enabled
     */
    public Double getTimeUntilEarliest() {
        Double elapsed = getElapsed();
        return elapsed == null ? null : Math.max(0.0, config.getEarliest() - elapsed);
    }

    /**
     * @return time left until the window closes (may be negative or infinite),
     *         or null when not enabled
     */
    public Double getTimeUntilLatest() {
        Double elapsed = getElapsed();
        return elapsed == null ? null : config.getLatest() - elapsed;
    }

    public boolean isUrgent() {
        return isUrgent(settings.getUrgencyTolerance());
    }

    /**
     * True when the deadline is less than {@code tolerance} away and not yet passed
     */
    public boolean isUrgent(double tolerance) {
        Double elapsed = getElapsed();
        if (elapsed == null || config.isUnbounded()) {
            return false;
        }
        return Math.abs(elapsed - config.getLatest()) < tolerance && elapsed < config.getLatest();
    }

    public Map<String, Object> getTimingInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        Double enablementTime = schedulingState.getEnablementTime();
        Double elapsed = getElapsed();
        info.put("earliest", config.getEarliest());
        info.put("latest", config.getLatest());
        info.put("enablementTime", enablementTime);
        info.put("currentTime", currentTime());
        info.put("elapsed", elapsed);
        if (elapsed != null) {
            double epsilon = settings.getTimingEpsilon();
            info.put("inWindow", elapsed + epsilon >= config.getEarliest() && elapsed <= config.getLatest() + epsilon);
            info.put("earliestFireTime", enablementTime + config.getEarliest());
            info.put("deadline", enablementTime + config.getLatest());
            info.put("timeUntilEarliest", getTimeUntilEarliest());
            info.put("timeUntilLatest", getTimeUntilLatest());
        } else {
            info.put("inWindow", false);
        }
        info.put("urgent", isUrgent());
        return info;
    }

    @Override
    public String getTypeName() {
        return "Timed (TPN)";
    }

    @Override
    public TransitionType getTransitionType() {
        return TransitionType.TIMED;
    }
}
