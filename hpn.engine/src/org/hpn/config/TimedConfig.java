package org.hpn.config;

import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.model.Transition;

/**
 * Timing window of a timed transition: [earliest, latest] after enablement.
 *
 * Resolution order:
 * 1. properties "earliest" / "latest" (either one present; missing earliest
 *    is 0, missing latest is unbounded)
 * 2. a positive numeric rate: fixed delay, earliest = latest = rate
 * 3. earliest = latest = 1.0
 */
public class TimedConfig {

    public static final String PROP_EARLIEST = "earliest";
    public static final String PROP_LATEST = "latest";

    private final double earliest;
    private final double latest;

    public TimedConfig(String transitionId, double earliest, double latest) throws BehaviorConfigurationException {
        if (earliest < 0 || Double.isNaN(earliest) || Double.isInfinite(earliest)) {
            throw new BehaviorConfigurationException(
                String.format("Earliest time of %s cannot be negative or unbounded: %s", transitionId, earliest),
                transitionId, PROP_EARLIEST, earliest);
        }
        if (Double.isNaN(latest) || latest < earliest) {
            throw new BehaviorConfigurationException(
                String.format("Latest time of %s (%s) must be >= earliest (%s)", transitionId, latest, earliest),
                transitionId, PROP_LATEST, latest);
        }
        this.earliest = earliest;
        this.latest = latest;
    }

    public static TimedConfig from(Transition transition) throws BehaviorConfigurationException {
        if (TransitionProperties.has(transition, PROP_EARLIEST) || TransitionProperties.has(transition, PROP_LATEST)) {
            double earliest = TransitionProperties.getDouble(transition, PROP_EARLIEST, 0.0);
            double latest = TransitionProperties.getDouble(transition, PROP_LATEST, Double.POSITIVE_INFINITY);
            return new TimedConfig(transition.getId(), earliest, latest);
        }

        Object rate = transition.getRate();
        if (rate instanceof Number) {
            double delay = ((Number) rate).doubleValue();
            if (delay > 0 && !Double.isInfinite(delay)) {
                return new TimedConfig(transition.getId(), delay, delay);
            }
        }
        return new TimedConfig(transition.getId(), EngineConstants.DEFAULT_TIMED_DELAY,
            EngineConstants.DEFAULT_TIMED_DELAY);
    }

    public double getEarliest() {
        return earliest;
    }

    public double getLatest() {
        return latest;
    }

    public boolean isUnbounded() {
        return Double.isInfinite(latest);
    }

    @Override
    public String toString() {
        return "TimedConfig[" + earliest + ", " + latest + "]";
    }
}
