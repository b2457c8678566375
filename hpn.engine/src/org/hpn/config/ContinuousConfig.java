package org.hpn.config;

import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.expression.ExpressionEvaluator;
import org.hpn.expression.RateFunction;
import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.Transition;

/**
 * Rate function and rate bounds of a continuous transition.
 *
 * Rate source, first match wins:
 * 1. property "rate_function" (expression text or rate function)
 * 2. property "rate" holding a rate function
 * 3. the transition's rate (number, expression text or rate function)
 * 4. constant 1.0
 *
 * "min_rate" defaults to 0 and "max_rate" to +infinity.
 */
public class ContinuousConfig {

    public static final String PROP_RATE_FUNCTION = "rate_function";
    public static final String PROP_RATE = "rate";
    public static final String PROP_MIN_RATE = "min_rate";
    public static final String PROP_MAX_RATE = "max_rate";

    private final RateFunction rateFunction;
    private final String rateSource;
    private final Double constantRate;
    private final double minRate;
    private final double maxRate;

    private ContinuousConfig(RateFunction rateFunction, String rateSource, Double constantRate,
                             double minRate, double maxRate) {
        this.rateFunction = rateFunction;
        this.rateSource = rateSource;
        this.constantRate = constantRate;
        this.minRate = minRate;
        this.maxRate = maxRate;
    }

    public static ContinuousConfig from(Transition transition, TransitionEventLogger eventLogger)
            throws BehaviorConfigurationException {
        String id = transition.getId();
        double minRate = TransitionProperties.getDouble(transition, PROP_MIN_RATE, EngineConstants.DEFAULT_MIN_RATE);
        double maxRate = TransitionProperties.getDouble(transition, PROP_MAX_RATE, EngineConstants.DEFAULT_MAX_RATE);
        if (minRate > maxRate) {
            throw new BehaviorConfigurationException(
                String.format("min_rate (%s) of %s exceeds max_rate (%s)", minRate, id, maxRate),
                id, PROP_MIN_RATE, minRate);
        }

        Object source = transition.getProperty(PROP_RATE_FUNCTION);
        if (source == null && transition.getProperty(PROP_RATE) instanceof RateFunction) {
            source = transition.getProperty(PROP_RATE);
        }
        if (source == null) {
            source = transition.getRate();
        }
        if (source == null) {
            source = EngineConstants.DEFAULT_RATE;
        }

        if (source instanceof RateFunction) {
            return new ContinuousConfig((RateFunction) source, source.toString(), null, minRate, maxRate);
        }
        Double numeric = TransitionProperties.toDouble(source);
        if (numeric != null) {
            final double value = numeric;
            return new ContinuousConfig(context -> value, source.toString(), value, minRate, maxRate);
        }
        if (source instanceof String) {
            String text = ((String) source).trim();
            return new ContinuousConfig(ExpressionEvaluator.compile(text, id, eventLogger), text, null,
                minRate, maxRate);
        }
        throw new BehaviorConfigurationException(
            String.format("Unsupported rate function type %s for %s", source.getClass().getName(), id),
            id, PROP_RATE_FUNCTION, source);
    }

    public RateFunction getRateFunction() {
        return rateFunction;
    }

    public String getRateSource() {
        return rateSource;
    }

    public boolean isConstantRate() {
        return constantRate != null;
    }

    public double getMinRate() {
        return minRate;
    }

    public double getMaxRate() {
        return maxRate;
    }

    /**
     * Clamp a raw rate into [min_rate, max_rate]. NaN clamps to min_rate.
     */
    public double clamp(double rate) {
        if (Double.isNaN(rate)) {
            return minRate;
        }
        return Math.max(minRate, Math.min(maxRate, rate));
    }

    @Override
    public String toString() {
        return "ContinuousConfig[rate=" + rateSource + ", min=" + minRate + ", max=" + maxRate + "]";
    }
}
