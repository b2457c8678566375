package org.hpn.config;

import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.expression.ExpressionEvaluator;
import org.hpn.expression.RateFunction;
import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.Transition;

/**
 * Rate and burst bound of a stochastic transition.
 *
 * The rate is taken from the "rate" property, else the transition's rate,
 * else 1.0. A number (or numeric text) must be positive and finite here;
 * other text is an expression and a {@link RateFunction} is used as given,
 * both evaluated each time a delay is sampled.
 *
 * "max_burst" defaults to the engine setting and must be at least 1.
 */
public class StochasticConfig {

    public static final String PROP_RATE = "rate";
    public static final String PROP_MAX_BURST = "max_burst";

    private final Double constantRate;
    private final RateFunction rateFunction;
    private final String rateSource;
    private final int maxBurst;

    private StochasticConfig(Double constantRate, RateFunction rateFunction, String rateSource, int maxBurst) {
        this.constantRate = constantRate;
        this.rateFunction = rateFunction;
        this.rateSource = rateSource;
        this.maxBurst = maxBurst;
    }

    public static StochasticConfig constant(String transitionId, double rate, int maxBurst)
            throws BehaviorConfigurationException {
        validateRate(transitionId, rate, rate);
        validateBurst(transitionId, maxBurst);
        return new StochasticConfig(rate, null, Double.toString(rate), maxBurst);
    }

    public static StochasticConfig from(Transition transition, EngineSettings settings,
                                        TransitionEventLogger eventLogger) throws BehaviorConfigurationException {
        String id = transition.getId();
        int maxBurst = TransitionProperties.getInt(transition, PROP_MAX_BURST, settings.getDefaultMaxBurst());
        validateBurst(id, maxBurst);

        Object rate = transition.getProperty(PROP_RATE);
        if (rate == null) {
            rate = transition.getRate();
        }
        if (rate == null) {
            return new StochasticConfig(EngineConstants.DEFAULT_RATE, null,
                Double.toString(EngineConstants.DEFAULT_RATE), maxBurst);
        }

        if (rate instanceof RateFunction) {
            return new StochasticConfig(null, (RateFunction) rate, rate.toString(), maxBurst);
        }
        Double numeric = TransitionProperties.toDouble(rate);
        if (numeric != null) {
            validateRate(id, numeric, rate);
            return new StochasticConfig(numeric, null, rate.toString(), maxBurst);
        }
        if (rate instanceof String) {
            String text = ((String) rate).trim();
            ExpressionEvaluator expression = ExpressionEvaluator.compile(text, id, eventLogger);
            return new StochasticConfig(null, expression, text, maxBurst);
        }
        throw new BehaviorConfigurationException(
            String.format("Unsupported rate type %s for %s", rate.getClass().getName(), id),
            id, PROP_RATE, rate);
    }

    private static void validateRate(String transitionId, double rate, Object rawValue)
            throws BehaviorConfigurationException {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new BehaviorConfigurationException(
                String.format("Stochastic rate of %s must be positive and finite: %s", transitionId, rawValue),
                transitionId, PROP_RATE, rawValue);
        }
    }

    private static void validateBurst(String transitionId, int maxBurst) throws BehaviorConfigurationException {
        if (maxBurst < 1) {
            throw new BehaviorConfigurationException(
                String.format("Max burst of %s must be >= 1: %d", transitionId, maxBurst),
                transitionId, PROP_MAX_BURST, maxBurst);
        }
    }

    public boolean isConstantRate() {
        return constantRate != null;
    }

    /**
     * @return the validated constant rate, or null for an evaluated rate
     */
    public Double getConstantRate() {
        return constantRate;
    }

    /**
     * @return the rate function for an evaluated rate, or null for a constant
     */
    public RateFunction getRateFunction() {
        return rateFunction;
    }

    public String getRateSource() {
        return rateSource;
    }

    public int getMaxBurst() {
        return maxBurst;
    }

    @Override
    public String toString() {
        return "StochasticConfig[rate=" + rateSource + ", maxBurst=" + maxBurst + "]";
    }
}
