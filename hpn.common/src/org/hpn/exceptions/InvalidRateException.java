package org.hpn.exceptions;

/**
 * A stochastic firing rate evaluated to a value for which an exponential
 * delay is undefined (zero, negative, NaN or infinite).
 *
 * The rate is never clamped. A formula that goes non-positive typically
 * belongs to a reversible reaction that should be modeled as continuous.
 */
public class InvalidRateException extends EngineException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "INVALID_RATE";

    private final String rateSource;
    private final double evaluatedRate;

    public InvalidRateException(String transitionId, String rateSource, double evaluatedRate) {
        super(String.format(
                "Stochastic rate must be positive and finite, '%s' evaluated to %s",
                rateSource, evaluatedRate), transitionId, ERROR_CODE);
        this.rateSource = rateSource;
        this.evaluatedRate = evaluatedRate;
    }

    public String getRateSource() {
        return rateSource;
    }

    public double getEvaluatedRate() {
        return evaluatedRate;
    }
}
