package org.hpn.exceptions;

/**
 * Invalid construction parameters for a firing behavior.
 *
 * Raised while a behavior (or its typed configuration) is being built, never
 * from inside a firing attempt: negative earliest time, latest before earliest,
 * non-positive constant rate, burst below one, inverted rate bounds,
 * unsupported guard or transition type.
 */
public class BehaviorConfigurationException extends EngineException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "CONFIGURATION_ERROR";

    private final String parameter;
    private final Object invalidValue;

    public BehaviorConfigurationException(String message, String transitionId) {
        super(message, transitionId, ERROR_CODE);
        this.parameter = null;
        this.invalidValue = null;
    }

    public BehaviorConfigurationException(String message, String transitionId,
                                          String parameter, Object invalidValue) {
        super(message, transitionId, ERROR_CODE);
        this.parameter = parameter;
        this.invalidValue = invalidValue;
    }

    public BehaviorConfigurationException(String message, Throwable cause, String transitionId,
                                          String parameter, Object invalidValue) {
        super(message, cause, transitionId, ERROR_CODE);
        this.parameter = parameter;
        this.invalidValue = invalidValue;
    }

    public String getParameter() {
        return parameter;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        if (parameter != null) {
            sb.append(" (parameter: ").append(parameter)
              .append(", value: ").append(invalidValue).append(")");
        }
        return sb.toString();
    }
}
