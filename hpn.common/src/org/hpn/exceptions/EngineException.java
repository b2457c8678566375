package org.hpn.exceptions;

/**
 * Base exception for all firing engine errors.
 *
 * Carries the id of the transition the error belongs to (may be null when
 * the error is not tied to one transition, e.g. a malformed expression parsed
 * on its own) and a machine-readable error code.
 */
public class EngineException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String transitionId;
    private final String errorCode;

    public EngineException(String message, String transitionId, String errorCode) {
        super(message);
        this.transitionId = transitionId;
        this.errorCode = errorCode;
    }

    public EngineException(String message, Throwable cause, String transitionId, String errorCode) {
        super(message, cause);
        this.transitionId = transitionId;
        this.errorCode = errorCode;
    }

    public EngineException(String message) {
        super(message);
        this.transitionId = null;
        this.errorCode = "GENERAL_ERROR";
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
        this.transitionId = null;
        this.errorCode = "GENERAL_ERROR";
    }

    public String getTransitionId() {
        return transitionId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (transitionId != null || errorCode != null) {
            sb.append(" [");
            if (transitionId != null) {
                sb.append(transitionId);
            }
            if (errorCode != null) {
                if (transitionId != null) {
                    sb.append(" - ");
                }
                sb.append(errorCode);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
