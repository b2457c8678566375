package org.hpn.expression;

/**
 * Raised while evaluating a parsed expression: unknown identifier, division
 * by zero, or an error thrown by a user rate function.
 *
 * Callers at the behavior boundary turn it into a safe default.
 */
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
