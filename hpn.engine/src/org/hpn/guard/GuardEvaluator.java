package org.hpn.guard;

import java.util.Locale;

import org.apache.log4j.Logger;
import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.expression.EvaluationContext;
import org.hpn.expression.ExpressionEvaluator;
import org.hpn.logger.TransitionEventLogger;

/**
 * Guard Evaluator
 *
 * Turns a transition's guard setting into a pass/fail decision with a reason.
 *
 * Guard forms:
 * ============
 * - absent (null or blank text)      : always passes, reason "no-guard"
 * - boolean, "true" / "false" text   : constant
 * - number, numeric text             : passes when the value is &gt; 0
 * - {@link GuardCondition}            : called with the evaluation context
 * - any other text                   : expression; passes when the result is &gt; 0
 *                                      (comparisons yield 1 or 0)
 *
 * Failures while evaluating (malformed text, unknown identifier, exception
 * from a guard condition) block the transition with reason "guard-error".
 */
public class GuardEvaluator {

    private static final Logger logger = Logger.getLogger(GuardEvaluator.class);

    public enum GuardMode {
        ABSENT,     // No guard configured
        CONSTANT,   // Fixed true/false
        THRESHOLD,  // Fixed number, passes when > 0
        CALLABLE,   // Java GuardCondition
        EXPRESSION  // Parsed expression text
    }

    private final String transitionId;
    private final GuardMode mode;
    private final Object guardSetting;
    private final boolean constantValue;
    private final double threshold;
    private final GuardCondition condition;
    private final ExpressionEvaluator expression;

    private GuardEvaluator(String transitionId, GuardMode mode, Object guardSetting, boolean constantValue,
                           double threshold, GuardCondition condition, ExpressionEvaluator expression) {
        this.transitionId = transitionId;
        this.mode = mode;
        this.guardSetting = guardSetting;
        this.constantValue = constantValue;
        this.threshold = threshold;
        this.condition = condition;
        this.expression = expression;
    }

    /**
     * Build the evaluator for a guard setting
     *
     * @throws BehaviorConfigurationException when the setting has an unsupported type
     */
    public static GuardEvaluator create(Object guardSetting, String transitionId,
                                        TransitionEventLogger eventLogger) throws BehaviorConfigurationException {
        if (guardSetting == null) {
            return new GuardEvaluator(transitionId, GuardMode.ABSENT, null, true, 0.0, null, null);
        }
        if (guardSetting instanceof Boolean) {
            return new GuardEvaluator(transitionId, GuardMode.CONSTANT, guardSetting,
                (Boolean) guardSetting, 0.0, null, null);
        }
        if (guardSetting instanceof Number) {
            return new GuardEvaluator(transitionId, GuardMode.THRESHOLD, guardSetting,
                false, ((Number) guardSetting).doubleValue(), null, null);
        }
        if (guardSetting instanceof GuardCondition) {
            return new GuardEvaluator(transitionId, GuardMode.CALLABLE, guardSetting,
                false, 0.0, (GuardCondition) guardSetting, null);
        }
        if (guardSetting instanceof String) {
            return fromText((String) guardSetting, transitionId, eventLogger);
        }
        throw new BehaviorConfigurationException(
            String.format("Unsupported guard type %s", guardSetting.getClass().getName()),
            transitionId, "guard", guardSetting);
    }

    private static GuardEvaluator fromText(String text, String transitionId, TransitionEventLogger eventLogger) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new GuardEvaluator(transitionId, GuardMode.ABSENT, text, true, 0.0, null, null);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return new GuardEvaluator(transitionId, GuardMode.CONSTANT, text, "true".equals(lower), 0.0, null, null);
        }
        Double number = parseNumber(trimmed);
        if (number != null) {
            return new GuardEvaluator(transitionId, GuardMode.THRESHOLD, text, false, number, null, null);
        }
        ExpressionEvaluator compiled = ExpressionEvaluator.compile(trimmed, transitionId, eventLogger);
        return new GuardEvaluator(transitionId, GuardMode.EXPRESSION, text, false, 0.0, null, compiled);
    }

    private static Double parseNumber(String text) {
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ========== Evaluation ==========

    /**
     * Decide whether the guard lets the transition proceed
     */
    public GuardDecision evaluate(EvaluationContext context) {
        switch (mode) {
            case ABSENT:
                return new GuardDecision(true, EngineConstants.REASON_NO_GUARD);
            case CONSTANT:
                return decide(constantValue);
            case THRESHOLD:
                return decide(threshold > 0);
            case CALLABLE:
                try {
                    return decide(condition.isSatisfied(context));
                } catch (RuntimeException e) {
                    return error(e);
                }
            case EXPRESSION:
                try {
                    double value = expression.evaluate(context);
                    return decide(value > 0);
                } catch (RuntimeException e) {
                    return error(e);
                }
            default:
                throw new IllegalStateException("Unhandled guard mode " + mode);
        }
    }

    private static GuardDecision decide(boolean passes) {
        return new GuardDecision(passes,
            passes ? EngineConstants.REASON_GUARD_PASSES : EngineConstants.REASON_GUARD_FAILS);
    }

    private GuardDecision error(RuntimeException e) {
        logger.warn(String.format("Guard of %s raised %s: %s, blocking",
            transitionId, e.getClass().getSimpleName(), e.getMessage()));
        return new GuardDecision(false, EngineConstants.REASON_GUARD_ERROR, e.getMessage());
    }

    // ========== Accessors ==========

    public GuardMode getMode() {
        return mode;
    }

    public boolean isPresent() {
        return mode != GuardMode.ABSENT;
    }

    public Object getGuardSetting() {
        return guardSetting;
    }

    /**
     * @return the compiled expression for EXPRESSION guards, else null
     */
    public ExpressionEvaluator getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return "GuardEvaluator[" + transitionId + ", " + mode + ", " + guardSetting + "]";
    }
}
