package org.hpn.expression;

import java.util.Collections;
import java.util.Set;

import org.apache.log4j.Logger;
import org.hpn.exceptions.ExpressionParseException;
import org.hpn.logger.TransitionEventLogger;

/**
 * Expression Evaluator
 *
 * Holds one rate or guard expression of a transition, parsed once when the
 * transition's behavior is built and evaluated on every poll.
 *
 * Malformed text does not stop behavior creation: the parse error is logged,
 * {@link #isValid()} reports false and every evaluation raises an
 * {@link EvaluationException}, which the behavior turns into its safe
 * default (rate 0, guard blocks).
 */
public class ExpressionEvaluator implements RateFunction {

    private static final Logger logger = Logger.getLogger(ExpressionEvaluator.class);

    private final String source;
    private final String ownerId;
    private final Expression expression;
    private final ExpressionParseException parseError;

    private ExpressionEvaluator(String source, String ownerId, Expression expression,
                                ExpressionParseException parseError) {
        this.source = source;
        this.ownerId = ownerId;
        this.expression = expression;
        this.parseError = parseError;
    }

    /**
     * Parse expression text for a transition
     *
     * @param source      the expression text
     * @param ownerId     id of the transition owning the expression, for log messages
     * @param eventLogger where to report a parse failure, may be null
     */
    public static ExpressionEvaluator compile(String source, String ownerId, TransitionEventLogger eventLogger) {
        try {
            Expression expression = ExpressionParser.parse(source);
            logger.debug(String.format("Compiled expression for %s: %s", ownerId, expression));
            return new ExpressionEvaluator(source, ownerId, expression, null);
        } catch (ExpressionParseException e) {
            logger.warn(String.format("Cannot parse expression for %s: %s", ownerId, e));
            if (eventLogger != null) {
                eventLogger.logEvaluationFallback(ownerId, source, e.getMessage(), "safe default");
            }
            return new ExpressionEvaluator(source, ownerId, null, e);
        }
    }

    public String getSource() {
        return source;
    }

    public boolean isValid() {
        return expression != null;
    }

    /**
     * @return the parse failure, or null when the text parsed
     */
    public ExpressionParseException getParseError() {
        return parseError;
    }

    public Set<String> getReferencedVariables() {
        return expression != null ? expression.getReferencedVariables() : Collections.<String>emptySet();
    }

    /**
     * Evaluate against the given context
     *
     * @throws EvaluationException when the text did not parse or evaluation fails
     */
    public double evaluate(EvaluationContext context) {
        if (expression == null) {
            throw new EvaluationException(String.format(
                "Expression '%s' of %s did not parse: %s", source, ownerId, parseError.getMessage()), parseError);
        }
        return expression.evaluate(context);
    }

    @Override
    public double rate(EvaluationContext context) {
        return evaluate(context);
    }

    @Override
    public String toString() {
        return source;
    }
}
