package org.hpn.expression;

/**
 * A rate computed from the current marking and time.
 *
 * Implementations may be plain Java code, for example
 * <pre>
 *   transition.setRate((RateFunction) ctx -&gt;
 *       FunctionCatalog.michaelisMenten(ctx.getTokens("1"), 10, 5));
 * </pre>
 * Any runtime exception thrown here is treated as an evaluation failure.
 */
public interface RateFunction {

    double rate(EvaluationContext context);
}
