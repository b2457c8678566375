package org.hpn.guard;

import org.hpn.expression.EvaluationContext;

/**
 * Guard written as Java code. A runtime exception counts as a guard error.
 */
public interface GuardCondition {

    boolean isSatisfied(EvaluationContext context);
}
