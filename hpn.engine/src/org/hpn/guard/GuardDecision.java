package org.hpn.guard;

/**
 * Outcome of one guard evaluation: whether the transition may proceed and why.
 */
public class GuardDecision {

    private final boolean passes;
    private final String reason;
    private final String detail;

    public GuardDecision(boolean passes, String reason, String detail) {
        this.passes = passes;
        this.reason = reason;
        this.detail = detail;
    }

    public GuardDecision(boolean passes, String reason) {
        this(passes, reason, null);
    }

    public boolean passes() {
        return passes;
    }

    /**
     * One of no-guard, guard-passes, guard-fails, guard-error
     */
    public String getReason() {
        return reason;
    }

    /**
     * Error message for guard-error decisions, otherwise null
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "GuardDecision[" + passes + ", " + reason + (detail != null ? ", " + detail : "") + "]";
    }
}
