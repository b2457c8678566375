package org.hpn.behavior;

/**
 * Answer of {@link FiringBehavior#canFire()}: whether the transition may fire
 * now and the reason code.
 *
 * The reason is one of the codes in {@code EngineConstants}, possibly
 * suffixed with a place symbol ("insufficient-tokens-P3").
 */
public final class EnablementResult {

    private final boolean canFire;
    private final String reason;
    private final String detail;

    private EnablementResult(boolean canFire, String reason, String detail) {
        this.canFire = canFire;
        this.reason = reason;
        this.detail = detail;
    }

    public static EnablementResult enabled(String reason) {
        return new EnablementResult(true, reason, null);
    }

    public static EnablementResult disabled(String reason) {
        return new EnablementResult(false, reason, null);
    }

    public static EnablementResult disabled(String reason, String detail) {
        return new EnablementResult(false, reason, detail);
    }

    public boolean canFire() {
        return canFire;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Extra context (e.g. a guard error message), may be null
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnablementResult)) return false;
        EnablementResult other = (EnablementResult) o;
        return canFire == other.canFire && reason.equals(other.reason);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(canFire) + reason.hashCode();
    }

    @Override
    public String toString() {
        return "(" + canFire + ", " + reason + (detail != null ? ": " + detail : "") + ")";
    }
}
