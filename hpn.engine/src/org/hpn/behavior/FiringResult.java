package org.hpn.behavior;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hpn.json.JsonEventBuilder;

/**
 * Outcome of a firing or integration step.
 *
 * On success the consumed and produced maps list every place touched
 * (place id to amount). On failure nothing was mutated and
 * {@link #getReason()} says why; {@link #getErrorType()} is set when the
 * failure was an unexpected exception.
 */
public final class FiringResult {

    private final boolean success;
    private final String transitionId;
    private final String transitionType;
    private final String mode;
    private final double time;
    private final String reason;
    private final String errorType;
    private final Map<String, Double> consumed;
    private final Map<String, Double> produced;
    private final Map<String, Object> details;

    private FiringResult(Builder builder) {
        this.success = builder.success;
        this.transitionId = builder.transitionId;
        this.transitionType = builder.transitionType;
        this.mode = builder.mode;
        this.time = builder.time;
        this.reason = builder.reason;
        this.errorType = builder.errorType;
        this.consumed = Collections.unmodifiableMap(new LinkedHashMap<>(builder.consumed));
        this.produced = Collections.unmodifiableMap(new LinkedHashMap<>(builder.produced));
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public static Builder builder(String transitionId, String transitionType) {
        return new Builder(transitionId, transitionType);
    }

    public boolean isSuccess() { return success; }
    public String getTransitionId() { return transitionId; }
    public String getTransitionType() { return transitionType; }
    public String getMode() { return mode; }
    public double getTime() { return time; }

    /**
     * Failure reason code, null on success
     */
    public String getReason() { return reason; }

    /**
     * Simple class name of the exception behind a "-error" reason, else null
     */
    public String getErrorType() { return errorType; }

    public Map<String, Double> getConsumed() { return consumed; }
    public Map<String, Double> getProduced() { return produced; }
    public Map<String, Object> getDetails() { return details; }

    public Object getDetail(String key) {
        return details.get(key);
    }

    public String toJson() {
        JsonEventBuilder json = new JsonEventBuilder()
            .setTransitionId(transitionId)
            .setTransitionType(transitionType)
            .setSuccess(success)
            .setTime(time)
            .setConsumed(consumed)
            .setProduced(produced)
            .setDetails(details);
        if (mode != null) {
            json.setMode(mode);
        }
        if (reason != null) {
            json.setReason(reason);
        }
        if (errorType != null) {
            json.addDetail("errorType", errorType);
        }
        return json.toJsonString();
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("FiringResult[%s ok, consumed=%s, produced=%s, details=%s]",
                transitionId, consumed, produced, details);
        }
        return String.format("FiringResult[%s failed: %s%s]",
            transitionId, reason, errorType != null ? " (" + errorType + ")" : "");
    }

    // ========== Builder ==========

    public static final class Builder {
        private final String transitionId;
        private final String transitionType;
        private boolean success;
        private String mode;
        private double time;
        private String reason;
        private String errorType;
        private final Map<String, Double> consumed = new LinkedHashMap<>();
        private final Map<String, Double> produced = new LinkedHashMap<>();
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(String transitionId, String transitionType) {
            this.transitionId = transitionId;
            this.transitionType = transitionType;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder time(double time) {
            this.time = time;
            return this;
        }

        public Builder consumed(Map<String, Double> amounts) {
            consumed.putAll(amounts);
            return this;
        }

        public Builder produced(Map<String, Double> amounts) {
            produced.putAll(amounts);
            return this;
        }

        public Builder detail(String key, Object value) {
            details.put(key, value);
            return this;
        }

        public FiringResult success() {
            this.success = true;
            this.reason = null;
            return new FiringResult(this);
        }

        public FiringResult failure(String reason) {
            this.success = false;
            this.reason = reason;
            consumed.clear();
            produced.clear();
            return new FiringResult(this);
        }

        public FiringResult error(String reason, Exception e) {
            this.errorType = e.getClass().getSimpleName();
            detail("error", String.valueOf(e.getMessage()));
            return failure(reason);
        }
    }
}
