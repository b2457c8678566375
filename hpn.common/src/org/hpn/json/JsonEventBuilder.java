package org.hpn.json;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Transition Event JSON Builder
 *
 * Builds the JSON form of one transition firing (or rejected firing).
 * The same shape is used by firing results and by the event logger.
 *
 * Event Format:
 * =============
 * {
 *   "transitionId": "T1",
 *   "transitionType": "timed",
 *   "success": true,
 *   "reason": "enabled-in-window",
 *   "mode": "logical",
 *   "time": 1.5,
 *   "consumed": { "P1": 1.0 },
 *   "produced": { "P2": 1.0 },
 *   "details": { "elapsed_time": 1.5, "timing_window": [1.0, 2.0] }
 * }
 *
 * Non-finite numbers (an unbounded latest time, an unbounded max rate) are
 * written as the strings "Infinity", "-Infinity" and "NaN" so the output stays
 * valid JSON.
 */
public class JsonEventBuilder {

    private String transitionId;
    private String transitionType;
    private Boolean success;
    private String reason;
    private String mode;
    private Double time;
    private Map<String, Double> consumed;
    private Map<String, Double> produced;
    private Map<String, Object> details;

    public JsonEventBuilder() {
        this.consumed = new LinkedHashMap<>();
        this.produced = new LinkedHashMap<>();
        this.details = new LinkedHashMap<>();
    }

    // ========== Builder Methods ==========

    public JsonEventBuilder setTransitionId(String transitionId) {
        this.transitionId = transitionId;
        return this;
    }

    public JsonEventBuilder setTransitionType(String transitionType) {
        this.transitionType = transitionType;
        return this;
    }

    public JsonEventBuilder setSuccess(boolean success) {
        this.success = success;
        return this;
    }

    public JsonEventBuilder setReason(String reason) {
        this.reason = reason;
        return this;
    }

    public JsonEventBuilder setMode(String mode) {
        this.mode = mode;
        return this;
    }

    public JsonEventBuilder setTime(double time) {
        this.time = time;
        return this;
    }

    public JsonEventBuilder setConsumed(Map<String, Double> consumed) {
        this.consumed = consumed != null ? new LinkedHashMap<>(consumed) : new LinkedHashMap<>();
        return this;
    }

    public JsonEventBuilder setProduced(Map<String, Double> produced) {
        this.produced = produced != null ? new LinkedHashMap<>(produced) : new LinkedHashMap<>();
        return this;
    }

    public JsonEventBuilder setDetails(Map<String, ?> details) {
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
        return this;
    }

    public JsonEventBuilder addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    // ========== Build Methods ==========

    /**
     * Build the event as a json-simple object
     */
    @SuppressWarnings("unchecked")
    public JSONObject build() {
        JSONObject event = new JSONObject();

        if (transitionId != null) {
            event.put("transitionId", transitionId);
        }
        if (transitionType != null) {
            event.put("transitionType", transitionType);
        }
        if (success != null) {
            event.put("success", success);
        }
        if (reason != null) {
            event.put("reason", reason);
        }
        if (mode != null) {
            event.put("mode", mode);
        }
        if (time != null) {
            event.put("time", toJsonValue(time));
        }

        event.put("consumed", toJsonObject(consumed));
        event.put("produced", toJsonObject(produced));

        if (!details.isEmpty()) {
            event.put("details", toJsonObject(details));
        }

        return event;
    }

    /**
     * Build the event as a JSON string
     */
    public String toJsonString() {
        return build().toJSONString();
    }

    // ========== Helpers ==========

    @SuppressWarnings("unchecked")
    private static JSONObject toJsonObject(Map<String, ?> values) {
        JSONObject json = new JSONObject();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            json.put(entry.getKey(), toJsonValue(entry.getValue()));
        }
        return json;
    }

    @SuppressWarnings("unchecked")
    private static Object toJsonValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return d;
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return toJsonObject(copy);
        }
        if (value instanceof Collection) {
            JSONArray array = new JSONArray();
            for (Object item : new ArrayList<>((Collection<?>) value)) {
                array.add(toJsonValue(item));
            }
            return array;
        }
        if (value instanceof double[]) {
            JSONArray array = new JSONArray();
            for (double d : (double[]) value) {
                array.add(toJsonValue(d));
            }
            return array;
        }
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        return value.toString();
    }
}
