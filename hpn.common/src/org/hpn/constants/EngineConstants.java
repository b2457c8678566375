package org.hpn.constants;

/**
 * Centralized constants for the firing engine
 *
 * Reason codes are the first element of every (canFire, reason) pair and of
 * every failed firing result. Codes that name a place are built with
 * {@link #placeReason(String, String)}, e.g. "insufficient-tokens-P3".
 *
 * Event modes tag each recorded transition event:
 *   logical    - discrete firing (immediate, timed)
 *   stochastic - burst firing after an exponential delay
 *   continuous - one integration step of a continuous flow
 */
public class EngineConstants {

    // =============================================================================
    // NUMERIC DEFAULTS
    // =============================================================================

    // Absorbs drift from repeated time-step summation in timing window checks
    public static final double TIMING_EPSILON = 1e-9;

    public static final int DEFAULT_MAX_BURST = 8;

    public static final double DEFAULT_URGENCY_TOLERANCE = 0.001;

    // Timed transitions without window or rate: fire exactly one time unit after enablement
    public static final double DEFAULT_TIMED_DELAY = 1.0;

    public static final double DEFAULT_RATE = 1.0;

    public static final double DEFAULT_MIN_RATE = 0.0;

    public static final double DEFAULT_MAX_RATE = Double.POSITIVE_INFINITY;

    // =============================================================================
    // EVENT MODES
    // =============================================================================
    public static final String MODE_LOGICAL = "logical";
    public static final String MODE_STOCHASTIC = "stochastic";
    public static final String MODE_CONTINUOUS = "continuous";

    // =============================================================================
    // REASON CODES
    // =============================================================================
    public static final String REASON_ENABLED = "enabled";
    public static final String REASON_ENABLED_NO_INPUTS = "enabled-no-inputs";
    public static final String REASON_ENABLED_IN_WINDOW = "enabled-in-window";
    public static final String REASON_ENABLED_STOCHASTIC = "enabled-stochastic";
    public static final String REASON_ENABLED_CONTINUOUS = "enabled-continuous";
    public static final String REASON_ENABLED_CONTINUOUS_NO_INPUTS = "enabled-continuous-no-inputs";
    public static final String REASON_ENABLED_SOURCE = "enabled-source";

    public static final String REASON_INSUFFICIENT_TOKENS = "insufficient-tokens";
    public static final String REASON_INSUFFICIENT_TOKENS_FOR_BURST = "insufficient-tokens-for-burst";
    public static final String REASON_INHIBITED = "inhibited-by";
    public static final String REASON_INPUT_PLACE_EMPTY = "input-place-empty";
    public static final String REASON_MISSING_SOURCE_PLACE = "missing-source-place";

    public static final String REASON_NO_GUARD = "no-guard";
    public static final String REASON_GUARD_PASSES = "guard-passes";
    public static final String REASON_GUARD_FAILS = "guard-fails";
    public static final String REASON_GUARD_ERROR = "guard-error";

    public static final String REASON_NOT_ENABLED_YET = "not-enabled-yet";
    public static final String REASON_NOT_SCHEDULED = "not-scheduled";
    public static final String REASON_TOO_EARLY = "too-early";
    public static final String REASON_TOO_LATE = "too-late";

    public static final String REASON_INVALID_TIME_STEP = "invalid-time-step";
    public static final String REASON_USE_INTEGRATE_STEP = "use-integrate-step-for-continuous";

    // =============================================================================
    // ERROR-TO-RESULT PREFIXES
    // =============================================================================
    public static final String ERROR_SUFFIX = "-error";

    /**
     * Build a reason code that names a place, e.g. "insufficient-tokens-P3"
     */
    public static String placeReason(String reason, String placeSymbol) {
        return reason + "-" + placeSymbol;
    }

    /**
     * Build the reason code of an unexpected runtime error, e.g. "timed-error"
     */
    public static String errorReason(String behaviorTag) {
        return behaviorTag + ERROR_SUFFIX;
    }
}
