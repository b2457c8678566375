package org.hpn.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.Random;

import org.apache.log4j.Logger;
import org.hpn.constants.EngineConstants;
import org.hpn.logger.TransitionEventLogger;

/**
 * Engine-wide settings
 *
 * Read from {@value #RESOURCE_NAME} on the classpath; any key can be
 * overridden with a system property of the same name
 * (e.g. {@code -Dhpn.random.seed=42}).
 *
 * Keys:
 * =====
 *   hpn.timing.epsilon              tolerance of timing window checks (default 1e-9)
 *   hpn.stochastic.defaultMaxBurst  max burst when a transition sets none (default 8)
 *   hpn.timed.urgencyTolerance      tolerance of the urgency check (default 0.001)
 *   hpn.random.seed                 seed for stochastic sampling (unset = nondeterministic)
 *   hpn.events.storage              keep fired events in memory (default true)
 */
public class EngineSettings {

    private static final Logger logger = Logger.getLogger(EngineSettings.class);

    public static final String RESOURCE_NAME = "hpn-engine.properties";

    public static final String KEY_TIMING_EPSILON = "hpn.timing.epsilon";
    public static final String KEY_DEFAULT_MAX_BURST = "hpn.stochastic.defaultMaxBurst";
    public static final String KEY_URGENCY_TOLERANCE = "hpn.timed.urgencyTolerance";
    public static final String KEY_RANDOM_SEED = "hpn.random.seed";
    public static final String KEY_EVENT_STORAGE = "hpn.events.storage";

    private static final String[] KEYS = {
        KEY_TIMING_EPSILON, KEY_DEFAULT_MAX_BURST, KEY_URGENCY_TOLERANCE, KEY_RANDOM_SEED, KEY_EVENT_STORAGE
    };

    private final double timingEpsilon;
    private final int defaultMaxBurst;
    private final double urgencyTolerance;
    private final Long randomSeed;
    private final boolean eventStorage;

    private EngineSettings(double timingEpsilon, int defaultMaxBurst, double urgencyTolerance,
                           Long randomSeed, boolean eventStorage) {
        this.timingEpsilon = timingEpsilon;
        this.defaultMaxBurst = defaultMaxBurst;
        this.urgencyTolerance = urgencyTolerance;
        this.randomSeed = randomSeed;
        this.eventStorage = eventStorage;
    }

    /**
     * Built-in defaults, ignoring the classpath and system properties
     */
    public static EngineSettings defaults() {
        return new EngineSettings(EngineConstants.TIMING_EPSILON, EngineConstants.DEFAULT_MAX_BURST,
            EngineConstants.DEFAULT_URGENCY_TOLERANCE, null, true);
    }

    /**
     * Classpath resource overlaid with system properties
     *
     * @throws IllegalArgumentException when a value is malformed or out of range
     */
    public static EngineSettings load() {
        Properties properties = new Properties();
        try (InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
                logger.debug("Loaded " + RESOURCE_NAME);
            } else {
                logger.debug(RESOURCE_NAME + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE_NAME, e);
        }

        for (String key : KEYS) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    /**
     * @throws IllegalArgumentException when a value is malformed or out of range
     */
    public static EngineSettings fromProperties(Properties properties) {
        double epsilon = parseDouble(properties, KEY_TIMING_EPSILON, EngineConstants.TIMING_EPSILON);
        if (epsilon < 0 || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException(KEY_TIMING_EPSILON + " must be a non-negative number, got " + epsilon);
        }

        long maxBurst = parseLong(properties, KEY_DEFAULT_MAX_BURST, EngineConstants.DEFAULT_MAX_BURST);
        if (maxBurst < 1 || maxBurst > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                KEY_DEFAULT_MAX_BURST + " must be between 1 and " + Integer.MAX_VALUE + ", got " + maxBurst);
        }

        double tolerance = parseDouble(properties, KEY_URGENCY_TOLERANCE, EngineConstants.DEFAULT_URGENCY_TOLERANCE);
        if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException(KEY_URGENCY_TOLERANCE + " must be positive, got " + tolerance);
        }

        Long seed = null;
        String seedText = trimmed(properties, KEY_RANDOM_SEED);
        if (seedText != null) {
            seed = parseLong(properties, KEY_RANDOM_SEED, 0L);
        }

        boolean storage = true;
        String storageText = trimmed(properties, KEY_EVENT_STORAGE);
        if (storageText != null) {
            if (!"true".equalsIgnoreCase(storageText) && !"false".equalsIgnoreCase(storageText)) {
                throw new IllegalArgumentException(KEY_EVENT_STORAGE + " must be true or false, got " + storageText);
            }
            storage = Boolean.parseBoolean(storageText);
        }

        EngineSettings settings = new EngineSettings(epsilon, (int) maxBurst, tolerance, seed, storage);
        logger.debug("Engine settings: " + settings);
        return settings;
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static double parseDouble(Properties properties, String key, double defaultValue) {
        String value = trimmed(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed)) {
                throw new IllegalArgumentException(key + " is not a number: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String value = trimmed(properties, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + value, e);
        }
    }

    // ========== Accessors ==========

    public double getTimingEpsilon() {
        return timingEpsilon;
    }

    public int getDefaultMaxBurst() {
        return defaultMaxBurst;
    }

    public double getUrgencyTolerance() {
        return urgencyTolerance;
    }

    /**
     * @return the configured seed, or null when sampling is nondeterministic
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public boolean isEventStorageEnabled() {
        return eventStorage;
    }

    /**
     * Random source for stochastic sampling: seeded when a seed is configured
     */
    public Random newRandom() {
        return randomSeed != null ? new Random(randomSeed) : new Random();
    }

    /**
     * Event logger honouring the event storage setting
     */
    public TransitionEventLogger newEventLogger() {
        return new TransitionEventLogger(eventStorage);
    }

    @Override
    public String toString() {
        return String.format("EngineSettings[epsilon=%s, defaultMaxBurst=%d, urgencyTolerance=%s, seed=%s, eventStorage=%s]",
            timingEpsilon, defaultMaxBurst, urgencyTolerance, randomSeed, eventStorage);
    }
}
