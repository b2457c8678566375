package org.hpn.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.Test;

class EngineSettingsTest {

    @Test
    void defaults() {
        EngineSettings settings = EngineSettings.defaults();

        assertEquals(1e-9, settings.getTimingEpsilon());
        assertEquals(8, settings.getDefaultMaxBurst());
        assertEquals(0.001, settings.getUrgencyTolerance());
        assertNull(settings.getRandomSeed());
        assertTrue(settings.isEventStorageEnabled());
    }

    @Test
    void bundledResourceMatchesDefaults() {
        EngineSettings settings = EngineSettings.load();

        assertEquals(8, settings.getDefaultMaxBurst());
        assertEquals(1e-9, settings.getTimingEpsilon());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(EngineSettings.KEY_TIMING_EPSILON, "1e-6");
        properties.setProperty(EngineSettings.KEY_DEFAULT_MAX_BURST, "4");
        properties.setProperty(EngineSettings.KEY_RANDOM_SEED, "42");
        properties.setProperty(EngineSettings.KEY_EVENT_STORAGE, "false");

        EngineSettings settings = EngineSettings.fromProperties(properties);

        assertEquals(1e-6, settings.getTimingEpsilon());
        assertEquals(4, settings.getDefaultMaxBurst());
        assertEquals(Long.valueOf(42), settings.getRandomSeed());
        assertFalse(settings.isEventStorageEnabled());
        assertFalse(settings.newEventLogger().isEventStorageEnabled());
    }

    @Test
    void seededRandomsRepeat() {
        Properties properties = new Properties();
        properties.setProperty(EngineSettings.KEY_RANDOM_SEED, "7");
        EngineSettings settings = EngineSettings.fromProperties(properties);

        assertEquals(settings.newRandom().nextDouble(), settings.newRandom().nextDouble());
    }

    @Test
    void invalidValuesAreRejected() {
        assertInvalid(EngineSettings.KEY_TIMING_EPSILON, "-1");
        assertInvalid(EngineSettings.KEY_DEFAULT_MAX_BURST, "0");
        assertInvalid(EngineSettings.KEY_DEFAULT_MAX_BURST, "4294967297");
        assertInvalid(EngineSettings.KEY_DEFAULT_MAX_BURST, "-4294967295");
        assertInvalid(EngineSettings.KEY_URGENCY_TOLERANCE, "0");
        assertInvalid(EngineSettings.KEY_RANDOM_SEED, "abc");
        assertInvalid(EngineSettings.KEY_EVENT_STORAGE, "maybe");
    }

    private static void assertInvalid(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.fromProperties(properties));
    }
}
