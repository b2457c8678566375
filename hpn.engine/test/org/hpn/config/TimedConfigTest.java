package org.hpn.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.model.Transition;
import org.junit.jupiter.api.Test;

class TimedConfigTest {

    @Test
    void explicitWindow() throws Exception {
        TimedConfig config = TimedConfig.from(new Transition("T1", "timed")
            .setProperty("earliest", 1.0).setProperty("latest", "2"));

        assertEquals(1.0, config.getEarliest());
        assertEquals(2.0, config.getLatest());
        assertFalse(config.isUnbounded());
    }

    @Test
    void missingLatestIsUnbounded() throws Exception {
        TimedConfig config = TimedConfig.from(new Transition("T1", "timed").setProperty("earliest", 0.5));

        assertEquals(0.5, config.getEarliest());
        assertTrue(config.isUnbounded());
    }

    @Test
    void missingEarliestIsZero() throws Exception {
        TimedConfig config = TimedConfig.from(new Transition("T1", "timed").setProperty("latest", 3));

        assertEquals(0.0, config.getEarliest());
        assertEquals(3.0, config.getLatest());
    }

    @Test
    void rateIsAFixedDelay() throws Exception {
        TimedConfig config = TimedConfig.from(new Transition("T1", "timed").setRate(2.5));

        assertEquals(2.5, config.getEarliest());
        assertEquals(2.5, config.getLatest());
    }

    @Test
    void defaultsToOneTimeUnit() throws Exception {
        TimedConfig config = TimedConfig.from(new Transition("T1", "timed"));

        assertEquals(1.0, config.getEarliest());
        assertEquals(1.0, config.getLatest());
    }

    @Test
    void invalidWindowsAreRejected() {
        assertThrows(BehaviorConfigurationException.class,
            () -> TimedConfig.from(new Transition("T1", "timed").setProperty("earliest", -1)));
        assertThrows(BehaviorConfigurationException.class,
            () -> TimedConfig.from(new Transition("T1", "timed")
                .setProperty("earliest", 3).setProperty("latest", 2)));
        assertThrows(BehaviorConfigurationException.class,
            () -> TimedConfig.from(new Transition("T1", "timed").setProperty("earliest", "soon")));
    }

    @Test
    void pointWindowIsAllowed() throws Exception {
        TimedConfig config = new TimedConfig("T1", 2.0, 2.0);

        assertEquals(config.getEarliest(), config.getLatest());
    }
}
