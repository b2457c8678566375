package org.hpn.logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransitionEventLoggerTest {

    private TransitionEventLogger eventLogger;

    @BeforeEach
    void setUp() {
        eventLogger = new TransitionEventLogger();
        eventLogger.setEnableLogging(false);
    }

    @Test
    void firedEventsAreStoredWithJson() {
        eventLogger.logTransitionFired("T1", "logical", 2.0,
            Collections.singletonMap("1", 1.0), Collections.singletonMap("2", 1.0), null);

        List<TransitionEventLogger.TransitionEvent> events = eventLogger.getEventHistory();
        assertEquals(1, events.size());
        TransitionEventLogger.TransitionEvent event = events.get(0);
        assertEquals(TransitionEventLogger.EVENT_TRANSITION_FIRED, event.getEventType());
        assertEquals("T1", event.getTransitionId());
        assertEquals(2.0, event.getSimulationTime());
        assertNotNull(event.getJson());
        assertTrue(event.getJson().contains("\"mode\":\"logical\""));
    }

    @Test
    void nonFiringEventsHaveNoJson() {
        eventLogger.logFiringRejected("T1", 0.5, "too-early");

        TransitionEventLogger.TransitionEvent event = eventLogger.getEventHistory().get(0);
        assertEquals(TransitionEventLogger.EVENT_FIRING_REJECTED, event.getEventType());
        assertNull(event.getJson());
        assertTrue(event.getMessage().contains("too-early"));
    }

    @Test
    void queriesFilterByTransitionAndType() {
        eventLogger.logEnablementSet("T1", 0.0);
        eventLogger.logDelayScheduled("T2", 0.0, 0.4, 3, 2.0);
        eventLogger.logTransitionFired("T1", "logical", 1.0, null, null, null);
        eventLogger.logTransitionFired("T2", "stochastic", 1.0, null, null, null);
        eventLogger.logTransitionFired("T1", "logical", 2.0, null, null, null);

        assertEquals(3, eventLogger.getEventsForTransition("T1").size());
        assertEquals(1, eventLogger.getEventsOfType(TransitionEventLogger.EVENT_DELAY_SCHEDULED).size());

        Map<String, Integer> counts = eventLogger.getFiringCounts();
        assertEquals(Integer.valueOf(2), counts.get("T1"));
        assertEquals(Integer.valueOf(1), counts.get("T2"));
        assertEquals("T1", counts.keySet().iterator().next());
    }

    @Test
    void storageCanBeDisabled() {
        TransitionEventLogger quiet = new TransitionEventLogger(false);
        quiet.setEnableLogging(false);
        quiet.logBehaviorCreated("T1", "Immediate");

        assertTrue(quiet.getEventHistory().isEmpty());
        assertTrue(!quiet.isEventStorageEnabled());
    }

    @Test
    void historyIsReadOnlyAndClearable() {
        eventLogger.logEvaluationFallback("T1", "P9 * 2", "Unknown identifier 'P9'", 0.0);
        eventLogger.logError("T1", 1.0, "fire", new IllegalStateException("boom"));

        List<TransitionEventLogger.TransitionEvent> history = eventLogger.getEventHistory();
        assertEquals(2, history.size());
        assertThrows(UnsupportedOperationException.class, () -> history.clear());

        eventLogger.clearEventHistory();
        assertTrue(eventLogger.getEventHistory().isEmpty());
    }
}
