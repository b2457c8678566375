package org.hpn.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.hpn.config.EngineSettings;
import org.hpn.logger.TransitionEventLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PetriNetModelTest {

    private PetriNetModel net;
    private Place p1;
    private Place p2;
    private Transition t1;

    @BeforeEach
    void setUp() {
        net = new PetriNetModel();
        net.getEventLogger().setEnableLogging(false);
        p1 = net.addPlace(new Place("1", 5));
        p2 = net.addPlace(new Place("2", 0));
        t1 = net.addTransition(new Transition("T1", "immediate"));
        net.connect(p1, t1, 1);
        net.connect(t1, p2, 2);
    }

    @Test
    void arcsAreSplitIntoInputsAndOutputs() {
        List<Arc> inputs = net.getInputArcs(t1);
        List<Arc> outputs = net.getOutputArcs(t1);

        assertEquals(1, inputs.size());
        assertSame(p1, inputs.get(0).getSourcePlace());
        assertEquals(1, outputs.size());
        assertSame(p2, outputs.get(0).getTargetPlace());
        assertEquals(2.0, outputs.get(0).getWeight());
    }

    @Test
    void unconnectedTransitionHasNoArcs() {
        Transition lonely = net.addTransition(new Transition("T2", "timed"));

        assertTrue(net.getInputArcs(lonely).isEmpty());
        assertTrue(net.getOutputArcs(lonely).isEmpty());
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> net.addPlace(new Place("1", 1)));
        assertThrows(IllegalArgumentException.class, () -> net.addTransition(new Transition("T1", "timed")));
    }

    @Test
    void clockOnlyMovesForward() {
        assertEquals(0.5, net.advanceTime(0.5));
        assertEquals(0.75, net.advanceTime(0.25));
        assertThrows(IllegalArgumentException.class, () -> net.advanceTime(-0.1));
        assertThrows(IllegalArgumentException.class, () -> net.advanceTime(Double.NaN));
        assertEquals(0.75, net.getLogicalTime());
    }

    @Test
    void markingAndTotal() {
        assertEquals(5.0, net.getMarking().get("1"));
        assertEquals(0.0, net.getMarking().get("2"));
        assertEquals(5.0, net.getTotalTokens());
    }

    @Test
    void recordedEventsGoToTheEventLogger() {
        net.setLogicalTime(3.0);
        net.recordTransitionEvent("T1", Collections.singletonMap("1", 1.0),
            Collections.singletonMap("2", 2.0), "logical", null);

        TransitionEventLogger.TransitionEvent event = net.getEventLogger().getEventHistory().get(0);
        assertEquals("T1", event.getTransitionId());
        assertEquals(3.0, event.getSimulationTime());
    }

    @Test
    void recordingWithoutEventLoggerIsIgnored() {
        PetriNetModel bare = new PetriNetModel((TransitionEventLogger) null);
        bare.recordTransitionEvent("T1", null, null, "logical", null);

        assertNull(bare.getEventLogger());
    }

    @Test
    void placeSymbols() {
        assertEquals("P1", p1.getSymbol());
        assertEquals("P7", Place.symbolFor("P7"));
        assertThrows(IllegalArgumentException.class, () -> new Place("3", -1));
    }

    @Test
    void eventStorageFollowsEngineSettings() {
        Properties properties = new Properties();
        properties.setProperty(EngineSettings.KEY_EVENT_STORAGE, "false");
        PetriNetModel quiet = new PetriNetModel(EngineSettings.fromProperties(properties));
        assertFalse(quiet.getEventLogger().isEventStorageEnabled());

        assertTrue(new PetriNetModel().getEventLogger().isEventStorageEnabled());
    }
}
