package org.hpn.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.hpn.model.PetriNetModel;
import org.hpn.model.Place;
import org.hpn.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimedBehaviorTest {

    private PetriNetModel net;
    private Place p1;
    private Place p2;
    private Transition t1;

    @BeforeEach
    void setUp() {
        net = new PetriNetModel();
        net.getEventLogger().setEnableLogging(false);
        p1 = net.addPlace(new Place("1", 1));
        p2 = net.addPlace(new Place("2", 0));
        t1 = net.addTransition(new Transition("T1", "timed")
            .setProperty("earliest", 1.0)
            .setProperty("latest", 2.0));
        net.connect(p1, t1, 1);
        net.connect(t1, p2, 1);
    }

    @Test
    void firesOnlyInsideTheWindow() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);

        net.setLogicalTime(0.5);
        assertEquals("too-early", behavior.canFire().getReason());

        net.setLogicalTime(1.5);
        assertEquals("enabled-in-window", behavior.canFire().getReason());

        net.setLogicalTime(2.5);
        assertEquals("too-late", behavior.canFire().getReason());
    }

    @Test
    void windowBoundsAreInclusive() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);

        net.setLogicalTime(1.0);
        assertTrue(behavior.canFire().canFire());
        net.setLogicalTime(2.0);
        assertTrue(behavior.canFire().canFire());
    }

    @Test
    void summedTimeStepsStillReachTheWindow() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);

        for (int i = 0; i < 10; i++) {
            net.advanceTime(0.1);
        }
        // ten steps of 0.1 sum to slightly less than 1.0
        assertTrue(net.getLogicalTime() < 1.0);
        assertTrue(behavior.canFire().canFire());
    }

    @Test
    void requiresEnablementFirst() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        net.setLogicalTime(1.5);

        assertEquals("not-enabled-yet", behavior.canFire().getReason());
        assertNull(behavior.getElapsed());
    }

    @Test
    void firingMovesTokensAndClearsEnablement() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);
        net.setLogicalTime(1.5);

        FiringResult result = behavior.fire(net.getInputArcs(t1), net.getOutputArcs(t1));

        assertTrue(result.isSuccess());
        assertEquals(1.0, p2.getTokens());
        assertEquals(1.5, result.getDetail("elapsed"));
        assertEquals(0.0, result.getDetail("enablementTime"));
        assertNull(behavior.getEnablementTime());
        assertFalse(behavior.getSchedulingState().isEnabled());
    }

    @Test
    void tooEarlyFiringLeavesMarkingUntouched() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);
        net.setLogicalTime(0.2);

        FiringResult result = behavior.fire(net.getInputArcs(t1), net.getOutputArcs(t1));

        assertFalse(result.isSuccess());
        assertEquals("too-early", result.getReason());
        assertEquals(1.0, p1.getTokens());
        assertEquals(Double.valueOf(0.0), behavior.getEnablementTime());
    }

    @Test
    void tokensAreCheckedBeforeTiming() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        p1.setTokens(0);

        assertEquals("insufficient-tokens-P1", behavior.canFire().getReason());
    }

    @Test
    void guardIsCheckedFirst() throws Exception {
        t1.setGuard("P1 > 5");
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);
        net.setLogicalTime(1.5);

        assertEquals("guard-fails", behavior.canFire().getReason());
    }

    @Test
    void guardFunctionProperty() throws Exception {
        t1.setProperty("guard_function", "time >= 1.8");
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);

        net.setLogicalTime(1.5);
        assertEquals("guard-fails", behavior.canFire().getReason());
        net.setLogicalTime(1.9);
        assertTrue(behavior.canFire().canFire());
    }

    @Test
    void reEnablementRestartsTheClock() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);
        net.setLogicalTime(2.5);
        behavior.setEnablementTime(2.5);

        net.setLogicalTime(3.5);
        assertTrue(behavior.canFire().canFire());
    }

    @Test
    void clearEnablementDisables() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);
        net.setLogicalTime(1.5);
        behavior.clearEnablement();

        assertEquals("not-enabled-yet", behavior.canFire().getReason());
    }

    @Test
    void unboundedWindowNeverExpires() throws Exception {
        Transition t2 = net.addTransition(new Transition("T2", "timed").setProperty("earliest", 0.5));
        net.connect(p1, t2, 1);
        TimedBehavior behavior = new TimedBehavior(t2, net);
        behavior.setEnablementTime(0.0);

        net.setLogicalTime(1e6);
        assertTrue(behavior.canFire().canFire());
        assertFalse(behavior.isUrgent());
    }

    @Test
    void urgencyNearTheDeadline() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(0.0);

        net.setLogicalTime(1.9995);
        assertTrue(behavior.isUrgent());
        net.setLogicalTime(1.5);
        assertFalse(behavior.isUrgent());
        assertTrue(behavior.isUrgent(0.6));
        net.setLogicalTime(2.0);
        assertFalse(behavior.isUrgent());
    }

    @Test
    void timingDiagnostics() throws Exception {
        TimedBehavior behavior = new TimedBehavior(t1, net);
        behavior.setEnablementTime(1.0);
        net.setLogicalTime(1.25);

        assertEquals(0.25, behavior.getElapsed(), 1e-12);
        assertEquals(0.75, behavior.getTimeUntilEarliest(), 1e-12);
        assertEquals(1.75, behavior.getTimeUntilLatest(), 1e-12);

        Map<String, Object> info = behavior.getTimingInfo();
        assertEquals(Boolean.FALSE, info.get("inWindow"));
        assertEquals(2.0, info.get("earliestFireTime"));
        assertEquals(3.0, info.get("deadline"));
        assertEquals("Timed (TPN)", behavior.getTypeName());
    }

    @Test
    void rateIsAFixedDelay() throws Exception {
        Transition t2 = net.addTransition(new Transition("T2", "timed").setRate(3.0));
        net.connect(p1, t2, 1);
        TimedBehavior behavior = new TimedBehavior(t2, net);
        behavior.setEnablementTime(0.0);

        net.setLogicalTime(2.9);
        assertEquals("too-early", behavior.canFire().getReason());
        net.setLogicalTime(3.0);
        assertTrue(behavior.canFire().canFire());
        net.setLogicalTime(3.1);
        assertEquals("too-late", behavior.canFire().getReason());
    }
}
