package org.hpn.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.ArcKind;
import org.hpn.model.PetriNetModel;
import org.hpn.model.Place;
import org.hpn.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImmediateBehaviorTest {

    private PetriNetModel net;
    private Place p1;
    private Place p2;
    private Transition t1;

    @BeforeEach
    void setUp() {
        net = new PetriNetModel();
        net.getEventLogger().setEnableLogging(false);
        p1 = net.addPlace(new Place("1", 0));
        p2 = net.addPlace(new Place("2", 0));
        t1 = net.addTransition(new Transition("T1", "immediate"));
        net.connect(p1, t1, 1);
        net.connect(t1, p2, 1);
    }

    private ImmediateBehavior behavior() throws Exception {
        return new ImmediateBehavior(t1, net);
    }

    @Test
    void emptyInputPlaceBlocksFiring() throws Exception {
        ImmediateBehavior behavior = behavior();

        EnablementResult enablement = behavior.canFire();
        assertFalse(enablement.canFire());
        assertEquals("insufficient-tokens-P1", enablement.getReason());

        FiringResult result = behavior.fire(net.getInputArcs(t1), net.getOutputArcs(t1));
        assertFalse(result.isSuccess());
        assertEquals("insufficient-tokens-P1", result.getReason());
        assertTrue(result.getConsumed().isEmpty());
        assertEquals(0.0, p2.getTokens());
        assertEquals(1, net.getEventLogger().getEventsOfType(TransitionEventLogger.EVENT_FIRING_REJECTED).size());
    }

    @Test
    void firesOnceTokensArrive() throws Exception {
        ImmediateBehavior behavior = behavior();
        p1.setTokens(1);

        assertEquals(EnablementResult.enabled("enabled"), behavior.canFire());
        FiringResult result = behavior.fire(net.getInputArcs(t1), net.getOutputArcs(t1));

        assertTrue(result.isSuccess());
        assertNull(result.getReason());
        assertEquals("logical", result.getMode());
        assertEquals(1.0, result.getConsumed().get("1"));
        assertEquals(1.0, result.getProduced().get("2"));
        assertEquals(0.0, p1.getTokens());
        assertEquals(1.0, p2.getTokens());
        assertEquals(Integer.valueOf(1), net.getEventLogger().getFiringCounts().get("T1"));
    }

    @Test
    void tokensAreConservedWithUnitWeights() throws Exception {
        ImmediateBehavior behavior = behavior();
        p1.setTokens(5);
        double total = net.getTotalTokens();

        while (behavior.canFire().canFire()) {
            assertTrue(behavior.fire(net.getInputArcs(t1), net.getOutputArcs(t1)).isSuccess());
            assertEquals(total, net.getTotalTokens());
        }
        assertEquals(0.0, p1.getTokens());
        assertEquals(5.0, p2.getTokens());
    }

    @Test
    void weightedArcsAndRepeatedPlace() throws Exception {
        Place p3 = net.addPlace(new Place("3", 4));
        Transition t2 = net.addTransition(new Transition("T2", "immediate"));
        net.connect(p3, t2, 2);
        net.connect(p3, t2, 1);
        net.connect(t2, p2, 3);
        ImmediateBehavior behavior = new ImmediateBehavior(t2, net);

        FiringResult first = behavior.fire(net.getInputArcs(t2), net.getOutputArcs(t2));
        assertTrue(first.isSuccess());
        assertEquals(3.0, first.getConsumed().get("3"));
        assertEquals(1.0, p3.getTokens());
        assertEquals(3.0, p2.getTokens());

        // both arcs need 3 together, only 1 is left
        assertEquals("insufficient-tokens-P3", behavior.canFire().getReason());
        FiringResult second = behavior.fire(net.getInputArcs(t2), net.getOutputArcs(t2));
        assertFalse(second.isSuccess());
        assertEquals(1.0, p3.getTokens());
    }

    @Test
    void testArcIsNotConsumed() throws Exception {
        Place catalyst = net.addPlace(new Place("3", 1));
        net.connect(catalyst, t1, 1, ArcKind.TEST);
        p1.setTokens(1);

        assertTrue(behavior().fire(net.getInputArcs(t1), net.getOutputArcs(t1)).isSuccess());
        assertEquals(1.0, catalyst.getTokens());
    }

    @Test
    void inhibitorArcBlocks() throws Exception {
        Place blocker = net.addPlace(new Place("3", 1));
        net.connect(blocker, t1, 1, ArcKind.INHIBITOR);
        p1.setTokens(1);

        assertEquals("inhibited-by-P3", behavior().canFire().getReason());
        blocker.setTokens(0);
        assertTrue(behavior().canFire().canFire());
    }

    @Test
    void sourceNeverConsumesAndSinkNeverProduces() throws Exception {
        t1.setSource(true).setSink(true);

        EnablementResult enablement = behavior().canFire();
        assertEquals("enabled-source", enablement.getReason());

        FiringResult result = behavior().fire(net.getInputArcs(t1), net.getOutputArcs(t1));
        assertTrue(result.isSuccess());
        assertTrue(result.getConsumed().isEmpty());
        assertTrue(result.getProduced().isEmpty());
        assertEquals(0.0, p1.getTokens());
        assertEquals(0.0, p2.getTokens());
    }

    @Test
    void transitionWithoutInputsIsAlwaysEnabled() throws Exception {
        Transition generator = net.addTransition(new Transition("T2", "immediate"));
        net.connect(generator, p2, 2);
        ImmediateBehavior behavior = new ImmediateBehavior(generator, net);

        assertEquals("enabled-no-inputs", behavior.canFire().getReason());
        behavior.fire(net.getInputArcs(generator), net.getOutputArcs(generator));
        assertEquals(2.0, p2.getTokens());
    }

    @Test
    void guardsAreIgnored() throws Exception {
        t1.setGuard(false);
        p1.setTokens(1);
        ImmediateBehavior behavior = behavior();

        assertNull(behavior.getGuard());
        assertTrue(behavior.canFire().canFire());
    }

    @Test
    void pollingDoesNotChangeTheMarking() throws Exception {
        ImmediateBehavior behavior = behavior();
        p1.setTokens(2);
        Map<String, Double> before = net.getMarking();

        EnablementResult first = behavior.canFire();
        EnablementResult second = behavior.canFire();

        assertEquals(first, second);
        assertEquals(before, net.getMarking());
    }

    @Test
    void enablementInfoReportsEveryInput() throws Exception {
        p1.setTokens(0.5);
        Map<String, Map<String, Object>> info = behavior().getEnablementInfo();

        assertEquals(Boolean.FALSE, info.get("1").get("sufficient"));
        assertEquals(0.5, info.get("1").get("available"));
    }

    @Test
    void typeNames() throws Exception {
        assertEquals("Immediate", behavior().getTypeName());
        assertEquals("immediate", behavior().getTransitionType().getTag());
    }

    @Test
    void failingEventSinkDoesNotFailTheFiring() throws Exception {
        PetriNetModel failingSink = new PetriNetModel() {
            @Override
            public void recordTransitionEvent(String transitionId, Map<String, Double> consumed,
                                              Map<String, Double> produced, String mode,
                                              Map<String, Object> metadata) {
                throw new IllegalStateException("event store offline");
            }
        };
        failingSink.getEventLogger().setEnableLogging(false);
        Place input = failingSink.addPlace(new Place("1", 1));
        Place output = failingSink.addPlace(new Place("2", 0));
        Transition t2 = failingSink.addTransition(new Transition("T2", "immediate"));
        failingSink.connect(input, t2, 1);
        failingSink.connect(t2, output, 1);
        ImmediateBehavior behavior = new ImmediateBehavior(t2, failingSink);

        FiringResult result = behavior.fire(failingSink.getInputArcs(t2), failingSink.getOutputArcs(t2));

        assertTrue(result.isSuccess());
        assertEquals(0.0, input.getTokens());
        assertEquals(1.0, output.getTokens());
    }

    @Test
    void runtimeErrorDuringFireBecomesFailedResult() throws Exception {
        Place faulty = net.addPlace(new Place("3", 0) {
            @Override
            public void setTokens(double tokens) {
                throw new UnsupportedOperationException("read-only place");
            }
        });
        net.connect(t1, faulty, 1);
        p1.setTokens(1);
        ImmediateBehavior behavior = behavior();

        FiringResult result = behavior.fire(net.getInputArcs(t1), net.getOutputArcs(t1));

        assertFalse(result.isSuccess());
        assertEquals("immediate-error", result.getReason());
        assertEquals("UnsupportedOperationException", result.getErrorType());
        assertTrue(result.getConsumed().isEmpty());
    }
}
