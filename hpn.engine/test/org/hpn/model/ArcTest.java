package org.hpn.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ArcTest {

    private final Place place = new Place("1", 3);
    private final Transition transition = new Transition("T1", "immediate");

    @Test
    void connectsPlaceAndTransition() {
        Arc arc = new Arc(place, transition, 2);

        assertEquals(ArcKind.NORMAL, arc.getKind());
        assertEquals(place, arc.getSourcePlace());
        assertNull(arc.getTargetPlace());
    }

    @Test
    void nullKindIsNormal() {
        assertEquals(ArcKind.NORMAL, new Arc(place, transition, 1, null).getKind());
    }

    @Test
    void rejectsPlaceToPlaceAndTransitionToTransition() {
        assertThrows(IllegalArgumentException.class, () -> new Arc(place, new Place("2", 0), 1));
        assertThrows(IllegalArgumentException.class,
            () -> new Arc(transition, new Transition("T2", "timed"), 1));
    }

    @Test
    void rejectsInvalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> new Arc(place, transition, 0));
        assertThrows(IllegalArgumentException.class, () -> new Arc(place, transition, -1));
        assertThrows(IllegalArgumentException.class, () -> new Arc(place, transition, Double.NaN));
        assertThrows(IllegalArgumentException.class,
            () -> new Arc(place, transition, Double.POSITIVE_INFINITY));
    }

    @Test
    void inhibitorArcMustStartAtPlace() {
        assertThrows(IllegalArgumentException.class,
            () -> new Arc(transition, place, 1, ArcKind.INHIBITOR));
    }

    @Test
    void kindTags() {
        assertEquals(ArcKind.NORMAL, ArcKind.fromTag(null));
        assertEquals(ArcKind.TEST, ArcKind.fromTag("read"));
        assertEquals(ArcKind.INHIBITOR, ArcKind.fromTag("inhibitor"));
        assertThrows(IllegalArgumentException.class, () -> ArcKind.fromTag("reset"));
    }

    @Test
    void transitionTypeLookup() {
        assertEquals(TransitionType.CONTINUOUS, TransitionType.lookup(null));
        assertEquals(TransitionType.STOCHASTIC, TransitionType.lookup("Stochastic"));
        assertNull(TransitionType.lookup("quantum"));
    }
}
