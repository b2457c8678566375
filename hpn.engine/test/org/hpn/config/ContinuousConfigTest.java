package org.hpn.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.expression.EvaluationContext;
import org.hpn.expression.RateFunction;
import org.hpn.model.Transition;
import org.junit.jupiter.api.Test;

class ContinuousConfigTest {

    @Test
    void defaultsToConstantOne() throws Exception {
        ContinuousConfig config = ContinuousConfig.from(new Transition("T1", "continuous"), null);

        assertTrue(config.isConstantRate());
        assertEquals(1.0, config.getRateFunction().rate(EvaluationContext.ofTime(0.0)));
        assertEquals(0.0, config.getMinRate());
        assertEquals(Double.POSITIVE_INFINITY, config.getMaxRate());
    }

    @Test
    void rateFunctionPropertyWinsOverRate() throws Exception {
        ContinuousConfig config = ContinuousConfig.from(new Transition("T1", "continuous")
            .setRate(5.0).setProperty("rate_function", "2 * time"), null);

        assertFalse(config.isConstantRate());
        assertEquals("2 * time", config.getRateSource());
        assertEquals(6.0, config.getRateFunction().rate(EvaluationContext.ofTime(3.0)));
    }

    @Test
    void rateFunctionUnderRateProperty() throws Exception {
        RateFunction rate = context -> 0.25;
        ContinuousConfig config = ContinuousConfig.from(new Transition("T1", "continuous")
            .setRate(5.0).setProperty("rate", rate), null);

        assertSame(rate, config.getRateFunction());
    }

    @Test
    void clampIntoBounds() throws Exception {
        ContinuousConfig config = ContinuousConfig.from(new Transition("T1", "continuous")
            .setProperty("min_rate", 0.5).setProperty("max_rate", "2"), null);

        assertEquals(0.5, config.clamp(-3.0));
        assertEquals(1.5, config.clamp(1.5));
        assertEquals(2.0, config.clamp(100.0));
        assertEquals(0.5, config.clamp(Double.NaN));
    }

    @Test
    void invertedBoundsAreRejected() {
        assertThrows(BehaviorConfigurationException.class, () -> ContinuousConfig.from(
            new Transition("T1", "continuous").setProperty("min_rate", 3).setProperty("max_rate", 1), null));
        assertThrows(BehaviorConfigurationException.class, () -> ContinuousConfig.from(
            new Transition("T1", "continuous").setProperty("max_rate", "fast"), null));
    }
}
