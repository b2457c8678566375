package org.hpn.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.expression.ExpressionEvaluator;
import org.hpn.expression.RateFunction;
import org.hpn.model.Transition;
import org.junit.jupiter.api.Test;

class StochasticConfigTest {

    private static final EngineSettings SETTINGS = EngineSettings.defaults();

    @Test
    void constantRateFromTransition() throws Exception {
        StochasticConfig config = StochasticConfig.from(
            new Transition("T1", "stochastic").setRate(2.0), SETTINGS, null);

        assertTrue(config.isConstantRate());
        assertEquals(2.0, config.getConstantRate());
        assertEquals(SETTINGS.getDefaultMaxBurst(), config.getMaxBurst());
    }

    @Test
    void rateProperty() throws Exception {
        StochasticConfig config = StochasticConfig.from(new Transition("T1", "stochastic")
            .setRate(2.0).setProperty("rate", "0.5").setProperty("max_burst", 3), SETTINGS, null);

        assertEquals(0.5, config.getConstantRate());
        assertEquals(3, config.getMaxBurst());
    }

    @Test
    void missingRateDefaultsToOne() throws Exception {
        assertEquals(1.0, StochasticConfig.from(new Transition("T1", "stochastic"), SETTINGS, null)
            .getConstantRate());
    }

    @Test
    void expressionRate() throws Exception {
        StochasticConfig config = StochasticConfig.from(
            new Transition("T1", "stochastic").setRate("0.1 * P1"), SETTINGS, null);

        assertFalse(config.isConstantRate());
        assertNull(config.getConstantRate());
        assertTrue(config.getRateFunction() instanceof ExpressionEvaluator);
        assertEquals("0.1 * P1", config.getRateSource());
    }

    @Test
    void rateFunctionIsUsedAsGiven() throws Exception {
        RateFunction rate = context -> 4.0;
        StochasticConfig config = StochasticConfig.from(
            new Transition("T1", "stochastic").setRate(rate), SETTINGS, null);

        assertSame(rate, config.getRateFunction());
    }

    @Test
    void maxBurstDefaultComesFromSettings() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(EngineSettings.KEY_DEFAULT_MAX_BURST, "2");
        EngineSettings settings = EngineSettings.fromProperties(properties);

        assertEquals(2, StochasticConfig.from(new Transition("T1", "stochastic"), settings, null).getMaxBurst());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(BehaviorConfigurationException.class,
            () -> StochasticConfig.from(new Transition("T1", "stochastic").setRate(0), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class,
            () -> StochasticConfig.from(new Transition("T1", "stochastic").setRate(-1.5), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class,
            () -> StochasticConfig.from(new Transition("T1", "stochastic").setRate("inf"), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class, () -> StochasticConfig.from(
            new Transition("T1", "stochastic").setProperty("max_burst", 0), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class, () -> StochasticConfig.from(
            new Transition("T1", "stochastic").setProperty("max_burst", 2.5), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class, () -> StochasticConfig.from(
            new Transition("T1", "stochastic").setProperty("max_burst", 4294967297L), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class, () -> StochasticConfig.from(
            new Transition("T1", "stochastic").setProperty("max_burst", "1e12"), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class,
            () -> StochasticConfig.from(new Transition("T1", "stochastic").setRate(new Object()), SETTINGS, null));
        assertThrows(BehaviorConfigurationException.class, () -> StochasticConfig.constant("T1", 1.0, 0));
    }
}
