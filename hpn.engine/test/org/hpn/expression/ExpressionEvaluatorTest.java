package org.hpn.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.Place;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {

    private TransitionEventLogger eventLogger;

    @BeforeEach
    void setUp() {
        eventLogger = new TransitionEventLogger();
        eventLogger.setEnableLogging(false);
    }

    @Test
    void compiledExpressionActsAsRateFunction() {
        ExpressionEvaluator evaluator = ExpressionEvaluator.compile("k * P1 * P2", "T1", eventLogger);
        EvaluationContext context = EvaluationContext.of(0.0,
            Arrays.asList(new Place("1", 3.0), new Place("2", 2.0)), Collections.singletonMap("k", 0.1));

        assertTrue(evaluator.isValid());
        assertNull(evaluator.getParseError());
        assertEquals(0.6, evaluator.rate(context), 1e-12);
        assertEquals("k * P1 * P2", evaluator.getSource());
        assertTrue(eventLogger.getEventHistory().isEmpty());
    }

    @Test
    void parseFailureIsReportedOnceAndEvaluationFails() {
        ExpressionEvaluator evaluator = ExpressionEvaluator.compile("P1 * (2", "T1", eventLogger);

        assertFalse(evaluator.isValid());
        assertNotNull(evaluator.getParseError());
        assertTrue(evaluator.getReferencedVariables().isEmpty());
        assertEquals(1, eventLogger.getEventsOfType(TransitionEventLogger.EVENT_EVALUATION_FALLBACK).size());
        assertThrows(EvaluationException.class, () -> evaluator.evaluate(EvaluationContext.ofTime(0.0)));
    }

    @Test
    void timeDependentExpression() {
        ExpressionEvaluator evaluator = ExpressionEvaluator.compile("2 * time", "T1", null);

        assertEquals(3.0, evaluator.evaluate(EvaluationContext.ofTime(1.5)));
    }

    @Test
    void placeSymbolsShadowParameters() {
        EvaluationContext context = EvaluationContext.of(0.0,
            Collections.singletonList(new Place("1", 7.0)), Collections.singletonMap("P1", 100.0));

        assertEquals(7.0, context.getVariable("P1"));
        assertEquals(7.0, context.getTokens("1"));
        assertThrows(EvaluationException.class, () -> context.getVariable("P2"));
    }

    @Test
    void reservedPlaceNamesAreNotAliased() {
        EvaluationContext context = EvaluationContext.of(0.0,
            Arrays.asList(new Place("1", "e", 2.0), new Place("2", "two words", 3.0)), null);

        assertFalse(context.hasVariable("e"));
        assertFalse(context.hasVariable("two words"));
        assertTrue(context.hasVariable("P2"));
    }
}
