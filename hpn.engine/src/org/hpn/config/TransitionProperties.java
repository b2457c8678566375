package org.hpn.config;

import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.model.Transition;

/**
 * Typed reads from a transition's property map.
 *
 * Numbers and numeric strings are accepted; anything else is a
 * configuration error naming the transition and the key.
 */
final class TransitionProperties {

    private TransitionProperties() {
    }

    static boolean has(Transition transition, String key) {
        return transition.getProperty(key) != null;
    }

    static double getDouble(Transition transition, String key, double defaultValue)
            throws BehaviorConfigurationException {
        Object value = transition.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        Double parsed = toDouble(value);
        if (parsed == null || Double.isNaN(parsed)) {
            throw new BehaviorConfigurationException(
                String.format("Property '%s' of %s is not a number: %s", key, transition.getId(), value),
                transition.getId(), key, value);
        }
        return parsed;
    }

    static int getInt(Transition transition, String key, int defaultValue) throws BehaviorConfigurationException {
        Object value = transition.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        Double parsed = toDouble(value);
        if (parsed == null || parsed != Math.rint(parsed) || Double.isInfinite(parsed)) {
            throw new BehaviorConfigurationException(
                String.format("Property '%s' of %s is not an integer: %s", key, transition.getId(), value),
                transition.getId(), key, value);
        }
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new BehaviorConfigurationException(
                String.format("Property '%s' of %s is out of integer range: %s", key, transition.getId(), value),
                transition.getId(), key, value);
        }
        return parsed.intValue();
    }

    /**
     * @return the numeric value of a Number or numeric string, otherwise null
     */
    static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("inf".equalsIgnoreCase(text)) {
                return Double.POSITIVE_INFINITY;
            }
            try {
                return Double.valueOf(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
