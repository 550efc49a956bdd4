package com.phillippitts.hdrcompute.pipeline.ops;

import java.util.Map;

/**
 * Typed access to loosely-typed stage parameter maps.
 */
final class ParameterReader {

    private ParameterReader() {
        // Utility class - prevent instantiation
    }

    static double number(Map<String, Object> parameters, String key, double defaultValue) {
        Object value = parameters.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Parameter '" + key + "' must be numeric, got " + value);
    }

    static int integer(Map<String, Object> parameters, String key, int defaultValue) {
        double value = number(parameters, key, defaultValue);
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer, got " + value);
        }
        return (int) value;
    }
}
