package com.omotes.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire-compatible scalar values: every parameter value crossing the wire is a {@link String},
 * a {@link Boolean} or a {@link Double}. Any other {@link Number} is widened to a double.
 */
public final class WireValues {

    private WireValues() {
    }

    /**
     * Returns an unmodifiable, insertion-ordered copy of the map with all numbers widened to
     * {@link Double}.
     *
     * @throws ProtocolException when a value is null or not a string, boolean or number
     */
    public static Map<String, Object> normalize(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            normalized.put(e.getKey(), normalizeValue(e.getKey(), e.getValue()));
        }
        return Collections.unmodifiableMap(normalized);
    }

    private static Object normalizeValue(String key, Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Double) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new ProtocolException("Parameter '" + key + "' has no wire-compatible value: " + value
                + (value != null ? " (" + value.getClass().getSimpleName() + ")" : ""));
    }
}
