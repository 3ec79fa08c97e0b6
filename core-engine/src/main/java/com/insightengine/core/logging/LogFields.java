package com.insightengine.core.logging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds insertion-ordered field maps for {@link InsightLogger} events.
 *
 * @since 1.0.0
 */
public final class LogFields {

    private LogFields() {
        // utility class
    }

    /**
     * @param keysAndValues alternating key, value pairs; keys must be strings
     * @return unmodifiable ordered map
     * @throws IllegalArgumentException if an odd number of arguments is given
     *                                  or a key is not a string
     */
    public static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " argument(s)");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (!(keysAndValues[i] instanceof String key)) {
                throw new IllegalArgumentException("Field key at position " + i + " is not a string");
            }
            fields.put(key, keysAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(fields);
    }
}
