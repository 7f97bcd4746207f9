package com.contact.resolution.mcp;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds insertion-ordered result maps, leaving out null values.
 */
final class ResultMaps {

    private ResultMaps() {
    }

    static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keysAndValues must come in pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object value = keysAndValues[i + 1];
            if (value != null) {
                map.put((String) keysAndValues[i], value);
            }
        }
        return map;
    }
}
