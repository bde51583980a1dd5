package com.fw24.framework.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of asking the repository which index best serves a set of equality values.
 * {@code index} is the repository's own identifier, empty for the primary index.
 */
public record KeyMatchResult(Map<String, Object> keys, String index, boolean shouldScan) {

    public KeyMatchResult {
        keys = keys == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        index = index == null ? "" : index;
    }

    public static KeyMatchResult scan() {
        return new KeyMatchResult(Map.of(), "", true);
    }
}
