package com.fw24.framework.repository.planner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chosen index and the equality values consumed as its key conditions. Template matches
 * carry no filters.
 */
public record IndexMatchResult(String indexName, Map<String, Object> indexFilters) {

    public IndexMatchResult {
        indexFilters = indexFilters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(indexFilters));
    }
}
