package com.fw24.framework.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller supplied index choice that bypasses index planning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexHint {
    private String name;
    @Builder.Default
    private Map<String, Object> filters = new LinkedHashMap<>();
}
