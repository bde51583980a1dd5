package com.fw24.framework.model.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single dispatched event. Created per dispatch and discarded after delivery.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EventPayload<T> {
    private EventMatcher type;
    private T data;
    private Instant timestamp;
    private String entityName;
    private String correlationId;
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();
}
