package com.fw24.framework.model.event;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dimensions of an entity lifecycle event. Unset dimensions are left out of the
 * resulting matcher.
 */
@Value
@Builder(toBuilder = true)
public class EntityEventType {
    public static final String ENTITY = "entity";
    public static final String OPERATION = "operation";
    public static final String PHASE = "phase";
    public static final String SUB_PHASE = "subPhase";
    public static final String SUCCESS_FAIL = "successFail";

    String entity;
    CrudOperation operation;
    EventPhase phase;
    EventSubPhase subPhase;
    SuccessFail successFail;

    public EventMatcher toMatcher() {
        Map<String, Object> dimensions = new LinkedHashMap<>();
        dimensions.put(ENTITY, entity);
        dimensions.put(OPERATION, operation);
        dimensions.put(PHASE, phase);
        dimensions.put(SUB_PHASE, subPhase);
        dimensions.put(SUCCESS_FAIL, successFail);
        return EventMatcher.structured(dimensions);
    }
}
