package com.fw24.framework.event;

import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.event.EntityEventType;
import com.fw24.framework.model.event.EventPayload;
import com.fw24.framework.model.event.EventPhase;
import com.fw24.framework.model.event.EventSubPhase;
import com.fw24.framework.model.event.SuccessFail;
import com.fw24.framework.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches the lifecycle events of one CRUD call. Every payload carries the call's
 * base context (actor, tenant, correlation id) merged with the context passed to
 * {@link #emit}, the latter winning on conflicts. The event data is copied into an
 * unmodifiable snapshot per dispatch, so later changes to the caller's maps never reach
 * listeners. A failing dispatcher is logged and otherwise ignored.
 */
public class EntityEventEmitter {

    private static final Logger LOG = Logger.getLogger(EntityEventEmitter.class);

    public static final String ACTOR = "actor";
    public static final String TENANT = "tenant";
    public static final String CORRELATION_ID = "correlationId";

    private final EventDispatcher dispatcher;
    private final String entityName;
    private final CrudOperation operation;
    private final String correlationId;
    private final Map<String, Object> baseContext;

    public EntityEventEmitter(EventDispatcher dispatcher, String entityName, CrudOperation operation,
                              String correlationId, Map<String, Object> baseContext) {
        this.dispatcher = dispatcher;
        this.entityName = entityName;
        this.operation = operation;
        this.correlationId = correlationId;
        this.baseContext = baseContext == null ? Map.of() : new LinkedHashMap<>(baseContext);
    }

    public static Map<String, Object> baseContext(Map<String, Object> actor, Map<String, Object> tenant, String correlationId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(ACTOR, actor);
        context.put(TENANT, tenant);
        context.put(CORRELATION_ID, correlationId);
        return context;
    }

    public void emit(EventPhase phase, Map<String, Object> data) {
        emit(phase, null, null, data, null);
    }

    public void emit(EventPhase phase, EventSubPhase subPhase, Map<String, Object> data) {
        emit(phase, subPhase, null, data, null);
    }

    public void emit(EventPhase phase, EventSubPhase subPhase, SuccessFail successFail,
                     Map<String, Object> data, Map<String, Object> context) {
        emit(EntityEventType.builder()
                .entity(entityName)
                .operation(operation)
                .phase(phase)
                .subPhase(subPhase)
                .successFail(successFail)
                .build(), data, context);
    }

    public void emit(EntityEventType type, Map<String, Object> data, Map<String, Object> context) {
        Map<String, Object> merged = new LinkedHashMap<>(baseContext);
        if (context != null) {
            merged.putAll(context);
        }
        EventPayload<Map<String, Object>> payload = EventPayload.<Map<String, Object>>builder()
                .type(type.toMatcher())
                .data(snapshot(data))
                .timestamp(Instant.now())
                .entityName(type.getEntity())
                .correlationId(correlationId)
                .context(merged)
                .build();
        try {
            dispatcher.dispatch(payload);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(LOG, e, "Dispatching %s failed", payload.getType().key());
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> snapshot(Map<String, Object> data) {
        return data == null ? null : (Map<String, Object>) copyValue(data);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, copyValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(copyValue(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public CrudOperation getOperation() {
        return operation;
    }
}
