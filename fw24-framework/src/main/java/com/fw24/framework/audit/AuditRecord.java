package com.fw24.framework.audit;

import com.fw24.framework.model.event.CrudOperation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AuditRecord {
    String entityName;
    CrudOperation crudType;
    Map<String, Object> identifiers;
    Map<String, Object> data;
    Object entity;
    Map<String, Object> actor;
    Map<String, Object> tenant;
    String correlationId;
    @Builder.Default
    Instant timestamp = Instant.now();
}
