package com.fw24.framework.authorize;

import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.query.EntityQuery;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AuthorizationRequest {
    String entityName;
    CrudOperation crudType;
    Map<String, Object> identifiers;
    Map<String, Object> data;
    EntityQuery query;
    Map<String, Object> actor;
    Map<String, Object> tenant;
}
