package com.fw24.framework.crud;

import com.fw24.framework.service.EntityService;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.Map;
import java.util.Objects;

/**
 * Arguments shared by every CRUD operation. There are no implicit defaults: the entity
 * service and all collaborators must be supplied.
 */
@Getter
@SuperBuilder
public abstract class CrudArgs {
    private final EntityService entityService;
    private final CrudCollaborators collaborators;
    private final Map<String, Object> actor;
    private final Map<String, Object> tenant;
    private final String correlationId;
    /** Extra event context, merged over the actor / tenant / correlation id context. */
    private final Map<String, Object> context;

    void requireCollaborators() {
        Objects.requireNonNull(entityService, "entityService");
        Objects.requireNonNull(collaborators, "collaborators");
        collaborators.requireComplete();
    }
}
