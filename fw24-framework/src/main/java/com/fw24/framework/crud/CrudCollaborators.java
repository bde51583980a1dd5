package com.fw24.framework.crud;

import com.fw24.framework.audit.EntityAuditor;
import com.fw24.framework.authorize.EntityAuthorizer;
import com.fw24.framework.event.EventDispatcher;
import com.fw24.framework.validation.EntityValidator;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Strategies a CRUD call runs with. Assembled once at application start, see
 * {@link com.fw24.framework.config.CrudCollaboratorsProducer}, and passed with every call.
 */
@Value
@Builder(toBuilder = true)
public class CrudCollaborators {
    EntityValidator validator;
    EntityAuthorizer authorizer;
    EntityAuditor auditor;
    EventDispatcher eventDispatcher;

    void requireComplete() {
        Objects.requireNonNull(validator, "validator");
        Objects.requireNonNull(authorizer, "authorizer");
        Objects.requireNonNull(auditor, "auditor");
        Objects.requireNonNull(eventDispatcher, "eventDispatcher");
    }
}
