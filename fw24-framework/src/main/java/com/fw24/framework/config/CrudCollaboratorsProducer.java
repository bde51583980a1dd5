package com.fw24.framework.config;

import com.fw24.framework.audit.LoggingAuditor;
import com.fw24.framework.authorize.AllowAllAuthorizer;
import com.fw24.framework.crud.CrudCollaborators;
import com.fw24.framework.event.DefaultEventDispatcher;
import com.fw24.framework.event.EventDispatcher;
import com.fw24.framework.validation.SchemaRuleValidator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;

import java.util.concurrent.ForkJoinPool;

/**
 * Default wiring of the CRUD collaborators. Applications that need a real authorizer
 * or auditor build their own {@link CrudCollaborators} with {@code toBuilder()}.
 */
@ApplicationScoped
public class CrudCollaboratorsProducer {

    private static final Logger LOG = Logger.getLogger(CrudCollaboratorsProducer.class);

    @Produces
    @ApplicationScoped
    public EventDispatcher eventDispatcher(EntityCrudConfig config) {
        return new DefaultEventDispatcher(ForkJoinPool.commonPool(), config.events().awaitAsyncTimeout());
    }

    @Produces
    @ApplicationScoped
    public CrudCollaborators crudCollaborators(EventDispatcher eventDispatcher) {
        LOG.info("Using default CRUD collaborators: schema rule validation, allow-all authorization, logging audit");
        return CrudCollaborators.builder()
                .validator(new SchemaRuleValidator())
                .authorizer(new AllowAllAuthorizer())
                .auditor(new LoggingAuditor())
                .eventDispatcher(eventDispatcher)
                .build();
    }
}
