package com.fw24.framework.crud;

import com.fw24.framework.audit.AuditRecord;
import com.fw24.framework.authorize.AuthorizationRequest;
import com.fw24.framework.authorize.AuthorizationResult;
import com.fw24.framework.config.EntityCrudConfig;
import com.fw24.framework.event.EntityEventEmitter;
import com.fw24.framework.exceptions.EntityAuthorizationException;
import com.fw24.framework.exceptions.EntityValidationException;
import com.fw24.framework.exceptions.MissingPayloadException;
import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.event.EventPhase;
import com.fw24.framework.model.event.EventSubPhase;
import com.fw24.framework.model.event.SuccessFail;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.query.EntityQuery;
import com.fw24.framework.model.schema.EntityIndex;
import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.model.validation.ValidationResult;
import com.fw24.framework.repository.EntityRepository;
import com.fw24.framework.repository.RepositoryResponse;
import com.fw24.framework.repository.filter.FilterCompiler;
import com.fw24.framework.repository.filter.FilterGroupUtils;
import com.fw24.framework.repository.planner.IndexMatchResult;
import com.fw24.framework.repository.planner.IndexSelectionPlanner;
import com.fw24.framework.repository.query.AttributePathParser;
import com.fw24.framework.repository.unique.UniquenessCheck;
import com.fw24.framework.repository.unique.UniquenessEnforcer;
import com.fw24.framework.service.EntityService;
import com.fw24.framework.validation.ValidationRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Runs the CRUD pipeline for any entity:
 * <pre>
 * pre -> pre/validate -> validate -> post/validate -> authorize
 *     -> [pre/duplicate -> post/duplicate] -> [pre/compositeKey -> post/compositeKey]
 *     -> repository call -> post -> audit
 * </pre>
 * Each call receives its entity service and collaborators through its arguments. Every
 * operation returns the repository response unchanged.
 */
@ApplicationScoped
public class EntityCrudService {

    private static final Logger LOG = Logger.getLogger(EntityCrudService.class);

    static final String IDENTIFIERS = "identifiers";
    static final String DATA = "data";
    static final String ENTITY = "entity";
    static final String QUERY = "query";
    static final String VALIDATION_RESULT = "validationResult";
    static final String COMPOSITE = "composite";
    static final String ERROR = "error";

    private final EntityCrudConfig config;
    private final FilterCompiler filterCompiler;
    private final IndexSelectionPlanner planner;

    @Inject
    public EntityCrudService(EntityCrudConfig config, FilterCompiler filterCompiler, IndexSelectionPlanner planner) {
        this.config = config;
        this.filterCompiler = filterCompiler;
        this.planner = planner;
    }

    public RepositoryResponse getEntity(GetEntityArgs args) {
        args.requireCollaborators();
        EntityService service = args.getEntityService();
        EntityEventEmitter events = emitter(args, CrudOperation.GET);
        Map<String, Object> identifiers = service.extractEntityIdentifiers(args.getId());

        events.emit(EventPhase.PRE, eventData(IDENTIFIERS, identifiers));
        validate(args, CrudOperation.GET, identifiers, events, IDENTIFIERS);
        authorize(args, CrudOperation.GET, identifiers, null, null);

        RepositoryResponse response = persist(events, eventData(IDENTIFIERS, identifiers),
                () -> service.getRepository().get(identifiers).go());

        events.emit(EventPhase.POST, eventData(IDENTIFIERS, identifiers, ENTITY, response.getData()));
        audit(args, CrudOperation.GET, identifiers, null, response.getData());
        return response;
    }

    public RepositoryResponse createEntity(CreateEntityArgs args) {
        args.requireCollaborators();
        if (args.getData() == null) {
            throw new MissingPayloadException(args.getEntityService().getEntityName(), CrudOperation.CREATE.getValue());
        }
        return write(args, CrudOperation.CREATE, args.getData(),
                (service, payload) -> service.getRepository().create(payload).go());
    }

    public RepositoryResponse upsertEntity(UpsertEntityArgs args) {
        args.requireCollaborators();
        if (args.getData() == null) {
            throw new MissingPayloadException(args.getEntityService().getEntityName(), CrudOperation.UPSERT.getValue());
        }
        return write(args, CrudOperation.UPSERT, args.getData(),
                (service, payload) -> service.getRepository().upsert(payload).go());
    }

    public RepositoryResponse updateEntity(UpdateEntityArgs args) {
        args.requireCollaborators();
        EntityService service = args.getEntityService();
        if (args.getData() == null) {
            throw new MissingPayloadException(service.getEntityName(), CrudOperation.UPDATE.getValue());
        }
        EntityEventEmitter events = emitter(args, CrudOperation.UPDATE);
        Map<String, Object> identifiers = service.extractEntityIdentifiers(args.getId());
        Map<String, Object> payload = new LinkedHashMap<>(args.getData());
        identifiers.keySet().forEach(payload::remove);

        events.emit(EventPhase.PRE, eventData(IDENTIFIERS, identifiers, DATA, payload));
        validate(args, CrudOperation.UPDATE, payload, events, DATA);
        authorize(args, CrudOperation.UPDATE, identifiers, payload, null);
        enforceUniqueness(args, payload, identifiers, events);

        events.emit(EventPhase.PRE, EventSubPhase.COMPOSITE_KEY, eventData(IDENTIFIERS, identifiers, DATA, payload));
        Map<String, Object> composite = compositeAttributes(service.getEntitySchema(), identifiers, payload);
        events.emit(EventPhase.POST, EventSubPhase.COMPOSITE_KEY, eventData(IDENTIFIERS, identifiers, COMPOSITE, composite));

        RepositoryResponse response = persist(events, eventData(IDENTIFIERS, identifiers, DATA, payload),
                () -> service.getRepository().patch(identifiers).set(payload).composite(composite).go());

        events.emit(EventPhase.POST, eventData(IDENTIFIERS, identifiers, DATA, payload, ENTITY, response.getData()));
        audit(args, CrudOperation.UPDATE, identifiers, payload, response.getData());
        return response;
    }

    public RepositoryResponse deleteEntity(DeleteEntityArgs args) {
        args.requireCollaborators();
        EntityService service = args.getEntityService();
        EntityEventEmitter events = emitter(args, CrudOperation.DELETE);
        Map<String, Object> identifiers = service.extractEntityIdentifiers(args.getId());

        events.emit(EventPhase.PRE, eventData(IDENTIFIERS, identifiers));
        validate(args, CrudOperation.DELETE, identifiers, events, IDENTIFIERS);
        authorize(args, CrudOperation.DELETE, identifiers, null, null);

        RepositoryResponse response = persist(events, eventData(IDENTIFIERS, identifiers),
                () -> service.getRepository().delete(identifiers).go());

        events.emit(EventPhase.POST, eventData(IDENTIFIERS, identifiers, ENTITY, response.getData()));
        audit(args, CrudOperation.DELETE, identifiers, null, response.getData());
        return response;
    }

    public RepositoryResponse listEntity(QueryEntityArgs args) {
        return search(args, CrudOperation.LIST);
    }

    public RepositoryResponse queryEntity(QueryEntityArgs args) {
        return search(args, CrudOperation.QUERY);
    }

    @FunctionalInterface
    private interface WriteCall {
        RepositoryResponse go(EntityService service, Map<String, Object> payload);
    }

    private RepositoryResponse write(CrudArgs args, CrudOperation operation, Map<String, Object> data, WriteCall call) {
        EntityService service = args.getEntityService();
        EntityEventEmitter events = emitter(args, operation);
        Map<String, Object> payload = new LinkedHashMap<>(data);
        Map<String, Object> identifiers = operation == CrudOperation.UPSERT ? service.extractEntityIdentifiers(payload) : Map.of();

        events.emit(EventPhase.PRE, eventData(DATA, payload));
        validate(args, operation, payload, events, DATA);
        authorize(args, operation, identifiers.isEmpty() ? null : identifiers, payload, null);
        enforceUniqueness(args, payload, identifiers, events);

        RepositoryResponse response = persist(events, eventData(DATA, payload), () -> call.go(service, payload));

        events.emit(EventPhase.POST, eventData(DATA, payload, ENTITY, response.getData()));
        audit(args, operation, identifiers.isEmpty() ? null : identifiers, payload, response.getData());
        return response;
    }

    private RepositoryResponse search(QueryEntityArgs args, CrudOperation operation) {
        args.requireCollaborators();
        EntityService service = args.getEntityService();
        EntityRepository repository = service.getRepository();
        EntityEventEmitter events = emitter(args, operation);
        EntityQuery query = args.getQuery() == null ? new EntityQuery() : args.getQuery();

        events.emit(EventPhase.PRE, eventData(QUERY, query));
        validate(args, operation, eventData(QUERY, query), events, QUERY);
        authorize(args, operation, null, null, query);

        FilterCriteria filters = withKeywordSearch(service, query);
        Map<String, Object> options = PaginationOptions.strip(query.getPagination() == null
                ? new LinkedHashMap<>() : query.getPagination().toOptions());
        if (query.getAttributes() != null && !query.getAttributes().isEmpty()) {
            options.put("attributes", new ArrayList<>(AttributePathParser.parse(query.getAttributes()).keySet()));
        }

        EntityRepository.QueryOperation read;
        if (query.getIndex() != null && query.getIndex().getName() != null) {
            read = repository.query(query.getIndex().getName(), query.getIndex().getFilters());
        } else {
            Optional<IndexMatchResult> index = planner.findMatchingIndex(
                    service.getEntitySchema(), filters, service.getEntityName(), repository);
            read = index.isPresent()
                    ? repository.query(index.get().indexName(), index.get().indexFilters())
                    : repository.match(Map.of());
        }
        if (filters != null) {
            read = read.where(filterCompiler.toWhereCallback(filters));
        }

        EntityRepository.QueryOperation pending = read;
        RepositoryResponse response = persist(events, eventData(QUERY, query), () -> pending.go(options));

        events.emit(EventPhase.POST, eventData(QUERY, query, ENTITY, response.getData()));
        audit(args, operation, null, null, response.getData());
        return response;
    }

    private FilterCriteria withKeywordSearch(EntityService service, EntityQuery query) {
        if (query.getSearch() == null || query.getSearch().isBlank()) {
            return query.getFilters();
        }
        List<String> keywords = new ArrayList<>();
        for (String keyword : Pattern.compile(config.search().keywordDelimiters()).split(query.getSearch().trim())) {
            if (!keyword.isBlank()) {
                keywords.add(keyword);
            }
        }
        List<String> attributes = query.getSearchAttributes() == null || query.getSearchAttributes().isEmpty()
                ? service.getSearchableAttributeNames() : query.getSearchAttributes();
        if (keywords.isEmpty() || attributes.isEmpty()) {
            return query.getFilters();
        }
        return FilterGroupUtils.and(query.getFilters(), FilterGroupUtils.forKeywordSearch(keywords, attributes));
    }

    private EntityEventEmitter emitter(CrudArgs args, CrudOperation operation) {
        Map<String, Object> base = EntityEventEmitter.baseContext(args.getActor(), args.getTenant(), args.getCorrelationId());
        if (args.getContext() != null) {
            base.putAll(args.getContext());
        }
        return new EntityEventEmitter(args.getCollaborators().getEventDispatcher(),
                args.getEntityService().getEntityName(), operation, args.getCorrelationId(), base);
    }

    private void validate(CrudArgs args, CrudOperation operation, Map<String, Object> input,
                          EntityEventEmitter events, String inputKey) {
        EntityService service = args.getEntityService();
        events.emit(EventPhase.PRE, EventSubPhase.VALIDATE, eventData(inputKey, input));

        ValidationResult result = args.getCollaborators().getValidator().validateEntity(ValidationRequest.builder()
                .operationName(operation)
                .entityName(service.getEntityName())
                .entityValidations(orEmpty(service.getEntityValidations()))
                .overriddenErrorMessages(orEmpty(service.getOverriddenEntityValidationErrorMessages()))
                .input(input)
                .actor(args.getActor())
                .build());

        events.emit(EventPhase.POST, EventSubPhase.VALIDATE, result.isPass() ? SuccessFail.SUCCESS : SuccessFail.FAIL,
                eventData(inputKey, input, VALIDATION_RESULT, result), null);
        if (!result.isPass()) {
            throw new EntityValidationException(service.getEntityName(), result.getErrors());
        }
    }

    private void authorize(CrudArgs args, CrudOperation operation, Map<String, Object> identifiers,
                           Map<String, Object> data, EntityQuery query) {
        String entityName = args.getEntityService().getEntityName();
        AuthorizationResult result = args.getCollaborators().getAuthorizer().authorize(AuthorizationRequest.builder()
                .entityName(entityName)
                .crudType(operation)
                .identifiers(identifiers)
                .data(data)
                .query(query)
                .actor(args.getActor())
                .tenant(args.getTenant())
                .build());
        if (result == null || !result.isPass()) {
            throw new EntityAuthorizationException(entityName, operation.getValue(),
                    result == null ? List.of() : result.getErrors());
        }
    }

    private void enforceUniqueness(CrudArgs args, Map<String, Object> payload, Map<String, Object> ignoredIdentifiers,
                                   EntityEventEmitter events) {
        EntityService service = args.getEntityService();
        List<String> uniqueAttributes = service.getUniqueAttributes();
        events.emit(EventPhase.PRE, EventSubPhase.DUPLICATE, eventData(DATA, payload));

        UniquenessEnforcer enforcer = new UniquenessEnforcer(service.getEntitySchema(), service);
        for (String attribute : uniqueAttributes) {
            if (!payload.containsKey(attribute) || payload.get(attribute) == null) {
                continue;
            }
            enforcer.checkUniquenessAndUpdate(UniquenessCheck.builder()
                    .payloadToUpdate(payload)
                    .attributeName(attribute)
                    .attributeValue(payload.get(attribute))
                    .ignoredIdentifiers(ignoredIdentifiers == null || ignoredIdentifiers.isEmpty() ? null : ignoredIdentifiers)
                    .maxAttempts(config.unique().maxAttempts())
                    .build());
        }
        events.emit(EventPhase.POST, EventSubPhase.DUPLICATE, eventData(DATA, payload));
    }

    /**
     * Composite attributes of every secondary index touched by the patch, so the
     * repository can rebuild those index keys.
     */
    private Map<String, Object> compositeAttributes(EntitySchema schema, Map<String, Object> identifiers,
                                                    Map<String, Object> payload) {
        Map<String, Object> composite = new LinkedHashMap<>();
        for (EntityIndex index : schema.getIndexes().values()) {
            if (index == schema.getPrimaryIndex()) {
                continue;
            }
            List<String> attributes = index.getAllCompositeAttributes();
            if (attributes.stream().noneMatch(payload::containsKey)) {
                continue;
            }
            for (String attribute : attributes) {
                if (payload.containsKey(attribute)) {
                    composite.put(attribute, payload.get(attribute));
                } else if (identifiers.containsKey(attribute)) {
                    composite.put(attribute, identifiers.get(attribute));
                }
            }
        }
        return composite;
    }

    private RepositoryResponse persist(EntityEventEmitter events, Map<String, Object> data, Supplier<RepositoryResponse> call) {
        try {
            RepositoryResponse response = call.get();
            return response == null ? new RepositoryResponse() : response;
        } catch (RuntimeException e) {
            Map<String, Object> failure = new LinkedHashMap<>(data);
            failure.put(ERROR, e.getMessage());
            events.emit(EventPhase.POST, null, SuccessFail.FAIL, failure, null);
            throw e;
        }
    }

    private void audit(CrudArgs args, CrudOperation operation, Map<String, Object> identifiers,
                       Map<String, Object> data, Object entity) {
        if (!config.audit().enabled()) {
            LOG.tracef("Audit disabled; skipping %s %s", operation.getValue(), args.getEntityService().getEntityName());
            return;
        }
        args.getCollaborators().getAuditor().audit(AuditRecord.builder()
                .entityName(args.getEntityService().getEntityName())
                .crudType(operation)
                .identifiers(identifiers)
                .data(data)
                .entity(entity)
                .actor(args.getActor())
                .tenant(args.getTenant())
                .correlationId(args.getCorrelationId())
                .build());
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }

    private static Map<String, Object> eventData(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return data;
    }
}
