package com.fw24.framework.crud;

import com.fw24.framework.audit.AuditRecord;
import com.fw24.framework.config.EntityCrudConfig;
import com.fw24.framework.config.EntityCrudConfigLoader;
import com.fw24.framework.event.DefaultEventDispatcher;
import com.fw24.framework.exceptions.EntityAuthorizationException;
import com.fw24.framework.exceptions.EntityValidationException;
import com.fw24.framework.exceptions.MissingPayloadException;
import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.event.EntityEventType;
import com.fw24.framework.model.event.EventMatcher;
import com.fw24.framework.model.event.EventPayload;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.query.EntityQuery;
import com.fw24.framework.model.query.IndexHint;
import com.fw24.framework.model.query.Pagination;
import com.fw24.framework.model.validation.ValidationRule;
import com.fw24.framework.repository.RepositoryResponse;
import com.fw24.framework.repository.filter.FilterCompiler;
import com.fw24.framework.repository.planner.IndexSelectionPlanner;
import com.fw24.framework.support.InMemoryEntityRepository;
import com.fw24.framework.support.RecordingCollaborators;
import com.fw24.framework.support.TestEntityService;
import com.fw24.framework.support.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EntityCrudServiceTest {

    private static final Map<String, Object> ACTOR = Map.of("userId", "admin-1");
    private static final Map<String, Object> TENANT = Map.of("tenantId", "t-1");

    private InMemoryEntityRepository repository;
    private TestEntityService service;
    private RecordingCollaborators.Validator validator;
    private RecordingCollaborators.Authorizer authorizer;
    private RecordingCollaborators.Auditor auditor;
    private CrudCollaborators collaborators;
    private List<EventPayload<?>> events;
    private EntityCrudService crud;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryEntityRepository(TestSchemas.user());
        service = new TestEntityService(TestSchemas.user(), repository);
        validator = new RecordingCollaborators.Validator();
        authorizer = new RecordingCollaborators.Authorizer();
        auditor = new RecordingCollaborators.Auditor();
        events = new CopyOnWriteArrayList<>();

        DefaultEventDispatcher dispatcher = new DefaultEventDispatcher();
        dispatcher.on(EventMatcher.wildcard(), events::add);
        collaborators = CrudCollaborators.builder()
                .validator(validator)
                .authorizer(authorizer)
                .auditor(auditor)
                .eventDispatcher(dispatcher)
                .build();
        crud = newCrud(EntityCrudConfigLoader.load());
    }

    private static EntityCrudService newCrud(EntityCrudConfig config) {
        return new EntityCrudService(config, new FilterCompiler(), new IndexSelectionPlanner());
    }

    private static Map<String, Object> user(String id, String email, String username) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("userId", id);
        user.put("tenantId", "t-1");
        user.put("email", email);
        user.put("username", username);
        user.put("firstName", "John");
        user.put("status", "active");
        return user;
    }

    private GetEntityArgs getArgs(Object id) {
        return GetEntityArgs.builder().entityService(service).collaborators(collaborators)
                .actor(ACTOR).tenant(TENANT).correlationId("corr-1").id(id).build();
    }

    private CreateEntityArgs createArgs(Map<String, Object> data) {
        return CreateEntityArgs.builder().entityService(service).collaborators(collaborators)
                .actor(ACTOR).tenant(TENANT).correlationId("corr-1").data(data).build();
    }

    private UpdateEntityArgs updateArgs(Object id, Map<String, Object> data) {
        return UpdateEntityArgs.builder().entityService(service).collaborators(collaborators)
                .actor(ACTOR).tenant(TENANT).correlationId("corr-1").id(id).data(data).build();
    }

    private QueryEntityArgs queryArgs(EntityQuery query) {
        return QueryEntityArgs.builder().entityService(service).collaborators(collaborators)
                .actor(ACTOR).tenant(TENANT).correlationId("corr-1").query(query).build();
    }

    private static String phases(EventPayload<?> event) {
        EventMatcher type = event.getType();
        String subPhase = type.getDimension(EntityEventType.SUB_PHASE);
        return type.getDimension(EntityEventType.PHASE) + (subPhase == null ? "" : "/" + subPhase);
    }

    private List<String> phases() {
        return events.stream().map(EntityCrudServiceTest::phases).collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(EventPayload<?> event) {
        return (Map<String, Object>) event.getData();
    }

    @Test
    public void testGetEmitsLifecycleEventsWithCallContext() {
        repository.put(user("u-1", "john@example.com", "jdoe"));

        RepositoryResponse response = crud.getEntity(getArgs("u-1"));

        assertEquals(user("u-1", "john@example.com", "jdoe"), response.getData());
        assertTrue(events.size() >= 4);
        assertEquals(List.of("pre", "pre/validate", "post/validate", "post"), phases());
        for (EventPayload<?> event : events) {
            assertEquals(ACTOR, event.getContext().get("actor"));
            assertEquals(TENANT, event.getContext().get("tenant"));
            assertEquals("corr-1", event.getCorrelationId());
            assertEquals("user", event.getEntityName());
            assertEquals("get", event.getType().getDimension(EntityEventType.OPERATION));
        }
        assertEquals("success", events.get(2).getType().getDimension(EntityEventType.SUCCESS_FAIL));
        assertEquals(Map.of("userId", "u-1"), data(events.get(0)).get("identifiers"));
        assertEquals(List.of("get"), repository.getCalls());
        assertEquals(1, auditor.records.size());
    }

    @Test
    public void testCreatePersistsAndEmitsDataEvents() {
        Map<String, Object> payload = user("u-1", "john@example.com", "jdoe");

        RepositoryResponse response = crud.createEntity(createArgs(payload));

        assertEquals(payload, response.getData());
        assertEquals(payload, repository.find("u-1"));
        assertEquals(List.of("pre", "pre/validate", "post/validate", "pre/duplicate", "post/duplicate", "post"), phases());
        assertEquals(payload, data(events.get(0)).get("data"));
        assertEquals(payload, data(events.get(events.size() - 1)).get("entity"));

        AuditRecord audit = auditor.records.get(0);
        assertEquals(CrudOperation.CREATE, audit.getCrudType());
        assertEquals("corr-1", audit.getCorrelationId());
        assertEquals(CrudOperation.CREATE, authorizer.requests.get(0).getCrudType());
    }

    @Test
    public void testCreateResolvesCollidingUniqueUsername() {
        repository.put(user("u-1", "john@example.com", "jdoe"));

        crud.createEntity(createArgs(user("u-2", "jane@example.com", "jdoe")));

        assertEquals("jdoe-1", repository.find("u-2").get("username"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testEmittedEventDataKeepsValuesAtEmitTime() {
        repository.put(user("u-1", "john@example.com", "jdoe"));

        crud.createEntity(createArgs(user("u-2", "jane@example.com", "jdoe")));

        Map<String, Object> preData = (Map<String, Object>) data(events.get(0)).get("data");
        assertEquals("jdoe", preData.get("username"));
        assertEquals("jdoe-1", repository.find("u-2").get("username"));
        Map<String, Object> postData = (Map<String, Object>) data(events.get(events.size() - 1)).get("data");
        assertEquals("jdoe-1", postData.get("username"));
        assertThrows(UnsupportedOperationException.class, () -> preData.put("username", "other"));
    }

    @Test
    public void testCreateRejectsDuplicateEmail() {
        repository.put(user("u-1", "john@example.com", "jdoe"));

        EntityValidationException e = assertThrows(EntityValidationException.class,
                () -> crud.createEntity(createArgs(user("u-2", "john@example.com", "jane"))));

        assertEquals("email", e.getViolations().get(0).getPropertyPath());
        assertFalse(repository.getCalls().contains("create"));
        assertNull(repository.find("u-2"));
    }

    @Test
    public void testUpdateEmitsCompositeKeyEventsAndPatches() {
        repository.put(user("u-1", "john@example.com", "jdoe"));
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", "inactive");
        changes.put("username", "jdoe");

        crud.updateEntity(updateArgs("u-1", changes));

        long compositeEvents = phases().stream().filter(p -> p.endsWith("/compositeKey")).count();
        assertEquals(2, compositeEvents);
        assertEquals(Map.of("status", "inactive"), repository.getLastComposite());
        assertEquals("inactive", repository.find("u-1").get("status"));
        assertEquals("jdoe", repository.find("u-1").get("username"));
        assertTrue(repository.getCalls().contains("patch"));
    }

    @Test
    public void testUpsertAndDelete() {
        repository.put(user("u-1", "john@example.com", "jdoe"));
        Map<String, Object> upsert = new LinkedHashMap<>();
        upsert.put("userId", "u-1");
        upsert.put("lastName", "Doe");

        crud.upsertEntity(UpsertEntityArgs.builder().entityService(service).collaborators(collaborators)
                .actor(ACTOR).tenant(TENANT).data(upsert).build());
        assertEquals("Doe", repository.find("u-1").get("lastName"));
        assertEquals("John", repository.find("u-1").get("firstName"));

        RepositoryResponse deleted = crud.deleteEntity(DeleteEntityArgs.builder().entityService(service)
                .collaborators(collaborators).actor(ACTOR).tenant(TENANT).id("u-1").build());
        assertNotNull(deleted.getData());
        assertNull(repository.find("u-1"));
        assertEquals(CrudOperation.DELETE, auditor.records.get(auditor.records.size() - 1).getCrudType());
    }

    @Test
    public void testMissingPayloadThrowsBeforeAnyCollaborator() {
        assertThrows(MissingPayloadException.class, () -> crud.createEntity(createArgs(null)));
        assertThrows(MissingPayloadException.class, () -> crud.updateEntity(updateArgs("u-1", null)));
        assertThrows(MissingPayloadException.class, () -> crud.upsertEntity(UpsertEntityArgs.builder()
                .entityService(service).collaborators(collaborators).build()));

        assertTrue(events.isEmpty());
        assertTrue(validator.requests.isEmpty());
        assertTrue(authorizer.requests.isEmpty());
        assertTrue(auditor.records.isEmpty());
        assertTrue(repository.getCalls().isEmpty());
    }

    @Test
    public void testMissingCollaboratorsAreRejected() {
        GetEntityArgs args = GetEntityArgs.builder().entityService(service)
                .collaborators(collaborators.toBuilder().auditor(null).build()).id("u-1").build();
        assertThrows(NullPointerException.class, () -> crud.getEntity(args));
        assertTrue(repository.getCalls().isEmpty());
    }

    @Test
    public void testValidationFailureSkipsRepository() {
        service.withValidation("lastName", ValidationRule.of("required", true));

        EntityValidationException e = assertThrows(EntityValidationException.class,
                () -> crud.createEntity(createArgs(user("u-1", "john@example.com", "jdoe"))));

        assertEquals("user", e.getEntityName());
        assertEquals("Value for 'lastName' is required", e.getViolations().get(0).getViolationDescription());
        assertEquals(List.of("pre", "pre/validate", "post/validate"), phases());
        assertEquals("fail", events.get(2).getType().getDimension(EntityEventType.SUCCESS_FAIL));
        assertTrue(authorizer.requests.isEmpty());
        assertTrue(repository.getCalls().isEmpty());
    }

    @Test
    public void testAuthorizationDenialStopsTheCall() {
        repository.put(user("u-1", "john@example.com", "jdoe"));
        authorizer.deny("not your tenant");

        EntityAuthorizationException e = assertThrows(EntityAuthorizationException.class,
                () -> crud.getEntity(getArgs("u-1")));

        assertEquals(List.of("not your tenant"), e.getReasons());
        assertTrue(repository.getCalls().isEmpty());
        assertTrue(auditor.records.isEmpty());
    }

    @Test
    public void testRepositoryFailureEmitsFailedPostEvent() {
        repository.failOn("create", new IllegalStateException("storage unavailable"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> crud.createEntity(createArgs(user("u-1", "john@example.com", "jdoe"))));

        assertEquals("storage unavailable", e.getMessage());
        EventPayload<?> last = events.get(events.size() - 1);
        assertEquals("post", last.getType().getDimension(EntityEventType.PHASE));
        assertEquals("fail", last.getType().getDimension(EntityEventType.SUCCESS_FAIL));
        assertEquals("storage unavailable", data(last).get("error"));
        assertTrue(auditor.records.isEmpty());
    }

    @Test
    public void testListUsesPlannedIndex() {
        repository.put(user("u-1", "john@example.com", "jdoe"));
        Map<String, Object> other = user("u-2", "jane@example.com", "jane");
        other.put("tenantId", "t-2");
        repository.put(other);

        EntityQuery query = EntityQuery.builder()
                .filters(FilterCriteria.fromJson("{\"tenantId\":\"t-1\",\"status\":{\"eq\":\"active\"}}"))
                .build();
        RepositoryResponse response = crud.listEntity(queryArgs(query));

        assertEquals(List.of("query:byTenant"), repository.getCalls());
        assertEquals(Map.of("tenantId", "t-1", "status", "active"), repository.getLastEqualities());
        assertEquals("( #tenantId = :tenantId0 AND #status = :status0 )", repository.getLastWhere());
        assertEquals(1, ((List<?>) response.getData()).size());
        assertEquals(CrudOperation.LIST, authorizer.requests.get(0).getCrudType());
        assertSame(query, authorizer.requests.get(0).getQuery());
    }

    @Test
    public void testQueryHonorsIndexHint() {
        repository.put(user("u-1", "john@example.com", "jdoe"));
        EntityQuery query = EntityQuery.builder()
                .index(IndexHint.builder().name("byEmail").filters(Map.of("email", "john@example.com")).build())
                .build();

        RepositoryResponse response = crud.queryEntity(queryArgs(query));

        assertEquals(List.of("query:byEmail"), repository.getCalls());
        assertNull(repository.getLastWhere());
        assertEquals(1, ((List<?>) response.getData()).size());
    }

    @Test
    public void testQueryWithoutIndexableFiltersScans() {
        EntityQuery query = EntityQuery.builder()
                .filters(FilterCriteria.fromJson("{\"attribute\":\"age\",\"gte\":18}"))
                .build();

        crud.queryEntity(queryArgs(query));

        assertEquals(List.of("match"), repository.getCalls());
        assertEquals(Map.of(), repository.getLastEqualities());
        assertEquals("#age >= :age0", repository.getLastWhere());
    }

    @Test
    public void testPaginationPlaceholdersAreStripped() {
        EntityQuery query = EntityQuery.builder()
                .pagination(Pagination.builder().count(10).cursor("").build())
                .attributes(new ArrayList<>(List.of("firstName", "address.city", "address.zip")))
                .build();

        crud.listEntity(queryArgs(query));

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("count", 10);
        expected.put("attributes", List.of("firstName", "address"));
        assertEquals(expected, repository.getLastOptions());
    }

    @Test
    public void testKeywordSearchAddsContainsFilters() {
        EntityQuery query = EntityQuery.builder()
                .search("john, doe")
                .searchAttributes(new ArrayList<>(List.of("firstName", "lastName")))
                .build();

        crud.queryEntity(queryArgs(query));

        String where = repository.getLastWhere();
        assertTrue(where.contains("contains(#firstName, :firstName0)"), where);
        assertTrue(where.contains("contains(#lastName, :lastName1)"), where);
        assertTrue(where.contains(" OR "), where);
        assertEquals("john", repository.getLastWhereValues().get(":firstName0"));
        assertEquals("doe", repository.getLastWhereValues().get(":firstName1"));
    }

    @Test
    public void testContextIsMergedIntoEveryEvent() {
        repository.put(user("u-1", "john@example.com", "jdoe"));
        GetEntityArgs args = GetEntityArgs.builder().entityService(service).collaborators(collaborators)
                .actor(ACTOR).tenant(TENANT).context(Map.of("requestId", "r-1")).id("u-1").build();

        crud.getEntity(args);

        assertFalse(events.isEmpty());
        events.forEach(event -> {
            assertEquals("r-1", event.getContext().get("requestId"));
            assertEquals(ACTOR, event.getContext().get("actor"));
        });
    }

    @Test
    public void testAuditCanBeDisabled() {
        crud = newCrud(EntityCrudConfigLoader.load(Map.of("fw24.entity.audit.enabled", "false")));

        crud.createEntity(createArgs(user("u-1", "john@example.com", "jdoe")));

        assertNotNull(repository.find("u-1"));
        assertTrue(auditor.records.isEmpty());
    }
}
