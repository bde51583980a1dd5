package com.fw24.framework.service;

import com.fw24.framework.support.InMemoryEntityRepository;
import com.fw24.framework.support.TestEntityService;
import com.fw24.framework.support.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BaseEntityServiceTest {

    private InMemoryEntityRepository repository;
    private TestEntityService service;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryEntityRepository(TestSchemas.user());
        service = new TestEntityService(TestSchemas.user(), repository);
    }

    private static Map<String, Object> user(String id, String email, String username) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("userId", id);
        user.put("email", email);
        user.put("username", username);
        return user;
    }

    @Test
    public void testExtractIdentifiersFromScalar() {
        assertEquals("userId", service.getEntityPrimaryIdPropertyName());
        assertEquals(Map.of("userId", "u-1"), service.extractEntityIdentifiers("u-1"));
    }

    @Test
    public void testExtractIdentifiersFromRecord() {
        assertEquals(Map.of("userId", "u-1"), service.extractEntityIdentifiers(user("u-1", "a@b.c", "a")));
        assertEquals(Map.of("userId", "u-2"), service.extractEntityIdentifiers(Map.of("id", "u-2")));
        assertEquals(Map.of(), service.extractEntityIdentifiers(Map.of("email", "a@b.c")));
        assertThrows(IllegalArgumentException.class, () -> service.extractEntityIdentifiers(null));
    }

    @Test
    public void testAttributeNameViews() {
        assertEquals("user", service.getEntityName());
        assertEquals(List.of("email", "username"), service.getUniqueAttributes());
        assertEquals(List.of("tenantId", "email", "username", "firstName", "lastName", "status"),
                service.getSearchableAttributeNames());
        assertFalse(service.getFilterableAttributeNames().contains("password"));
    }

    @Test
    public void testSerializeRecordDropsHiddenAttributes() {
        Map<String, Object> record = user("u-1", "a@b.c", "a");
        record.put("password", "secret");
        record.put("extra", 1);

        Map<String, Object> serialized = service.serializeRecord(record);

        assertFalse(serialized.containsKey("password"));
        assertEquals(1, serialized.get("extra"));
        assertTrue(service.serializeRecords(List.of(record, record)).stream()
                .noneMatch(r -> r.containsKey("password")));
    }

    @Test
    public void testUniqueLookupUsesIndexWhenAvailable() {
        repository.put(user("u-1", "john@example.com", "jdoe"));

        assertFalse(service.isUniqueAttributeValue("email", "john@example.com", null));
        assertEquals("query:byEmail", repository.getCalls().get(0));
        assertEquals(Map.of("pages", "all"), repository.getLastOptions());
        assertEquals("#email = :email0", repository.getLastWhere());

        assertTrue(service.isUniqueAttributeValue("email", "jane@example.com", null));
    }

    @Test
    public void testUniqueLookupScansAndIgnoresOwnRecord() {
        repository.put(user("u-1", "john@example.com", "jdoe"));

        assertFalse(service.isUniqueAttributeValue("username", "jdoe", Map.of()));
        assertEquals("match", repository.getCalls().get(0));
        assertTrue(service.isUniqueAttributeValue("username", "jdoe", Map.of("userId", "u-1")));
        assertTrue(service.isUniqueAttributeValue("username", null, null));
    }
}
