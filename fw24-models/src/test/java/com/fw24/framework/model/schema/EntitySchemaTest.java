package com.fw24.framework.model.schema;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EntitySchemaTest {

    private EntitySchema.EntitySchemaBuilder userSchema() {
        return EntitySchema.builder()
                .entity("user")
                .attribute("userId", EntityAttribute.builder().identifier(true).required(true).build())
                .attribute("status", EntityAttribute.ofType(AttributeType.STRING))
                .attribute("type", EntityAttribute.ofType(AttributeType.STRING))
                .index("primary", EntityIndex.builder().pk(IndexKey.of("userId")).sk(IndexKey.of()).build());
    }

    @Test
    public void testValidSchema() {
        EntitySchema schema = userSchema()
                .index("byStatusAndType", EntityIndex.builder().index("gsi2")
                        .pk(IndexKey.of("status")).sk(IndexKey.of("type")).build())
                .build();
        assertEquals("primary", schema.findIndexNameById("").orElseThrow());
        assertEquals("byStatusAndType", schema.findIndexNameById("gsi2").orElseThrow());
        assertTrue(schema.findIndexNameById("gsi9").isEmpty());
        assertEquals(List.of("userId"), schema.getIdentifierAttributeNames());
        assertEquals(List.of("status", "type"),
                schema.getIndexes().get("byStatusAndType").getAllCompositeAttributes());
    }

    @Test
    public void testMissingPrimaryIndexIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> EntitySchema.builder()
                .entity("user")
                .attribute("userId", EntityAttribute.builder().identifier(true).build())
                .build());
        assertTrue(ex.getMessage().contains("primary"));
    }

    @Test
    public void testCompositeMustReferenceDeclaredAttributes() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> userSchema()
                .index("byEmail", EntityIndex.builder().index("gsi1").pk(IndexKey.of("email")).build())
                .build());
        assertTrue(ex.getMessage().contains("email"));
    }

    @Test
    public void testUniquenessFlags() {
        assertTrue(EntityAttribute.builder().unique(true).build().allowsAutoResolution());
        assertFalse(EntityAttribute.builder().ensureUnique(true).build().allowsAutoResolution());
        assertTrue(EntityAttribute.builder().ensureUnique(true).makeUnique(true).build().allowsAutoResolution());
        assertFalse(EntityAttribute.builder().build().requiresUniqueness());
    }
}
