package com.fw24.framework.model.schema;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static description of one entity type: its attributes and indexes. Construction
 * fails with {@link IllegalArgumentException} when there is no {@code primary} index
 * or when an index composite names an attribute that is not declared.
 */
@Getter
public class EntitySchema {
    public static final String PRIMARY_INDEX = "primary";

    private final String entity;
    private final String version;
    private final String service;
    private final Map<String, EntityAttribute> attributes;
    private final Map<String, EntityIndex> indexes;

    @Builder
    private EntitySchema(String entity, String version, String service,
                         @Singular("attribute") Map<String, EntityAttribute> attributes,
                         @Singular("index") Map<String, EntityIndex> indexes) {
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("Entity schema requires an entity name");
        }
        this.entity = entity;
        this.version = version;
        this.service = service;
        this.attributes = attributes;
        this.indexes = indexes;
        validate();
    }

    private void validate() {
        if (!indexes.containsKey(PRIMARY_INDEX)) {
            throw new IllegalArgumentException("Entity schema " + entity + " must declare a 'primary' index");
        }
        for (Map.Entry<String, EntityIndex> entry : indexes.entrySet()) {
            for (String attribute : entry.getValue().getAllCompositeAttributes()) {
                if (!attributes.containsKey(attribute)) {
                    throw new IllegalArgumentException(String.format(
                            "Index %s of entity %s references unknown attribute %s", entry.getKey(), entity, attribute));
                }
            }
        }
    }

    public EntityIndex getPrimaryIndex() {
        return indexes.get(PRIMARY_INDEX);
    }

    public Optional<EntityAttribute> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * Finds the index name whose repository identifier equals {@code indexId}. The empty
     * identifier denotes the primary index.
     */
    public Optional<String> findIndexNameById(String indexId) {
        if (indexId == null || indexId.isEmpty()) {
            return Optional.of(PRIMARY_INDEX);
        }
        for (Map.Entry<String, EntityIndex> entry : indexes.entrySet()) {
            if (indexId.equals(entry.getValue().getIndex())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public List<String> getIdentifierAttributeNames() {
        List<String> names = new ArrayList<>();
        attributes.forEach((name, attribute) -> {
            if (attribute.isIdentifier()) {
                names.add(name);
            }
        });
        return names;
    }
}
