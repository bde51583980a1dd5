package com.fw24.framework.model.schema;

import lombok.Builder;
import lombok.Value;

/**
 * Metadata of a single schema attribute.
 * <p>
 * {@code unique} is the legacy flag: a colliding value is always resolved by suffixing.
 * {@code ensureUnique} rejects collisions unless {@code makeUnique} is also set.
 */
@Value
@Builder
public class EntityAttribute {
    @Builder.Default
    AttributeType type = AttributeType.STRING;
    boolean required;
    boolean identifier;
    boolean unique;
    boolean ensureUnique;
    boolean makeUnique;
    boolean hidden;
    Boolean searchable;

    public boolean requiresUniqueness() {
        return unique || ensureUnique;
    }

    public boolean allowsAutoResolution() {
        return unique || (ensureUnique && makeUnique);
    }

    public static EntityAttribute ofType(AttributeType type) {
        return EntityAttribute.builder().type(type).build();
    }
}
