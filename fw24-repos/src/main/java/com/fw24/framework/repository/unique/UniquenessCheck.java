package com.fw24.framework.repository.unique;

import com.fw24.framework.model.schema.EntityAttribute;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class UniquenessCheck {
    /** Mutated in place with the value that was finally accepted. */
    Map<String, Object> payloadToUpdate;
    String attributeName;
    Object attributeValue;
    /** Identifiers of the record being updated, so it does not collide with itself. */
    Map<String, Object> ignoredIdentifiers;
    /** Overrides the schema attribute when set. */
    EntityAttribute attribute;
    @Builder.Default
    int maxAttempts = UniquenessEnforcer.DEFAULT_MAX_ATTEMPTS;
}
