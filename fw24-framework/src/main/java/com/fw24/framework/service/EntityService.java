package com.fw24.framework.service;

import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.model.validation.ValidationRule;
import com.fw24.framework.repository.EntityRepository;
import com.fw24.framework.repository.unique.UniqueValueLookup;

import java.util.List;
import java.util.Map;

/**
 * Per entity collaborator handed to the CRUD pipeline: schema, repository and the
 * entity's validation configuration.
 */
public interface EntityService extends UniqueValueLookup {

    EntitySchema getEntitySchema();

    EntityRepository getRepository();

    default String getEntityName() {
        return getEntitySchema().getEntity();
    }

    Map<String, List<ValidationRule>> getEntityValidations();

    Map<String, String> getOverriddenEntityValidationErrorMessages();

    /**
     * Normalizes an identifier value or a record into the map of primary key attributes.
     */
    Map<String, Object> extractEntityIdentifiers(Object input);

    List<String> getSearchableAttributeNames();

    /**
     * Names of attributes flagged {@code unique} or {@code ensureUnique}.
     */
    List<String> getUniqueAttributes();
}
