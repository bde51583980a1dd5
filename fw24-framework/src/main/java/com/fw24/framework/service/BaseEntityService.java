package com.fw24.framework.service;

import com.fw24.framework.model.filter.AttributeFilter;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.filter.FilterOperator;
import com.fw24.framework.model.schema.AttributeType;
import com.fw24.framework.model.schema.EntityAttribute;
import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.model.validation.ValidationRule;
import com.fw24.framework.repository.EntityRepository;
import com.fw24.framework.repository.RepositoryResponse;
import com.fw24.framework.repository.filter.FilterCompiler;
import com.fw24.framework.repository.planner.IndexMatchResult;
import com.fw24.framework.repository.planner.IndexSelectionPlanner;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema driven defaults for {@link EntityService}. Subclasses supply the schema and the
 * repository and may override the validation configuration.
 */
public abstract class BaseEntityService implements EntityService {

    private static final Logger LOG = Logger.getLogger(BaseEntityService.class);

    public static final String DEFAULT_ID_ATTRIBUTE = "id";

    protected final EntitySchema schema;
    protected final EntityRepository repository;
    protected final IndexSelectionPlanner planner;
    protected final FilterCompiler filterCompiler;

    protected BaseEntityService(EntitySchema schema, EntityRepository repository) {
        this(schema, repository, new IndexSelectionPlanner(), new FilterCompiler());
    }

    protected BaseEntityService(EntitySchema schema, EntityRepository repository,
                                IndexSelectionPlanner planner, FilterCompiler filterCompiler) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.planner = planner;
        this.filterCompiler = filterCompiler;
    }

    @Override
    public EntitySchema getEntitySchema() {
        return schema;
    }

    @Override
    public EntityRepository getRepository() {
        return repository;
    }

    @Override
    public Map<String, List<ValidationRule>> getEntityValidations() {
        return Map.of();
    }

    @Override
    public Map<String, String> getOverriddenEntityValidationErrorMessages() {
        return Map.of();
    }

    /**
     * The attribute flagged as identifier, else the first partition attribute of the
     * primary index.
     */
    public String getEntityPrimaryIdPropertyName() {
        List<String> identifiers = schema.getIdentifierAttributeNames();
        if (!identifiers.isEmpty()) {
            return identifiers.get(0);
        }
        List<String> partition = schema.getPrimaryIndex().getPartitionComposite();
        return partition.isEmpty() ? DEFAULT_ID_ATTRIBUTE : partition.get(0);
    }

    @Override
    public Map<String, Object> extractEntityIdentifiers(Object input) {
        if (input == null) {
            throw new IllegalArgumentException("Input is required to extract identifiers of " + getEntityName());
        }
        String primaryId = getEntityPrimaryIdPropertyName();
        Map<String, Object> identifiers = new LinkedHashMap<>();
        if (!(input instanceof Map<?, ?> source)) {
            identifiers.put(primaryId, input);
            return identifiers;
        }

        for (String attribute : schema.getPrimaryIndex().getAllCompositeAttributes()) {
            Object value = source.get(attribute);
            if (value == null && attribute.equals(primaryId)) {
                value = source.get(DEFAULT_ID_ATTRIBUTE);
            }
            if (value != null) {
                identifiers.put(attribute, value);
            } else {
                EntityAttribute definition = schema.getAttributes().get(attribute);
                if (definition != null && definition.isRequired()) {
                    LOG.warnf("Required identifier attribute %s is missing for %s", attribute, getEntityName());
                }
            }
        }
        if (!identifiers.containsKey(primaryId) && source.get(primaryId) != null) {
            identifiers.put(primaryId, source.get(primaryId));
        }
        return identifiers;
    }

    @Override
    public List<String> getUniqueAttributes() {
        List<String> names = new ArrayList<>();
        schema.getAttributes().forEach((name, attribute) -> {
            if (attribute.requiresUniqueness()) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * String attributes that are neither hidden nor identifiers, plus any attribute
     * explicitly marked searchable.
     */
    @Override
    public List<String> getSearchableAttributeNames() {
        List<String> names = new ArrayList<>();
        schema.getAttributes().forEach((name, attribute) -> {
            boolean byDefault = !attribute.isHidden() && !attribute.isIdentifier() && attribute.getType() == AttributeType.STRING;
            boolean searchable = attribute.getSearchable() == null ? byDefault : attribute.getSearchable();
            if (searchable) {
                names.add(name);
            }
        });
        return names;
    }

    public List<String> getFilterableAttributeNames() {
        List<String> names = new ArrayList<>();
        schema.getAttributes().forEach((name, attribute) -> {
            if (!attribute.isHidden()) {
                names.add(name);
            }
        });
        return names;
    }

    public Map<String, Object> serializeRecord(Map<String, Object> record) {
        if (record == null) {
            return null;
        }
        Map<String, Object> serialized = new LinkedHashMap<>();
        record.forEach((name, value) -> {
            EntityAttribute attribute = schema.getAttributes().get(name);
            if (attribute == null || !attribute.isHidden()) {
                serialized.put(name, value);
            }
        });
        return serialized;
    }

    public List<Map<String, Object>> serializeRecords(Collection<Map<String, Object>> records) {
        List<Map<String, Object>> serialized = new ArrayList<>();
        if (records != null) {
            records.forEach(record -> serialized.add(serializeRecord(record)));
        }
        return serialized;
    }

    @Override
    public boolean isUniqueAttributeValue(String attributeName, Object value, Map<String, Object> ignoredIdentifiers) {
        if (value == null) {
            return true;
        }
        FilterCriteria filter = AttributeFilter.of(attributeName, FilterOperator.EQ.getCanonicalName(), value);
        Optional<IndexMatchResult> index = planner.findMatchingIndex(schema, filter, getEntityName(), repository);
        EntityRepository.QueryOperation operation = index.isPresent()
                ? repository.query(index.get().indexName(), index.get().indexFilters())
                : repository.match(Map.of(attributeName, value));
        RepositoryResponse response = operation
                .where(filterCompiler.toWhereCallback(filter))
                .go(Map.of("pages", "all"));

        for (Map<String, Object> record : records(response)) {
            if (!isSameRecord(record, ignoredIdentifiers)) {
                return false;
            }
        }
        return true;
    }

    private boolean isSameRecord(Map<String, Object> record, Map<String, Object> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, Object> entry : identifiers.entrySet()) {
            if (!Objects.equals(record.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    protected static List<Map<String, Object>> records(RepositoryResponse response) {
        if (response == null || response.getData() == null) {
            return List.of();
        }
        Object data = response.getData();
        if (data instanceof Collection<?> collection) {
            List<Map<String, Object>> records = new ArrayList<>();
            for (Object item : collection) {
                if (item instanceof Map<?, ?>) {
                    records.add((Map<String, Object>) item);
                }
            }
            return records;
        }
        if (data instanceof Map<?, ?>) {
            return List.of((Map<String, Object>) data);
        }
        return List.of();
    }
}
