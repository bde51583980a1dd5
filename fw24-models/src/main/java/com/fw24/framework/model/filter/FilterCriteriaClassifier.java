package com.fw24.framework.model.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fw24.framework.exceptions.InvalidFilterShapeException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw map trees into typed {@link FilterCriteria}. A value has to match exactly
 * one shape:
 * <ul>
 *   <li>a map with an {@code attribute} key and at least one operator key is an attribute filter,</li>
 *   <li>a map whose only non meta keys are {@code and}, {@code or} and {@code not} is a group,</li>
 *   <li>any other non empty map of attribute names is an entity filter.</li>
 * </ul>
 * Within an entity filter a non map value is shorthand for {@code {eq: value}}.
 */
final class FilterCriteriaClassifier {

    static final String ATTRIBUTE = "attribute";
    static final String FILTER_ID = "filterId";
    static final String FILTER_LABEL = "filterLabel";
    static final String LOGICAL_OP = "logicalOp";
    static final Set<String> META_KEYS = Set.of(FILTER_ID, FILTER_LABEL, LOGICAL_OP);
    static final List<String> GROUP_KEYS = List.of("and", "or", "not");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FilterCriteriaClassifier() {
    }

    static FilterCriteria classifyJson(String json) {
        try {
            return classify(MAPPER.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new InvalidFilterShapeException("Filter is not valid JSON: " + e.getOriginalMessage(), json);
        }
    }

    static FilterCriteria classify(Object raw) {
        if (raw instanceof FilterCriteria criteria) {
            return criteria;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidFilterShapeException("Filter must be an object but was " +
                    (raw == null ? "null" : raw.getClass().getSimpleName()), raw);
        }
        if (map.isEmpty()) {
            throw new InvalidFilterShapeException("Filter must not be empty", raw);
        }

        boolean hasAttribute = map.containsKey(ATTRIBUTE);
        boolean hasGroupKey = GROUP_KEYS.stream().anyMatch(map::containsKey);
        boolean hasOperatorKey = map.keySet().stream().anyMatch(k -> FilterOperator.isOperatorKey(String.valueOf(k)));

        if (hasAttribute && hasGroupKey) {
            throw new InvalidFilterShapeException("Filter mixes an attribute filter with group branches", raw);
        }
        if (hasAttribute) {
            return toAttributeFilter(map, null);
        }
        if (hasGroupKey) {
            return toGroup(map);
        }
        if (hasOperatorKey) {
            throw new InvalidFilterShapeException("Filter criteria has operators but no 'attribute'", raw);
        }
        return toEntityFilter(map);
    }

    private static AttributeFilter toAttributeFilter(Map<?, ?> map, String attributeName) {
        Object attribute = attributeName != null ? attributeName : map.get(ATTRIBUTE);
        if (!(attribute instanceof String name) || name.isBlank()) {
            throw new InvalidFilterShapeException("Attribute filter requires a non blank 'attribute' name", map);
        }
        Map<String, Object> clauses = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!ATTRIBUTE.equals(key) && !META_KEYS.contains(key)) {
                clauses.put(key, entry.getValue());
            }
        }
        if (clauses.keySet().stream().noneMatch(FilterOperator::isOperatorKey)) {
            throw new InvalidFilterShapeException("Attribute filter for '" + name + "' has no operator", map);
        }
        return AttributeFilter.builder()
                .filterId(text(map.get(FILTER_ID)))
                .filterLabel(text(map.get(FILTER_LABEL)))
                .attribute(name)
                .logicalOp(LogicalOperator.fromValue(map.get(LOGICAL_OP)))
                .clauses(clauses)
                .build();
    }

    private static FilterGroup toGroup(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            String name = String.valueOf(key);
            if (!GROUP_KEYS.contains(name) && !META_KEYS.contains(name)) {
                throw new InvalidFilterShapeException("Filter mixes group branches with attribute '" + name + "'", map);
            }
        }
        FilterGroup.FilterGroupBuilder builder = FilterGroup.builder()
                .filterId(text(map.get(FILTER_ID)))
                .filterLabel(text(map.get(FILTER_LABEL)));
        for (Object child : branch(map, "and")) {
            builder.andFilter(classify(child));
        }
        for (Object child : branch(map, "or")) {
            builder.orFilter(classify(child));
        }
        for (Object child : branch(map, "not")) {
            builder.notFilter(classify(child));
        }
        return builder.build();
    }

    private static Collection<?> branch(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> collection)) {
            throw new InvalidFilterShapeException("Group branch '" + key + "' must be a list", map);
        }
        return collection;
    }

    private static EntityFilter toEntityFilter(Map<?, ?> map) {
        EntityFilter.EntityFilterBuilder builder = EntityFilter.builder()
                .filterId(text(map.get(FILTER_ID)))
                .filterLabel(text(map.get(FILTER_LABEL)))
                .logicalOp(LogicalOperator.fromValue(map.get(LOGICAL_OP)));
        int attributes = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (META_KEYS.contains(name)) {
                continue;
            }
            attributes++;
            Object value = entry.getValue();
            if (value instanceof AttributeFilter attributeFilter) {
                builder.criteria(name, attributeFilter.toBuilder().attribute(name).build());
            } else if (value instanceof Map<?, ?> criteria && !criteria.containsKey(ComplexFilterValue.VAL)) {
                builder.criteria(name, toAttributeFilter(criteria, name));
            } else if (value instanceof Collection<?>) {
                throw new InvalidFilterShapeException("List value for attribute '" + name + "' needs an explicit operator", map);
            } else {
                builder.criteria(name, AttributeFilter.of(name, FilterOperator.EQ.getCanonicalName(), value));
            }
        }
        if (attributes == 0) {
            throw new InvalidFilterShapeException("Entity filter has no attributes", map);
        }
        return builder.build();
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
