package com.fw24.framework.repository.filter;

import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.repository.AttributeRef;
import com.fw24.framework.repository.WhereOperations;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link WhereOperations} that renders DynamoDB condition expressions using
 * {@code #name} and {@code :value} placeholders, collecting both maps as it goes.
 * Each distinct attribute name gets its own name placeholder, suffixed with a counter
 * when its sanitized form is already taken. One renderer instance serves one expression.
 */
public class DynamoConditionRenderer implements WhereOperations {

    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> placeholdersByName = new HashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    public static Map<String, AttributeRef> attributeRefs(EntitySchema schema) {
        Map<String, AttributeRef> refs = new LinkedHashMap<>();
        for (String attribute : schema.getAttributes().keySet()) {
            refs.put(attribute, new AttributeRef(attribute));
        }
        return refs;
    }

    @Override
    public String eq(AttributeRef attribute, Object value) {
        return compare(attribute, "=", value);
    }

    @Override
    public String ne(AttributeRef attribute, Object value) {
        return compare(attribute, "<>", value);
    }

    @Override
    public String gt(AttributeRef attribute, Object value) {
        return compare(attribute, ">", value);
    }

    @Override
    public String gte(AttributeRef attribute, Object value) {
        return compare(attribute, ">=", value);
    }

    @Override
    public String lt(AttributeRef attribute, Object value) {
        return compare(attribute, "<", value);
    }

    @Override
    public String lte(AttributeRef attribute, Object value) {
        return compare(attribute, "<=", value);
    }

    @Override
    public String between(AttributeRef attribute, Object from, Object to) {
        return namePlaceholder(attribute) + " between " + operand(attribute, from) + " and " + operand(attribute, to);
    }

    @Override
    public String begins(AttributeRef attribute, Object value) {
        return "begins_with(" + namePlaceholder(attribute) + ", " + operand(attribute, value) + ")";
    }

    @Override
    public String exists(AttributeRef attribute) {
        return "attribute_exists(" + namePlaceholder(attribute) + ")";
    }

    @Override
    public String notExists(AttributeRef attribute) {
        return "attribute_not_exists(" + namePlaceholder(attribute) + ")";
    }

    @Override
    public String contains(AttributeRef attribute, Object value) {
        return "contains(" + namePlaceholder(attribute) + ", " + operand(attribute, value) + ")";
    }

    @Override
    public String notContains(AttributeRef attribute, Object value) {
        return "not contains(" + namePlaceholder(attribute) + ", " + operand(attribute, value) + ")";
    }

    @Override
    public AttributeRef name(String path) {
        return new AttributeRef(path);
    }

    public Map<String, String> getExpressionAttributeNames() {
        return Collections.unmodifiableMap(names);
    }

    public Map<String, Object> getExpressionAttributeValues() {
        return Collections.unmodifiableMap(values);
    }

    private String compare(AttributeRef attribute, String comparator, Object value) {
        return namePlaceholder(attribute) + " " + comparator + " " + operand(attribute, value);
    }

    private String operand(AttributeRef attribute, Object value) {
        if (value instanceof AttributeRef reference) {
            return namePlaceholder(reference);
        }
        String base = namePlaceholder(attribute).substring(1);
        String placeholder;
        do {
            placeholder = ":" + base + (counters.merge(base, 1, Integer::sum) - 1);
        } while (values.containsKey(placeholder));
        values.put(placeholder, value);
        return placeholder;
    }

    private String namePlaceholder(AttributeRef attribute) {
        return placeholdersByName.computeIfAbsent(attribute.name(), name -> {
            String base = "#" + sanitize(name);
            String placeholder = base;
            for (int suffix = 1; names.containsKey(placeholder); suffix++) {
                placeholder = base + suffix;
            }
            names.put(placeholder, name);
            return placeholder;
        });
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
