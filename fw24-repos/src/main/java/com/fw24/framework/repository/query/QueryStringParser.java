package com.fw24.framework.repository.query;

import com.fw24.framework.model.filter.AttributeFilter;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.filter.FilterGroup;
import com.fw24.framework.model.filter.FilterOperator;
import com.fw24.framework.model.filter.LogicalOperator;
import com.fw24.framework.util.ValueParsingUtils;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Turns URL query parameters into a {@link FilterGroup}.
 * <p>
 * Bracket keys are folded first, so {@code age[gte]=18} becomes {@code {age: {gte: 18}}}
 * and {@code or[0][status]=active} becomes {@code {or: [{status: active}]}}. Keys
 * {@code and}, {@code or} and {@code not} hold lists of single key objects; every other
 * key names an attribute. A plain value means equality. Values of membership and
 * containment operators are split on {@code & , + ; : .} and every value is run through
 * {@link ValueParsingUtils#parseValue(String)}.
 */
@ApplicationScoped
public class QueryStringParser {

    private static final Logger LOG = Logger.getLogger(QueryStringParser.class);

    public static final String FILTER_ID = "queryStringParamsToFilterGroup";
    public static final Pattern ARRAY_VALUE_DELIMITERS = Pattern.compile("(?:&|,|\\+|;|:|\\.)+");
    private static final Pattern INDEX_SEGMENT = Pattern.compile("\\d+");
    private static final List<String> GROUP_KEYS = List.of("and", "or", "not");

    public FilterGroup parse(Map<String, String> flatParams) {
        return toFilterGroup(fold(flatParams));
    }

    /**
     * Converts already nested parameters, as produced by {@link #fold(Map)} or a JSON body.
     */
    public FilterGroup toFilterGroup(Map<String, ?> params) {
        FilterGroup.FilterGroupBuilder builder = FilterGroup.builder().filterId(FILTER_ID);
        if (params == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            String key = entry.getKey();
            switch (key) {
                case "and" -> branchItems(key, entry.getValue()).forEach(builder::andFilter);
                case "or" -> branchItems(key, entry.getValue()).forEach(builder::orFilter);
                case "not" -> branchItems(key, entry.getValue()).forEach(builder::notFilter);
                default -> builder.andFilter(toAttributeFilter(key, entry.getValue()));
            }
        }
        return builder.build();
    }

    private List<FilterCriteria> branchItems(String branch, Object value) {
        List<FilterCriteria> filters = new ArrayList<>();
        for (Object item : asList(value)) {
            if (!(item instanceof Map<?, ?> itemMap)) {
                LOG.warnf("Ignoring non object entry %s in '%s' branch", item, branch);
                continue;
            }
            for (Map.Entry<?, ?> inner : itemMap.entrySet()) {
                String innerKey = String.valueOf(inner.getKey());
                if (GROUP_KEYS.contains(innerKey)) {
                    Map<String, Object> nested = new LinkedHashMap<>();
                    nested.put(innerKey, inner.getValue());
                    filters.add(toFilterGroup(nested));
                } else {
                    filters.add(toAttributeFilter(innerKey, inner.getValue()));
                }
            }
        }
        return filters;
    }

    private AttributeFilter toAttributeFilter(String attribute, Object rawValue) {
        AttributeFilter.AttributeFilterBuilder builder = AttributeFilter.builder().attribute(attribute);
        if (!(rawValue instanceof Map<?, ?> operators)) {
            return builder.clause(FilterOperator.EQ.getCanonicalName(), parse(rawValue)).build();
        }
        for (Map.Entry<?, ?> entry : operators.entrySet()) {
            String operator = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if ("logicalOp".equals(operator)) {
                builder.logicalOp(LogicalOperator.fromValue(value));
                continue;
            }
            boolean arrayValued = FilterOperator.fromAlias(operator).map(FilterOperator::isArrayValued).orElse(false);
            if (arrayValued && value instanceof String text) {
                value = Arrays.asList(ARRAY_VALUE_DELIMITERS.split(text));
            }
            builder.clause(operator, parse(value));
        }
        return builder.build();
    }

    private Object parse(Object value) {
        if (value instanceof Map<?, ?> map && isIndexed(map)) {
            return ValueParsingUtils.parseLooseValue(asList(map));
        }
        return ValueParsingUtils.parseLooseValue(value);
    }

    /**
     * Folds bracketed keys into nested maps and lists.
     */
    public Map<String, Object> fold(Map<String, String> flatParams) {
        Map<String, Object> root = new LinkedHashMap<>();
        if (flatParams == null) {
            return root;
        }
        for (Map.Entry<String, String> entry : flatParams.entrySet()) {
            List<String> path = splitKey(entry.getKey());
            Map<String, Object> current = root;
            for (int i = 0; i < path.size() - 1; i++) {
                Object next = current.get(path.get(i));
                if (!(next instanceof Map<?, ?>)) {
                    next = new LinkedHashMap<String, Object>();
                    current.put(path.get(i), next);
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> child = (Map<String, Object>) next;
                current = child;
            }
            current.put(path.get(path.size() - 1), entry.getValue());
        }
        return listify(root);
    }

    private static List<String> splitKey(String key) {
        List<String> path = new ArrayList<>();
        int bracket = key.indexOf('[');
        if (bracket <= 0 || !key.endsWith("]")) {
            path.add(key);
            return path;
        }
        path.add(key.substring(0, bracket));
        for (String segment : key.substring(bracket + 1, key.length() - 1).split("\\]\\[")) {
            path.add(segment);
        }
        return path;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> listify(Map<String, Object> map) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?> child) {
                Map<String, Object> converted = listify((Map<String, Object>) child);
                entry.setValue(isIndexed(converted) ? asList(converted) : converted);
            }
        }
        return map;
    }

    private static boolean isIndexed(Map<?, ?> map) {
        return !map.isEmpty() && map.keySet().stream().allMatch(k -> INDEX_SEGMENT.matcher(String.valueOf(k)).matches());
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Map<?, ?> map && isIndexed(map)) {
            Map<Integer, Object> ordered = new TreeMap<>();
            map.forEach((k, v) -> ordered.put(Integer.parseInt(String.valueOf(k)), v));
            return new ArrayList<>(ordered.values());
        }
        List<Object> single = new ArrayList<>();
        if (value != null) {
            single.add(value);
        }
        return single;
    }
}
