package com.fw24.framework.repository.filter;

import com.fw24.framework.exceptions.InvalidFilterShapeException;
import com.fw24.framework.exceptions.UnknownFilterAttributeException;
import com.fw24.framework.model.filter.AttributeFilter;
import com.fw24.framework.model.filter.ComplexFilterValue;
import com.fw24.framework.model.filter.ComplexValueType;
import com.fw24.framework.model.filter.EntityFilter;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.filter.FilterGroup;
import com.fw24.framework.model.filter.FilterOperator;
import com.fw24.framework.model.filter.LogicalOperator;
import com.fw24.framework.repository.AttributeRef;
import com.fw24.framework.repository.WhereCallback;
import com.fw24.framework.repository.WhereOperations;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Compiles a filter description into a boolean expression built from the repository's
 * {@link WhereOperations}.
 * <p>
 * A list of one fragment is returned as is; two or more are wrapped in a single pair of
 * parentheses joined by the upper cased operator, e.g. {@code ( a AND b )}. Operator keys
 * that are not recognized are skipped so callers may carry auxiliary keys on a filter.
 */
@ApplicationScoped
public class FilterCompiler {

    private static final Logger LOG = Logger.getLogger(FilterCompiler.class);

    public WhereCallback toWhereCallback(FilterCriteria filter) {
        return (attributes, operations) -> compile(filter, attributes, operations);
    }

    public String compile(FilterCriteria filter, Map<String, AttributeRef> attributes, WhereOperations ops) {
        if (filter == null) {
            return "";
        }
        String expression = switch (filter.getKind()) {
            case ATTRIBUTE -> compileAttributeFilter((AttributeFilter) filter, attributes, ops);
            case ENTITY -> compileEntityFilter((EntityFilter) filter, attributes, ops);
            case GROUP -> compileGroup((FilterGroup) filter, attributes, ops);
        };
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Compiled %s filter %s to: %s", filter.getKind(),
                    filter.getFilterId() == null ? "" : filter.getFilterId(), expression);
        }
        return expression;
    }

    /**
     * Wraps two or more fragments in parentheses joined by {@code delimiter}; empty
     * fragments are dropped first.
     */
    public static String parenthesize(List<String> fragments, String delimiter) {
        List<String> items = new ArrayList<>();
        for (String fragment : fragments) {
            if (fragment != null && !fragment.isEmpty()) {
                items.add(fragment);
            }
        }
        if (items.isEmpty()) {
            return "";
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        return "( " + String.join(" " + delimiter.toUpperCase() + " ", items) + " )";
    }

    private String compileEntityFilter(EntityFilter filter, Map<String, AttributeRef> attributes, WhereOperations ops) {
        List<String> fragments = new ArrayList<>();
        for (AttributeFilter attributeFilter : filter.toAttributeFilters()) {
            fragments.add(compileAttributeFilter(attributeFilter, attributes, ops));
        }
        return parenthesize(fragments, filter.getLogicalOp().name());
    }

    private String compileGroup(FilterGroup group, Map<String, AttributeRef> attributes, WhereOperations ops) {
        List<String> branches = new ArrayList<>();
        branches.add(parenthesize(compileAll(group.getAnd(), attributes, ops), "and"));
        branches.add(parenthesize(compileAll(group.getOr(), attributes, ops), "or"));
        String negated = parenthesize(compileAll(group.getNot(), attributes, ops), "and");
        if (!negated.isEmpty()) {
            branches.add("NOT " + negated);
        }
        return parenthesize(branches, "and");
    }

    private List<String> compileAll(List<FilterCriteria> filters, Map<String, AttributeRef> attributes, WhereOperations ops) {
        List<String> fragments = new ArrayList<>(filters.size());
        for (FilterCriteria child : filters) {
            fragments.add(compile(child, attributes, ops));
        }
        return fragments;
    }

    private String compileAttributeFilter(AttributeFilter filter, Map<String, AttributeRef> attributes, WhereOperations ops) {
        AttributeRef ref = attributes == null ? null : attributes.get(filter.getAttribute());
        if (ref == null) {
            throw new UnknownFilterAttributeException(filter.getAttribute());
        }

        List<String> fragments = new ArrayList<>();
        for (Map.Entry<String, Object> clause : filter.getClauses().entrySet()) {
            Optional<FilterOperator> operator = FilterOperator.fromAlias(clause.getKey());
            if (operator.isEmpty()) {
                if (LOG.isDebugEnabled()) {
                    LOG.debugf("Skipping unrecognized filter key %s on attribute %s", clause.getKey(), filter.getAttribute());
                }
                continue;
            }
            fragments.add(compileClause(operator.get(), ref, clause.getValue(), filter.getAttribute(), ops));
        }
        LogicalOperator logicalOp = filter.getLogicalOp() == null ? LogicalOperator.AND : filter.getLogicalOp();
        return parenthesize(fragments, logicalOp.name());
    }

    private String compileClause(FilterOperator operator, AttributeRef ref, Object rawValue, String attribute, WhereOperations ops) {
        return switch (operator) {
            case EQ -> ops.eq(ref, resolve(rawValue, ops));
            case NE -> ops.ne(ref, resolve(rawValue, ops));
            case GT -> ops.gt(ref, resolve(rawValue, ops));
            case GTE -> ops.gte(ref, resolve(rawValue, ops));
            case LT -> ops.lt(ref, resolve(rawValue, ops));
            case LTE -> ops.lte(ref, resolve(rawValue, ops));
            case BETWEEN -> {
                List<Object> range = toRange(rawValue, attribute);
                yield ops.between(ref, resolve(range.get(0), ops), resolve(range.get(1), ops));
            }
            case BEGINS -> ops.begins(ref, resolve(rawValue, ops));
            case ENDS_WITH -> {
                LOG.warnf("endsWith is not supported by the repository; ignoring it on attribute %s", attribute);
                yield "";
            }
            case CONTAINS -> joinEach(rawValue, v -> ops.contains(ref, v), "and", ops);
            case CONTAINS_SOME -> joinEach(rawValue, v -> ops.contains(ref, v), "or", ops);
            case NOT_CONTAINS -> joinEach(rawValue, v -> ops.notContains(ref, v), "and", ops);
            case IN -> joinEach(rawValue, v -> ops.eq(ref, v), "or", ops);
            case NIN -> joinEach(rawValue, v -> ops.ne(ref, v), "and", ops);
            case EXISTS, IS_NULL -> isTruthy(rawValue) ? ops.exists(ref) : ops.notExists(ref);
            case IS_EMPTY -> isTruthy(rawValue) ? ops.eq(ref, "") : ops.ne(ref, "");
        };
    }

    private String joinEach(Object rawValue, Function<Object, String> primitive, String delimiter, WhereOperations ops) {
        List<String> fragments = new ArrayList<>();
        for (Object value : toList(rawValue)) {
            fragments.add(primitive.apply(resolve(value, ops)));
        }
        return parenthesize(fragments, delimiter);
    }

    /**
     * Attribute references become {@link AttributeRef}s, tagged literals are unwrapped and
     * everything else passes through.
     */
    private Object resolve(Object value, WhereOperations ops) {
        Optional<ComplexFilterValue> complex = ComplexFilterValue.detect(value);
        if (complex.isEmpty()) {
            return value;
        }
        ComplexFilterValue complexValue = complex.get();
        if (complexValue.isPropertyReference()) {
            return ops.name(String.valueOf(complexValue.getVal()));
        }
        if (complexValue.getValType() == ComplexValueType.EXPRESSION) {
            LOG.warnf("Expression filter values are not evaluated; using %s as a literal", complexValue.getVal());
        }
        return complexValue.getVal();
    }

    private List<Object> toRange(Object rawValue, String attribute) {
        if (rawValue instanceof Map<?, ?> map && map.containsKey("from") && map.containsKey("to")) {
            return Arrays.asList(map.get("from"), map.get("to"));
        }
        List<Object> values = rawValue instanceof Collection<?> || (rawValue != null && rawValue.getClass().isArray())
                ? toList(rawValue) : List.of();
        if (values.size() != 2) {
            throw new InvalidFilterShapeException(
                    "between on attribute " + attribute + " requires exactly two values", rawValue);
        }
        return values;
    }

    static List<Object> toList(Object value) {
        List<Object> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            values.addAll(collection);
        } else if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                values.add(Array.get(value, i));
            }
        } else {
            values.add(value);
        }
        return values;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s);
        }
        return true;
    }
}
