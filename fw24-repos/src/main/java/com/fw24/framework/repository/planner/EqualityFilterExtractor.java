package com.fw24.framework.repository.planner;

import com.fw24.framework.model.filter.AttributeFilter;
import com.fw24.framework.model.filter.ComplexFilterValue;
import com.fw24.framework.model.filter.EntityFilter;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.filter.FilterGroup;
import com.fw24.framework.model.filter.FilterOperator;
import com.fw24.framework.model.filter.LogicalOperator;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collects {@code attribute -> value} pairs that every matching record must satisfy.
 * Only conjunctive positions are considered: attribute filters joined by AND and the
 * {@code and} branch of groups. Values under {@code or} and {@code not} never constrain
 * the key.
 */
final class EqualityFilterExtractor {

    private EqualityFilterExtractor() {
    }

    static Map<String, Object> extract(FilterCriteria filter) {
        Map<String, Object> equalities = new LinkedHashMap<>();
        collect(filter, equalities);
        return equalities;
    }

    private static void collect(FilterCriteria filter, Map<String, Object> equalities) {
        if (filter == null) {
            return;
        }
        switch (filter.getKind()) {
            case ATTRIBUTE -> collectAttribute((AttributeFilter) filter, equalities);
            case ENTITY -> {
                EntityFilter entityFilter = (EntityFilter) filter;
                if (entityFilter.getLogicalOp() == LogicalOperator.OR && entityFilter.getAttributes().size() > 1) {
                    return;
                }
                entityFilter.toAttributeFilters().forEach(f -> collectAttribute(f, equalities));
            }
            case GROUP -> {
                FilterGroup group = (FilterGroup) filter;
                if (group.getAnd().isEmpty() && group.getOr().size() == 1 && group.getNot().isEmpty()) {
                    collect(group.getOr().get(0), equalities);
                }
                group.getAnd().forEach(child -> collect(child, equalities));
            }
        }
    }

    private static void collectAttribute(AttributeFilter filter, Map<String, Object> equalities) {
        long operatorClauses = filter.getClauses().keySet().stream().filter(FilterOperator::isOperatorKey).count();
        if (filter.getLogicalOp() == LogicalOperator.OR && operatorClauses > 1) {
            return;
        }
        for (Map.Entry<String, Object> clause : filter.getClauses().entrySet()) {
            if (FilterOperator.fromAlias(clause.getKey()).orElse(null) != FilterOperator.EQ) {
                continue;
            }
            literal(clause.getValue()).ifPresent(value -> equalities.putIfAbsent(filter.getAttribute(), value));
            return;
        }
    }

    private static Optional<Object> literal(Object value) {
        Optional<ComplexFilterValue> complex = ComplexFilterValue.detect(value);
        if (complex.isPresent()) {
            return complex.get().isPropertyReference() ? Optional.empty() : Optional.ofNullable(complex.get().getVal());
        }
        if (value == null || value instanceof Collection<?> || value instanceof Map<?, ?>) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
