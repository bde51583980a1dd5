package com.fw24.framework.model.filter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One attribute with one or more operator clauses, combined by {@link #logicalOp}.
 * Clause keys keep their insertion order and may include keys that are not operators.
 */
@Value
@Builder(toBuilder = true)
public class AttributeFilter implements FilterCriteria {
    String filterId;
    String filterLabel;
    String attribute;
    @Builder.Default
    LogicalOperator logicalOp = LogicalOperator.AND;
    @Singular
    Map<String, Object> clauses;

    @Override
    public FilterKind getKind() {
        return FilterKind.ATTRIBUTE;
    }

    public static AttributeFilter of(String attribute, String operator, Object value) {
        return AttributeFilter.builder().attribute(attribute).clause(operator, value).build();
    }

    public boolean hasOperatorClause() {
        return clauses.keySet().stream().anyMatch(FilterOperator::isOperatorKey);
    }
}
