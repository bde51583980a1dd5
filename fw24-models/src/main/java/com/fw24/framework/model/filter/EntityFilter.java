package com.fw24.framework.model.filter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flat attribute name to criteria map; sugar for a list of attribute filters joined
 * by one logical operator.
 */
@Value
@Builder
public class EntityFilter implements FilterCriteria {
    String filterId;
    String filterLabel;
    @Builder.Default
    LogicalOperator logicalOp = LogicalOperator.AND;
    @Singular("criteria")
    Map<String, AttributeFilter> attributes;

    @Override
    public FilterKind getKind() {
        return FilterKind.ENTITY;
    }

    public List<AttributeFilter> toAttributeFilters() {
        List<AttributeFilter> filters = new ArrayList<>(attributes.size());
        attributes.forEach((name, filter) -> filters.add(
                name.equals(filter.getAttribute()) ? filter : filter.toBuilder().attribute(name).build()));
        return filters;
    }
}
