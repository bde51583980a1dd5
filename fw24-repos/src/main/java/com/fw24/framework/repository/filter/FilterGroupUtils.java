package com.fw24.framework.repository.filter;

import com.fw24.framework.model.filter.AttributeFilter;
import com.fw24.framework.model.filter.EntityFilter;
import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.filter.FilterGroup;
import com.fw24.framework.model.filter.FilterOperator;
import com.fw24.framework.model.filter.LogicalOperator;

import java.util.List;

public final class FilterGroupUtils {

    private FilterGroupUtils() {
    }

    /**
     * Expands an entity filter into a group holding one attribute filter per attribute
     * under the branch of the given operator.
     */
    public static FilterGroup fromEntityFilter(EntityFilter filter, LogicalOperator logicalOp) {
        FilterGroup.FilterGroupBuilder builder = FilterGroup.builder()
                .filterId(filter.getFilterId())
                .filterLabel(filter.getFilterLabel());
        LogicalOperator op = logicalOp == null ? filter.getLogicalOp() : logicalOp;
        for (AttributeFilter attributeFilter : filter.toAttributeFilters()) {
            if (op == LogicalOperator.OR) {
                builder.orFilter(attributeFilter);
            } else {
                builder.andFilter(attributeFilter);
            }
        }
        return builder.build();
    }

    /**
     * A record matches when any of the search attributes contains every keyword.
     */
    public static FilterGroup forKeywordSearch(List<String> keywords, List<String> searchAttributes) {
        FilterGroup.FilterGroupBuilder builder = FilterGroup.builder().filterId("searchKeywords");
        for (String attribute : searchAttributes) {
            builder.orFilter(AttributeFilter.of(attribute, FilterOperator.CONTAINS.getCanonicalName(), List.copyOf(keywords)));
        }
        return builder.build();
    }

    /**
     * ANDs {@code additional} onto {@code existing}; either may be null.
     */
    public static FilterCriteria and(FilterCriteria existing, FilterCriteria additional) {
        if (existing == null) {
            return additional;
        }
        if (additional == null) {
            return existing;
        }
        return FilterGroup.builder().andFilter(existing).andFilter(additional).build();
    }
}
