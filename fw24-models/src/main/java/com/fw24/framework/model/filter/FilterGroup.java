package com.fw24.framework.model.filter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Explicit and / or / not composition of nested filter descriptions. Missing branches
 * are empty lists.
 */
@Value
@Builder(toBuilder = true)
public class FilterGroup implements FilterCriteria {
    String filterId;
    String filterLabel;
    @Singular("andFilter")
    List<FilterCriteria> and;
    @Singular("orFilter")
    List<FilterCriteria> or;
    @Singular("notFilter")
    List<FilterCriteria> not;

    @Override
    public FilterKind getKind() {
        return FilterKind.GROUP;
    }

    public boolean isEmpty() {
        return and.isEmpty() && or.isEmpty() && not.isEmpty();
    }
}
