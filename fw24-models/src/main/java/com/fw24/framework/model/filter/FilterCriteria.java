package com.fw24.framework.model.filter;

/**
 * A filter description: exactly one of {@link AttributeFilter}, {@link EntityFilter}
 * or {@link FilterGroup}, discriminated by {@link #getKind()}.
 */
public interface FilterCriteria {

    FilterKind getKind();

    String getFilterId();

    String getFilterLabel();

    /**
     * Classifies a raw map tree (as produced by a JSON parser) into a typed filter.
     *
     * @throws com.fw24.framework.exceptions.InvalidFilterShapeException when the value
     *         matches no shape or more than one
     */
    static FilterCriteria from(Object raw) {
        return FilterCriteriaClassifier.classify(raw);
    }

    /**
     * Parses a JSON document and classifies it. Object key order is preserved, so clause
     * order in the compiled expression follows the document.
     */
    static FilterCriteria fromJson(String json) {
        return FilterCriteriaClassifier.classifyJson(json);
    }
}
