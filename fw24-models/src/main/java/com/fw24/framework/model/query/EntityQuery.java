package com.fw24.framework.model.query;

import com.fw24.framework.model.filter.FilterCriteria;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityQuery {
    /** Dotted attribute paths the caller wants returned. */
    @Builder.Default
    private List<String> attributes = new ArrayList<>();
    private FilterCriteria filters;
    /** Free text keywords; split on the configured delimiters. */
    private String search;
    @Builder.Default
    private List<String> searchAttributes = new ArrayList<>();
    private Pagination pagination;
    private IndexHint index;
}
