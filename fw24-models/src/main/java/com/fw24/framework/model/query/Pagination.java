package com.fw24.framework.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {
    public static final String ALL_PAGES = "all";

    /** Hard cap on the number of items read from the repository. */
    private Integer limit;
    /** Items per page. */
    private Integer count;
    private Integer pages;
    private boolean allPages;
    private PagerType pager;
    private SortOrder order;
    private String cursor;

    /**
     * Repository option map; keys without a value are still present and must be
     * stripped by the caller before handing the map downstream.
     */
    public Map<String, Object> toOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("limit", limit);
        options.put("count", count);
        options.put("pages", allPages ? ALL_PAGES : pages);
        options.put("pager", pager == null ? null : pager.getValue());
        options.put("order", order == null ? null : order.getValue());
        options.put("cursor", cursor);
        return options;
    }
}
