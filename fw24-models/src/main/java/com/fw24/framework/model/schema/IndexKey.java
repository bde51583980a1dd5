package com.fw24.framework.model.schema;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partition or sort key of an index: the ordered attribute composite and an optional
 * constant template.
 */
@Value
@Builder
public class IndexKey {
    String field;
    @Builder.Default
    List<String> composite = List.of();
    String template;

    public static IndexKey of(String... composite) {
        return IndexKey.builder().composite(List.of(composite)).build();
    }

    public static IndexKey ofTemplate(String template, String... composite) {
        return IndexKey.builder().template(template).composite(List.of(composite)).build();
    }

    public boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }
}
