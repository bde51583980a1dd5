package com.fw24.framework.crud;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

final class PaginationOptions {

    private PaginationOptions() {
    }

    /**
     * Drops keys whose value is null, a blank string or an empty collection or map, so
     * the repository never sees placeholders.
     */
    static Map<String, Object> strip(Map<String, Object> options) {
        Map<String, Object> stripped = new LinkedHashMap<>();
        if (options == null) {
            return stripped;
        }
        options.forEach((key, value) -> {
            if (value == null
                    || (value instanceof CharSequence text && text.toString().isBlank())
                    || (value instanceof Collection<?> collection && collection.isEmpty())
                    || (value instanceof Map<?, ?> map && map.isEmpty())) {
                return;
            }
            stripped.put(key, value);
        });
        return stripped;
    }
}
