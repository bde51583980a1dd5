package com.fw24.framework.repository.unique;

import java.util.Map;

/**
 * Answers whether no stored record other than the ignored one holds {@code value} for
 * {@code attributeName}.
 */
@FunctionalInterface
public interface UniqueValueLookup {
    boolean isUniqueAttributeValue(String attributeName, Object value, Map<String, Object> ignoredIdentifiers);
}
