package com.fw24.framework.repository;

import java.util.Map;

@FunctionalInterface
public interface WhereCallback {
    String apply(Map<String, AttributeRef> attributes, WhereOperations operations);
}
