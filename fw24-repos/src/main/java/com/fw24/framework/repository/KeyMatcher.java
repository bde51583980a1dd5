package com.fw24.framework.repository;

import java.util.Map;

@FunctionalInterface
public interface KeyMatcher {
    KeyMatchResult keyMatch(Map<String, Object> equalities);
}
