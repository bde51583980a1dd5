package com.fw24.framework.model.event;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identifies an event either by an opaque name or by a structured set of dimensions.
 * <p>
 * Structured matchers drop {@code null} dimensions, so on the subscriber side a missing
 * dimension means "any value". The canonical key of a structured matcher is its
 * dimensions sorted by name and joined as {@code name:value|name:value}; an empty
 * structured matcher is the structured wildcard.
 */
public final class EventMatcher {
    public static final String WILDCARD = "*";
    public static final String STRUCTURED_WILDCARD_KEY = "__STRUCTURED_WILDCARD__";

    private final String name;
    private final SortedMap<String, String> dimensions;

    private EventMatcher(String name, SortedMap<String, String> dimensions) {
        this.name = name;
        this.dimensions = dimensions;
    }

    public static EventMatcher of(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Event name must not be empty");
        }
        return new EventMatcher(name, null);
    }

    public static EventMatcher wildcard() {
        return of(WILDCARD);
    }

    public static EventMatcher structured(Map<String, ?> dimensions) {
        SortedMap<String, String> concrete = new TreeMap<>();
        if (dimensions != null) {
            dimensions.forEach((key, value) -> {
                if (key != null && value != null) {
                    concrete.put(key, value instanceof EventDimension dimension ? dimension.getValue() : value.toString());
                }
            });
        }
        return new EventMatcher(null, Collections.unmodifiableSortedMap(concrete));
    }

    public boolean isStructured() {
        return dimensions != null;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getDimensions() {
        return dimensions == null ? Map.of() : dimensions;
    }

    public String getDimension(String dimension) {
        return dimensions == null ? null : dimensions.get(dimension);
    }

    public String key() {
        return isStructured() ? keyOf(dimensions) : name;
    }

    public static String keyOf(Map<String, String> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            return STRUCTURED_WILDCARD_KEY;
        }
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(dimensions).forEach((k, v) -> {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(k).append(':').append(v);
        });
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMatcher)) return false;
        EventMatcher that = (EventMatcher) o;
        return Objects.equals(name, that.name) && Objects.equals(dimensions, that.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dimensions);
    }

    @Override
    public String toString() {
        return "EventMatcher{" + key() + '}';
    }
}
