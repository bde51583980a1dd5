package com.fw24.framework.repository.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the nested selection tree for dotted attribute paths. {@code ["a", "b.c"]}
 * becomes {@code {a: true, b: {attributes: {c: true}}}}. Used for choosing returned
 * attributes, never for filtering.
 */
public final class AttributePathParser {

    public static final String ATTRIBUTES = "attributes";
    private static final Pattern PATH_DELIMITERS = Pattern.compile("(?:&|,|\\+|;|:)+");
    private static final Pattern DOT = Pattern.compile("\\.");

    private AttributePathParser() {
    }

    public static Map<String, Object> parse(String paths) {
        if (paths == null || paths.isBlank()) {
            return new LinkedHashMap<>();
        }
        return parse(Arrays.asList(PATH_DELIMITERS.split(paths.trim())));
    }

    public static Map<String, Object> parse(Collection<String> paths) {
        Map<String, Object> root = new LinkedHashMap<>();
        if (paths == null) {
            return root;
        }
        for (String path : paths) {
            if (path == null || path.isBlank()) {
                continue;
            }
            List<String> segments = new ArrayList<>();
            for (String segment : DOT.split(path.trim())) {
                if (!segment.isBlank()) {
                    segments.add(segment.trim());
                }
            }
            if (!segments.isEmpty()) {
                insert(root, segments);
            }
        }
        return root;
    }

    @SuppressWarnings("unchecked")
    private static void insert(Map<String, Object> node, List<String> segments) {
        String head = segments.get(0);
        if (segments.size() == 1) {
            node.putIfAbsent(head, Boolean.TRUE);
            return;
        }
        Object existing = node.get(head);
        Map<String, Object> children;
        if (existing instanceof Map<?, ?> map) {
            children = (Map<String, Object>) map.get(ATTRIBUTES);
        } else {
            children = new LinkedHashMap<>();
            Map<String, Object> wrapper = new LinkedHashMap<>();
            wrapper.put(ATTRIBUTES, children);
            node.put(head, wrapper);
        }
        insert(children, segments.subList(1, segments.size()));
    }
}
