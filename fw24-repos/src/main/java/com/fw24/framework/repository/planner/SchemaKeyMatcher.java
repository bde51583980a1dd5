package com.fw24.framework.repository.planner;

import com.fw24.framework.model.schema.EntityIndex;
import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.repository.KeyMatchResult;
import com.fw24.framework.repository.KeyMatcher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best key match over a schema's declared indexes, for repository adapters whose
 * storage client has no such primitive.
 * <p>
 * An index is eligible when its partition composite is non empty and every partition
 * attribute has an equality value. The score is the partition size plus the length of
 * the leading run of sort attributes that have values. The highest score wins and ties
 * go to the index declared first. Indexes keyed by a template only never match.
 */
public class SchemaKeyMatcher implements KeyMatcher {

    private final EntitySchema schema;

    public SchemaKeyMatcher(EntitySchema schema) {
        this.schema = schema;
    }

    @Override
    public KeyMatchResult keyMatch(Map<String, Object> equalities) {
        if (equalities == null || equalities.isEmpty()) {
            return KeyMatchResult.scan();
        }
        EntityIndex best = null;
        Map<String, Object> bestKeys = null;
        int bestScore = 0;

        for (EntityIndex index : schema.getIndexes().values()) {
            List<String> partition = index.getPartitionComposite();
            if (partition.isEmpty() || !equalities.keySet().containsAll(partition)) {
                continue;
            }
            Map<String, Object> keys = new LinkedHashMap<>();
            partition.forEach(attribute -> keys.put(attribute, equalities.get(attribute)));
            for (String attribute : index.getSortComposite()) {
                if (!equalities.containsKey(attribute)) {
                    break;
                }
                keys.put(attribute, equalities.get(attribute));
            }
            if (keys.size() > bestScore) {
                best = index;
                bestKeys = keys;
                bestScore = keys.size();
            }
        }

        if (best == null) {
            return KeyMatchResult.scan();
        }
        boolean primary = best == schema.getPrimaryIndex();
        return new KeyMatchResult(bestKeys, primary ? "" : best.getIndex(), false);
    }
}
