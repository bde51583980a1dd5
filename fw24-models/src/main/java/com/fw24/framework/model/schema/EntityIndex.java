package com.fw24.framework.model.schema;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared index. {@code index} is the identifier the repository knows the index by;
 * the primary index has none.
 */
@Value
@Builder
public class EntityIndex {
    String index;
    String collection;
    IndexKey pk;
    IndexKey sk;

    public List<String> getPartitionComposite() {
        return pk == null ? List.of() : pk.getComposite();
    }

    public List<String> getSortComposite() {
        return sk == null ? List.of() : sk.getComposite();
    }

    public List<String> getAllCompositeAttributes() {
        List<String> all = new ArrayList<>(getPartitionComposite());
        for (String attribute : getSortComposite()) {
            if (!all.contains(attribute)) {
                all.add(attribute);
            }
        }
        return all;
    }
}
