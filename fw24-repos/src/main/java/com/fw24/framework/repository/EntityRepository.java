package com.fw24.framework.repository;

import java.util.Map;

/**
 * Keyed, secondary indexed storage of one entity type. Every call returns a pending
 * operation that only touches storage when {@code go} is invoked.
 */
public interface EntityRepository extends KeyMatcher {

    Operation get(Map<String, Object> identifiers);

    Operation create(Map<String, Object> data);

    Operation upsert(Map<String, Object> data);

    PatchOperation patch(Map<String, Object> identifiers);

    Operation delete(Map<String, Object> identifiers);

    /**
     * Scans the primary index for records matching the equality values.
     */
    QueryOperation match(Map<String, Object> equalities);

    /**
     * Queries a declared index by name using its key equality values.
     */
    QueryOperation query(String indexName, Map<String, Object> equalities);

    interface Operation {
        RepositoryResponse go();
    }

    interface PatchOperation extends Operation {
        PatchOperation set(Map<String, Object> data);

        /**
         * Composite key attributes that must be rewritten along with the patch so
         * secondary index keys stay consistent.
         */
        PatchOperation composite(Map<String, Object> compositeAttributes);
    }

    interface QueryOperation {
        QueryOperation where(WhereCallback callback);

        RepositoryResponse go(Map<String, Object> options);
    }
}
