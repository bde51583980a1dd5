package com.fw24.framework.repository.planner;

import com.fw24.framework.model.filter.FilterCriteria;
import com.fw24.framework.model.schema.EntityIndex;
import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.repository.KeyMatchResult;
import com.fw24.framework.repository.KeyMatcher;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the index a list or query call should read from.
 * <ol>
 *   <li>The repository's key matcher gets the equality values of the filter. When it finds
 *       a key, its index identifier is mapped back to the declared index name.</li>
 *   <li>Otherwise an index whose partition template equals the entity name (ignoring case)
 *       is used with no key filters.</li>
 *   <li>Otherwise the result is empty and the caller scans.</li>
 * </ol>
 * Ranking among key matches is left to the key matcher.
 */
@ApplicationScoped
public class IndexSelectionPlanner {

    private static final Logger LOG = Logger.getLogger(IndexSelectionPlanner.class);

    public Optional<IndexMatchResult> findMatchingIndex(EntitySchema schema, FilterCriteria filters,
                                                        String entityName, KeyMatcher keyMatcher) {
        Map<String, Object> equalities = EqualityFilterExtractor.extract(filters);

        if (!equalities.isEmpty()) {
            KeyMatchResult keyMatch = keyMatcher.keyMatch(equalities);
            if (keyMatch != null && !keyMatch.shouldScan()) {
                Optional<String> indexName = schema.findIndexNameById(keyMatch.index());
                if (indexName.isPresent()) {
                    Map<String, Object> consumed = consumedFilters(schema.getIndexes().get(indexName.get()), keyMatch, equalities);
                    if (LOG.isDebugEnabled()) {
                        LOG.debugf("Index %s selected for %s using %s", indexName.get(), entityName, consumed);
                    }
                    return Optional.of(new IndexMatchResult(indexName.get(), consumed));
                }
                LOG.warnf("Key match reported index '%s' which is not declared on %s", keyMatch.index(), entityName);
            }
        }

        for (Map.Entry<String, EntityIndex> entry : schema.getIndexes().entrySet()) {
            EntityIndex index = entry.getValue();
            if (index.getPk() != null && index.getPk().hasTemplate()
                    && StringUtils.equalsIgnoreCase(index.getPk().getTemplate(), entityName)) {
                if (LOG.isDebugEnabled()) {
                    LOG.debugf("Template index %s selected for %s", entry.getKey(), entityName);
                }
                return Optional.of(new IndexMatchResult(entry.getKey(), Map.of()));
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debugf("No index matches filters %s on %s; a scan is required", equalities.keySet(), entityName);
        }
        return Optional.empty();
    }

    private Map<String, Object> consumedFilters(EntityIndex index, KeyMatchResult keyMatch, Map<String, Object> equalities) {
        Map<String, Object> consumed = new LinkedHashMap<>();
        Iterable<String> attributes = keyMatch.keys().isEmpty() ? index.getAllCompositeAttributes() : keyMatch.keys().keySet();
        for (String attribute : attributes) {
            if (equalities.containsKey(attribute)) {
                consumed.put(attribute, equalities.get(attribute));
            }
        }
        return consumed;
    }
}
