package com.fw24.framework.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each audit record as one JSON line at INFO level.
 */
@ApplicationScoped
public class LoggingAuditor implements EntityAuditor {

    private static final Logger LOG = Logger.getLogger(LoggingAuditor.class);
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void audit(AuditRecord record) {
        LOG.info(toJson(record));
    }

    String toJson(AuditRecord record) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("entityName", record.getEntityName());
        line.put("crudType", record.getCrudType() == null ? null : record.getCrudType().getValue());
        line.put("identifiers", record.getIdentifiers());
        line.put("data", record.getData());
        line.put("entity", record.getEntity());
        line.put("actor", record.getActor());
        line.put("tenant", record.getTenant());
        line.put("correlationId", record.getCorrelationId());
        line.put("timestamp", record.getTimestamp() == null ? null : record.getTimestamp().toString());
        try {
            return mapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            LOG.warnf("Audit record for %s is not serializable: %s", record.getEntityName(), e.getOriginalMessage());
            return line.toString();
        }
    }
}
