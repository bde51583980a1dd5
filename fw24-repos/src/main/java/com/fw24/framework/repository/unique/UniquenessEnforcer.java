package com.fw24.framework.repository.unique;

import com.fw24.framework.exceptions.EntityValidationException;
import com.fw24.framework.model.schema.EntityAttribute;
import com.fw24.framework.model.schema.EntitySchema;
import com.fw24.framework.model.validation.ValidationViolation;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Optimistic collision resolution for unique attributes.
 * <p>
 * Attributes flagged neither {@code unique} nor {@code ensureUnique} are written as
 * given. A colliding value is replaced by {@code value-1}, {@code value-2} and so on up
 * to the configured number of attempts, then by {@code value-<random>}, when the
 * attribute allows it; otherwise an {@link EntityValidationException} is raised and the
 * payload is left untouched.
 */
public class UniquenessEnforcer {

    private static final Logger LOG = Logger.getLogger(UniquenessEnforcer.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final String UNIQUE_MESSAGE_ID = "validation.unique";
    private static final int RANDOM_BOUND = 1_000_000;

    private final EntitySchema schema;
    private final UniqueValueLookup lookup;

    public UniquenessEnforcer(EntitySchema schema, UniqueValueLookup lookup) {
        this.schema = schema;
        this.lookup = lookup;
    }

    public boolean checkUniquenessAndUpdate(UniquenessCheck check) {
        String attributeName = check.getAttributeName();
        Object value = check.getAttributeValue();
        EntityAttribute attribute = check.getAttribute() != null
                ? check.getAttribute()
                : schema.getAttribute(attributeName).orElse(null);

        if (attribute == null || !attribute.requiresUniqueness()) {
            check.getPayloadToUpdate().put(attributeName, value);
            return true;
        }

        if (lookup.isUniqueAttributeValue(attributeName, value, check.getIgnoredIdentifiers())) {
            check.getPayloadToUpdate().put(attributeName, value);
            return true;
        }

        if (!attribute.allowsAutoResolution()) {
            ValidationViolation violation = new ValidationViolation(attributeName,
                    "Value for '" + attributeName + "' should be unique", value);
            violation.setMessageIds(List.of(UNIQUE_MESSAGE_ID));
            throw new EntityValidationException(schema.getEntity(), List.of(violation));
        }

        String candidate = null;
        for (int attempt = 1; attempt <= Math.max(0, check.getMaxAttempts()); attempt++) {
            String next = generateUniqueValue(String.valueOf(value), attempt);
            if (lookup.isUniqueAttributeValue(attributeName, next, check.getIgnoredIdentifiers())) {
                candidate = next;
                break;
            }
        }
        if (candidate == null) {
            candidate = generateUniqueValue(String.valueOf(value));
            LOG.warnf("Could not resolve a unique %s for %s within %d attempts; using %s",
                    attributeName, schema.getEntity(), check.getMaxAttempts(), candidate);
        } else if (LOG.isDebugEnabled()) {
            LOG.debugf("Resolved colliding %s value %s to %s", attributeName, value, candidate);
        }
        check.getPayloadToUpdate().put(attributeName, candidate);
        return true;
    }

    public static String generateUniqueValue(String value) {
        return value + "-" + ThreadLocalRandom.current().nextInt(1, RANDOM_BOUND);
    }

    public static String generateUniqueValue(String value, Integer attempt) {
        return attempt == null ? generateUniqueValue(value) : value + "-" + attempt;
    }
}
