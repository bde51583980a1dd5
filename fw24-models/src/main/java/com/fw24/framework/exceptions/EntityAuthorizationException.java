package com.fw24.framework.exceptions;

import java.util.List;

public class EntityAuthorizationException extends EntityCrudException {
    private static final long serialVersionUID = 1L;

    private final List<String> reasons;

    public EntityAuthorizationException(String entityName, String operation, List<String> reasons) {
        super(entityName, "Not authorized to " + operation + " entity " + entityName
                + (reasons == null || reasons.isEmpty() ? "" : ": " + String.join(", ", reasons)));
        this.reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
