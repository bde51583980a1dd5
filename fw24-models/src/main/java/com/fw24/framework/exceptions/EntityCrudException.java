package com.fw24.framework.exceptions;

/**
 * Base class for failures raised by the CRUD pipeline itself, as opposed to
 * failures propagated from its collaborators.
 */
public class EntityCrudException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    protected String entityName;

    public EntityCrudException(String message) {
        super(message);
    }

    public EntityCrudException(String entityName, String message) {
        super(message);
        this.entityName = entityName;
    }

    public EntityCrudException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getEntityName() {
        return entityName;
    }
}
