package com.fw24.framework.exceptions;

public class MissingPayloadException extends EntityCrudException {
    private static final long serialVersionUID = 1L;

    public MissingPayloadException(String entityName, String operation) {
        super(entityName, "No data provided for " + operation + " operation on entity " + entityName);
    }
}
