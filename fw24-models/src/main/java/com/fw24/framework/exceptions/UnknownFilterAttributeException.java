package com.fw24.framework.exceptions;

public class UnknownFilterAttributeException extends QueryException {
    private static final long serialVersionUID = 1L;

    private final String attribute;

    public UnknownFilterAttributeException(String attribute) {
        super("Unknown filter attribute: " + attribute);
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
