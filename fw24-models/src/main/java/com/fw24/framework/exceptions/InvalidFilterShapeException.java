package com.fw24.framework.exceptions;

/**
 * Raised when a filter value is not exactly one of attribute filter, entity filter
 * or filter group.
 */
public class InvalidFilterShapeException extends QueryException {
    private static final long serialVersionUID = 1L;

    private final transient Object filter;

    public InvalidFilterShapeException(String message, Object filter) {
        super(message);
        this.filter = filter;
    }

    public Object getFilter() {
        return filter;
    }
}
