package com.fw24.framework.exceptions;

/**
 * Base class for errors raised while turning a filter description into a
 * repository expression.
 */
public class QueryException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public QueryException() {
        super();
    }

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public QueryException(Throwable cause) {
        super(cause);
    }
}
