package com.fw24.framework.model.filter;

import com.fw24.framework.exceptions.InvalidFilterShapeException;

public enum LogicalOperator {
    AND,
    OR;

    public static LogicalOperator fromValue(Object value) {
        if (value == null) {
            return AND;
        }
        if (value instanceof LogicalOperator op) {
            return op;
        }
        String text = value.toString().trim();
        if ("and".equalsIgnoreCase(text)) {
            return AND;
        }
        if ("or".equalsIgnoreCase(text)) {
            return OR;
        }
        throw new InvalidFilterShapeException("Unsupported logicalOp: " + value, value);
    }
}
