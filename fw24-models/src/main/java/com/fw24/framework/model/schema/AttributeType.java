package com.fw24.framework.model.schema;

public enum AttributeType {
    STRING,
    NUMBER,
    BOOLEAN,
    MAP,
    LIST,
    SET,
    ANY
}
