package com.fw24.framework.model.event;

public enum CrudOperation implements EventDimension {
    GET("get"),
    CREATE("create"),
    UPDATE("update"),
    UPSERT("upsert"),
    DELETE("delete"),
    LIST("list"),
    QUERY("query");

    private final String value;

    CrudOperation(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public boolean isWrite() {
        return this == CREATE || this == UPDATE || this == UPSERT;
    }
}
