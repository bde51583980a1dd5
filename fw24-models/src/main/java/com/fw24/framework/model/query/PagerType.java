package com.fw24.framework.model.query;

public enum PagerType {
    RAW("raw"),
    CURSOR("cursor");

    private final String value;

    PagerType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
