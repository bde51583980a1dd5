package com.fw24.framework.model.event;

public enum SuccessFail implements EventDimension {
    SUCCESS("success"),
    FAIL("fail");

    private final String value;

    SuccessFail(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
