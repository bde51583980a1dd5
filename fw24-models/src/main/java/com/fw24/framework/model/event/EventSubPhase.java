package com.fw24.framework.model.event;

public enum EventSubPhase implements EventDimension {
    VALIDATE("validate"),
    DUPLICATE("duplicate"),
    COMPOSITE_KEY("compositeKey");

    private final String value;

    EventSubPhase(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
