package com.fw24.framework.model.event;

public enum EventPhase implements EventDimension {
    PRE("pre"),
    POST("post");

    private final String value;

    EventPhase(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
