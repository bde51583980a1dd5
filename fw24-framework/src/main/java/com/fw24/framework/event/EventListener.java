package com.fw24.framework.event;

import com.fw24.framework.model.event.EventPayload;

@FunctionalInterface
public interface EventListener {
    void onEvent(EventPayload<?> payload) throws Exception;
}
