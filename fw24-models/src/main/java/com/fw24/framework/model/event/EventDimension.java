package com.fw24.framework.model.event;

/**
 * A value usable as a structured matcher dimension.
 */
public interface EventDimension {
    String getValue();
}
