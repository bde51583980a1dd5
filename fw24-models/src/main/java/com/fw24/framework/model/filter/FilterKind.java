package com.fw24.framework.model.filter;

public enum FilterKind {
    ATTRIBUTE,
    ENTITY,
    GROUP
}
