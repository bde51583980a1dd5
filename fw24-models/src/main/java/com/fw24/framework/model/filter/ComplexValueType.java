package com.fw24.framework.model.filter;

public enum ComplexValueType {
    LITERAL("literal"),
    PROP_REF("propRef"),
    EXPRESSION("expression");

    private final String value;

    ComplexValueType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ComplexValueType fromValue(Object raw) {
        if (raw == null) {
            return LITERAL;
        }
        for (ComplexValueType type : values()) {
            if (type.value.equalsIgnoreCase(raw.toString()) || type.name().equalsIgnoreCase(raw.toString())) {
                return type;
            }
        }
        return LITERAL;
    }
}
