package com.fw24.framework.validation;

import java.util.Map;

/**
 * Default message templates keyed by message id. Templates may use the placeholders
 * {@code {key}}, {@code {validationName}}, {@code {validationValue}}, {@code {received}}
 * and {@code {refinedReceived}}.
 */
public final class ValidationMessages {

    public static final String PREFIX = "validation.";
    public static final String FALLBACK_ID = "validation.custom";

    public static final Map<String, String> DEFAULTS = Map.ofEntries(
            Map.entry("validation.eq", "Value for '{key}' should be equal to '{validationValue}'"),
            Map.entry("validation.neq", "Value for '{key}' should not be equal to '{validationValue}'"),
            Map.entry("validation.gt", "Value for '{key}' should be greater than '{validationValue}'"),
            Map.entry("validation.gte", "Value for '{key}' should be greater than or equal to '{validationValue}'"),
            Map.entry("validation.lt", "Value for '{key}' should be less than '{validationValue}'"),
            Map.entry("validation.lte", "Value for '{key}' should be less than or equal to '{validationValue}'"),
            Map.entry("validation.inlist", "Value for '{key}' should be one of '{validationValue}'"),
            Map.entry("validation.notinlist", "Value for '{key}' should not be one of '{validationValue}'"),
            Map.entry("validation.unique", "Value for '{key}' should be unique"),
            Map.entry("validation.pattern", "Value for '{key}' should match '{validationValue}' pattern"),
            Map.entry("validation.required", "Value for '{key}' is required"),
            Map.entry("validation.maxlength",
                    "Value for '{key}' should have maximum length of '{validationValue}'; instead of '{refinedReceived}'"),
            Map.entry("validation.minlength",
                    "Value for '{key}' should have minimum length of '{validationValue}'; instead of '{refinedReceived}'"),
            Map.entry(FALLBACK_ID, "Value for '{key}' is invalid"));

    private ValidationMessages() {
    }
}
