package com.fw24.framework.validation;

import com.fw24.framework.model.validation.ValidationResult;

/**
 * Pluggable validation strategy consulted by the CRUD pipeline before authorization.
 */
public interface EntityValidator {
    ValidationResult validateEntity(ValidationRequest request);
}
