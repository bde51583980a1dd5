package com.fw24.framework.model.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating an entity payload or identifier set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {
    private boolean pass;
    @Builder.Default
    private List<ValidationViolation> errors = new ArrayList<>();

    public static ValidationResult passed() {
        return ValidationResult.builder().pass(true).build();
    }

    public static ValidationResult failed(List<ValidationViolation> errors) {
        return ValidationResult.builder().pass(false).errors(new ArrayList<>(errors)).build();
    }
}
