package com.fw24.framework.model.validation;

import com.fw24.framework.model.event.CrudOperation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * One declarative rule on one attribute, for example {@code minLength = 3}.
 * An empty operation set means the rule applies to every write operation.
 */
@Value
@Builder
public class ValidationRule {
    String name;
    Object value;
    @Singular
    Set<CrudOperation> operations;
    String message;
    String messageId;

    public boolean appliesTo(CrudOperation operation) {
        return operations.isEmpty() || operations.contains(operation);
    }

    public static ValidationRule of(String name, Object value) {
        return ValidationRule.builder().name(name).value(value).build();
    }
}
