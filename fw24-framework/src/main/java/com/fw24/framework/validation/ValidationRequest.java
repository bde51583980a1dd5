package com.fw24.framework.validation;

import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.validation.ValidationRule;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ValidationRequest {
    CrudOperation operationName;
    String entityName;
    @Singular
    Map<String, List<ValidationRule>> entityValidations;
    @Singular
    Map<String, String> overriddenErrorMessages;
    Map<String, Object> input;
    Map<String, Object> actor;
}
