package com.fw24.framework.exceptions;

import com.fw24.framework.model.validation.ValidationViolation;
import jakarta.validation.ValidationException;

import java.util.ArrayList;
import java.util.List;

public class EntityValidationException extends ValidationException {
   private static final long serialVersionUID = 1L;
   public static final String DEFAULT_MESSAGE = "Validation failed";

   protected List<ValidationViolation> violations;
   protected String entityName;

   public EntityValidationException(List<ValidationViolation> violations) {
      super(DEFAULT_MESSAGE);
      this.violations = violations == null ? new ArrayList<>() : new ArrayList<>(violations);
   }

   public EntityValidationException(String entityName, List<ValidationViolation> violations) {
      this(violations);
      this.entityName = entityName;
   }

   public EntityValidationException(String message, Throwable cause) {
      super(message, cause);
      this.violations = new ArrayList<>();
   }

   public List<ValidationViolation> getViolations () {
      return violations;
   }

   public void setViolations (List<ValidationViolation> violations) {
      this.violations = violations;
   }

   public String getEntityName() {
      return entityName;
   }

   @Override
   public String getMessage() {
      if (violations != null && !violations.isEmpty()) {
         StringBuilder sb = new StringBuilder(DEFAULT_MESSAGE);
         for (ValidationViolation violation : violations) {
            sb.append("\n").append(violation.getPropertyPath()).append(" : ").append(violation.getViolationDescription());
         }
         return sb.toString();
      } else {
         return super.getMessage();
      }
   }

   @Override
   public String toString() {
      return "EntityValidationException{" +
              "entityName='" + entityName + '\'' +
              ", violations=" + violations +
              '}';
   }
}
