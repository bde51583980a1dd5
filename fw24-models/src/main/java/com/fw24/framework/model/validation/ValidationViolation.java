package com.fw24.framework.model.validation;

import java.util.ArrayList;
import java.util.List;

public class ValidationViolation {
   /**
    Path to the attribute this violation refers to, for example {@code user.email}.
    An empty path denotes an entity level violation.
    */
   protected String propertyPath;
   protected String violationDescription;
   protected Object invalidValue;
   /**
    Message ids tried when resolving the description, most specific first.
    */
   protected List<String> messageIds = new ArrayList<>();

   public ValidationViolation() {

   }

   public ValidationViolation(String propertyPath, String violationDescription) {
      this.propertyPath = propertyPath;
      this.violationDescription = violationDescription;
   }

   public ValidationViolation(String propertyPath, String violationDescription, Object invalidValue) {
      this(propertyPath, violationDescription);
      this.invalidValue = invalidValue;
   }

   public String getPropertyPath () {
      return propertyPath;
   }

   public void setPropertyPath (String propertyPath) {
      this.propertyPath = propertyPath;
   }

   public String getViolationDescription () {
      return violationDescription;
   }

   public void setViolationDescription (String violationDescription) {
      this.violationDescription = violationDescription;
   }

   public Object getInvalidValue () {
      return invalidValue;
   }

   public void setInvalidValue (Object invalidValue) {
      this.invalidValue = invalidValue;
   }

   public List<String> getMessageIds () {
      return messageIds;
   }

   public void setMessageIds (List<String> messageIds) {
      this.messageIds = messageIds == null ? new ArrayList<>() : new ArrayList<>(messageIds);
   }

   @Override
   public boolean equals (Object o) {
      if (this == o) return true;
      if (!(o instanceof ValidationViolation)) return false;

      ValidationViolation that = (ValidationViolation) o;

      if (propertyPath != null ? !propertyPath.equals(that.propertyPath) : that.propertyPath != null) return false;
      if (violationDescription != null ? !violationDescription.equals(that.violationDescription) :
             that.violationDescription != null)
         return false;
      return invalidValue != null ? invalidValue.equals(that.invalidValue) : that.invalidValue == null;
   }

   @Override
   public int hashCode () {
      int result = propertyPath != null ? propertyPath.hashCode() : 0;
      result = 31 * result + (violationDescription != null ? violationDescription.hashCode() : 0);
      result = 31 * result + (invalidValue != null ? invalidValue.hashCode() : 0);
      return result;
   }

   @Override
   public String toString() {
      return "ValidationViolation{" +
              "propertyPath='" + propertyPath + '\'' +
              ", violationDescription='" + violationDescription + '\'' +
              ", invalidValue=" + invalidValue +
              '}';
   }
}
