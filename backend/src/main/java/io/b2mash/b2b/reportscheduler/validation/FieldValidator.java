package io.b2mash.b2b.reportscheduler.validation;

/** Validates the value of one entity field, recording errors on the owning validator. */
@FunctionalInterface
public interface FieldValidator {

  /**
   * @param value the raw field value as it appears in the entity model
   * @return true if the value is valid
   */
  boolean validate(Object value);
}
