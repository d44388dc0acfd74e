package io.b2mash.b2b.reportscheduler.validation;

import java.util.List;

/**
 * Outcome of validating one entity.
 *
 * @param valid true if every validated field passed
 * @param errors errors in the order they were recorded (empty if valid)
 */
public record ValidationResult(boolean valid, List<EntityValidationError> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }
}
