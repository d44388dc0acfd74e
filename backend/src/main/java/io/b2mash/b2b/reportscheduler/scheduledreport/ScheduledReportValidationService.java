package io.b2mash.b2b.reportscheduler.scheduledreport;

import io.b2mash.b2b.reportscheduler.exception.EntityValidationException;
import io.b2mash.b2b.reportscheduler.validation.ValidateMode;
import io.b2mash.b2b.reportscheduler.validation.ValidationResult;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ScheduledReportValidationService {

  private static final Logger log = LoggerFactory.getLogger(ScheduledReportValidationService.class);

  static final String ENTITY_TYPE = "scheduled_report";

  private final ScheduledReportValidatorFactory validatorFactory;

  public ScheduledReportValidationService(ScheduledReportValidatorFactory validatorFactory) {
    this.validatorFactory = validatorFactory;
  }

  /** Validates a scheduled report's fields and returns every recorded error. */
  public ValidationResult validate(Map<String, Object> entity, ValidateMode mode) {
    var validator = validatorFactory.create(mode);
    boolean valid = validator.validate(entity);
    if (!valid) {
      log.info(
          "Scheduled report failed validation: mode={}, errors={}",
          mode,
          validator.getErrors().size());
    }
    return new ValidationResult(valid, validator.getErrors());
  }

  /**
   * Same as {@link #validate(Map, ValidateMode)} but throws {@link EntityValidationException} when
   * the entity is invalid.
   */
  public void validateOrThrow(Map<String, Object> entity, ValidateMode mode) {
    var result = validate(entity, mode);
    if (!result.valid()) {
      throw new EntityValidationException(ENTITY_TYPE, result.errors());
    }
  }
}
