package io.b2mash.b2b.reportscheduler.scheduledreport;

import io.b2mash.b2b.reportscheduler.codeset.EnumSource;
import io.b2mash.b2b.reportscheduler.validation.ValidateMode;
import org.springframework.stereotype.Component;

/**
 * Creates {@link ScheduledReportEntityValidator} instances. Validators carry mutable state (errors
 * and the code set cache), so each validation request gets a fresh one.
 */
@Component
public class ScheduledReportValidatorFactory {

  private final EnumSource enumSource;
  private final SchedulerOptionsDecoder decoder;

  public ScheduledReportValidatorFactory(EnumSource enumSource, SchedulerOptionsDecoder decoder) {
    this.enumSource = enumSource;
    this.decoder = decoder;
  }

  public ScheduledReportEntityValidator create(ValidateMode mode) {
    var validator = new ScheduledReportEntityValidator(enumSource, decoder);
    validator.setValidateMode(mode);
    return validator;
  }
}
