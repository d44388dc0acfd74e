package io.b2mash.b2b.reportscheduler.scheduledreport;

import io.b2mash.b2b.reportscheduler.codeset.CodeSetCache;
import io.b2mash.b2b.reportscheduler.codeset.CodeSetEndpoints;
import io.b2mash.b2b.reportscheduler.codeset.EnumSource;
import io.b2mash.b2b.reportscheduler.validation.EntityValidator;
import io.b2mash.b2b.reportscheduler.validation.ValidationErrorKind;
import io.b2mash.b2b.reportscheduler.validation.ValidationMessages;
import io.b2mash.b2b.reportscheduler.validation.ValidationValues;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates the {@code scheduler_options} field of a scheduled report.
 *
 * <p>Checks run in a fixed order and the first failing stage stops validation of the field:
 *
 * <ol>
 *   <li>the value decodes to a non-empty JSON object
 *   <li>{@code frequency} is in the {@code codes/srofrequency} code set
 *   <li>{@code frequency_option} matches one of the shapes in {@link FrequencyOptionRules}
 *   <li>{@code period} and {@code period_option} match {@link PeriodRules}
 * </ol>
 *
 * <p>Code sets are fetched lazily and cached for the lifetime of the instance.
 */
public class ScheduledReportEntityValidator extends EntityValidator {

  public static final String SCHEDULER_OPTIONS = "scheduler_options";

  static final String FREQUENCY_FIELD = SCHEDULER_OPTIONS + ".frequency";
  static final String FREQUENCY_OPTION_FIELD = SCHEDULER_OPTIONS + ".frequency_option";
  static final String PERIOD_FIELD = SCHEDULER_OPTIONS + ".period";
  static final String PERIOD_OPTION_FIELD = SCHEDULER_OPTIONS + ".period_option";

  private final SchedulerOptionsDecoder decoder;
  private final CodeSetCache codeSets;

  public ScheduledReportEntityValidator(EnumSource enumSource, SchedulerOptionsDecoder decoder) {
    this.decoder = decoder;
    this.codeSets = new CodeSetCache(enumSource);
    registerValidationFn(SCHEDULER_OPTIONS, this::validateSchedulerOptions);
    registerRequiredField(SCHEDULER_OPTIONS);
  }

  public boolean validateSchedulerOptions(Object value) {
    var decoded = decoder.decode(value);
    if (decoded.isEmpty()) {
      addError(
          ValidationMessages.EM_CANT_DECODE,
          SCHEDULER_OPTIONS,
          ValidationErrorKind.MISSING_OR_UNDECODABLE);
      return false;
    }
    var options = decoded.get();

    if (!isValueInSet(
        options.frequency(), codeSets.lookup(CodeSetEndpoints.FREQUENCY), FREQUENCY_FIELD)) {
      return false;
    }

    if (!validateFrequencyOption(options.frequency(), options.frequencyOption())) {
      return false;
    }

    return validatePeriodAndOptions(
        options.frequency(), options.period(), options.periodOption());
  }

  private boolean validateFrequencyOption(String frequency, Object frequencyOption) {
    var shapes = FrequencyOptionRules.shapesFor(frequency);

    if (shapes.isEmpty()) {
      if (!ValidationValues.isEmpty(frequencyOption)) {
        addError(
            ValidationMessages.EM_EMPTY,
            FREQUENCY_OPTION_FIELD,
            ValidationErrorKind.EXPECTED_EMPTY);
        return false;
      }
      return true;
    }

    if (!(frequencyOption instanceof Map<?, ?> rawOptions)) {
      addError(
          ValidationMessages.EM_OBJECT, FREQUENCY_OPTION_FIELD, ValidationErrorKind.EXPECTED_OBJECT);
      return false;
    }

    var options = new LinkedHashMap<String, Object>();
    rawOptions.forEach((name, optionValue) -> options.put(String.valueOf(name), optionValue));

    // unknown option names are rejected before shape matching
    if (!isValueInSet(
        List.copyOf(options.keySet()),
        codeSets.lookup(CodeSetEndpoints.FREQUENCY_OPTION),
        FREQUENCY_OPTION_FIELD)) {
      return false;
    }

    var shape = shapes.stream().filter(s -> s.matches(options.keySet())).findFirst();
    if (shape.isEmpty()) {
      addError(
          ValidationMessages.EM_INVALID, FREQUENCY_OPTION_FIELD, ValidationErrorKind.SHAPE_MISMATCH);
      return false;
    }

    for (var entry : options.entrySet()) {
      Collection<String> allowed =
          shape
              .get()
              .allowedValuesFor(entry.getKey())
              .map(values -> values.resolve(codeSets))
              .orElse(List.of());
      if (allowed.isEmpty()) {
        addError(
            ValidationMessages.EM_INVALID,
            FREQUENCY_OPTION_FIELD,
            ValidationErrorKind.GENERIC_INVALID);
        return false;
      }
      if (!checkValues(frequency, allowed, entry.getValue())) {
        return false;
      }
    }

    return true;
  }

  /**
   * Weekly {@code day_of_week} holds a comma-separated list of days and every one of them must be
   * valid. All other option values are single values checked with {@link #isValueInSet}.
   */
  private boolean checkValues(String frequency, Collection<String> allowed, Object optionValue) {
    if (Frequencies.WEEKLY.equals(frequency)) {
      List<String> values =
          optionValue instanceof Collection<?>
              ? ValidationValues.candidates(optionValue)
              : Arrays.asList(ValidationValues.canonical(optionValue).split(",", -1));
      if (!allowed.containsAll(values)) {
        addError(
            ValidationMessages.EM_INVALID,
            FREQUENCY_OPTION_FIELD,
            ValidationErrorKind.NOT_IN_ALLOWED_SET);
        return false;
      }
      return true;
    }
    return isValueInSet(optionValue, allowed, FREQUENCY_OPTION_FIELD);
  }

  private boolean validatePeriodAndOptions(String frequency, Object period, Object periodOption) {
    var rule = PeriodRules.ruleFor(frequency);

    if (!rule.allowsPeriod() && !ValidationValues.isEmpty(period)) {
      addError(ValidationMessages.EM_EMPTY, PERIOD_FIELD, ValidationErrorKind.EXPECTED_EMPTY);
      return false;
    }

    if (!rule.allowsPeriodOption() && !ValidationValues.isEmpty(periodOption)) {
      addError(
          ValidationMessages.EM_EMPTY, PERIOD_OPTION_FIELD, ValidationErrorKind.EXPECTED_EMPTY);
      return false;
    }

    if (rule.allowsPeriod() && !isRegExpValueInSet(period, rule.periodPatterns(), PERIOD_FIELD)) {
      return false;
    }

    // Weekly month-to-date takes no period option
    if (Frequencies.WEEKLY.equals(frequency)
        && PeriodRules.MONTH_TO_DATE.equals(ValidationValues.asText(period))) {
      if (ValidationValues.isEmpty(periodOption)) {
        return true;
      }
      addError(
          ValidationMessages.EM_EMPTY, PERIOD_OPTION_FIELD, ValidationErrorKind.EXPECTED_EMPTY);
      return false;
    }

    return !rule.allowsPeriodOption()
        || isRegExpValueInSet(periodOption, rule.periodOptionPatterns(), PERIOD_OPTION_FIELD);
  }
}
