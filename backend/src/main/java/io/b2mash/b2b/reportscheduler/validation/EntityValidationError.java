package io.b2mash.b2b.reportscheduler.validation;

/**
 * A single validation failure.
 *
 * @param message one of the {@link ValidationMessages} templates, already rendered
 * @param field dotted path of the offending field (e.g. {@code scheduler_options.period})
 * @param code numeric error code, {@value #NO_CODE} when none is assigned
 * @param kind abstract category of the failure
 */
public record EntityValidationError(
    String message, String field, int code, ValidationErrorKind kind) {

  public static final int NO_CODE = -1;

  public EntityValidationError(String message, String field, ValidationErrorKind kind) {
    this(message, field, NO_CODE, kind);
  }
}
