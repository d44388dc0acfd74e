package io.b2mash.b2b.reportscheduler.validation;

/** Abstract category of a validation error, independent of its message text. */
public enum ValidationErrorKind {
  MISSING_OR_UNDECODABLE,
  NOT_IN_ALLOWED_SET,
  SHAPE_MISMATCH,
  EXPECTED_EMPTY,
  EXPECTED_OBJECT,
  GENERIC_INVALID
}
