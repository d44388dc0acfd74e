package io.b2mash.b2b.reportscheduler.validation;

/** Fixed message templates used by entity validators. */
public final class ValidationMessages {

  public static final String EM_SPECIFY = "Value should be specified.";
  public static final String EM_IN_SET = "Value should be in the set {%s}.";
  public static final String EM_CANT_DECODE = "Can't decode value. Invalid format.";
  public static final String EM_OBJECT = "The value should be an object.";
  public static final String EM_EMPTY = "The value should be empty.";
  public static final String EM_INVALID = "Invalid value.";

  private ValidationMessages() {}

  /** Renders {@link #EM_IN_SET} for the given allowed values. */
  public static String inSet(Iterable<String> allowed) {
    return String.format(EM_IN_SET, String.join(", ", allowed));
  }
}
