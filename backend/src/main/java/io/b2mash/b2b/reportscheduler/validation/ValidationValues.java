package io.b2mash.b2b.reportscheduler.validation;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for inspecting decoded JSON values (maps, lists, strings, numbers, booleans and
 * nulls) during validation.
 */
public final class ValidationValues {

  private ValidationValues() {}

  /**
   * Canonical string form used for set membership. Integral floating-point numbers lose their
   * fraction ({@code 15.0} becomes {@code "15"}) and {@code null} becomes the empty string.
   */
  public static String canonical(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof String str) {
      return str;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (!Double.isInfinite(d) && d == Math.rint(d)) {
        return Long.toString((long) d);
      }
      return value.toString();
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.stripTrailingZeros().toPlainString();
    }
    return value.toString();
  }

  /** Same as {@link #canonical(Object)} but keeps {@code null} as {@code null}. */
  public static String asText(Object value) {
    return value == null ? null : canonical(value);
  }

  /** A collection contributes each element; anything else is a single candidate. */
  public static List<String> candidates(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(ValidationValues::canonical).toList();
    }
    return List.of(canonical(value));
  }

  /**
   * Determines whether a value counts as absent: null, blank text, an empty map or collection, or
   * {@code false}.
   */
  public static boolean isEmpty(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence text) {
      return text.toString().isBlank();
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    return Boolean.FALSE.equals(value);
  }
}
