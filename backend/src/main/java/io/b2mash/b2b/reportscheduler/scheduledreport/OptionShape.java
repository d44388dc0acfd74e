package io.b2mash.b2b.reportscheduler.scheduledreport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One accepted layout of a {@code frequency_option} object: the exact set of field names it must
 * carry, and the allowed values of each.
 */
public record OptionShape(Map<String, AllowedValues> fields) {

  public OptionShape {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  static OptionShape of(String name, AllowedValues values) {
    var fields = new LinkedHashMap<String, AllowedValues>();
    fields.put(name, values);
    return new OptionShape(fields);
  }

  static OptionShape of(
      String name1, AllowedValues values1, String name2, AllowedValues values2) {
    var fields = new LinkedHashMap<String, AllowedValues>();
    fields.put(name1, values1);
    fields.put(name2, values2);
    return new OptionShape(fields);
  }

  /** True if the given field names are exactly this shape's fields, no more and no fewer. */
  public boolean matches(Set<String> fieldNames) {
    return fields.keySet().equals(fieldNames);
  }

  public Optional<AllowedValues> allowedValuesFor(String fieldName) {
    return Optional.ofNullable(fields.get(fieldName));
  }
}
