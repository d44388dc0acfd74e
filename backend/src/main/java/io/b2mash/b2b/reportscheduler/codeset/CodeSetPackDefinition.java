package io.b2mash.b2b.reportscheduler.codeset;

import java.util.Map;

/** DTO record for deserializing code set pack JSON files from the classpath. */
public record CodeSetPackDefinition(String endpoint, Map<String, String> codes) {

  /** Compact canonical constructor that defaults codes to an empty map when null. */
  public CodeSetPackDefinition {
    if (codes == null) {
      codes = Map.of();
    }
  }
}
