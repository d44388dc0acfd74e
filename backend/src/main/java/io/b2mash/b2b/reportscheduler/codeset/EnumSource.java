package io.b2mash.b2b.reportscheduler.codeset;

import java.util.Map;

/**
 * Provides enumerated code lists by endpoint name (e.g. {@code codes/srodow}). Keys are the codes,
 * values are human-readable labels. Implementations must preserve key order and return an empty
 * map for unknown endpoints.
 */
public interface EnumSource {

  Map<String, String> getCodeMap(String endpoint);
}
