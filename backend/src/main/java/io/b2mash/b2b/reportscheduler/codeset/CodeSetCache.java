package io.b2mash.b2b.reportscheduler.codeset;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Memoizes the valid codes of each endpoint for the lifetime of one validator. The first lookup of
 * an endpoint fetches its code map from the {@link EnumSource}, drops the empty-string placeholder
 * key and keeps only the codes; later lookups return the same set without touching the source.
 *
 * <p>Not thread-safe. Each validator owns its own cache.
 */
public class CodeSetCache {

  private final EnumSource enumSource;
  private final Map<String, Set<String>> codes = new HashMap<>();

  public CodeSetCache(EnumSource enumSource) {
    this.enumSource = enumSource;
  }

  /** Returns the ordered set of valid codes for the endpoint; empty when the source has none. */
  public Set<String> lookup(String endpoint) {
    return codes.computeIfAbsent(endpoint, this::fetch);
  }

  private Set<String> fetch(String endpoint) {
    var codeMap = enumSource.getCodeMap(endpoint);
    if (codeMap == null || codeMap.isEmpty()) {
      return Set.of();
    }
    var result = new LinkedHashSet<String>();
    for (String code : codeMap.keySet()) {
      if (code != null && !code.isEmpty()) {
        result.add(code);
      }
    }
    return Collections.unmodifiableSet(result);
  }
}
