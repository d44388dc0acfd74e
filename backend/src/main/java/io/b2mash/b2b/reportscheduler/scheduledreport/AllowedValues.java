package io.b2mash.b2b.reportscheduler.scheduledreport;

import io.b2mash.b2b.reportscheduler.codeset.CodeSetCache;
import java.util.Collection;
import java.util.List;
import java.util.stream.IntStream;

/** Allowed values of one frequency option field: a literal list or a code set lookup. */
public sealed interface AllowedValues {

  /** Resolves the allowed codes, fetching the code set through the cache when needed. */
  Collection<String> resolve(CodeSetCache codeSets);

  static AllowedValues of(String... values) {
    return new Literal(List.of(values));
  }

  static AllowedValues range(int fromInclusive, int toInclusive) {
    return new Literal(
        IntStream.rangeClosed(fromInclusive, toInclusive).mapToObj(Integer::toString).toList());
  }

  static AllowedValues codeSet(String endpoint) {
    return new CodeSetReference(endpoint);
  }

  record Literal(List<String> values) implements AllowedValues {

    public Literal {
      values = List.copyOf(values);
    }

    @Override
    public Collection<String> resolve(CodeSetCache codeSets) {
      return values;
    }
  }

  record CodeSetReference(String endpoint) implements AllowedValues {

    @Override
    public Collection<String> resolve(CodeSetCache codeSets) {
      return codeSets.lookup(endpoint);
    }
  }
}
