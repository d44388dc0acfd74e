package io.b2mash.b2b.reportscheduler.scheduledreport;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Patterns accepted for {@code period} and {@code period_option} under one frequency. An empty
 * list means the corresponding value must be absent.
 */
public record PeriodRule(List<Pattern> periodPatterns, List<Pattern> periodOptionPatterns) {

  static final PeriodRule NONE = new PeriodRule(List.of(), List.of());

  public PeriodRule {
    periodPatterns = List.copyOf(periodPatterns);
    periodOptionPatterns = List.copyOf(periodOptionPatterns);
  }

  static PeriodRule of(List<String> periodPatterns, List<String> periodOptionPatterns) {
    return new PeriodRule(compile(periodPatterns), compile(periodOptionPatterns));
  }

  public boolean allowsPeriod() {
    return !periodPatterns.isEmpty();
  }

  public boolean allowsPeriodOption() {
    return !periodOptionPatterns.isEmpty();
  }

  private static List<Pattern> compile(List<String> patterns) {
    return patterns.stream().map(Pattern::compile).toList();
  }
}
