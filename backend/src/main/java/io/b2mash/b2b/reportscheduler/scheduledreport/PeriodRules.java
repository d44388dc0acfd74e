package io.b2mash.b2b.reportscheduler.scheduledreport;

import java.util.List;
import java.util.Map;

/** Accepted {@code period} and {@code period_option} patterns per frequency. */
public final class PeriodRules {

  /** Month-to-date. Under Weekly it takes no period option. */
  public static final String MONTH_TO_DATE = "MTD";

  private static final List<String> CALENDAR_OPTIONS = List.of("CAL", "CAL F", "LST", "LSD \\d+");

  private static final Map<String, PeriodRule> RULES =
      Map.of(
          Frequencies.HOURLY,
          PeriodRule.NONE,
          Frequencies.DAILY,
          PeriodRule.of(List.of("Today", "\\d+ Days", "\\d+ Weeks"), List.of()),
          Frequencies.WEEKLY,
          PeriodRule.of(List.of("\\d+ Weeks", MONTH_TO_DATE, "YTD"), CALENDAR_OPTIONS),
          Frequencies.BI_MONTHLY,
          PeriodRule.NONE,
          Frequencies.MONTHLY,
          PeriodRule.of(List.of("\\d+ Months", "YTD"), CALENDAR_OPTIONS),
          Frequencies.QUARTERLY,
          PeriodRule.of(List.of("\\d+ Quarters", "YTD"), CALENDAR_OPTIONS),
          Frequencies.SEMI_ANNUALLY,
          PeriodRule.NONE,
          Frequencies.YEARLY,
          PeriodRule.of(List.of(), List.of("CAL", "CAL F")));

  private PeriodRules() {}

  /** Rule for the frequency; frequencies missing from the table accept neither value. */
  public static PeriodRule ruleFor(String frequency) {
    if (frequency == null) {
      return PeriodRule.NONE;
    }
    return RULES.getOrDefault(frequency, PeriodRule.NONE);
  }
}
