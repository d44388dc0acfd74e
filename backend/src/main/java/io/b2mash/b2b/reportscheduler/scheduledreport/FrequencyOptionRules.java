package io.b2mash.b2b.reportscheduler.scheduledreport;

import io.b2mash.b2b.reportscheduler.codeset.CodeSetEndpoints;
import java.util.List;
import java.util.Map;

/**
 * Accepted {@code frequency_option} shapes per frequency. A frequency with no shapes (e.g.
 * Bi-Monthly, or one missing from the table) takes no options at all.
 */
public final class FrequencyOptionRules {

  public static final String HOUR_OF_DAY = "hour_of_day";
  public static final String WEEKDAYS_ONLY = "weekdays_only";
  public static final String DAY_OF_WEEK = "day_of_week";
  public static final String DAY_OF_MONTH = "day_of_month";
  public static final String WEEK_OF_MONTH = "week_of_month";
  public static final String MONTH_OF_YEAR = "month_of_year";

  private static final AllowedValues DAYS_OF_MONTH = AllowedValues.range(1, 31);

  private static final Map<String, List<OptionShape>> RULES =
      Map.of(
          Frequencies.HOURLY,
          List.of(
              OptionShape.of(HOUR_OF_DAY, AllowedValues.codeSet(CodeSetEndpoints.HOUR_OF_DAY))),
          Frequencies.DAILY,
          List.of(OptionShape.of(WEEKDAYS_ONLY, AllowedValues.of("true", "false"))),
          Frequencies.WEEKLY,
          List.of(
              OptionShape.of(DAY_OF_WEEK, AllowedValues.codeSet(CodeSetEndpoints.DAY_OF_WEEK))),
          Frequencies.BI_MONTHLY,
          List.of(),
          Frequencies.MONTHLY,
          List.of(
              OptionShape.of(DAY_OF_MONTH, DAYS_OF_MONTH),
              OptionShape.of(
                  WEEK_OF_MONTH,
                  AllowedValues.codeSet(CodeSetEndpoints.WEEK_OF_MONTH),
                  DAY_OF_WEEK,
                  AllowedValues.codeSet(CodeSetEndpoints.DAY_OF_WEEK))),
          Frequencies.QUARTERLY,
          List.of(OptionShape.of(DAY_OF_MONTH, DAYS_OF_MONTH)),
          Frequencies.SEMI_ANNUALLY,
          List.of(dayOfMonthOfYear()),
          Frequencies.YEARLY,
          List.of(dayOfMonthOfYear()));

  private FrequencyOptionRules() {}

  /** Shapes accepted for the frequency, in preference order; empty if it takes no options. */
  public static List<OptionShape> shapesFor(String frequency) {
    if (frequency == null) {
      return List.of();
    }
    return RULES.getOrDefault(frequency, List.of());
  }

  private static OptionShape dayOfMonthOfYear() {
    return OptionShape.of(
        DAY_OF_MONTH,
        DAYS_OF_MONTH,
        MONTH_OF_YEAR,
        AllowedValues.codeSet(CodeSetEndpoints.MONTH_OF_YEAR));
  }
}
