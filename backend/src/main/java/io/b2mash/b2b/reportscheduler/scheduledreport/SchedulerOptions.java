package io.b2mash.b2b.reportscheduler.scheduledreport;

import io.b2mash.b2b.reportscheduler.validation.ValidationValues;
import java.util.Map;

/**
 * Decoded {@code scheduler_options} of a scheduled report.
 *
 * @param frequency recurrence cadence (e.g. "Weekly"), or null if absent
 * @param frequencyOption cadence-specific sub-object as decoded; usually a map, but left untyped so
 *     that a wrongly-typed value can be reported
 * @param period date range the report covers (e.g. "2 Weeks"), or null; untyped like {@code
 *     frequencyOption} so that {@code false}, {@code []} and {@code {}} still count as absent
 * @param periodOption period modifier (e.g. "CAL"), or null
 */
public record SchedulerOptions(
    String frequency, Object frequencyOption, Object period, Object periodOption) {

  static SchedulerOptions from(Map<?, ?> decoded) {
    return new SchedulerOptions(
        ValidationValues.asText(decoded.get("frequency")),
        decoded.get("frequency_option"),
        decoded.get("period"),
        decoded.get("period_option"));
  }
}
