package io.b2mash.b2b.reportscheduler.scheduledreport;

/**
 * Frequency codes the rule tables know about. The codes accepted at runtime come from the {@code
 * codes/srofrequency} code set, not from this class.
 */
public final class Frequencies {

  public static final String HOURLY = "Hourly";
  public static final String DAILY = "Daily";
  public static final String WEEKLY = "Weekly";
  public static final String BI_MONTHLY = "Bi-Monthly";
  public static final String MONTHLY = "Monthly";
  public static final String QUARTERLY = "Quarterly";
  public static final String SEMI_ANNUALLY = "Semi-Annually";
  public static final String YEARLY = "Yearly";

  private Frequencies() {}
}
