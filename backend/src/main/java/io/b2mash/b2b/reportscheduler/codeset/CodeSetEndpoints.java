package io.b2mash.b2b.reportscheduler.codeset;

/** Endpoint names of the code sets used by scheduled report validation. */
public final class CodeSetEndpoints {

  public static final String FREQUENCY = "codes/srofrequency";
  public static final String FREQUENCY_OPTION = "codes/srofrequencyopt";
  public static final String HOUR_OF_DAY = "codes/srohourofday";
  public static final String DAY_OF_WEEK = "codes/srodow";
  public static final String WEEK_OF_MONTH = "codes/srowom";
  public static final String MONTH_OF_YEAR = "codes/sromoy";

  private CodeSetEndpoints() {}
}
