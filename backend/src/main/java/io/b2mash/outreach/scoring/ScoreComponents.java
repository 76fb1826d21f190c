package io.b2mash.outreach.scoring;

/**
 * Raw, capped sub-scores of a lead. {@code riskDeduction} is subtracted from the total.
 *
 * @param dataQuality 0..20
 * @param authority 0..25
 * @param companyFit 0..25
 * @param timing 0..15
 * @param riskDeduction 0..15
 */
public record ScoreComponents(
    int dataQuality, int authority, int companyFit, int timing, int riskDeduction) {

  public static final int MAX_DATA_QUALITY = 20;
  public static final int MAX_AUTHORITY = 25;
  public static final int MAX_COMPANY_FIT = 25;
  public static final int MAX_TIMING = 15;
  public static final int MAX_RISK_DEDUCTION = 15;

  public ScoreComponents {
    requireRange("dataQuality", dataQuality, MAX_DATA_QUALITY);
    requireRange("authority", authority, MAX_AUTHORITY);
    requireRange("companyFit", companyFit, MAX_COMPANY_FIT);
    requireRange("timing", timing, MAX_TIMING);
    requireRange("riskDeduction", riskDeduction, MAX_RISK_DEDUCTION);
  }

  private static void requireRange(String name, int value, int max) {
    if (value < 0 || value > max) {
      throw new IllegalArgumentException(name + " must be within 0.." + max + ", was " + value);
    }
  }
}
