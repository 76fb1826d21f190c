package io.b2mash.outreach.scoring;

import java.util.Map;

/**
 * Relative importance of the five score components. The default vector leaves every component at
 * face value; a tenant vector rescales each component by {@code weight / defaultWeight}.
 */
public record ScoreWeights(
    double dataQuality, double authority, double companyFit, double timing, double risk) {

  public static final ScoreWeights DEFAULT = new ScoreWeights(0.20, 0.25, 0.25, 0.15, 0.15);

  public ScoreWeights {
    if (dataQuality < 0 || authority < 0 || companyFit < 0 || timing < 0 || risk < 0) {
      throw new IllegalArgumentException("Score weights must not be negative");
    }
    if (dataQuality + authority + companyFit + timing + risk == 0) {
      throw new IllegalArgumentException("At least one score weight must be positive");
    }
  }

  /**
   * Reads a weight vector stored as JSON. Missing keys fall back to the default for that component;
   * a null map yields {@link #DEFAULT}.
   */
  public static ScoreWeights fromMap(Map<String, Object> values) {
    if (values == null || values.isEmpty()) {
      return DEFAULT;
    }
    return new ScoreWeights(
        read(values, "dataQuality", DEFAULT.dataQuality),
        read(values, "authority", DEFAULT.authority),
        read(values, "companyFit", DEFAULT.companyFit),
        read(values, "timing", DEFAULT.timing),
        read(values, "risk", DEFAULT.risk));
  }

  public Map<String, Object> toMap() {
    return Map.of(
        "dataQuality", dataQuality,
        "authority", authority,
        "companyFit", companyFit,
        "timing", timing,
        "risk", risk);
  }

  private static double read(Map<String, Object> values, String key, double fallback) {
    Object value = values.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      return Double.parseDouble(text);
    }
    return fallback;
  }
}
