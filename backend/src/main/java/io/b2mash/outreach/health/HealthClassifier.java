package io.b2mash.outreach.health;

import org.springframework.stereotype.Component;

/** Pure classification of rolling send metrics. Same window in, same status out. */
@Component
public class HealthClassifier {

  private final HealthProperties properties;

  public HealthClassifier(HealthProperties properties) {
    this.properties = properties;
  }

  public HealthAssessment assess(long sends, long bounces, long complaints) {
    double bounceRate = sends > 0 ? (double) bounces / sends : 0.0;
    double complaintRate = sends > 0 ? (double) complaints / sends : 0.0;
    return new HealthAssessment(
        sends, bounces, complaints, bounceRate, complaintRate, classify(bounceRate, complaintRate));
  }

  public HealthStatus classify(double bounceRate, double complaintRate) {
    if (bounceRate > properties.bounceCritical()
        || complaintRate > properties.complaintCritical()) {
      return HealthStatus.CRITICAL;
    }
    if (bounceRate > properties.bounceWarning()
        || complaintRate > properties.complaintWarning()) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.GOOD;
  }

  /**
   * Daily cap derived from a seat's connection accept rate, or null when the rate is healthy or
   * based on too few requests to judge.
   */
  public Integer acceptRateCap(long requests, long accepted) {
    if (requests < properties.minConnectionRequests()) {
      return null;
    }
    double rate = (double) accepted / requests;
    if (rate < properties.acceptRatePoor()) {
      return properties.poorAcceptCap();
    }
    if (rate < properties.acceptRateLow()) {
      return properties.lowAcceptCap();
    }
    return null;
  }

  /**
   * 0-100 reputation used to rank candidates. Seats with enough connection requests rank by accept
   * rate; everything else loses points for bounces and complaints relative to the critical
   * thresholds.
   */
  public int reputation(HealthAssessment assessment, long requests, long accepted, int current) {
    if (requests >= properties.minConnectionRequests()) {
      return (int) Math.round(100.0 * accepted / requests);
    }
    if (assessment.sends() == 0) {
      return current;
    }
    double bouncePenalty = 50.0 * assessment.bounceRate() / properties.bounceCritical();
    double complaintPenalty = 50.0 * assessment.complaintRate() / properties.complaintCritical();
    long score = Math.round(100.0 - bouncePenalty - complaintPenalty);
    return (int) Math.max(0, Math.min(100, score));
  }
}
