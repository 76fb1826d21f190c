package io.b2mash.outreach.health;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Health thresholds. Rates are fractions, so 0.05 means 5%.
 *
 * @param window rolling window for send, bounce and complaint counts
 * @param bounceCritical bounce rate above which a resource is critical
 * @param complaintCritical complaint rate above which a resource is critical
 * @param bounceWarning bounce rate above which a resource is in warning
 * @param complaintWarning complaint rate above which a resource is in warning
 * @param warningDailyCap daily ceiling applied while in warning
 * @param acceptWindow rolling window for seat connection accept rates
 * @param minConnectionRequests requests needed in the accept window before the rate counts
 * @param acceptRateLow accept rate below which a seat is throttled to {@code lowAcceptCap}
 * @param lowAcceptCap daily cap for a seat with a low accept rate
 * @param acceptRatePoor accept rate below which a seat is throttled to {@code poorAcceptCap}
 * @param poorAcceptCap daily cap for a seat with a poor accept rate
 */
@ConfigurationProperties(prefix = "outreach.health")
public record HealthProperties(
    Duration window,
    double bounceCritical,
    double complaintCritical,
    double bounceWarning,
    double complaintWarning,
    int warningDailyCap,
    Duration acceptWindow,
    int minConnectionRequests,
    double acceptRateLow,
    int lowAcceptCap,
    double acceptRatePoor,
    int poorAcceptCap) {

  public static HealthProperties defaults() {
    return new HealthProperties(
        Duration.ofDays(30), 0.05, 0.001, 0.02, 0.0005, 35, Duration.ofDays(7), 10, 0.30, 15,
        0.20, 10);
  }
}
