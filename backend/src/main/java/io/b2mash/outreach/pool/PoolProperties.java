package io.b2mash.outreach.pool;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Lead pool tuning.
 *
 * @param minTouchGap minimum time between two touches of the same lead
 * @param maxBulkAllocation upper bound on leads handed out by one criteria allocation
 */
@ConfigurationProperties(prefix = "outreach.pool")
public record PoolProperties(Duration minTouchGap, int maxBulkAllocation) {

  public PoolProperties {
    if (minTouchGap == null) {
      minTouchGap = Duration.ofDays(2);
    }
    if (maxBulkAllocation <= 0) {
      maxBulkAllocation = 1000;
    }
  }
}
