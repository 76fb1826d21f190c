package io.b2mash.outreach.health;

import io.b2mash.outreach.resource.PoolResource;
import io.b2mash.outreach.resource.ResourceStatus;
import io.b2mash.outreach.warmup.WarmupScheduler;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Combines warm-up and health into the number of actions a resource may send today.
 *
 * <ol>
 *   <li>retired: 0
 *   <li>manual {@code dailyLimitOverride}: the override
 *   <li>CRITICAL: 0
 *   <li>WARNING: {@code min(warm-up, warningDailyCap)}
 *   <li>GOOD: the warm-up limit
 * </ol>
 *
 * A seat throttled for a low accept rate is additionally capped by its accept-rate cap.
 */
@Component
public class DailyLimitPolicy {

  private final WarmupScheduler warmupScheduler;
  private final HealthProperties healthProperties;

  public DailyLimitPolicy(WarmupScheduler warmupScheduler, HealthProperties healthProperties) {
    this.warmupScheduler = warmupScheduler;
    this.healthProperties = healthProperties;
  }

  public int effectiveDailyLimit(PoolResource resource, Instant now) {
    if (resource.getStatus() == ResourceStatus.RETIRED) {
      return 0;
    }
    if (resource.getDailyLimitOverride() != null) {
      return resource.getDailyLimitOverride();
    }
    int warmup = warmupScheduler.warmupLimit(resource, now);
    int limit =
        switch (resource.getHealthStatus()) {
          case CRITICAL -> 0;
          case WARNING -> Math.min(warmup, healthProperties.warningDailyCap());
          case GOOD -> warmup;
        };
    if (resource.getAcceptRateCap() != null) {
      limit = Math.min(limit, resource.getAcceptRateCap());
    }
    return limit;
  }
}
