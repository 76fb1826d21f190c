package io.b2mash.outreach.warmup;

import io.b2mash.outreach.resource.PoolResource;
import io.b2mash.outreach.resource.ResourceType;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Derives a resource's allowed daily volume from the days since its activation, using the ramp
 * configured for its type. Pure function of {@code activatedAt} and {@code now}.
 */
@Component
public class WarmupScheduler {

  private final Map<ResourceType, WarmupRamp> ramps;

  public WarmupScheduler(WarmupProperties properties) {
    this.ramps = properties.resolve();
  }

  /** {@code floor(now - activatedAt) + 1} in whole days; 0 if not activated or not yet active. */
  public static long daysActive(Instant activatedAt, Instant now) {
    if (activatedAt == null || now.isBefore(activatedAt)) {
      return 0;
    }
    return Duration.between(activatedAt, now).toDays() + 1;
  }

  public int warmupLimit(PoolResource resource, Instant now) {
    return warmupLimit(resource.getResourceType(), resource.getActivatedAt(), now);
  }

  public int warmupLimit(ResourceType type, Instant activatedAt, Instant now) {
    return rampFor(type).limitForDay(daysActive(activatedAt, now));
  }

  /** True once the resource has reached the steady-state step of its ramp. */
  public boolean hasReachedCeiling(PoolResource resource, Instant now) {
    long days = daysActive(resource.getActivatedAt(), now);
    return days >= rampFor(resource.getResourceType()).steadyStateDay();
  }

  public WarmupRamp rampFor(ResourceType type) {
    return ramps.get(type);
  }
}
