package io.b2mash.outreach.warmup;

import io.b2mash.outreach.resource.ResourceType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Warm-up ramps keyed by resource type. Types without a configured ramp use the built-in defaults.
 */
@ConfigurationProperties(prefix = "outreach.warmup")
public record WarmupProperties(Map<ResourceType, List<WarmupRamp.Step>> ramps) {

  public static final WarmupRamp DEFAULT_SEAT_RAMP = WarmupRamp.of(1, 5, 4, 10, 8, 15, 12, 20);
  public static final WarmupRamp DEFAULT_DOMAIN_RAMP =
      WarmupRamp.of(1, 5, 4, 10, 8, 20, 15, 35, 22, 50);
  public static final WarmupRamp DEFAULT_PHONE_RAMP = WarmupRamp.of(1, 50);

  public static WarmupProperties defaults() {
    return new WarmupProperties(Map.of());
  }

  /** Resolves the ramp for every resource type, validating configured ones. */
  public Map<ResourceType, WarmupRamp> resolve() {
    var resolved = new EnumMap<ResourceType, WarmupRamp>(ResourceType.class);
    resolved.put(ResourceType.LINKEDIN_SEAT, DEFAULT_SEAT_RAMP);
    resolved.put(ResourceType.EMAIL_DOMAIN, DEFAULT_DOMAIN_RAMP);
    resolved.put(ResourceType.PHONE_NUMBER, DEFAULT_PHONE_RAMP);
    if (ramps != null) {
      ramps.forEach((type, steps) -> resolved.put(type, new WarmupRamp(steps)));
    }
    return resolved;
  }
}
