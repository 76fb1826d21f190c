package io.b2mash.outreach.tenant;

import java.time.ZoneId;
import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated tenant on whose behalf a core operation runs. Passed explicitly into every service
 * call instead of being read from ambient request state, so scheduled jobs and request handlers go
 * through the same checks.
 *
 * @param tenantId the tenant the caller may act for
 * @param tier subscription tier at resolution time
 * @param zone tenant-local time zone, used for calendar-day boundaries
 */
public record TenantContext(UUID tenantId, Tier tier, ZoneId zone) {

  public TenantContext {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(zone, "zone");
  }

  public static TenantContext of(Tenant tenant) {
    return new TenantContext(tenant.getId(), tenant.getTier(), ZoneId.of(tenant.getTimezone()));
  }

  /** True when the given tenant id is the one this context acts for. */
  public boolean owns(UUID otherTenantId) {
    return tenantId.equals(otherTenantId);
  }
}
