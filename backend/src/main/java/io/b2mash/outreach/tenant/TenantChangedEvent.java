package io.b2mash.outreach.tenant;

import java.util.UUID;

/** Published when a tenant's tier, time zone or status changes. */
public record TenantChangedEvent(UUID tenantId, String change) {}
