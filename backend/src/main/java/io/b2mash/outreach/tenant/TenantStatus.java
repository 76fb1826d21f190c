package io.b2mash.outreach.tenant;

public enum TenantStatus {
  ACTIVE,
  CHURNED
}
