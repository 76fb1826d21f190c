package io.b2mash.outreach.resource;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A tenant's hold on one shared resource. One active grant per tenant-resource pair. */
@Entity
@Table(name = "tenant_resource_grants")
public class TenantResourceGrant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "resource_id", nullable = false, updatable = false)
  private UUID resourceId;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "resource_type", nullable = false, length = 20, updatable = false)
  private ResourceType resourceType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private GrantStatus status;

  @Column(name = "granted_at", nullable = false, updatable = false)
  private Instant grantedAt;

  @Column(name = "released_at")
  private Instant releasedAt;

  @Column(name = "total_sends", nullable = false)
  private long totalSends;

  @Column(name = "last_used_at")
  private Instant lastUsedAt;

  protected TenantResourceGrant() {}

  public TenantResourceGrant(UUID resourceId, UUID tenantId, ResourceType resourceType) {
    this.resourceId = resourceId;
    this.tenantId = tenantId;
    this.resourceType = resourceType;
    this.status = GrantStatus.ACTIVE;
    this.grantedAt = Instant.now();
  }

  public boolean isActive() {
    return status == GrantStatus.ACTIVE;
  }

  public void release() {
    if (status != GrantStatus.ACTIVE) {
      throw new IllegalStateException("Grant " + id + " is already released");
    }
    this.status = GrantStatus.RELEASED;
    this.releasedAt = Instant.now();
  }

  public void recordUsage(Instant at) {
    this.totalSends++;
    this.lastUsedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public ResourceType getResourceType() {
    return resourceType;
  }

  public GrantStatus getStatus() {
    return status;
  }

  public Instant getGrantedAt() {
    return grantedAt;
  }

  public Instant getReleasedAt() {
    return releasedAt;
  }

  public long getTotalSends() {
    return totalSends;
  }

  public Instant getLastUsedAt() {
    return lastUsedAt;
  }
}
