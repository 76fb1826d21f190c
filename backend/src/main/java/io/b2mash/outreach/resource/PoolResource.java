package io.b2mash.outreach.resource;

import io.b2mash.outreach.health.HealthAssessment;
import io.b2mash.outreach.health.HealthStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

/**
 * A shared communication asset: a sending domain, a phone number or a LinkedIn seat. Up to {@code
 * maxTenants} tenants may hold it at once; {@code currentTenants} is only changed by {@link
 * #grantSlot()} and {@link #releaseSlot()} while the row is locked.
 */
@Entity
@Table(name = "resources")
public class PoolResource {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "resource_type", nullable = false, length = 20)
  private ResourceType resourceType;

  @Column(name = "resource_value", nullable = false, unique = true)
  private String resourceValue;

  @Column(name = "max_tenants", nullable = false)
  private int maxTenants;

  @Column(name = "current_tenants", nullable = false)
  private int currentTenants;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ResourceStatus status;

  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Column(name = "provider", length = 50)
  private String provider;

  @Column(name = "provider_id", length = 255)
  private String providerId;

  @Column(name = "activated_at")
  private Instant activatedAt;

  @Column(name = "warmup_completed_at")
  private Instant warmupCompletedAt;

  @Column(name = "reputation_score", nullable = false)
  private int reputationScore;

  @Column(name = "sends_30d", nullable = false)
  private long sends30d;

  @Column(name = "bounces_30d", nullable = false)
  private long bounces30d;

  @Column(name = "complaints_30d", nullable = false)
  private long complaints30d;

  @Column(name = "connection_requests_7d", nullable = false)
  private long connectionRequests7d;

  @Column(name = "connections_accepted_7d", nullable = false)
  private long connectionsAccepted7d;

  @Column(name = "bounce_rate", nullable = false)
  private double bounceRate;

  @Column(name = "complaint_rate", nullable = false)
  private double complaintRate;

  @Column(name = "accept_rate")
  private Double acceptRate;

  @Enumerated(EnumType.STRING)
  @Column(name = "health_status", nullable = false, length = 20)
  private HealthStatus healthStatus;

  @Column(name = "health_checked_at")
  private Instant healthCheckedAt;

  @Column(name = "daily_limit_override")
  private Integer dailyLimitOverride;

  @Column(name = "accept_rate_cap")
  private Integer acceptRateCap;

  @Column(name = "retired_at")
  private Instant retiredAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PoolResource() {}

  public PoolResource(
      ResourceType resourceType,
      String resourceValue,
      int maxTenants,
      String provider,
      String providerId) {
    if (maxTenants < 1) {
      throw new IllegalArgumentException("maxTenants must be at least 1");
    }
    this.resourceType = resourceType;
    this.resourceValue = resourceValue;
    this.maxTenants = maxTenants;
    this.currentTenants = 0;
    this.status = ResourceStatus.WARMING;
    this.timezone = "UTC";
    this.provider = provider;
    this.providerId = providerId;
    this.reputationScore = 50;
    this.healthStatus = HealthStatus.GOOD;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean hasSpareCapacity() {
    return status != ResourceStatus.RETIRED && currentTenants < maxTenants;
  }

  public boolean isWarmupComplete() {
    return warmupCompletedAt != null;
  }

  /** Takes one tenant slot. Caller must hold the row lock and have checked capacity. */
  public void grantSlot() {
    if (status == ResourceStatus.RETIRED) {
      throw new IllegalStateException("Resource " + id + " is retired");
    }
    if (currentTenants >= maxTenants) {
      throw new IllegalStateException("Resource " + id + " is at capacity");
    }
    this.currentTenants++;
    if (currentTenants == maxTenants) {
      this.status = ResourceStatus.ASSIGNED;
    }
    this.updatedAt = Instant.now();
  }

  /** Returns one tenant slot and reopens the resource for sharing. */
  public void releaseSlot() {
    if (currentTenants <= 0) {
      throw new IllegalStateException("Resource " + id + " has no tenants to release");
    }
    this.currentTenants--;
    if (status == ResourceStatus.ASSIGNED) {
      this.status = isWarmupComplete() ? ResourceStatus.AVAILABLE : ResourceStatus.WARMING;
    }
    this.updatedAt = Instant.now();
  }

  public void activate(Instant at) {
    if (status == ResourceStatus.RETIRED) {
      throw new IllegalStateException("Resource " + id + " is retired");
    }
    this.activatedAt = at;
    this.updatedAt = Instant.now();
  }

  /** Marks the warm-up ramp as finished; a warming resource becomes available. */
  public void completeWarmup(Instant at) {
    if (warmupCompletedAt != null) {
      return;
    }
    this.warmupCompletedAt = at;
    if (status == ResourceStatus.WARMING) {
      this.status = ResourceStatus.AVAILABLE;
    }
    this.updatedAt = Instant.now();
  }

  public void retire() {
    if (currentTenants > 0) {
      throw new IllegalStateException(
          "Resource " + id + " is still held by " + currentTenants + " tenant(s)");
    }
    this.status = ResourceStatus.RETIRED;
    this.retiredAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Adopts a time zone for calendar-day counters. Only meaningful while unshared. */
  public void adoptTimezone(ZoneId zone) {
    this.timezone = zone.getId();
    this.updatedAt = Instant.now();
  }

  public void changeDailyLimitOverride(Integer dailyLimitOverride) {
    if (dailyLimitOverride != null && dailyLimitOverride < 0) {
      throw new IllegalArgumentException("dailyLimitOverride must not be negative");
    }
    this.dailyLimitOverride = dailyLimitOverride;
    this.updatedAt = Instant.now();
  }

  /** Stores the outcome of a health recomputation over the rolling windows. */
  public void applyHealth(
      HealthAssessment assessment,
      long connectionRequests7d,
      long connectionsAccepted7d,
      Double acceptRate,
      Integer acceptRateCap,
      int reputationScore,
      Instant checkedAt) {
    this.sends30d = assessment.sends();
    this.bounces30d = assessment.bounces();
    this.complaints30d = assessment.complaints();
    this.bounceRate = assessment.bounceRate();
    this.complaintRate = assessment.complaintRate();
    this.healthStatus = assessment.status();
    this.connectionRequests7d = connectionRequests7d;
    this.connectionsAccepted7d = connectionsAccepted7d;
    this.acceptRate = acceptRate;
    this.acceptRateCap = acceptRateCap;
    this.reputationScore = Math.max(0, Math.min(100, reputationScore));
    this.healthCheckedAt = checkedAt;
    this.updatedAt = Instant.now();
  }

  public ZoneId zone() {
    return ZoneId.of(timezone);
  }

  public UUID getId() {
    return id;
  }

  public ResourceType getResourceType() {
    return resourceType;
  }

  public String getResourceValue() {
    return resourceValue;
  }

  public int getMaxTenants() {
    return maxTenants;
  }

  public int getCurrentTenants() {
    return currentTenants;
  }

  public ResourceStatus getStatus() {
    return status;
  }

  public String getTimezone() {
    return timezone;
  }

  public String getProvider() {
    return provider;
  }

  public String getProviderId() {
    return providerId;
  }

  public Instant getActivatedAt() {
    return activatedAt;
  }

  public Instant getWarmupCompletedAt() {
    return warmupCompletedAt;
  }

  public int getReputationScore() {
    return reputationScore;
  }

  public long getSends30d() {
    return sends30d;
  }

  public long getBounces30d() {
    return bounces30d;
  }

  public long getComplaints30d() {
    return complaints30d;
  }

  public long getConnectionRequests7d() {
    return connectionRequests7d;
  }

  public long getConnectionsAccepted7d() {
    return connectionsAccepted7d;
  }

  public double getBounceRate() {
    return bounceRate;
  }

  public double getComplaintRate() {
    return complaintRate;
  }

  public Double getAcceptRate() {
    return acceptRate;
  }

  public HealthStatus getHealthStatus() {
    return healthStatus;
  }

  public Instant getHealthCheckedAt() {
    return healthCheckedAt;
  }

  public Integer getDailyLimitOverride() {
    return dailyLimitOverride;
  }

  public Integer getAcceptRateCap() {
    return acceptRateCap;
  }

  public Instant getRetiredAt() {
    return retiredAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
