package io.b2mash.outreach.tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "tenants")
public class Tenant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "tier", nullable = false, length = 20)
  private Tier tier;

  @Column(name = "plan_slug", length = 100)
  private String planSlug;

  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TenantStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "target_industries", columnDefinition = "jsonb")
  private List<String> targetIndustries;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "competitor_domains", columnDefinition = "jsonb")
  private List<String> competitorDomains;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "scoring_weights", columnDefinition = "jsonb")
  private Map<String, Object> scoringWeights;

  @Column(name = "churned_at")
  private Instant churnedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tenant() {}

  public Tenant(String name, Tier tier, String timezone) {
    this.name = name;
    this.tier = tier;
    this.timezone = ZoneId.of(timezone).getId();
    this.status = TenantStatus.ACTIVE;
    this.targetIndustries = new ArrayList<>();
    this.competitorDomains = new ArrayList<>();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void changePlan(Tier tier, String planSlug) {
    this.tier = tier;
    this.planSlug = planSlug;
    this.updatedAt = Instant.now();
  }

  public void updateScoringProfile(
      List<String> targetIndustries,
      List<String> competitorDomains,
      Map<String, Object> scoringWeights) {
    this.targetIndustries = targetIndustries != null ? targetIndustries : new ArrayList<>();
    this.competitorDomains = competitorDomains != null ? competitorDomains : new ArrayList<>();
    this.scoringWeights = scoringWeights != null ? new HashMap<>(scoringWeights) : null;
    this.updatedAt = Instant.now();
  }

  /** Marks the tenant as churned. Only an active tenant can churn. */
  public void churn() {
    if (status != TenantStatus.ACTIVE) {
      throw new IllegalStateException("Tenant is already churned");
    }
    this.status = TenantStatus.CHURNED;
    this.churnedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isActive() {
    return status == TenantStatus.ACTIVE;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Tier getTier() {
    return tier;
  }

  public String getPlanSlug() {
    return planSlug;
  }

  public String getTimezone() {
    return timezone;
  }

  public TenantStatus getStatus() {
    return status;
  }

  public List<String> getTargetIndustries() {
    return targetIndustries != null ? targetIndustries : List.of();
  }

  public List<String> getCompetitorDomains() {
    return competitorDomains != null ? competitorDomains : List.of();
  }

  public Map<String, Object> getScoringWeights() {
    return scoringWeights;
  }

  public Instant getChurnedAt() {
    return churnedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
