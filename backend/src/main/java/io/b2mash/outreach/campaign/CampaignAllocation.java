package io.b2mash.outreach.campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Share of a tenant's leads, in percent, that one campaign may draw. */
@Entity
@Table(name = "campaign_allocations")
public class CampaignAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "campaign_id", nullable = false, updatable = false)
  private UUID campaignId;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "lead_allocation_pct", nullable = false)
  private int leadAllocationPct;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CampaignStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CampaignAllocation() {}

  public CampaignAllocation(UUID tenantId, UUID campaignId, String name, int leadAllocationPct) {
    this.tenantId = tenantId;
    this.campaignId = campaignId;
    this.name = name;
    this.leadAllocationPct = leadAllocationPct;
    this.status = CampaignStatus.DRAFT;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public void update(String name, int leadAllocationPct) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Campaign " + campaignId + " is " + status);
    }
    this.name = name;
    this.leadAllocationPct = leadAllocationPct;
  }

  public void transitionTo(CampaignStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Cannot move campaign " + campaignId + " from " + status + " to " + target);
    }
    this.status = target;
  }

  /** {@code floor(totalLeads * pct / 100)}. */
  public int leadShare(int totalLeads) {
    return (int) ((long) totalLeads * leadAllocationPct / 100);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public String getName() {
    return name;
  }

  public int getLeadAllocationPct() {
    return leadAllocationPct;
  }

  public CampaignStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
