package io.b2mash.outreach.campaign;

import io.b2mash.outreach.audit.AuditEventBuilder;
import io.b2mash.outreach.audit.AuditService;
import io.b2mash.outreach.exception.AllocationExceededException;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.pool.AllocationCriteria;
import io.b2mash.outreach.pool.LeadAssignment;
import io.b2mash.outreach.pool.LeadPoolService;
import io.b2mash.outreach.pool.PoolProperties;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the lead allocation of a tenant's non-terminal campaigns at or below 100%. Every check
 * runs under a lock on the tenant row, so two concurrent updates cannot both pass against the same
 * stale total.
 */
@Service
public class CampaignAllocationService {

  private static final Logger log = LoggerFactory.getLogger(CampaignAllocationService.class);

  private final CampaignAllocationRepository allocationRepository;
  private final TenantRepository tenantRepository;
  private final LeadPoolService leadPoolService;
  private final PoolProperties poolProperties;
  private final AuditService auditService;

  public CampaignAllocationService(
      CampaignAllocationRepository allocationRepository,
      TenantRepository tenantRepository,
      LeadPoolService leadPoolService,
      PoolProperties poolProperties,
      AuditService auditService) {
    this.allocationRepository = allocationRepository;
    this.tenantRepository = tenantRepository;
    this.leadPoolService = leadPoolService;
    this.poolProperties = poolProperties;
    this.auditService = auditService;
  }

  /** Result of a successful allocation check. */
  public record AllocationCheck(int allocatedElsewhere, int requested, int remaining) {}

  public record AllocationSummary(
      int allocatedPct, int remainingPct, List<CampaignAllocation> campaigns) {}

  /**
   * Checks that giving {@code pct} percent to the campaign keeps the tenant at or below 100%. The
   * campaign's own current row, if any, is excluded from the sum.
   *
   * @throws AllocationExceededException if the total would exceed 100%
   * @throws InvalidStateException if {@code pct} is outside 1..100
   */
  @Transactional
  public AllocationCheck validate(TenantContext context, UUID campaignId, int pct) {
    lockTenant(context);
    return check(context, campaignId, pct);
  }

  /**
   * Creates or updates a campaign's allocation. New campaigns start as DRAFT.
   *
   * @throws AllocationExceededException if the total would exceed 100%
   * @throws InvalidStateException if the campaign is completed or cancelled
   */
  @Transactional
  public CampaignAllocation upsert(TenantContext context, UUID campaignId, String name, int pct) {
    lockTenant(context);
    var existing = allocationRepository.findByTenantIdAndCampaignId(context.tenantId(), campaignId);
    if (existing.isPresent() && existing.get().getStatus().isTerminal()) {
      throw new InvalidStateException(
          "Campaign closed",
          "Campaign " + campaignId + " is " + existing.get().getStatus() + " and cannot change");
    }
    check(context, campaignId, pct);

    CampaignAllocation allocation;
    String eventType;
    if (existing.isPresent()) {
      allocation = existing.get();
      allocation.update(name, pct);
      eventType = "campaign_allocation.updated";
    } else {
      allocation = new CampaignAllocation(context.tenantId(), campaignId, name, pct);
      eventType = "campaign_allocation.created";
    }
    allocation = allocationRepository.save(allocation);
    audit(context, allocation, eventType);
    return allocation;
  }

  /**
   * Moves a campaign through its lifecycle. Re-activating a paused campaign re-validates its share
   * against the current total.
   *
   * @throws InvalidStateException if the transition is not allowed
   */
  @Transactional
  public CampaignAllocation changeStatus(
      TenantContext context, UUID campaignId, CampaignStatus target) {
    lockTenant(context);
    var allocation = requireAllocation(context, campaignId);
    if (!allocation.getStatus().canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid status transition",
          "Cannot move campaign "
              + campaignId
              + " from "
              + allocation.getStatus()
              + " to "
              + target);
    }
    if (target == CampaignStatus.ACTIVE) {
      check(context, campaignId, allocation.getLeadAllocationPct());
    }
    allocation.transitionTo(target);
    allocation = allocationRepository.save(allocation);
    audit(context, allocation, "campaign_allocation.status_changed");
    return allocation;
  }

  @Transactional(readOnly = true)
  public int leadShare(TenantContext context, UUID campaignId, int totalLeads) {
    return requireAllocation(context, campaignId).leadShare(totalLeads);
  }

  /**
   * Draws each ACTIVE campaign's share of {@code totalLeads} from the pool using the criteria.
   * Returns the number of leads assigned per campaign.
   */
  @Transactional
  public Map<UUID, Integer> distribute(
      TenantContext context, AllocationCriteria criteria, int totalLeads) {
    lockTenant(context);
    var result = new LinkedHashMap<UUID, Integer>();
    for (var allocation :
        allocationRepository.findByTenantIdAndStatus(context.tenantId(), CampaignStatus.ACTIVE)) {
      int share = Math.min(allocation.leadShare(totalLeads), poolProperties.maxBulkAllocation());
      if (share == 0) {
        result.put(allocation.getCampaignId(), 0);
        continue;
      }
      List<LeadAssignment> assigned =
          leadPoolService.allocateMatching(context, criteria, share, allocation.getCampaignId());
      result.put(allocation.getCampaignId(), assigned.size());
    }
    log.info("Distributed leads for tenant {}: {}", context.tenantId(), result);
    return result;
  }

  @Transactional(readOnly = true)
  public CampaignAllocation getAllocation(TenantContext context, UUID campaignId) {
    return requireAllocation(context, campaignId);
  }

  @Transactional(readOnly = true)
  public AllocationSummary summary(TenantContext context) {
    var campaigns = allocationRepository.findByTenantIdOrderByCreatedAtAsc(context.tenantId());
    int allocated =
        campaigns.stream()
            .filter(c -> !c.getStatus().isTerminal())
            .mapToInt(CampaignAllocation::getLeadAllocationPct)
            .sum();
    return new AllocationSummary(allocated, Math.max(0, 100 - allocated), campaigns);
  }

  private AllocationCheck check(TenantContext context, UUID campaignId, int pct) {
    if (pct < 1 || pct > 100) {
      throw new InvalidStateException(
          "Invalid allocation", "leadAllocationPct must be between 1 and 100, got " + pct);
    }
    int elsewhere =
        (int)
            allocationRepository.sumAllocatedExcluding(
                context.tenantId(), CampaignStatus.NON_TERMINAL, campaignId);
    if (elsewhere + pct > 100) {
      throw new AllocationExceededException(elsewhere, pct);
    }
    return new AllocationCheck(elsewhere, pct, 100 - elsewhere - pct);
  }

  private void lockTenant(TenantContext context) {
    tenantRepository
        .findByIdForUpdate(context.tenantId())
        .orElseThrow(() -> new ResourceNotFoundException("Tenant", context.tenantId()));
  }

  private CampaignAllocation requireAllocation(TenantContext context, UUID campaignId) {
    return allocationRepository
        .findByTenantIdAndCampaignId(context.tenantId(), campaignId)
        .orElseThrow(() -> new ResourceNotFoundException("CampaignAllocation", campaignId));
  }

  private void audit(TenantContext context, CampaignAllocation allocation, String eventType) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("campaign_allocation")
            .entityId(allocation.getId())
            .tenantId(context.tenantId())
            .details(
                Map.of(
                    "campaign_id", allocation.getCampaignId().toString(),
                    "lead_allocation_pct", allocation.getLeadAllocationPct(),
                    "status", allocation.getStatus().name()))
            .build());
  }
}
