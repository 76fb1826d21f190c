package io.b2mash.outreach.pool;

import io.b2mash.outreach.audit.AuditEventBuilder;
import io.b2mash.outreach.audit.AuditService;
import io.b2mash.outreach.exception.AssignmentNotActiveException;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.exception.LeadNotAvailableException;
import io.b2mash.outreach.exception.ResourceConflictException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.tenant.TenantContext;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the platform-wide lead inventory and the exclusive assignment of leads to tenants.
 *
 * <p>Every mutation of an assignment first takes a {@code PESSIMISTIC_WRITE} lock on the lead row,
 * so the availability check and the write happen in one atomic unit. Two tenants racing for the
 * same lead serialize on that lock; the loser re-reads the lead as assigned and receives {@link
 * LeadNotAvailableException}.
 */
@Service
public class LeadPoolService {

  private static final Logger log = LoggerFactory.getLogger(LeadPoolService.class);

  // Native IN () with an empty list is invalid SQL; the "any" flag short-circuits this value.
  private static final List<String> MATCH_ANY = List.of("");

  private final PoolLeadRepository leadRepository;
  private final LeadAssignmentRepository assignmentRepository;
  private final SuppressionEntryRepository suppressionRepository;
  private final PoolProperties poolProperties;
  private final AuditService auditService;

  public LeadPoolService(
      PoolLeadRepository leadRepository,
      LeadAssignmentRepository assignmentRepository,
      SuppressionEntryRepository suppressionRepository,
      PoolProperties poolProperties,
      AuditService auditService) {
    this.leadRepository = leadRepository;
    this.assignmentRepository = assignmentRepository;
    this.suppressionRepository = suppressionRepository;
    this.poolProperties = poolProperties;
    this.auditService = auditService;
  }

  /** Attributes supplied by ingestion for a new pool lead. */
  public record SubmitLeadCommand(
      String externalId,
      String email,
      EmailVerification emailVerification,
      String firstName,
      String lastName,
      String title,
      String seniority,
      String phone,
      String linkedinUrl,
      String companyName,
      String companyDomain,
      String industry,
      Integer employeeCount,
      String country,
      boolean hiring,
      LocalDate latestFundingDate) {}

  /** Per-tenant assignment counters. */
  public record TenantLeadStats(
      long active, long converted, long released, long touchesOnActive, long repliedOnActive) {}

  /**
   * Adds a lead to the pool. It enters as available (or invalid when its address is known bad)
   * and unscored.
   *
   * @throws ResourceConflictException if a lead with the same email or external id exists
   */
  @Transactional
  public PoolLead submitLead(SubmitLeadCommand command) {
    if (command.email() != null && leadRepository.existsByEmail(normalizeEmail(command.email()))) {
      throw new ResourceConflictException(
          "Duplicate lead", "A lead with email " + command.email() + " already exists");
    }
    if (command.externalId() != null && leadRepository.existsByExternalId(command.externalId())) {
      throw new ResourceConflictException(
          "Duplicate lead", "A lead with external id " + command.externalId() + " already exists");
    }
    var lead = new PoolLead(command.externalId(), command.email(), command.emailVerification());
    lead.updateContact(
        command.firstName(),
        command.lastName(),
        command.title(),
        command.seniority(),
        command.phone(),
        command.linkedinUrl());
    lead.updateFirmographics(
        command.companyName(),
        command.companyDomain(),
        command.industry(),
        command.employeeCount(),
        command.country(),
        command.hiring(),
        command.latestFundingDate());
    lead = leadRepository.save(lead);
    log.info("Submitted lead {} to pool with status {}", lead.getId(), lead.getPoolStatus());
    return lead;
  }

  @Transactional(readOnly = true)
  public PoolLead getLead(UUID leadId) {
    return leadRepository
        .findById(leadId)
        .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
  }

  /** True iff the lead is available and has no active assignment. Advisory outside a lock. */
  @Transactional(readOnly = true)
  public boolean isAvailable(UUID leadId) {
    return leadRepository
        .findById(leadId)
        .map(
            lead ->
                lead.isAssignable()
                    && !assignmentRepository.existsByLeadIdAndStatus(
                        leadId, AssignmentStatus.ACTIVE))
        .orElse(false);
  }

  /**
   * Assigns a lead exclusively to the calling tenant.
   *
   * @throws ResourceNotFoundException if the lead does not exist
   * @throws LeadNotAvailableException if the lead is not available when the lock is held
   */
  @Transactional
  public LeadAssignment assign(
      TenantContext context, UUID leadId, UUID campaignId, String reason, String assignedBy) {
    var lead =
        leadRepository
            .findByIdForUpdate(leadId)
            .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
    var assignment = assignLocked(context, lead, campaignId, reason, assignedBy);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("lead.assigned")
            .entityType("lead_assignment")
            .entityId(assignment.getId())
            .tenantId(context.tenantId())
            .details(assignmentDetails(assignment, reason))
            .build());
    log.info(
        "Assigned lead {} to tenant {} (assignment {})",
        leadId,
        context.tenantId(),
        assignment.getId());
    return assignment;
  }

  /**
   * Allocates up to {@code count} available leads matching the criteria. Candidates are locked with
   * {@code SKIP LOCKED}, so concurrent allocations for different tenants draw disjoint leads
   * instead of blocking each other.
   *
   * @throws InvalidStateException if {@code count} is outside 1..max
   */
  @Transactional
  public List<LeadAssignment> allocateMatching(
      TenantContext context, AllocationCriteria criteria, int count, UUID campaignId) {
    if (count < 1 || count > poolProperties.maxBulkAllocation()) {
      throw new InvalidStateException(
          "Invalid allocation size",
          "count must be between 1 and " + poolProperties.maxBulkAllocation());
    }
    var candidates =
        leadRepository.lockMatchingAvailable(
            criteria.emailVerifications().stream().map(Enum::name).toList(),
            criteria.industries().isEmpty(),
            orMatchAny(criteria.industries()),
            criteria.countries().isEmpty(),
            orMatchAny(criteria.countries()),
            criteria.seniorities().isEmpty(),
            orMatchAny(criteria.seniorities()),
            criteria.minEmployees(),
            criteria.maxEmployees(),
            count);

    var assignments = new ArrayList<LeadAssignment>();
    for (var lead : candidates) {
      if (assignmentRepository.existsByLeadIdAndStatus(lead.getId(), AssignmentStatus.ACTIVE)) {
        log.warn("Lead {} is available but has an active assignment, skipping", lead.getId());
        continue;
      }
      assignments.add(assignLocked(context, lead, campaignId, "icp_match", "allocator"));
    }

    if (!assignments.isEmpty()) {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("lead.bulk_allocated")
              .entityType("tenant")
              .entityId(context.tenantId())
              .tenantId(context.tenantId())
              .details(
                  Map.of(
                      "requested", count,
                      "allocated", assignments.size(),
                      "campaign_id", campaignId != null ? campaignId.toString() : ""))
              .build());
    }
    log.info(
        "Allocated {} of {} requested leads to tenant {}",
        assignments.size(),
        count,
        context.tenantId());
    return assignments;
  }

  /**
   * Releases an active assignment and returns the lead to the pool, or retires it when the lead
   * has been globally bounced or unsubscribed meanwhile.
   *
   * @throws ResourceNotFoundException if the assignment does not exist for this tenant
   * @throws AssignmentNotActiveException if the assignment is no longer active
   */
  @Transactional
  public LeadAssignment release(TenantContext context, UUID assignmentId, String reason) {
    var locked = lockOwnedAssignment(context, assignmentId);
    var assignment = locked.assignment();
    var lead = locked.lead();
    releaseLocked(assignment, lead, reason);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("lead.released")
            .entityType("lead_assignment")
            .entityId(assignment.getId())
            .tenantId(context.tenantId())
            .details(
                Map.of(
                    "lead_id", lead.getId().toString(),
                    "reason", reason != null ? reason : "",
                    "lead_status", lead.getPoolStatus().name()))
            .build());
    log.info(
        "Released assignment {} (lead {} now {})",
        assignmentId,
        lead.getId(),
        lead.getPoolStatus());
    return assignment;
  }

  /**
   * Marks an active assignment as converted. Terminal: the lead stays with the tenant.
   *
   * @throws AssignmentNotActiveException if the assignment is no longer active
   */
  @Transactional
  public LeadAssignment markConverted(
      TenantContext context, UUID assignmentId, String conversionType) {
    var locked = lockOwnedAssignment(context, assignmentId);
    var assignment = locked.assignment();
    var lead = locked.lead();
    requireCurrent(assignment, lead);
    assignment.convert(conversionType);
    lead.markConverted();
    assignmentRepository.save(assignment);
    leadRepository.save(lead);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("lead.converted")
            .entityType("lead_assignment")
            .entityId(assignment.getId())
            .tenantId(context.tenantId())
            .details(
                Map.of(
                    "lead_id", lead.getId().toString(),
                    "conversion_type", conversionType != null ? conversionType : ""))
            .build());
    return assignment;
  }

  /** Increments the touch counters of the tenant's active assignment for a lead. */
  @Transactional
  public LeadAssignment recordTouch(
      TenantContext context, UUID leadId, Channel channel, Instant at) {
    lockLead(leadId);
    var assignment = requireActiveForLead(context, leadId);
    assignment.recordTouch(channel, at);
    return assignmentRepository.save(assignment);
  }

  /**
   * Touch recording used by the dispatcher after a successful send. Unlike {@link #recordTouch}
   * it does not throw when the assignment has been released in the meantime.
   *
   * @return true if an active assignment was updated
   */
  @Transactional
  public boolean recordDeliveredTouch(UUID tenantId, UUID leadId, Channel channel, Instant at) {
    if (leadRepository.findByIdForUpdate(leadId).isEmpty()) {
      return false;
    }
    var assignment =
        assignmentRepository.findByTenantIdAndLeadIdAndStatus(
            tenantId, leadId, AssignmentStatus.ACTIVE);
    assignment.ifPresent(
        a -> {
          a.recordTouch(channel, at);
          assignmentRepository.save(a);
        });
    return assignment.isPresent();
  }

  @Transactional
  public LeadAssignment recordReply(
      TenantContext context, UUID assignmentId, String intent, Instant at) {
    var assignment = lockOwnedAssignment(context, assignmentId).assignment();
    assignment.recordReply(intent, at);
    return assignmentRepository.save(assignment);
  }

  @Transactional
  public LeadAssignment applyCoolingPeriod(
      TenantContext context, UUID assignmentId, Instant until) {
    var locked = lockOwnedAssignment(context, assignmentId);
    var assignment = locked.assignment();
    requireCurrent(assignment, locked.lead());
    assignment.coolOff(until);
    return assignmentRepository.save(assignment);
  }

  /**
   * Flags a lead as hard-bounced platform-wide. An active assignment is released and the lead
   * becomes permanently ineligible.
   */
  @Transactional
  public PoolLead markBounced(UUID leadId, String reason) {
    var lead = lockLead(leadId);
    lead.flagBounced(reason);
    releaseActiveOnGlobalFlag(lead, "bounced");
    log.info("Lead {} marked bounced: {}", leadId, reason);
    return leadRepository.save(lead);
  }

  /** Flags a lead as unsubscribed platform-wide. */
  @Transactional
  public PoolLead markUnsubscribed(UUID leadId) {
    var lead = lockLead(leadId);
    lead.flagUnsubscribed();
    releaseActiveOnGlobalFlag(lead, "unsubscribed");
    log.info("Lead {} marked unsubscribed", leadId);
    return leadRepository.save(lead);
  }

  /**
   * Releases every active assignment of a tenant, e.g. on churn. Converted leads stay with the
   * tenant.
   *
   * @return the number of assignments released
   */
  @Transactional
  public int releaseAllForTenant(UUID tenantId, String reason) {
    var leadIds =
        assignmentRepository.findLeadIdsByTenantIdAndStatus(tenantId, AssignmentStatus.ACTIVE);
    int released = 0;
    for (UUID leadId : leadIds) {
      var lead = lockLead(leadId);
      // re-read under the lead lock; a concurrent release may have closed it
      var assignment =
          assignmentRepository.findByTenantIdAndLeadIdAndStatus(
              tenantId, leadId, AssignmentStatus.ACTIVE);
      if (assignment.isPresent()) {
        releaseLocked(assignment.get(), lead, reason);
        released++;
      }
    }
    if (released > 0) {
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("lead.bulk_released")
              .entityType("tenant")
              .entityId(tenantId)
              .tenantId(tenantId)
              .details(Map.of("released", released, "reason", reason))
              .build());
    }
    log.info("Released {} assignments for tenant {}", released, tenantId);
    return released;
  }

  @Transactional(readOnly = true)
  public Map<PoolStatus, Long> poolStats() {
    var stats = new EnumMap<PoolStatus, Long>(PoolStatus.class);
    for (PoolStatus status : PoolStatus.values()) {
      stats.put(status, 0L);
    }
    for (var count : leadRepository.countByPoolStatus()) {
      stats.put(count.getStatus(), count.getCount());
    }
    return stats;
  }

  @Transactional(readOnly = true)
  public TenantLeadStats tenantStats(TenantContext context) {
    UUID tenantId = context.tenantId();
    return new TenantLeadStats(
        assignmentRepository.countByTenantIdAndStatus(tenantId, AssignmentStatus.ACTIVE),
        assignmentRepository.countByTenantIdAndStatus(tenantId, AssignmentStatus.CONVERTED),
        assignmentRepository.countByTenantIdAndStatus(tenantId, AssignmentStatus.RELEASED),
        assignmentRepository.sumTouches(tenantId, AssignmentStatus.ACTIVE),
        assignmentRepository.countByTenantIdAndStatusAndReplied(
            tenantId, AssignmentStatus.ACTIVE, true));
  }

  @Transactional(readOnly = true)
  public List<LeadAssignment> activeAssignments(TenantContext context) {
    return assignmentRepository.findByTenantIdAndStatus(
        context.tenantId(), AssignmentStatus.ACTIVE);
  }

  @Transactional
  public SuppressionEntry suppress(
      TenantContext context, SuppressionKind kind, String value, String reason) {
    var entry = new SuppressionEntry(context.tenantId(), kind, value, reason);
    if (suppressionRepository.existsByTenantIdAndKindAndValue(
        context.tenantId(), kind, entry.getValue())) {
      throw new ResourceConflictException(
          "Already suppressed", kind + " " + entry.getValue() + " is already suppressed");
    }
    return suppressionRepository.save(entry);
  }

  @Transactional(readOnly = true)
  public List<SuppressionEntry> listSuppressions(TenantContext context) {
    return suppressionRepository.findByTenantIdOrderByCreatedAtDesc(context.tenantId());
  }

  @Transactional
  public void removeSuppression(TenantContext context, UUID entryId) {
    var entry =
        suppressionRepository
            .findByIdAndTenantId(entryId, context.tenantId())
            .orElseThrow(() -> new ResourceNotFoundException("Suppression entry", entryId));
    suppressionRepository.delete(entry);
  }

  private LeadAssignment assignLocked(
      TenantContext context, PoolLead lead, UUID campaignId, String reason, String assignedBy) {
    if (!lead.isAssignable()) {
      throw new LeadNotAvailableException(lead.getId(), "status " + lead.getPoolStatus());
    }
    if (assignmentRepository.existsByLeadIdAndStatus(lead.getId(), AssignmentStatus.ACTIVE)) {
      throw new LeadNotAvailableException(lead.getId(), "active assignment exists");
    }
    var assignment =
        assignmentRepository.saveAndFlush(
            new LeadAssignment(lead.getId(), context.tenantId(), campaignId, assignedBy, reason));
    lead.assignTo(context.tenantId(), campaignId, assignment.getId());
    leadRepository.save(lead);
    return assignment;
  }

  private void releaseLocked(LeadAssignment assignment, PoolLead lead, String reason) {
    requireCurrent(assignment, lead);
    assignment.release(reason);
    lead.returnToPool();
    assignmentRepository.save(assignment);
    leadRepository.save(lead);
  }

  private void releaseActiveOnGlobalFlag(PoolLead lead, String reason) {
    assignmentRepository
        .findByLeadIdAndStatus(lead.getId(), AssignmentStatus.ACTIVE)
        .ifPresent(assignment -> releaseLocked(assignment, lead, reason));
  }

  private PoolLead lockLead(UUID leadId) {
    return leadRepository
        .findByIdForUpdate(leadId)
        .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
  }

  /**
   * Locks the lead behind an assignment and only then reads the assignment, so its status
   * reflects every release or conversion committed before the lock was granted.
   */
  private LockedAssignment lockOwnedAssignment(TenantContext context, UUID assignmentId) {
    var leadId =
        assignmentRepository
            .findLeadIdByIdAndTenantId(assignmentId, context.tenantId())
            .orElseThrow(() -> new ResourceNotFoundException("Assignment", assignmentId));
    var lead = lockLead(leadId);
    var assignment =
        assignmentRepository
            .findByIdForUpdate(assignmentId)
            .orElseThrow(() -> new ResourceNotFoundException("Assignment", assignmentId));
    return new LockedAssignment(assignment, lead);
  }

  private record LockedAssignment(LeadAssignment assignment, PoolLead lead) {}

  private LeadAssignment requireActiveForLead(TenantContext context, UUID leadId) {
    return assignmentRepository
        .findByTenantIdAndLeadIdAndStatus(context.tenantId(), leadId, AssignmentStatus.ACTIVE)
        .orElseThrow(() -> AssignmentNotActiveException.noActiveAssignment(leadId));
  }

  /** The assignment must be ACTIVE and still the one the locked lead points at. */
  private static void requireCurrent(LeadAssignment assignment, PoolLead lead) {
    if (!assignment.isActive()) {
      throw new AssignmentNotActiveException(assignment.getId(), assignment.getStatus().name());
    }
    if (!assignment.getId().equals(lead.getCurrentAssignmentId())) {
      throw new AssignmentNotActiveException(assignment.getId(), "SUPERSEDED");
    }
  }

  private static Map<String, Object> assignmentDetails(LeadAssignment assignment, String reason) {
    var details = new HashMap<String, Object>();
    details.put("lead_id", assignment.getLeadId().toString());
    details.put("assigned_by", assignment.getAssignedBy());
    if (assignment.getCampaignId() != null) {
      details.put("campaign_id", assignment.getCampaignId().toString());
    }
    if (reason != null) {
      details.put("reason", reason);
    }
    return details;
  }

  private static List<String> orMatchAny(List<String> values) {
    return values.isEmpty() ? MATCH_ANY : values;
  }

  private static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
