package io.b2mash.outreach.queue;

import io.b2mash.outreach.exception.ForbiddenException;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.health.HealthMonitorService;
import io.b2mash.outreach.pool.LeadPoolService;
import io.b2mash.outreach.queue.ActionStateMachine.Transition;
import io.b2mash.outreach.resource.ResourceAllocator;
import io.b2mash.outreach.tenant.TenantContext;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable per-resource work queue. Enqueue is a plain insert; capacity is only checked when an
 * item is dispatched. Claiming is a single conditional update behind {@link ActionLease}; every
 * later status change goes through {@link ActionStateMachine} and its side effects are written in
 * the same transaction as the item.
 */
@Service
public class ActionQueueService {

  private static final Logger log = LoggerFactory.getLogger(ActionQueueService.class);

  private final ActionQueueRepository queueRepository;
  private final ActionLease actionLease;
  private final QueueProperties properties;
  private final ResourceAllocator resourceAllocator;
  private final HealthMonitorService healthMonitorService;
  private final LeadPoolService leadPoolService;
  private final DailyCapService dailyCapService;
  private final OperationalAlerts operationalAlerts;

  public ActionQueueService(
      ActionQueueRepository queueRepository,
      ActionLease actionLease,
      QueueProperties properties,
      ResourceAllocator resourceAllocator,
      HealthMonitorService healthMonitorService,
      LeadPoolService leadPoolService,
      DailyCapService dailyCapService,
      OperationalAlerts operationalAlerts) {
    this.queueRepository = queueRepository;
    this.actionLease = actionLease;
    this.properties = properties;
    this.resourceAllocator = resourceAllocator;
    this.healthMonitorService = healthMonitorService;
    this.leadPoolService = leadPoolService;
    this.dailyCapService = dailyCapService;
    this.operationalAlerts = operationalAlerts;
  }

  public record EnqueueCommand(
      UUID resourceId,
      UUID leadId,
      UUID campaignId,
      ActionType actionType,
      String payloadRef,
      Instant scheduledAt,
      int priority,
      int maxAttempts) {}

  /**
   * Schedules an action on a resource the tenant holds.
   *
   * @throws ForbiddenException if the tenant holds no active grant on the resource
   */
  @Transactional
  public ActionQueueItem enqueue(TenantContext context, EnqueueCommand command) {
    if (!resourceAllocator.holds(context, command.resourceId())) {
      throw new ForbiddenException(
          "Resource not granted",
          "Tenant does not hold resource " + command.resourceId());
    }
    var item =
        queueRepository.save(
            new ActionQueueItem(
                context.tenantId(),
                command.resourceId(),
                command.leadId(),
                command.campaignId(),
                command.actionType(),
                command.payloadRef(),
                command.scheduledAt() != null ? command.scheduledAt() : Instant.now(),
                command.priority(),
                command.maxAttempts()));
    log.debug(
        "Enqueued {} action {} for lead {} on resource {}",
        item.getActionType(),
        item.getId(),
        item.getLeadId(),
        item.getResourceId());
    return item;
  }

  /**
   * Claims the next due item, optionally for one resource, in {@code (priority desc, scheduled_at
   * asc)} order. Rows locked by other workers are skipped, so concurrent callers never receive the
   * same item.
   */
  @Transactional
  public Optional<ActionQueueItem> dequeueNext(UUID resourceId, String workerId) {
    var now = Instant.now();
    int limit = properties.batchSize();
    List<UUID> candidates =
        resourceId == null
            ? queueRepository.lockDueIds(now, limit)
            : queueRepository.lockDueIdsForResource(resourceId, now, limit);
    for (UUID id : candidates) {
      if (actionLease.tryClaim(id, workerId, properties.leaseDuration(), now)
          == ClaimResult.CLAIMED) {
        return queueRepository.findById(id);
      }
    }
    return Optional.empty();
  }

  /**
   * Applies the outcome of a claimed item.
   *
   * @throws InvalidStateException if the caller no longer holds the claim
   */
  @Transactional
  public ActionQueueItem complete(UUID itemId, String workerId, ActionOutcome outcome) {
    var item = lockItem(itemId);
    if (!item.isClaimedBy(workerId)) {
      throw new InvalidStateException(
          "Claim lost",
          "Action "
              + itemId
              + " is not held by "
              + workerId
              + " (status "
              + item.getStatus()
              + ")");
    }
    var now = Instant.now();
    Transition transition =
        switch (outcome.kind()) {
          case SENT -> ActionStateMachine.succeed(item, outcome.providerReference(), now);
          case REJECTED -> ActionStateMachine.reject(item, outcome.reason(), now);
          case RATE_LIMITED -> ActionStateMachine.rateLimit(item, outcome.nextWindow());
          case PROVIDER_ERROR ->
              ActionStateMachine.fail(item, outcome.reason(), now, properties.backoffPolicy());
        };
    return persist(transition, outcome.slotDate(), now);
  }

  @Transactional
  public ActionQueueItem cancel(TenantContext context, UUID itemId, String reason) {
    var item = lockItem(itemId);
    if (!context.owns(item.getTenantId())) {
      throw new ResourceNotFoundException("Action", itemId);
    }
    if (!item.getStatus().isDequeueable()) {
      throw new InvalidStateException(
          "Cannot cancel", "Action " + itemId + " is " + item.getStatus());
    }
    var now = Instant.now();
    return persist(ActionStateMachine.cancel(item, reason, now), null, now);
  }

  /** Ids of PROCESSING items whose lease has run out. */
  @Transactional(readOnly = true)
  public List<UUID> staleClaimIds(Instant now) {
    return queueRepository.findStaleClaimIds(
        ActionStatus.PROCESSING, now.minus(properties.leaseDuration()));
  }

  /**
   * Returns an abandoned claim to the queue, or fails it if no attempts remain.
   *
   * @return false if the item was completed or re-claimed in the meantime
   */
  @Transactional
  public boolean expireLease(UUID itemId, Instant now) {
    var item = lockItem(itemId);
    if (item.getStatus() != ActionStatus.PROCESSING
        || item.getClaimedAt() == null
        || !item.getClaimedAt().isBefore(now.minus(properties.leaseDuration()))) {
      return false;
    }
    log.warn(
        "Lease of action {} held by {} since {} expired",
        itemId,
        item.getClaimedBy(),
        item.getClaimedAt());
    persist(ActionStateMachine.expireLease(item, now, properties.backoffPolicy()), null, now);
    return true;
  }

  @Transactional(readOnly = true)
  public ActionQueueItem getItem(TenantContext context, UUID itemId) {
    return queueRepository
        .findById(itemId)
        .filter(item -> context.owns(item.getTenantId()))
        .orElseThrow(() -> new ResourceNotFoundException("Action", itemId));
  }

  @Transactional(readOnly = true)
  public List<ActionQueueItem> listItems(TenantContext context, ActionStatus status) {
    if (status == null) {
      return queueRepository.findByTenantIdOrderByScheduledAtAsc(context.tenantId());
    }
    return queueRepository.findByTenantIdAndStatusOrderByScheduledAtAsc(context.tenantId(), status);
  }

  @Transactional(readOnly = true)
  public Map<ActionStatus, Long> stats() {
    return toMap(queueRepository.countByStatus());
  }

  @Transactional(readOnly = true)
  public Map<ActionStatus, Long> tenantStats(TenantContext context) {
    return toMap(queueRepository.countByStatusForTenant(context.tenantId()));
  }

  private ActionQueueItem persist(Transition transition, LocalDate slotDate, Instant now) {
    var item = queueRepository.save(transition.item());
    for (SideEffect effect : transition.sideEffects()) {
      switch (effect) {
        case RECORD_SEND_EVENT ->
            healthMonitorService.reportSendEvent(
                item.getResourceId(),
                item.getTenantId(),
                item.getActionType().sendEventType(),
                now);
        case RECORD_LEAD_TOUCH -> {
          if (!leadPoolService.recordDeliveredTouch(
              item.getTenantId(), item.getLeadId(), item.getChannel(), now)) {
            log.warn(
                "Action {} sent but lead {} is no longer assigned to tenant {}",
                item.getId(),
                item.getLeadId(),
                item.getTenantId());
          }
        }
        case RECORD_GRANT_USAGE ->
            resourceAllocator.recordUsage(item.getTenantId(), item.getResourceId(), now);
        case REFUND_DAILY_SLOT -> {
          if (slotDate != null) {
            dailyCapService.refund(item.getResourceId(), slotDate);
          }
        }
        case ALERT_OPERATIONS -> operationalAlerts.actionFailed(item);
      }
    }
    return item;
  }

  private ActionQueueItem lockItem(UUID itemId) {
    return queueRepository
        .findByIdForUpdate(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("Action", itemId));
  }

  private static Map<ActionStatus, Long> toMap(List<ActionQueueRepository.StatusCount> counts) {
    var result = new EnumMap<ActionStatus, Long>(ActionStatus.class);
    for (ActionStatus status : ActionStatus.values()) {
      result.put(status, 0L);
    }
    counts.forEach(c -> result.put(c.getStatus(), c.getCount()));
    return result;
  }
}
