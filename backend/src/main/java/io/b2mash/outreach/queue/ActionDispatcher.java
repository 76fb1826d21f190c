package io.b2mash.outreach.queue;

import io.b2mash.outreach.exception.ForbiddenException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.pool.JitValidator;
import io.b2mash.outreach.resource.ResourceAllocator;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantContextResolver;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Works claimed queue items: re-validates the lead, reserves a daily slot, calls the provider and
 * reports the outcome. Not transactional: each step commits on its own and no row lock is held
 * while the provider is called.
 */
@Component
public class ActionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

  public enum DispatchResult {
    SENT,
    REJECTED,
    RATE_LIMITED,
    RETRY_SCHEDULED,
    FAILED
  }

  private final ActionQueueService queueService;
  private final JitValidator jitValidator;
  private final TenantContextResolver tenantContextResolver;
  private final ResourceAllocator resourceAllocator;
  private final DailyCapService dailyCapService;
  private final DeliveryProvider deliveryProvider;

  public ActionDispatcher(
      ActionQueueService queueService,
      JitValidator jitValidator,
      TenantContextResolver tenantContextResolver,
      ResourceAllocator resourceAllocator,
      DailyCapService dailyCapService,
      DeliveryProvider deliveryProvider) {
    this.queueService = queueService;
    this.jitValidator = jitValidator;
    this.tenantContextResolver = tenantContextResolver;
    this.resourceAllocator = resourceAllocator;
    this.dailyCapService = dailyCapService;
    this.deliveryProvider = deliveryProvider;
  }

  /** Dispatches one item previously claimed by {@code workerId}. */
  public DispatchResult dispatch(ActionQueueItem item, String workerId) {
    var now = Instant.now();

    TenantContext context;
    try {
      context = tenantContextResolver.resolve(item.getTenantId());
    } catch (ForbiddenException | ResourceNotFoundException e) {
      queueService.complete(item.getId(), workerId, ActionOutcome.rejected("tenant_inactive"));
      return DispatchResult.REJECTED;
    }
    if (!resourceAllocator.holds(context, item.getResourceId())) {
      queueService.complete(item.getId(), workerId, ActionOutcome.rejected("resource_not_granted"));
      return DispatchResult.REJECTED;
    }

    var jit = jitValidator.validate(context, item.getLeadId(), item.getChannel(), now);
    if (!jit.valid()) {
      log.info("Action {} rejected before send: {}", item.getId(), jit.rejection());
      queueService.complete(item.getId(), workerId, ActionOutcome.rejected(jit.rejection()));
      return DispatchResult.REJECTED;
    }

    var reservation = dailyCapService.tryReserve(item.getResourceId(), now);
    if (!reservation.reserved()) {
      queueService.complete(
          item.getId(), workerId, ActionOutcome.rateLimited(reservation.nextWindow()));
      return DispatchResult.RATE_LIMITED;
    }

    var resource = resourceAllocator.getResource(item.getResourceId());
    var request =
        new DeliveryRequest(
            item.getId(),
            item.getTenantId(),
            resource.getId(),
            resource.getResourceValue(),
            item.getLeadId(),
            item.getActionType(),
            item.getPayloadRef());

    DeliveryReceipt receipt;
    try {
      receipt = deliveryProvider.deliver(request);
    } catch (DeliveryProviderException e) {
      log.warn(
          "Provider {} failed action {}: {}",
          deliveryProvider.providerId(),
          item.getId(),
          e.getMessage());
      return failed(item, workerId, e.getMessage(), reservation);
    } catch (RuntimeException e) {
      log.error("Provider {} threw on action {}", deliveryProvider.providerId(), item.getId(), e);
      return failed(item, workerId, "unexpected provider error: " + e.getMessage(), reservation);
    }

    queueService.complete(item.getId(), workerId, ActionOutcome.sent(receipt.providerReference()));
    return DispatchResult.SENT;
  }

  /**
   * Claims and dispatches up to {@code max} due items. A failure on one item is logged and does not
   * stop the pass; its claim is recovered by the lease reaper.
   */
  public Map<DispatchResult, Integer> drain(UUID resourceId, String workerId, int max) {
    var results = new EnumMap<DispatchResult, Integer>(DispatchResult.class);
    for (int i = 0; i < max; i++) {
      var next = queueService.dequeueNext(resourceId, workerId);
      if (next.isEmpty()) {
        break;
      }
      var item = next.get();
      try {
        results.merge(dispatch(item, workerId), 1, Integer::sum);
      } catch (Exception e) {
        log.error("Failed to dispatch action {}", item.getId(), e);
      }
    }
    return results;
  }

  private DispatchResult failed(
      ActionQueueItem item,
      String workerId,
      String error,
      DailyCapService.Reservation reservation) {
    var updated =
        queueService.complete(
            item.getId(), workerId, ActionOutcome.providerError(error, reservation.stateDate()));
    return updated.getStatus() == ActionStatus.FAILED
        ? DispatchResult.FAILED
        : DispatchResult.RETRY_SCHEDULED;
  }
}
