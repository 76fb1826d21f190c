package io.b2mash.outreach.queue;

import io.b2mash.outreach.queue.ActionDispatcher.DispatchResult;
import io.b2mash.outreach.tenant.TenantContextResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ActionQueueController {

  private final ActionQueueService queueService;
  private final ActionDispatcher dispatcher;
  private final TenantContextResolver tenantContextResolver;
  private final QueueProperties queueProperties;

  public ActionQueueController(
      ActionQueueService queueService,
      ActionDispatcher dispatcher,
      TenantContextResolver tenantContextResolver,
      QueueProperties queueProperties) {
    this.queueService = queueService;
    this.dispatcher = dispatcher;
    this.tenantContextResolver = tenantContextResolver;
    this.queueProperties = queueProperties;
  }

  @PostMapping("/internal/tenants/{tenantId}/actions")
  public ResponseEntity<ActionResponse> enqueue(
      @PathVariable UUID tenantId, @Valid @RequestBody EnqueueActionRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var item =
        queueService.enqueue(
            context,
            new ActionQueueService.EnqueueCommand(
                request.resourceId(),
                request.leadId(),
                request.campaignId(),
                request.actionType(),
                request.payloadRef(),
                request.scheduledAt(),
                request.priority() != null ? request.priority() : 0,
                request.maxAttempts() != null
                    ? request.maxAttempts()
                    : ActionQueueItem.DEFAULT_MAX_ATTEMPTS));
    return ResponseEntity.created(
            URI.create("/internal/tenants/" + tenantId + "/actions/" + item.getId()))
        .body(ActionResponse.from(item));
  }

  @GetMapping("/internal/tenants/{tenantId}/actions")
  public ResponseEntity<List<ActionResponse>> listActions(
      @PathVariable UUID tenantId, @RequestParam(required = false) ActionStatus status) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        queueService.listItems(context, status).stream().map(ActionResponse::from).toList());
  }

  @GetMapping("/internal/tenants/{tenantId}/actions/{actionId}")
  public ResponseEntity<ActionResponse> getAction(
      @PathVariable UUID tenantId, @PathVariable UUID actionId) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(ActionResponse.from(queueService.getItem(context, actionId)));
  }

  @PostMapping("/internal/tenants/{tenantId}/actions/{actionId}/cancel")
  public ResponseEntity<ActionResponse> cancelAction(
      @PathVariable UUID tenantId,
      @PathVariable UUID actionId,
      @RequestParam(required = false) String reason) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(ActionResponse.from(queueService.cancel(context, actionId, reason)));
  }

  @GetMapping("/internal/tenants/{tenantId}/actions/stats")
  public ResponseEntity<Map<ActionStatus, Long>> tenantStats(@PathVariable UUID tenantId) {
    return ResponseEntity.ok(queueService.tenantStats(tenantContextResolver.resolve(tenantId)));
  }

  @GetMapping("/internal/actions/stats")
  public ResponseEntity<Map<ActionStatus, Long>> stats() {
    return ResponseEntity.ok(queueService.stats());
  }

  /** Runs one dispatch pass on demand, e.g. from an operator or an external scheduler. */
  @PostMapping("/internal/actions/dispatch")
  public ResponseEntity<Map<DispatchResult, Integer>> dispatch(
      @Valid @RequestBody DispatchRequest request) {
    String workerId =
        request.workerId() != null && !request.workerId().isBlank()
            ? request.workerId()
            : queueProperties.workerId();
    return ResponseEntity.ok(dispatcher.drain(request.resourceId(), workerId, request.max()));
  }

  public record EnqueueActionRequest(
      @NotNull(message = "resourceId is required") UUID resourceId,
      @NotNull(message = "leadId is required") UUID leadId,
      UUID campaignId,
      @NotNull(message = "actionType is required") ActionType actionType,
      String payloadRef,
      Instant scheduledAt,
      Integer priority,
      @Min(value = 1, message = "maxAttempts must be at least 1") Integer maxAttempts) {}

  public record DispatchRequest(
      UUID resourceId,
      String workerId,
      @Min(value = 1, message = "max must be at least 1")
          @Max(value = 500, message = "max must be at most 500")
          int max) {}

  public record ActionResponse(
      UUID id,
      UUID resourceId,
      UUID leadId,
      UUID campaignId,
      ActionType actionType,
      String channel,
      ActionStatus status,
      int priority,
      Instant scheduledAt,
      int attempts,
      int maxAttempts,
      String lastError,
      String providerReference,
      Instant processedAt) {

    public static ActionResponse from(ActionQueueItem item) {
      return new ActionResponse(
          item.getId(),
          item.getResourceId(),
          item.getLeadId(),
          item.getCampaignId(),
          item.getActionType(),
          item.getChannel().name(),
          item.getStatus(),
          item.getPriority(),
          item.getScheduledAt(),
          item.getAttempts(),
          item.getMaxAttempts(),
          item.getLastError(),
          item.getProviderReference(),
          item.getProcessedAt());
    }
  }
}
