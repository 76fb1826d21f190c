package io.b2mash.outreach.pool;

import io.b2mash.outreach.tenant.TenantContextResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Tenant-scoped lead operations: assignment lifecycle, pre-send checks and suppressions. */
@RestController
@RequestMapping("/internal/tenants/{tenantId}")
public class LeadAssignmentController {

  private final LeadPoolService leadPoolService;
  private final JitValidator jitValidator;
  private final TenantContextResolver tenantContextResolver;

  public LeadAssignmentController(
      LeadPoolService leadPoolService,
      JitValidator jitValidator,
      TenantContextResolver tenantContextResolver) {
    this.leadPoolService = leadPoolService;
    this.jitValidator = jitValidator;
    this.tenantContextResolver = tenantContextResolver;
  }

  @PostMapping("/leads/{leadId}/assign")
  public ResponseEntity<AssignmentResponse> assign(
      @PathVariable UUID tenantId,
      @PathVariable UUID leadId,
      @RequestBody(required = false) AssignRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var body = request != null ? request : new AssignRequest(null, null, null);
    var assignment =
        leadPoolService.assign(
            context,
            leadId,
            body.campaignId(),
            body.reason(),
            body.assignedBy() != null ? body.assignedBy() : "api");
    return ResponseEntity.created(
            URI.create("/internal/tenants/" + tenantId + "/assignments/" + assignment.getId()))
        .body(AssignmentResponse.from(assignment));
  }

  @PostMapping("/leads/allocate")
  public ResponseEntity<List<AssignmentResponse>> allocate(
      @PathVariable UUID tenantId, @Valid @RequestBody AllocateRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var criteria =
        new AllocationCriteria(
            request.industries(),
            request.countries(),
            request.seniorities(),
            request.minEmployees(),
            request.maxEmployees(),
            request.emailVerifications());
    return ResponseEntity.ok(
        leadPoolService.allocateMatching(context, criteria, request.count(), request.campaignId())
            .stream()
            .map(AssignmentResponse::from)
            .toList());
  }

  @PostMapping("/leads/{leadId}/touches")
  public ResponseEntity<AssignmentResponse> recordTouch(
      @PathVariable UUID tenantId,
      @PathVariable UUID leadId,
      @Valid @RequestBody TouchRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var at = request.at() != null ? request.at() : Instant.now();
    return ResponseEntity.ok(
        AssignmentResponse.from(
            leadPoolService.recordTouch(context, leadId, request.channel(), at)));
  }

  @GetMapping("/assignments")
  public ResponseEntity<List<AssignmentResponse>> activeAssignments(@PathVariable UUID tenantId) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        leadPoolService.activeAssignments(context).stream()
            .map(AssignmentResponse::from)
            .toList());
  }

  @GetMapping("/assignments/stats")
  public ResponseEntity<LeadPoolService.TenantLeadStats> assignmentStats(
      @PathVariable UUID tenantId) {
    return ResponseEntity.ok(leadPoolService.tenantStats(tenantContextResolver.resolve(tenantId)));
  }

  @PostMapping("/assignments/{assignmentId}/release")
  public ResponseEntity<AssignmentResponse> release(
      @PathVariable UUID tenantId,
      @PathVariable UUID assignmentId,
      @RequestParam(required = false) String reason) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        AssignmentResponse.from(leadPoolService.release(context, assignmentId, reason)));
  }

  @PostMapping("/assignments/{assignmentId}/convert")
  public ResponseEntity<AssignmentResponse> convert(
      @PathVariable UUID tenantId,
      @PathVariable UUID assignmentId,
      @RequestParam(required = false) String conversionType) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        AssignmentResponse.from(
            leadPoolService.markConverted(context, assignmentId, conversionType)));
  }

  @PostMapping("/assignments/{assignmentId}/reply")
  public ResponseEntity<AssignmentResponse> recordReply(
      @PathVariable UUID tenantId,
      @PathVariable UUID assignmentId,
      @Valid @RequestBody ReplyRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var at = request.at() != null ? request.at() : Instant.now();
    return ResponseEntity.ok(
        AssignmentResponse.from(
            leadPoolService.recordReply(context, assignmentId, request.intent(), at)));
  }

  @PostMapping("/assignments/{assignmentId}/cooling")
  public ResponseEntity<AssignmentResponse> applyCooling(
      @PathVariable UUID tenantId,
      @PathVariable UUID assignmentId,
      @Valid @RequestBody CoolingRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        AssignmentResponse.from(
            leadPoolService.applyCoolingPeriod(context, assignmentId, request.until())));
  }

  @PostMapping("/jit-validations")
  public ResponseEntity<JitResult> validate(
      @PathVariable UUID tenantId, @Valid @RequestBody JitRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var now = Instant.now();
    var result =
        request.leadId() != null
            ? jitValidator.validate(context, request.leadId(), request.channel(), now)
            : jitValidator.validateByEmail(context, request.email(), request.channel(), now);
    return ResponseEntity.ok(result);
  }

  @PostMapping("/jit-validations/batch")
  public ResponseEntity<Map<UUID, JitResult>> validateBatch(
      @PathVariable UUID tenantId, @Valid @RequestBody JitBatchRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        jitValidator.validateBatch(context, request.leadIds(), request.channel(), Instant.now()));
  }

  @GetMapping("/suppressions")
  public ResponseEntity<List<SuppressionResponse>> listSuppressions(@PathVariable UUID tenantId) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        leadPoolService.listSuppressions(context).stream().map(SuppressionResponse::from).toList());
  }

  @PostMapping("/suppressions")
  public ResponseEntity<SuppressionResponse> suppress(
      @PathVariable UUID tenantId, @Valid @RequestBody SuppressionRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var entry =
        leadPoolService.suppress(context, request.kind(), request.value(), request.reason());
    return ResponseEntity.created(
            URI.create("/internal/tenants/" + tenantId + "/suppressions/" + entry.getId()))
        .body(SuppressionResponse.from(entry));
  }

  @DeleteMapping("/suppressions/{entryId}")
  public ResponseEntity<Void> removeSuppression(
      @PathVariable UUID tenantId, @PathVariable UUID entryId) {
    leadPoolService.removeSuppression(tenantContextResolver.resolve(tenantId), entryId);
    return ResponseEntity.noContent().build();
  }

  public record AssignRequest(UUID campaignId, String reason, String assignedBy) {}

  public record AllocateRequest(
      @Min(value = 1, message = "count must be at least 1") int count,
      UUID campaignId,
      List<String> industries,
      List<String> countries,
      List<String> seniorities,
      Integer minEmployees,
      Integer maxEmployees,
      List<EmailVerification> emailVerifications) {}

  public record TouchRequest(
      @NotNull(message = "channel is required") Channel channel, Instant at) {}

  public record ReplyRequest(@NotBlank(message = "intent is required") String intent, Instant at) {}

  public record CoolingRequest(@NotNull(message = "until is required") Instant until) {}

  public record JitRequest(
      UUID leadId, String email, @NotNull(message = "channel is required") Channel channel) {}

  public record JitBatchRequest(
      @NotEmpty(message = "leadIds is required") List<UUID> leadIds,
      @NotNull(message = "channel is required") Channel channel) {}

  public record SuppressionRequest(
      @NotNull(message = "kind is required") SuppressionKind kind,
      @NotBlank(message = "value is required") String value,
      String reason) {}

  public record AssignmentResponse(
      UUID id,
      UUID leadId,
      UUID campaignId,
      AssignmentStatus status,
      Instant assignedAt,
      String assignedBy,
      Instant releasedAt,
      String releaseReason,
      Instant convertedAt,
      int totalTouches,
      int maxTouches,
      List<String> channelsUsed,
      Instant lastContactedAt,
      boolean replied,
      String replyIntent,
      Instant coolingUntil) {

    public static AssignmentResponse from(LeadAssignment assignment) {
      return new AssignmentResponse(
          assignment.getId(),
          assignment.getLeadId(),
          assignment.getCampaignId(),
          assignment.getStatus(),
          assignment.getAssignedAt(),
          assignment.getAssignedBy(),
          assignment.getReleasedAt(),
          assignment.getReleaseReason(),
          assignment.getConvertedAt(),
          assignment.getTotalTouches(),
          assignment.getMaxTouches(),
          assignment.getChannelsUsed(),
          assignment.getLastContactedAt(),
          assignment.hasReplied(),
          assignment.getReplyIntent(),
          assignment.getCoolingUntil());
    }
  }

  public record SuppressionResponse(
      UUID id, SuppressionKind kind, String value, String reason, Instant createdAt) {

    public static SuppressionResponse from(SuppressionEntry entry) {
      return new SuppressionResponse(
          entry.getId(),
          entry.getKind(),
          entry.getValue(),
          entry.getReason(),
          entry.getCreatedAt());
    }
  }
}
