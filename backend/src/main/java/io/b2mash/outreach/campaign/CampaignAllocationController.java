package io.b2mash.outreach.campaign;

import io.b2mash.outreach.pool.AllocationCriteria;
import io.b2mash.outreach.pool.EmailVerification;
import io.b2mash.outreach.tenant.TenantContextResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants/{tenantId}/campaign-allocations")
public class CampaignAllocationController {

  private final CampaignAllocationService allocationService;
  private final TenantContextResolver tenantContextResolver;

  public CampaignAllocationController(
      CampaignAllocationService allocationService, TenantContextResolver tenantContextResolver) {
    this.allocationService = allocationService;
    this.tenantContextResolver = tenantContextResolver;
  }

  @GetMapping
  public ResponseEntity<SummaryResponse> summary(@PathVariable UUID tenantId) {
    var summary = allocationService.summary(tenantContextResolver.resolve(tenantId));
    return ResponseEntity.ok(
        new SummaryResponse(
            summary.allocatedPct(),
            summary.remainingPct(),
            summary.campaigns().stream().map(AllocationResponse::from).toList()));
  }

  @PostMapping("/validate")
  public ResponseEntity<CampaignAllocationService.AllocationCheck> validate(
      @PathVariable UUID tenantId, @Valid @RequestBody ValidateRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        allocationService.validate(context, request.campaignId(), request.leadAllocationPct()));
  }

  @PutMapping("/{campaignId}")
  public ResponseEntity<AllocationResponse> upsert(
      @PathVariable UUID tenantId,
      @PathVariable UUID campaignId,
      @Valid @RequestBody UpsertAllocationRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        AllocationResponse.from(
            allocationService.upsert(
                context, campaignId, request.name(), request.leadAllocationPct())));
  }

  @GetMapping("/{campaignId}")
  public ResponseEntity<AllocationResponse> get(
      @PathVariable UUID tenantId, @PathVariable UUID campaignId) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        AllocationResponse.from(allocationService.getAllocation(context, campaignId)));
  }

  @PostMapping("/{campaignId}/status")
  public ResponseEntity<AllocationResponse> changeStatus(
      @PathVariable UUID tenantId,
      @PathVariable UUID campaignId,
      @Valid @RequestBody StatusChangeRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        AllocationResponse.from(
            allocationService.changeStatus(context, campaignId, request.status())));
  }

  @GetMapping("/{campaignId}/lead-share")
  public ResponseEntity<Map<String, Integer>> leadShare(
      @PathVariable UUID tenantId, @PathVariable UUID campaignId, @RequestParam int totalLeads) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        Map.of("leadShare", allocationService.leadShare(context, campaignId, totalLeads)));
  }

  @PostMapping("/distribute")
  public ResponseEntity<Map<UUID, Integer>> distribute(
      @PathVariable UUID tenantId, @Valid @RequestBody DistributeRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    var criteria =
        new AllocationCriteria(
            request.industries(),
            request.countries(),
            request.seniorities(),
            request.minEmployees(),
            request.maxEmployees(),
            request.emailVerifications());
    return ResponseEntity.ok(allocationService.distribute(context, criteria, request.totalLeads()));
  }

  public record ValidateRequest(
      @NotNull(message = "campaignId is required") UUID campaignId,
      @Min(value = 1, message = "leadAllocationPct must be at least 1")
          @Max(value = 100, message = "leadAllocationPct must be at most 100")
          int leadAllocationPct) {}

  public record UpsertAllocationRequest(
      @NotBlank(message = "name is required") String name,
      @Min(value = 1, message = "leadAllocationPct must be at least 1")
          @Max(value = 100, message = "leadAllocationPct must be at most 100")
          int leadAllocationPct) {}

  public record StatusChangeRequest(
      @NotNull(message = "status is required") CampaignStatus status) {}

  public record DistributeRequest(
      @Min(value = 1, message = "totalLeads must be at least 1") int totalLeads,
      List<String> industries,
      List<String> countries,
      List<String> seniorities,
      Integer minEmployees,
      Integer maxEmployees,
      List<EmailVerification> emailVerifications) {}

  public record SummaryResponse(
      int allocatedPct, int remainingPct, List<AllocationResponse> campaigns) {}

  public record AllocationResponse(
      UUID id,
      UUID campaignId,
      String name,
      int leadAllocationPct,
      CampaignStatus status,
      Instant createdAt,
      Instant updatedAt) {

    public static AllocationResponse from(CampaignAllocation allocation) {
      return new AllocationResponse(
          allocation.getId(),
          allocation.getCampaignId(),
          allocation.getName(),
          allocation.getLeadAllocationPct(),
          allocation.getStatus(),
          allocation.getCreatedAt(),
          allocation.getUpdatedAt());
    }
  }
}
