package io.b2mash.outreach.tenant;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class TenantController {

  private final TenantService tenantService;

  public TenantController(TenantService tenantService) {
    this.tenantService = tenantService;
  }

  @PostMapping
  public ResponseEntity<TenantResponse> createTenant(
      @Valid @RequestBody CreateTenantRequest request) {
    var tenant =
        tenantService.createTenant(
            request.name(),
            request.planSlug(),
            request.timezone() != null ? request.timezone() : "UTC");
    return ResponseEntity.created(URI.create("/internal/tenants/" + tenant.getId()))
        .body(TenantResponse.from(tenant));
  }

  @GetMapping("/{tenantId}")
  public ResponseEntity<TenantResponse> getTenant(@PathVariable UUID tenantId) {
    return ResponseEntity.ok(TenantResponse.from(tenantService.getTenant(tenantId)));
  }

  @PostMapping("/{tenantId}/plan-sync")
  public ResponseEntity<TenantResponse> syncPlan(
      @PathVariable UUID tenantId, @Valid @RequestBody PlanSyncRequest request) {
    return ResponseEntity.ok(
        TenantResponse.from(tenantService.syncPlan(tenantId, request.planSlug())));
  }

  @PutMapping("/{tenantId}/scoring-profile")
  public ResponseEntity<TenantResponse> updateScoringProfile(
      @PathVariable UUID tenantId, @RequestBody ScoringProfileRequest request) {
    return ResponseEntity.ok(
        TenantResponse.from(
            tenantService.updateScoringProfile(
                tenantId,
                request.targetIndustries(),
                request.competitorDomains(),
                request.weights())));
  }

  @PostMapping("/{tenantId}/churn")
  public ResponseEntity<TenantService.ChurnResult> churn(@PathVariable UUID tenantId) {
    return ResponseEntity.ok(tenantService.churn(tenantId));
  }

  public record CreateTenantRequest(
      @NotBlank(message = "name is required") String name,
      @NotBlank(message = "planSlug is required") String planSlug,
      String timezone) {}

  public record PlanSyncRequest(@NotBlank(message = "planSlug is required") String planSlug) {}

  public record ScoringProfileRequest(
      List<String> targetIndustries, List<String> competitorDomains, Map<String, Object> weights) {}

  public record TenantResponse(
      UUID id,
      String name,
      Tier tier,
      String planSlug,
      String timezone,
      TenantStatus status,
      List<String> targetIndustries,
      List<String> competitorDomains,
      Instant createdAt) {

    public static TenantResponse from(Tenant tenant) {
      return new TenantResponse(
          tenant.getId(),
          tenant.getName(),
          tenant.getTier(),
          tenant.getPlanSlug(),
          tenant.getTimezone(),
          tenant.getStatus(),
          tenant.getTargetIndustries(),
          tenant.getCompetitorDomains(),
          tenant.getCreatedAt());
    }
  }
}
