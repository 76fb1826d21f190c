package io.b2mash.outreach.resource;

import io.b2mash.outreach.health.HealthStatus;
import io.b2mash.outreach.tenant.TenantContextResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ResourceController {

  private final ResourceAllocator resourceAllocator;
  private final TenantContextResolver tenantContextResolver;

  public ResourceController(
      ResourceAllocator resourceAllocator, TenantContextResolver tenantContextResolver) {
    this.resourceAllocator = resourceAllocator;
    this.tenantContextResolver = tenantContextResolver;
  }

  // --- Pool administration ---

  @PostMapping("/internal/resources")
  public ResponseEntity<ResourceResponse> addResource(
      @Valid @RequestBody AddResourceRequest request) {
    var resource =
        resourceAllocator.addResource(
            new ResourceAllocator.AddResourceCommand(
                request.resourceType(),
                request.resourceValue(),
                request.maxTenants() != null ? request.maxTenants() : 1,
                request.provider(),
                request.providerId(),
                request.activatedAt()));
    return ResponseEntity.created(URI.create("/internal/resources/" + resource.getId()))
        .body(ResourceResponse.from(resource));
  }

  @GetMapping("/internal/resources/{resourceId}")
  public ResponseEntity<ResourceResponse> getResource(@PathVariable UUID resourceId) {
    return ResponseEntity.ok(ResourceResponse.from(resourceAllocator.getResource(resourceId)));
  }

  @GetMapping("/internal/resources/candidates")
  public ResponseEntity<List<ResourceResponse>> candidates(
      @RequestParam ResourceType type, @RequestParam(defaultValue = "10") int count) {
    return ResponseEntity.ok(
        resourceAllocator.selectCandidates(type, count).stream()
            .map(ResourceResponse::from)
            .toList());
  }

  @PostMapping("/internal/resources/{resourceId}/activate")
  public ResponseEntity<ResourceResponse> activate(
      @PathVariable UUID resourceId, @RequestParam(required = false) Instant at) {
    return ResponseEntity.ok(ResourceResponse.from(resourceAllocator.activate(resourceId, at)));
  }

  @PostMapping("/internal/resources/{resourceId}/retire")
  public ResponseEntity<ResourceResponse> retire(
      @PathVariable UUID resourceId, @RequestParam(required = false) String reason) {
    return ResponseEntity.ok(ResourceResponse.from(resourceAllocator.retire(resourceId, reason)));
  }

  @GetMapping("/internal/resources/stats")
  public ResponseEntity<List<ResourceAllocator.PoolStats>> poolStats() {
    return ResponseEntity.ok(resourceAllocator.poolStats());
  }

  // --- Tenant grants ---

  @PostMapping("/internal/tenants/{tenantId}/resources/request")
  public ResponseEntity<List<GrantResponse>> requestResources(
      @PathVariable UUID tenantId, @Valid @RequestBody ResourceRequest request) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        resourceAllocator.requestResources(context, request.resourceType(), request.count())
            .stream()
            .map(GrantResponse::from)
            .toList());
  }

  @PostMapping("/internal/tenants/{tenantId}/resources/{resourceId}/grant")
  public ResponseEntity<GrantResponse> grant(
      @PathVariable UUID tenantId, @PathVariable UUID resourceId) {
    var context = tenantContextResolver.resolve(tenantId);
    var grant = resourceAllocator.grant(context, resourceId);
    return ResponseEntity.created(
            URI.create("/internal/tenants/" + tenantId + "/resource-grants/" + grant.getId()))
        .body(GrantResponse.from(grant));
  }

  @PostMapping("/internal/tenants/{tenantId}/resource-grants/{grantId}/revoke")
  public ResponseEntity<GrantResponse> revoke(
      @PathVariable UUID tenantId, @PathVariable UUID grantId) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(GrantResponse.from(resourceAllocator.revoke(context, grantId)));
  }

  @GetMapping("/internal/tenants/{tenantId}/resource-grants")
  public ResponseEntity<List<GrantResponse>> listGrants(@PathVariable UUID tenantId) {
    var context = tenantContextResolver.resolve(tenantId);
    return ResponseEntity.ok(
        resourceAllocator.activeGrants(context).stream().map(GrantResponse::from).toList());
  }

  public record AddResourceRequest(
      @NotNull(message = "resourceType is required") ResourceType resourceType,
      @NotBlank(message = "resourceValue is required") String resourceValue,
      @Min(value = 1, message = "maxTenants must be at least 1") Integer maxTenants,
      String provider,
      String providerId,
      Instant activatedAt) {}

  public record ResourceRequest(
      @NotNull(message = "resourceType is required") ResourceType resourceType,
      @Min(value = 1, message = "count must be at least 1")
          @Max(value = 50, message = "count must be at most 50")
          int count) {}

  public record ResourceResponse(
      UUID id,
      ResourceType resourceType,
      String resourceValue,
      int maxTenants,
      int currentTenants,
      ResourceStatus status,
      String timezone,
      Instant activatedAt,
      Instant warmupCompletedAt,
      int reputationScore,
      HealthStatus healthStatus,
      double bounceRate,
      double complaintRate,
      Double acceptRate,
      Integer dailyLimitOverride,
      Integer acceptRateCap,
      Instant healthCheckedAt) {

    public static ResourceResponse from(PoolResource resource) {
      return new ResourceResponse(
          resource.getId(),
          resource.getResourceType(),
          resource.getResourceValue(),
          resource.getMaxTenants(),
          resource.getCurrentTenants(),
          resource.getStatus(),
          resource.getTimezone(),
          resource.getActivatedAt(),
          resource.getWarmupCompletedAt(),
          resource.getReputationScore(),
          resource.getHealthStatus(),
          resource.getBounceRate(),
          resource.getComplaintRate(),
          resource.getAcceptRate(),
          resource.getDailyLimitOverride(),
          resource.getAcceptRateCap(),
          resource.getHealthCheckedAt());
    }
  }

  public record GrantResponse(
      UUID id,
      UUID resourceId,
      ResourceType resourceType,
      GrantStatus status,
      Instant grantedAt,
      Instant releasedAt,
      long totalSends,
      Instant lastUsedAt) {

    public static GrantResponse from(TenantResourceGrant grant) {
      return new GrantResponse(
          grant.getId(),
          grant.getResourceId(),
          grant.getResourceType(),
          grant.getStatus(),
          grant.getGrantedAt(),
          grant.getReleasedAt(),
          grant.getTotalSends(),
          grant.getLastUsedAt());
    }
  }
}
