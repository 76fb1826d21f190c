package io.b2mash.outreach.resource;

import io.b2mash.outreach.audit.AuditEventBuilder;
import io.b2mash.outreach.audit.AuditService;
import io.b2mash.outreach.exception.CapacityExceededException;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.exception.PlanLimitExceededException;
import io.b2mash.outreach.exception.ResourceConflictException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantRepository;
import io.b2mash.outreach.tenant.TierQuotas;
import io.b2mash.outreach.warmup.WarmupScheduler;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates shared resources to tenants. The capacity comparison and increment happen on a row
 * held with {@code PESSIMISTIC_WRITE}, and a CHECK constraint on {@code current_tenants <=
 * max_tenants} backs it up.
 */
@Service
public class ResourceAllocator {

  private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

  static final int BUFFER_WARNING_PCT = 40;
  static final int BUFFER_CRITICAL_PCT = 20;

  private static final Set<ResourceStatus> SHAREABLE =
      EnumSet.of(ResourceStatus.AVAILABLE, ResourceStatus.WARMING);

  private final PoolResourceRepository resourceRepository;
  private final TenantResourceGrantRepository grantRepository;
  private final TenantRepository tenantRepository;
  private final WarmupScheduler warmupScheduler;
  private final AuditService auditService;

  public ResourceAllocator(
      PoolResourceRepository resourceRepository,
      TenantResourceGrantRepository grantRepository,
      TenantRepository tenantRepository,
      WarmupScheduler warmupScheduler,
      AuditService auditService) {
    this.resourceRepository = resourceRepository;
    this.grantRepository = grantRepository;
    this.tenantRepository = tenantRepository;
    this.warmupScheduler = warmupScheduler;
    this.auditService = auditService;
  }

  /** Attributes of a new pool resource. */
  public record AddResourceCommand(
      ResourceType resourceType,
      String resourceValue,
      int maxTenants,
      String provider,
      String providerId,
      Instant activatedAt) {}

  /** Buffer of spare resources for one type. */
  public record PoolStats(
      ResourceType resourceType,
      int total,
      int withSpareCapacity,
      int saturated,
      int warming,
      int bufferPct,
      BufferLevel bufferLevel) {}

  public enum BufferLevel {
    OK,
    LOW,
    CRITICAL
  }

  @Transactional(readOnly = true)
  public List<PoolResource> selectCandidates(ResourceType type, int count) {
    return resourceRepository.findCandidates(
        type, SHAREABLE, PageRequest.of(0, Math.max(1, count)));
  }

  /**
   * Grants one resource to the calling tenant.
   *
   * @throws ResourceNotFoundException if the resource does not exist
   * @throws CapacityExceededException if the resource is already at {@code maxTenants}
   * @throws ResourceConflictException if the tenant already holds the resource
   * @throws InvalidStateException if the resource is retired
   */
  @Transactional
  public TenantResourceGrant grant(TenantContext context, UUID resourceId) {
    var resource =
        resourceRepository
            .findByIdForUpdate(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    return grantLocked(context, resource);
  }

  /**
   * Grants up to {@code count} resources of a type to the calling tenant, best-ranked first. The
   * tenant row is locked so concurrent requests from one tenant cannot overshoot its quota.
   * Candidates lost to a concurrent grant are skipped; fewer than {@code count} grants are
   * returned when the pool runs dry.
   *
   * @throws PlanLimitExceededException if the request would exceed the tier quota
   */
  @Transactional
  public List<TenantResourceGrant> requestResources(
      TenantContext context, ResourceType type, int count) {
    if (count < 1) {
      throw new InvalidStateException("Invalid request", "count must be at least 1");
    }
    tenantRepository
        .findByIdForUpdate(context.tenantId())
        .orElseThrow(() -> new ResourceNotFoundException("Tenant", context.tenantId()));

    long held =
        grantRepository.countByTenantIdAndResourceTypeAndStatus(
            context.tenantId(), type, GrantStatus.ACTIVE);
    int quota = TierQuotas.maxResources(context.tier(), type);
    if (held + count > quota) {
      throw new PlanLimitExceededException(
          "Tier "
              + context.tier()
              + " allows "
              + quota
              + " "
              + type
              + " resources; "
              + held
              + " held, "
              + count
              + " requested");
    }

    var candidateIds =
        resourceRepository.findCandidateIdsForTenant(
            type, SHAREABLE, context.tenantId(), GrantStatus.ACTIVE, PageRequest.of(0, count * 3));
    var grants = new ArrayList<TenantResourceGrant>();
    for (UUID candidateId : candidateIds) {
      if (grants.size() == count) {
        break;
      }
      var locked = resourceRepository.findByIdForUpdate(candidateId).orElse(null);
      if (locked == null || !locked.hasSpareCapacity()) {
        log.debug("Candidate {} filled up concurrently, skipping", candidateId);
        continue;
      }
      grants.add(grantLocked(context, locked));
    }
    if (grants.size() < count) {
      log.warn(
          "Resource pool short for {}: granted {}/{} to tenant {}",
          type,
          grants.size(),
          count,
          context.tenantId());
    }
    return grants;
  }

  /**
   * Closes a grant and frees its slot on the resource.
   *
   * @throws ResourceNotFoundException if the grant does not belong to the tenant
   * @throws InvalidStateException if the grant is already released
   */
  @Transactional
  public TenantResourceGrant revoke(TenantContext context, UUID grantId) {
    var resourceId =
        grantRepository
            .findResourceIdByIdAndTenantId(grantId, context.tenantId())
            .orElseThrow(() -> new ResourceNotFoundException("Grant", grantId));
    var resource = lockResource(resourceId);
    // read under the resource lock so a concurrent revoke is visible
    var grant =
        grantRepository
            .findByIdForUpdate(grantId)
            .orElseThrow(() -> new ResourceNotFoundException("Grant", grantId));
    return revokeLocked(resource, grant);
  }

  /** Revokes every active grant of a tenant, e.g. when it churns. */
  @Transactional
  public int releaseAllForTenant(UUID tenantId) {
    var resourceIds =
        grantRepository.findResourceIdsByTenantIdAndStatus(tenantId, GrantStatus.ACTIVE);
    int released = 0;
    for (UUID resourceId : resourceIds) {
      var resource = lockResource(resourceId);
      var grant =
          grantRepository.findByTenantIdAndResourceIdAndStatus(
              tenantId, resourceId, GrantStatus.ACTIVE);
      if (grant.isPresent()) {
        revokeLocked(resource, grant.get());
        released++;
      }
    }
    log.info("Released {} resource grants for tenant {}", released, tenantId);
    return released;
  }

  @Transactional(readOnly = true)
  public List<TenantResourceGrant> activeGrants(TenantContext context) {
    return grantRepository.findByTenantIdAndStatus(context.tenantId(), GrantStatus.ACTIVE);
  }

  /** True when the tenant currently holds the resource. */
  @Transactional(readOnly = true)
  public boolean holds(TenantContext context, UUID resourceId) {
    return grantRepository.existsByTenantIdAndResourceIdAndStatus(
        context.tenantId(), resourceId, GrantStatus.ACTIVE);
  }

  /** Adds one send to the tenant's usage counters on the resource, if it still holds it. */
  @Transactional
  public void recordUsage(UUID tenantId, UUID resourceId, Instant at) {
    grantRepository
        .findByTenantIdAndResourceIdAndStatus(tenantId, resourceId, GrantStatus.ACTIVE)
        .ifPresent(grant -> grant.recordUsage(at));
  }

  /**
   * Adds a resource to the shared pool. It starts in warm-up unless its ramp is already at the
   * ceiling on the activation date.
   *
   * @throws ResourceConflictException if a resource with the same value exists
   */
  @Transactional
  public PoolResource addResource(AddResourceCommand command) {
    if (resourceRepository.existsByResourceValue(command.resourceValue())) {
      throw new ResourceConflictException(
          "Duplicate resource", "Resource " + command.resourceValue() + " already exists");
    }
    var resource =
        new PoolResource(
            command.resourceType(),
            command.resourceValue(),
            command.maxTenants() > 0 ? command.maxTenants() : 1,
            command.provider(),
            command.providerId());
    if (command.activatedAt() != null) {
      resource.activate(command.activatedAt());
      var now = Instant.now();
      if (warmupScheduler.hasReachedCeiling(resource, now)) {
        resource.completeWarmup(now);
      }
    }
    resource = resourceRepository.save(resource);
    log.info(
        "Added {} resource {} ({}), max tenants {}",
        resource.getResourceType(),
        resource.getId(),
        resource.getResourceValue(),
        resource.getMaxTenants());
    return resource;
  }

  /** Starts the warm-up clock of a resource. */
  @Transactional
  public PoolResource activate(UUID resourceId, Instant at) {
    var resource = lockResource(resourceId);
    resource.activate(at != null ? at : Instant.now());
    return resourceRepository.save(resource);
  }

  /**
   * Completes warm-up once the resource reaches the steady-state step of its ramp.
   *
   * @return true if the resource changed
   */
  @Transactional
  public boolean completeWarmupIfDue(UUID resourceId, Instant now) {
    var resource = lockResource(resourceId);
    if (resource.isWarmupComplete() || !warmupScheduler.hasReachedCeiling(resource, now)) {
      return false;
    }
    resource.completeWarmup(now);
    resourceRepository.save(resource);
    log.info("Resource {} completed warm-up", resourceId);
    return true;
  }

  @Transactional(readOnly = true)
  public List<UUID> warmingResourceIds() {
    return resourceRepository.findByStatusNot(ResourceStatus.RETIRED).stream()
        .filter(r -> !r.isWarmupComplete() && r.getActivatedAt() != null)
        .map(PoolResource::getId)
        .toList();
  }

  /**
   * Removes a resource from service permanently.
   *
   * @throws InvalidStateException if any tenant still holds it
   */
  @Transactional
  public PoolResource retire(UUID resourceId, String reason) {
    var resource = lockResource(resourceId);
    if (resource.getCurrentTenants() > 0) {
      throw new InvalidStateException(
          "Resource in use",
          "Resource " + resourceId + " is held by " + resource.getCurrentTenants() + " tenant(s)");
    }
    resource.retire();
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("resource.retired")
            .entityType("resource")
            .entityId(resourceId)
            .details(Map.of("reason", reason != null ? reason : ""))
            .build());
    return resourceRepository.save(resource);
  }

  @Transactional(readOnly = true)
  public PoolResource getResource(UUID resourceId) {
    return resourceRepository
        .findById(resourceId)
        .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
  }

  @Transactional(readOnly = true)
  public List<PoolStats> poolStats() {
    var stats = new ArrayList<PoolStats>();
    for (ResourceType type : ResourceType.values()) {
      var resources =
          resourceRepository.findByResourceTypeAndStatusNot(type, ResourceStatus.RETIRED);
      int total = resources.size();
      int spare = (int) resources.stream().filter(PoolResource::hasSpareCapacity).count();
      int warming =
          (int) resources.stream().filter(r -> r.getStatus() == ResourceStatus.WARMING).count();
      int bufferPct = total == 0 ? 0 : spare * 100 / total;
      stats.add(
          new PoolStats(type, total, spare, total - spare, warming, bufferPct, level(bufferPct)));
    }
    return stats;
  }

  static BufferLevel level(int bufferPct) {
    if (bufferPct < BUFFER_CRITICAL_PCT) {
      return BufferLevel.CRITICAL;
    }
    if (bufferPct < BUFFER_WARNING_PCT) {
      return BufferLevel.LOW;
    }
    return BufferLevel.OK;
  }

  private TenantResourceGrant grantLocked(TenantContext context, PoolResource resource) {
    if (resource.getStatus() == ResourceStatus.RETIRED) {
      throw new InvalidStateException(
          "Resource retired", "Resource " + resource.getId() + " is retired");
    }
    if (grantRepository.existsByTenantIdAndResourceIdAndStatus(
        context.tenantId(), resource.getId(), GrantStatus.ACTIVE)) {
      throw new ResourceConflictException(
          "Already granted", "Tenant already holds resource " + resource.getId());
    }
    if (resource.getCurrentTenants() >= resource.getMaxTenants()) {
      throw new CapacityExceededException(resource.getId(), resource.getMaxTenants());
    }
    if (resource.getCurrentTenants() == 0) {
      resource.adoptTimezone(context.zone());
    }
    resource.grantSlot();
    resourceRepository.save(resource);
    var grant =
        grantRepository.save(
            new TenantResourceGrant(
                resource.getId(), context.tenantId(), resource.getResourceType()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("resource.granted")
            .entityType("resource_grant")
            .entityId(grant.getId())
            .tenantId(context.tenantId())
            .details(
                Map.of(
                    "resource_id", resource.getId().toString(),
                    "resource_type", resource.getResourceType().name(),
                    "current_tenants", resource.getCurrentTenants()))
            .build());
    log.info(
        "Granted resource {} to tenant {} ({}/{})",
        resource.getId(),
        context.tenantId(),
        resource.getCurrentTenants(),
        resource.getMaxTenants());
    return grant;
  }

  /** Caller holds the resource lock and read {@code grant} after taking it. */
  private TenantResourceGrant revokeLocked(PoolResource resource, TenantResourceGrant grant) {
    if (!grant.isActive()
        || grantRepository.closeIfActive(
                grant.getId(), Instant.now(), GrantStatus.ACTIVE, GrantStatus.RELEASED)
            != 1) {
      throw new InvalidStateException(
          "Grant not active", "Grant " + grant.getId() + " is released");
    }
    grant.release();
    resource.releaseSlot();
    resourceRepository.save(resource);
    grantRepository.save(grant);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("resource.revoked")
            .entityType("resource_grant")
            .entityId(grant.getId())
            .tenantId(grant.getTenantId())
            .details(Map.of("resource_id", resource.getId().toString()))
            .build());
    return grant;
  }

  private PoolResource lockResource(UUID resourceId) {
    return resourceRepository
        .findByIdForUpdate(resourceId)
        .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
  }
}
