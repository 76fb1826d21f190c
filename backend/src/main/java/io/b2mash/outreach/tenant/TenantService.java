package io.b2mash.outreach.tenant;

import io.b2mash.outreach.audit.AuditEventBuilder;
import io.b2mash.outreach.audit.AuditService;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.pool.LeadPoolService;
import io.b2mash.outreach.resource.ResourceAllocator;
import io.b2mash.outreach.scoring.ScoreWeights;
import java.time.DateTimeException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TenantService {

  private static final Logger log = LoggerFactory.getLogger(TenantService.class);

  private final TenantRepository tenantRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final LeadPoolService leadPoolService;
  private final ResourceAllocator resourceAllocator;
  private final AuditService auditService;

  public TenantService(
      TenantRepository tenantRepository,
      ApplicationEventPublisher eventPublisher,
      LeadPoolService leadPoolService,
      ResourceAllocator resourceAllocator,
      AuditService auditService) {
    this.tenantRepository = tenantRepository;
    this.eventPublisher = eventPublisher;
    this.leadPoolService = leadPoolService;
    this.resourceAllocator = resourceAllocator;
    this.auditService = auditService;
  }

  /** What a churn released. */
  public record ChurnResult(UUID tenantId, int leadsReleased, int resourcesReleased) {}

  /**
   * Registers a tenant. Its tier is derived from the plan slug.
   *
   * @throws InvalidStateException if the time zone is not a valid IANA zone id
   */
  @Transactional
  public Tenant createTenant(String name, String planSlug, String timezone) {
    Tenant tenant;
    try {
      tenant = new Tenant(name, Tier.fromPlanSlug(planSlug), timezone);
    } catch (DateTimeException e) {
      throw new InvalidStateException("Invalid time zone", "Unknown time zone: " + timezone);
    }
    tenant.changePlan(tenant.getTier(), planSlug);
    tenant = tenantRepository.save(tenant);
    log.info("Created tenant {} on tier {}", tenant.getId(), tenant.getTier());
    return tenant;
  }

  @Transactional(readOnly = true)
  public Tenant getTenant(UUID tenantId) {
    return tenantRepository
        .findById(tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("Tenant", tenantId));
  }

  /** Applies a billing plan change. Existing grants above the new quota are kept. */
  @Transactional
  public Tenant syncPlan(UUID tenantId, String planSlug) {
    var tenant = lockTenant(tenantId);
    var previous = tenant.getTier();
    tenant.changePlan(Tier.fromPlanSlug(planSlug), planSlug);
    tenant = tenantRepository.save(tenant);
    eventPublisher.publishEvent(new TenantChangedEvent(tenantId, "plan"));
    log.info("Plan synced: tenant={}, tier {} -> {}", tenantId, previous, tenant.getTier());
    return tenant;
  }

  /**
   * Replaces the tenant's scoring profile.
   *
   * @throws IllegalArgumentException if the weights are invalid
   */
  @Transactional
  public Tenant updateScoringProfile(
      UUID tenantId,
      List<String> targetIndustries,
      List<String> competitorDomains,
      Map<String, Object> weights) {
    if (weights != null) {
      ScoreWeights.fromMap(weights);
    }
    var tenant = lockTenant(tenantId);
    tenant.updateScoringProfile(targetIndustries, competitorDomains, weights);
    return tenantRepository.save(tenant);
  }

  /**
   * Marks a tenant as churned and returns everything it held to the shared pools: active lead
   * assignments are released and resource grants revoked.
   */
  @Transactional
  public ChurnResult churn(UUID tenantId) {
    var tenant = lockTenant(tenantId);
    tenant.churn();
    tenantRepository.save(tenant);
    int leads = leadPoolService.releaseAllForTenant(tenantId, "tenant_churned");
    int resources = resourceAllocator.releaseAllForTenant(tenantId);
    eventPublisher.publishEvent(new TenantChangedEvent(tenantId, "churned"));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("tenant.churned")
            .entityType("tenant")
            .entityId(tenantId)
            .tenantId(tenantId)
            .details(Map.of("leads_released", leads, "resources_released", resources))
            .build());
    log.info(
        "Tenant {} churned: released {} leads and {} resources", tenantId, leads, resources);
    return new ChurnResult(tenantId, leads, resources);
  }

  private Tenant lockTenant(UUID tenantId) {
    return tenantRepository
        .findByIdForUpdate(tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("Tenant", tenantId));
  }
}
