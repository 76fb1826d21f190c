package io.b2mash.outreach.health;

import io.b2mash.outreach.audit.AuditEventBuilder;
import io.b2mash.outreach.audit.AuditService;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.resource.PoolResource;
import io.b2mash.outreach.resource.PoolResourceRepository;
import io.b2mash.outreach.resource.ResourceStatus;
import io.b2mash.outreach.resource.ResourceType;
import io.b2mash.outreach.warmup.WarmupScheduler;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains per-resource health from reported send events. Recomputation is a pure function of
 * the rolling windows and may be re-run at any time; it only writes the resource row.
 */
@Service
public class HealthMonitorService {

  private static final Logger log = LoggerFactory.getLogger(HealthMonitorService.class);

  private final PoolResourceRepository resourceRepository;
  private final SendEventRepository sendEventRepository;
  private final HealthClassifier classifier;
  private final HealthProperties properties;
  private final DailyLimitPolicy dailyLimitPolicy;
  private final WarmupScheduler warmupScheduler;
  private final AuditService auditService;

  public HealthMonitorService(
      PoolResourceRepository resourceRepository,
      SendEventRepository sendEventRepository,
      HealthClassifier classifier,
      HealthProperties properties,
      DailyLimitPolicy dailyLimitPolicy,
      WarmupScheduler warmupScheduler,
      AuditService auditService) {
    this.resourceRepository = resourceRepository;
    this.sendEventRepository = sendEventRepository;
    this.classifier = classifier;
    this.properties = properties;
    this.dailyLimitPolicy = dailyLimitPolicy;
    this.warmupScheduler = warmupScheduler;
    this.auditService = auditService;
  }

  /** Breakdown of how a resource's limit for today was derived. */
  public record DailyLimitView(
      UUID resourceId,
      HealthStatus healthStatus,
      long daysActive,
      int warmupLimit,
      Integer dailyLimitOverride,
      Integer acceptRateCap,
      int effectiveDailyLimit) {}

  /**
   * Records a delivery outcome reported by the delivery subsystem.
   *
   * @throws ResourceNotFoundException if the resource does not exist
   */
  @Transactional
  public SendEvent reportSendEvent(
      UUID resourceId, UUID tenantId, SendEventType eventType, Instant occurredAt) {
    if (!resourceRepository.existsById(resourceId)) {
      throw new ResourceNotFoundException("Resource", resourceId);
    }
    var event =
        sendEventRepository.save(
            new SendEvent(
                resourceId, tenantId, eventType, occurredAt != null ? occurredAt : Instant.now()));
    log.debug("Send event {} recorded for resource {}", eventType, resourceId);
    return event;
  }

  /**
   * Recomputes rates, status, accept-rate cap and reputation for one resource from its rolling
   * windows ending now.
   */
  @Transactional
  public PoolResource recompute(UUID resourceId) {
    var resource =
        resourceRepository
            .findByIdForUpdate(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    return recompute(resource, Instant.now());
  }

  PoolResource recompute(PoolResource resource, Instant now) {
    var counts = countsByType(resource.getId(), now.minus(properties.window()), now);
    var assessment =
        classifier.assess(
            counts.get(SendEventType.SENT),
            counts.get(SendEventType.BOUNCED),
            counts.get(SendEventType.COMPLAINED));

    long requests = 0;
    long accepted = 0;
    Double acceptRate = null;
    Integer acceptRateCap = null;
    if (resource.getResourceType() == ResourceType.LINKEDIN_SEAT) {
      var seatCounts = countsByType(resource.getId(), now.minus(properties.acceptWindow()), now);
      requests = seatCounts.get(SendEventType.CONNECTION_REQUESTED);
      accepted = seatCounts.get(SendEventType.CONNECTION_ACCEPTED);
      acceptRate = requests > 0 ? (double) accepted / requests : null;
      acceptRateCap = classifier.acceptRateCap(requests, accepted);
    }
    int reputation =
        classifier.reputation(assessment, requests, accepted, resource.getReputationScore());

    HealthStatus previous = resource.getHealthStatus();
    resource.applyHealth(
        assessment, requests, accepted, acceptRate, acceptRateCap, reputation, now);
    resource = resourceRepository.save(resource);

    if (previous != assessment.status()) {
      log.warn(
          "Resource {} health changed {} -> {} (bounce={}, complaint={}, sends={})",
          resource.getId(),
          previous,
          assessment.status(),
          assessment.bounceRate(),
          assessment.complaintRate(),
          assessment.sends());
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("resource.health_changed")
              .entityType("resource")
              .entityId(resource.getId())
              .details(
                  Map.of(
                      "from", previous.name(),
                      "to", assessment.status().name(),
                      "bounce_rate", assessment.bounceRate(),
                      "complaint_rate", assessment.complaintRate()))
              .build());
    }
    return resource;
  }

  @Transactional(readOnly = true)
  public List<UUID> recomputableResourceIds() {
    return resourceRepository.findByStatusNot(ResourceStatus.RETIRED).stream()
        .map(PoolResource::getId)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<PoolResource> unhealthyResources() {
    return resourceRepository.findByStatusNot(ResourceStatus.RETIRED).stream()
        .filter(r -> r.getHealthStatus() != HealthStatus.GOOD)
        .toList();
  }

  @Transactional(readOnly = true)
  public DailyLimitView dailyLimit(UUID resourceId) {
    var resource =
        resourceRepository
            .findById(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    var now = Instant.now();
    return new DailyLimitView(
        resourceId,
        resource.getHealthStatus(),
        WarmupScheduler.daysActive(resource.getActivatedAt(), now),
        warmupScheduler.warmupLimit(resource, now),
        resource.getDailyLimitOverride(),
        resource.getAcceptRateCap(),
        dailyLimitPolicy.effectiveDailyLimit(resource, now));
  }

  /** Sets or clears (null) the manual daily limit override. */
  @Transactional
  public PoolResource changeDailyLimitOverride(UUID resourceId, Integer dailyLimitOverride) {
    var resource =
        resourceRepository
            .findByIdForUpdate(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    resource.changeDailyLimitOverride(dailyLimitOverride);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("resource.limit_overridden")
            .entityType("resource")
            .entityId(resourceId)
            .details(
                Map.of(
                    "daily_limit_override",
                    dailyLimitOverride != null ? dailyLimitOverride : "cleared"))
            .build());
    return resourceRepository.save(resource);
  }

  private Map<SendEventType, Long> countsByType(UUID resourceId, Instant since, Instant until) {
    var counts = new EnumMap<SendEventType, Long>(SendEventType.class);
    for (SendEventType type : SendEventType.values()) {
      counts.put(type, 0L);
    }
    for (var row : sendEventRepository.countByTypeInWindow(resourceId, since, until)) {
      counts.put(row.getEventType(), row.getCount());
    }
    return counts;
  }
}
