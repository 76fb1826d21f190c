package io.b2mash.outreach.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Recomputes health for every active resource. Each resource runs in its own transaction through
 * the service proxy, so one failure does not stop the sweep.
 */
@Component
public class HealthRecomputeJob {

  private static final Logger log = LoggerFactory.getLogger(HealthRecomputeJob.class);

  private final HealthMonitorService healthMonitorService;

  public HealthRecomputeJob(HealthMonitorService healthMonitorService) {
    this.healthMonitorService = healthMonitorService;
  }

  @Scheduled(cron = "${outreach.health.recompute-cron:0 5 * * * *}")
  public void recomputeAll() {
    var resourceIds = healthMonitorService.recomputableResourceIds();
    int recomputed = 0;
    for (var resourceId : resourceIds) {
      try {
        healthMonitorService.recompute(resourceId);
        recomputed++;
      } catch (Exception e) {
        log.error("Failed to recompute health for resource {}", resourceId, e);
      }
    }
    log.info("Health recompute completed: {}/{} resources", recomputed, resourceIds.size());
  }
}
