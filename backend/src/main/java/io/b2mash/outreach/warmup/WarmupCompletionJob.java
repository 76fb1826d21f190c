package io.b2mash.outreach.warmup;

import io.b2mash.outreach.resource.ResourceAllocator;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Daily sweep that marks resources whose ramp has reached its ceiling as warmed. */
@Component
public class WarmupCompletionJob {

  private static final Logger log = LoggerFactory.getLogger(WarmupCompletionJob.class);

  private final ResourceAllocator resourceAllocator;

  public WarmupCompletionJob(ResourceAllocator resourceAllocator) {
    this.resourceAllocator = resourceAllocator;
  }

  @Scheduled(cron = "${outreach.warmup.completion-cron:0 15 0 * * *}")
  public void completeDueWarmups() {
    var now = Instant.now();
    int completed = 0;
    for (var resourceId : resourceAllocator.warmingResourceIds()) {
      try {
        if (resourceAllocator.completeWarmupIfDue(resourceId, now)) {
          completed++;
        }
      } catch (Exception e) {
        log.error("Failed to complete warm-up for resource {}", resourceId, e);
      }
    }
    log.info("Warm-up completion sweep finished: {} resources warmed", completed);
  }
}
