package io.b2mash.outreach.queue;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Recovers items whose worker died or hung while holding a claim. */
@Component
public class StaleLeaseReaper {

  private static final Logger log = LoggerFactory.getLogger(StaleLeaseReaper.class);

  private final ActionQueueService queueService;

  public StaleLeaseReaper(ActionQueueService queueService) {
    this.queueService = queueService;
  }

  @Scheduled(fixedDelayString = "${outreach.queue.reaper-interval:PT1M}")
  public void reap() {
    var now = Instant.now();
    int recovered = 0;
    for (var itemId : queueService.staleClaimIds(now)) {
      try {
        if (queueService.expireLease(itemId, now)) {
          recovered++;
        }
      } catch (Exception e) {
        log.error("Failed to expire lease of action {}", itemId, e);
      }
    }
    if (recovered > 0) {
      log.info("Recovered {} stale action claims", recovered);
    }
  }
}
