package io.b2mash.outreach.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Lease backed by a conditional update on {@code claimed_by} and {@code claimed_at}. */
@Component
public class JdbcActionLease implements ActionLease {

  private final ActionQueueRepository queueRepository;

  public JdbcActionLease(ActionQueueRepository queueRepository) {
    this.queueRepository = queueRepository;
  }

  @Override
  @Transactional
  public ClaimResult tryClaim(UUID itemId, String workerId, Duration leaseDuration, Instant now) {
    int updated = queueRepository.claim(itemId, workerId, now, now.minus(leaseDuration));
    return updated == 1 ? ClaimResult.CLAIMED : ClaimResult.ALREADY_CLAIMED;
  }
}
