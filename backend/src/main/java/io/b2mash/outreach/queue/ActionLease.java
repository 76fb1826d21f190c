package io.b2mash.outreach.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-bounded exclusive claim on a queue item. A successful claim moves the item to PROCESSING
 * with one more attempt; a claim older than {@code leaseDuration} may be taken over by another
 * worker. Implementations must be atomic across concurrent callers.
 */
public interface ActionLease {

  ClaimResult tryClaim(UUID itemId, String workerId, Duration leaseDuration, Instant now);
}
