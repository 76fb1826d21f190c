package io.b2mash.outreach.queue;

import java.time.Duration;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Action queue tuning.
 *
 * @param backoffBase first retry delay
 * @param backoffCap longest retry delay
 * @param leaseDuration how long a claim is honoured before another worker may take the item
 * @param batchSize items one worker pass dispatches at most
 * @param jitterPct upper bound, in percent, on the random reduction of a new day's limit
 * @param workerId identity stamped into {@code claimed_by}; generated when blank
 * @param workerEnabled whether the scheduled worker polls at all
 */
@ConfigurationProperties(prefix = "outreach.queue")
public record QueueProperties(
    Duration backoffBase,
    Duration backoffCap,
    Duration leaseDuration,
    int batchSize,
    int jitterPct,
    String workerId,
    boolean workerEnabled) {

  public QueueProperties {
    if (backoffBase == null) {
      backoffBase = Duration.ofMinutes(5);
    }
    if (backoffCap == null) {
      backoffCap = Duration.ofHours(6);
    }
    if (leaseDuration == null) {
      leaseDuration = Duration.ofMinutes(10);
    }
    if (batchSize <= 0) {
      batchSize = 25;
    }
    if (jitterPct < 0 || jitterPct > 50) {
      throw new IllegalArgumentException("outreach.queue.jitter-pct must be between 0 and 50");
    }
    if (workerId == null || workerId.isBlank()) {
      workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
    }
  }

  public BackoffPolicy backoffPolicy() {
    return new BackoffPolicy(backoffBase, backoffCap);
  }
}
