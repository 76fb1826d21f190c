package io.b2mash.outreach.queue;

import java.time.Duration;

/** Exponential retry delay {@code min(base * 2^attempts, cap)}. */
public record BackoffPolicy(Duration base, Duration cap) {

  public BackoffPolicy {
    if (base == null || base.isNegative() || base.isZero()) {
      throw new IllegalArgumentException("backoff base must be positive");
    }
    if (cap == null || cap.compareTo(base) < 0) {
      throw new IllegalArgumentException("backoff cap must be at least the base");
    }
  }

  public Duration delayFor(int attempts) {
    if (attempts < 0) {
      return base;
    }
    // 2^62 seconds overflows Duration arithmetic long before the cap matters
    if (attempts >= 62) {
      return cap;
    }
    long factor = 1L << attempts;
    if (base.getSeconds() > cap.getSeconds() / factor) {
      return cap;
    }
    Duration delay = base.multipliedBy(factor);
    return delay.compareTo(cap) > 0 ? cap : delay;
  }
}
