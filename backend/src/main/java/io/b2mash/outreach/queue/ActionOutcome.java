package io.b2mash.outreach.queue;

import io.b2mash.outreach.pool.JitRejection;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Result of working on a claimed item, reported back through {@link
 * ActionQueueService#complete}.
 *
 * @param slotDate day whose send slot was reserved for this attempt, if any
 */
public record ActionOutcome(
    Kind kind, String providerReference, String reason, Instant nextWindow, LocalDate slotDate) {

  public enum Kind {
    SENT,
    REJECTED,
    RATE_LIMITED,
    PROVIDER_ERROR
  }

  public static ActionOutcome sent(String providerReference) {
    return new ActionOutcome(Kind.SENT, providerReference, null, null, null);
  }

  public static ActionOutcome rejected(JitRejection rejection) {
    return rejected("jit_rejected: " + rejection.name());
  }

  public static ActionOutcome rejected(String reason) {
    return new ActionOutcome(Kind.REJECTED, null, reason, null, null);
  }

  public static ActionOutcome rateLimited(Instant nextWindow) {
    return new ActionOutcome(Kind.RATE_LIMITED, null, null, nextWindow, null);
  }

  public static ActionOutcome providerError(String error, LocalDate slotDate) {
    return new ActionOutcome(Kind.PROVIDER_ERROR, null, error, null, slotDate);
  }
}
