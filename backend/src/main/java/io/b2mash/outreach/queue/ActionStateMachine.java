package io.b2mash.outreach.queue;

import java.time.Instant;
import java.util.List;

/**
 * Transitions of an {@link ActionQueueItem}. Each method checks the source state, mutates the item
 * and returns the side effects the caller must persist with it. Nothing here touches storage.
 *
 * <pre>
 * PENDING | RATE_LIMITED --claim--> PROCESSING
 * PROCESSING --succeed--> SENT
 * PROCESSING --reject--> CANCELLED
 * PROCESSING --rateLimit--> RATE_LIMITED (attempt refunded)
 * PROCESSING --fail--> PENDING (backoff) | FAILED (attempts exhausted)
 * PENDING | RATE_LIMITED --cancel--> CANCELLED
 * </pre>
 */
public final class ActionStateMachine {

  public record Transition(ActionQueueItem item, List<SideEffect> sideEffects) {

    public boolean has(SideEffect effect) {
      return sideEffects.contains(effect);
    }
  }

  private ActionStateMachine() {}

  /**
   * Entity-level form of the claim. The database lease claims with one conditional update instead
   * ({@code ActionQueueRepository.claim}); this is for leases that hold items in memory and must
   * enforce the same preconditions.
   */
  public static Transition claim(ActionQueueItem item, String workerId, Instant now) {
    if (!item.getStatus().isDequeueable()) {
      throw illegal(item, "claim");
    }
    if (!item.hasAttemptsLeft()) {
      throw new IllegalStateException(
          "Action " + item.getId() + " has exhausted " + item.getMaxAttempts() + " attempts");
    }
    if (item.getScheduledAt().isAfter(now)) {
      throw new IllegalStateException("Action " + item.getId() + " is not due yet");
    }
    item.claim(workerId, now);
    return new Transition(item, List.of());
  }

  public static Transition succeed(ActionQueueItem item, String providerReference, Instant now) {
    requireProcessing(item, "succeed");
    item.markSent(providerReference, now);
    return new Transition(
        item,
        List.of(
            SideEffect.RECORD_SEND_EVENT,
            SideEffect.RECORD_LEAD_TOUCH,
            SideEffect.RECORD_GRANT_USAGE));
  }

  /** The pre-send check refused the action; it will never be sent. */
  public static Transition reject(ActionQueueItem item, String reason, Instant now) {
    requireProcessing(item, "reject");
    item.complete(ActionStatus.CANCELLED, reason, now);
    return new Transition(item, List.of());
  }

  /**
   * The resource has no capacity left today. The attempt taken by the claim is given back so that
   * throttling alone never exhausts the item.
   */
  public static Transition rateLimit(ActionQueueItem item, Instant nextWindow) {
    requireProcessing(item, "rate-limit");
    item.reschedule(ActionStatus.RATE_LIMITED, nextWindow, "daily limit reached", true);
    return new Transition(item, List.of());
  }

  /**
   * The provider call failed after a daily slot was reserved. Retries with backoff while attempts
   * remain, otherwise the item fails for good and operations are alerted.
   */
  public static Transition fail(
      ActionQueueItem item, String error, Instant now, BackoffPolicy backoff) {
    requireProcessing(item, "fail");
    return retryOrFail(item, error, now, backoff, SideEffect.REFUND_DAILY_SLOT);
  }

  /**
   * A claim outlived its lease without completing. Whether the provider was reached is unknown, so
   * the reserved slot stays consumed.
   */
  public static Transition expireLease(ActionQueueItem item, Instant now, BackoffPolicy backoff) {
    requireProcessing(item, "expire lease of");
    var error = "lease expired (worker " + item.getClaimedBy() + ")";
    return retryOrFail(item, error, now, backoff, null);
  }

  public static Transition cancel(ActionQueueItem item, String reason, Instant now) {
    if (!item.getStatus().isDequeueable()) {
      throw illegal(item, "cancel");
    }
    item.complete(ActionStatus.CANCELLED, reason != null ? "cancelled: " + reason : null, now);
    return new Transition(item, List.of());
  }

  private static Transition retryOrFail(
      ActionQueueItem item,
      String error,
      Instant now,
      BackoffPolicy backoff,
      SideEffect slotEffect) {
    if (item.hasAttemptsLeft()) {
      var retryAt = now.plus(backoff.delayFor(item.getAttempts()));
      item.reschedule(ActionStatus.PENDING, retryAt, error, false);
      return new Transition(item, slotEffect == null ? List.of() : List.of(slotEffect));
    }
    item.complete(ActionStatus.FAILED, error, now);
    return new Transition(
        item,
        slotEffect == null
            ? List.of(SideEffect.ALERT_OPERATIONS)
            : List.of(slotEffect, SideEffect.ALERT_OPERATIONS));
  }

  private static void requireProcessing(ActionQueueItem item, String action) {
    if (item.getStatus() != ActionStatus.PROCESSING) {
      throw illegal(item, action);
    }
  }

  private static IllegalStateException illegal(ActionQueueItem item, String action) {
    return new IllegalStateException(
        "Cannot " + action + " action " + item.getId() + " in status " + item.getStatus());
  }
}
