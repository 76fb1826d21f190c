package io.b2mash.outreach.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ActionStateMachineTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
  private static final BackoffPolicy BACKOFF =
      new BackoffPolicy(Duration.ofMinutes(5), Duration.ofHours(6));

  private ActionQueueItem pendingItem(int maxAttempts) {
    return new ActionQueueItem(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        null,
        ActionType.EMAIL,
        "template-1",
        NOW.minusSeconds(60),
        0,
        maxAttempts);
  }

  @Test
  void claim_movesToProcessingAndCountsAttempt() {
    var item = pendingItem(3);

    var transition = ActionStateMachine.claim(item, "worker-a", NOW);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.PROCESSING);
    assertThat(item.getAttempts()).isEqualTo(1);
    assertThat(item.isClaimedBy("worker-a")).isTrue();
    assertThat(item.isClaimedBy("worker-b")).isFalse();
    assertThat(transition.sideEffects()).isEmpty();
  }

  @Test
  void claim_beforeScheduledTime_isRefused() {
    var item = pendingItem(3);

    assertThatThrownBy(() -> ActionStateMachine.claim(item, "worker-a", NOW.minusSeconds(120)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not due");
  }

  @Test
  void succeed_recordsSendTouchAndUsage() {
    var item = pendingItem(3);
    ActionStateMachine.claim(item, "worker-a", NOW);

    var transition = ActionStateMachine.succeed(item, "msg-123", NOW);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.SENT);
    assertThat(item.getProviderReference()).isEqualTo("msg-123");
    assertThat(item.getProcessedAt()).isEqualTo(NOW);
    assertThat(item.getClaimedBy()).isNull();
    assertThat(transition.sideEffects())
        .containsExactly(
            SideEffect.RECORD_SEND_EVENT,
            SideEffect.RECORD_LEAD_TOUCH,
            SideEffect.RECORD_GRANT_USAGE);
  }

  @Test
  void succeed_withoutClaim_isRefused() {
    var item = pendingItem(3);

    assertThatThrownBy(() -> ActionStateMachine.succeed(item, "msg-1", NOW))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("PENDING");
  }

  @Test
  void reject_cancelsWithReason() {
    var item = pendingItem(3);
    ActionStateMachine.claim(item, "worker-a", NOW);

    ActionStateMachine.reject(item, "jit_rejected: SUPPRESSED", NOW);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.CANCELLED);
    assertThat(item.getLastError()).isEqualTo("jit_rejected: SUPPRESSED");
  }

  @Test
  void rateLimit_refundsAttemptAndWaitsForNextWindow() {
    var item = pendingItem(3);
    ActionStateMachine.claim(item, "worker-a", NOW);
    var nextWindow = Instant.parse("2025-06-02T00:00:00Z");

    var transition = ActionStateMachine.rateLimit(item, nextWindow);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.RATE_LIMITED);
    assertThat(item.getAttempts()).isZero();
    assertThat(item.getScheduledAt()).isEqualTo(nextWindow);
    assertThat(transition.sideEffects()).isEmpty();
  }

  @Test
  void fail_withAttemptsLeft_retriesWithBackoffAndRefundsSlot() {
    var item = pendingItem(3);
    ActionStateMachine.claim(item, "worker-a", NOW);

    var transition = ActionStateMachine.fail(item, "503 from provider", NOW, BACKOFF);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.PENDING);
    assertThat(item.getAttempts()).isEqualTo(1);
    assertThat(item.getScheduledAt()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
    assertThat(item.getLastError()).isEqualTo("503 from provider");
    assertThat(transition.sideEffects()).containsExactly(SideEffect.REFUND_DAILY_SLOT);
  }

  @Test
  void threeFailures_exhaustItemAndAlert() {
    var item = pendingItem(3);
    var clock = NOW;
    ActionStateMachine.Transition last = null;

    for (int i = 0; i < 3; i++) {
      clock = item.getScheduledAt().isAfter(clock) ? item.getScheduledAt() : clock;
      ActionStateMachine.claim(item, "worker-a", clock);
      last = ActionStateMachine.fail(item, "boom " + i, clock, BACKOFF);
    }

    assertThat(item.getStatus()).isEqualTo(ActionStatus.FAILED);
    assertThat(item.getAttempts()).isEqualTo(3);
    assertThat(item.hasAttemptsLeft()).isFalse();
    assertThat(last.sideEffects())
        .containsExactly(SideEffect.REFUND_DAILY_SLOT, SideEffect.ALERT_OPERATIONS);

    var afterwards = clock.plus(Duration.ofDays(1));
    assertThatThrownBy(() -> ActionStateMachine.claim(item, "worker-b", afterwards))
        .isInstanceOf(IllegalStateException.class);
    assertThat(item.getStatus()).isEqualTo(ActionStatus.FAILED);
  }

  @Test
  void expireLease_doesNotRefundSlot() {
    var item = pendingItem(3);
    ActionStateMachine.claim(item, "worker-a", NOW);

    var transition = ActionStateMachine.expireLease(item, NOW.plusSeconds(900), BACKOFF);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.PENDING);
    assertThat(item.getLastError()).contains("lease expired").contains("worker-a");
    assertThat(transition.has(SideEffect.REFUND_DAILY_SLOT)).isFalse();
  }

  @Test
  void expireLease_onLastAttempt_failsAndAlerts() {
    var item = pendingItem(1);
    ActionStateMachine.claim(item, "worker-a", NOW);

    var transition = ActionStateMachine.expireLease(item, NOW.plusSeconds(900), BACKOFF);

    assertThat(item.getStatus()).isEqualTo(ActionStatus.FAILED);
    assertThat(transition.sideEffects()).containsExactly(SideEffect.ALERT_OPERATIONS);
  }

  @Test
  void cancel_onlyFromWaitingStates() {
    var pending = pendingItem(3);
    ActionStateMachine.cancel(pending, "campaign paused", NOW);
    assertThat(pending.getStatus()).isEqualTo(ActionStatus.CANCELLED);
    assertThat(pending.getLastError()).isEqualTo("cancelled: campaign paused");

    var processing = pendingItem(3);
    ActionStateMachine.claim(processing, "worker-a", NOW);
    assertThatThrownBy(() -> ActionStateMachine.cancel(processing, "too late", NOW))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void longErrors_areTruncated() {
    var item = pendingItem(3);
    ActionStateMachine.claim(item, "worker-a", NOW);

    ActionStateMachine.fail(item, "x".repeat(5000), NOW, BACKOFF);

    assertThat(item.getLastError()).hasSize(1000);
  }
}
