package io.b2mash.outreach.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  private final BackoffPolicy policy =
      new BackoffPolicy(Duration.ofMinutes(5), Duration.ofHours(6));

  @Test
  void delay_doublesPerAttempt() {
    assertThat(policy.delayFor(0)).isEqualTo(Duration.ofMinutes(5));
    assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMinutes(10));
    assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMinutes(40));
  }

  @Test
  void delay_isCapped() {
    assertThat(policy.delayFor(7)).isEqualTo(Duration.ofHours(6));
    assertThat(policy.delayFor(40)).isEqualTo(Duration.ofHours(6));
    assertThat(policy.delayFor(Integer.MAX_VALUE)).isEqualTo(Duration.ofHours(6));
  }

  @Test
  void capBelowBase_isRejected() {
    assertThatThrownBy(() -> new BackoffPolicy(Duration.ofHours(1), Duration.ofMinutes(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
