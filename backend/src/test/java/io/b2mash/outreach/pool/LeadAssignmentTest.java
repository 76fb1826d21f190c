package io.b2mash.outreach.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LeadAssignmentTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

  private LeadAssignment newAssignment() {
    return new LeadAssignment(UUID.randomUUID(), UUID.randomUUID(), null, null, "manual");
  }

  @Test
  void newAssignment_isActiveWithDefaults() {
    var assignment = newAssignment();

    assertThat(assignment.isActive()).isTrue();
    assertThat(assignment.getAssignedBy()).isEqualTo("allocator");
    assertThat(assignment.getMaxTouches()).isEqualTo(LeadAssignment.DEFAULT_MAX_TOUCHES);
    assertThat(assignment.getTotalTouches()).isZero();
  }

  @Test
  void touches_trackFirstLastAndChannels() {
    var assignment = newAssignment();

    assignment.recordTouch(Channel.EMAIL, NOW);
    assignment.recordTouch(Channel.LINKEDIN, NOW.plusSeconds(3600));
    assignment.recordTouch(Channel.EMAIL, NOW.plusSeconds(7200));

    assertThat(assignment.getTotalTouches()).isEqualTo(3);
    assertThat(assignment.getFirstContactedAt()).isEqualTo(NOW);
    assertThat(assignment.getLastContactedAt()).isEqualTo(NOW.plusSeconds(7200));
    assertThat(assignment.getChannelsUsed()).containsExactly("EMAIL", "LINKEDIN");
  }

  @Test
  void release_isTerminal() {
    var assignment = newAssignment();

    assignment.release("tenant churned");

    assertThat(assignment.getStatus()).isEqualTo(AssignmentStatus.RELEASED);
    assertThat(assignment.getReleaseReason()).isEqualTo("tenant churned");
    assertThatThrownBy(() -> assignment.recordTouch(Channel.EMAIL, NOW))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> assignment.convert("meeting"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void negativeIntent_isDetected() {
    var assignment = newAssignment();

    assignment.recordReply("interested", NOW);
    assertThat(assignment.hasNegativeReply()).isFalse();

    assignment.recordReply("do_not_contact", NOW);
    assertThat(assignment.hasReplied()).isTrue();
    assertThat(assignment.hasNegativeReply()).isTrue();
  }

  @Test
  void maxTouches_mustBePositive() {
    assertThatThrownBy(() -> newAssignment().changeMaxTouches(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
