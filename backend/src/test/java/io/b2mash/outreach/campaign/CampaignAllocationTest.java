package io.b2mash.outreach.campaign;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class CampaignAllocationTest {

  private CampaignAllocation draft(int pct) {
    return new CampaignAllocation(UUID.randomUUID(), UUID.randomUUID(), "Q3 push", pct);
  }

  @Test
  void leadShare_roundsDown() {
    assertThat(draft(30).leadShare(1000)).isEqualTo(300);
    assertThat(draft(33).leadShare(10)).isEqualTo(3);
    assertThat(draft(1).leadShare(50)).isZero();
  }

  @Test
  void lifecycle_followsAllowedTransitions() {
    var allocation = draft(40);

    allocation.transitionTo(CampaignStatus.ACTIVE);
    allocation.transitionTo(CampaignStatus.PAUSED);
    allocation.transitionTo(CampaignStatus.ACTIVE);
    allocation.transitionTo(CampaignStatus.COMPLETED);

    assertThat(allocation.getStatus()).isEqualTo(CampaignStatus.COMPLETED);
    assertThatThrownBy(() -> allocation.transitionTo(CampaignStatus.ACTIVE))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void draftCannotPause() {
    assertThatThrownBy(() -> draft(10).transitionTo(CampaignStatus.PAUSED))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void terminalCampaign_cannotBeEdited() {
    var allocation = draft(10);
    allocation.transitionTo(CampaignStatus.CANCELLED);

    assertThatThrownBy(() -> allocation.update("renamed", 20))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void onlyNonTerminalStatusesCountTowardsTotal() {
    assertThat(CampaignStatus.NON_TERMINAL)
        .containsExactlyInAnyOrder(
            CampaignStatus.DRAFT, CampaignStatus.ACTIVE, CampaignStatus.PAUSED);
    assertThat(CampaignStatus.CANCELLED.isTerminal()).isTrue();
  }
}
