package io.b2mash.outreach.campaign;

import java.util.EnumSet;
import java.util.Set;

public enum CampaignStatus {
  DRAFT,
  ACTIVE,
  PAUSED,
  COMPLETED,
  CANCELLED;

  /** Statuses whose allocation counts against the tenant's 100%. */
  public static final Set<CampaignStatus> NON_TERMINAL = EnumSet.of(DRAFT, ACTIVE, PAUSED);

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  public boolean canTransitionTo(CampaignStatus target) {
    return switch (this) {
      case DRAFT -> target == ACTIVE || target == CANCELLED;
      case ACTIVE -> target == PAUSED || target == COMPLETED || target == CANCELLED;
      case PAUSED -> target == ACTIVE || target == COMPLETED || target == CANCELLED;
      case COMPLETED, CANCELLED -> false;
    };
  }
}
