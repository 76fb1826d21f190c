package io.b2mash.outreach.pool;

/** Lifecycle of a lead in the platform pool. Leads are never deleted, only moved between states. */
public enum PoolStatus {
  AVAILABLE,
  ASSIGNED,
  CONVERTED,
  BOUNCED,
  UNSUBSCRIBED,
  INVALID;

  /** Terminal statuses never return to {@link #AVAILABLE}. */
  public boolean isPermanentlyIneligible() {
    return this == BOUNCED || this == UNSUBSCRIBED || this == INVALID;
  }
}
