package io.b2mash.outreach.queue;

public enum ActionStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED,
  CANCELLED,
  RATE_LIMITED;

  public boolean isTerminal() {
    return this == SENT || this == FAILED || this == CANCELLED;
  }

  /** Statuses a worker may pick up once the item is due. */
  public boolean isDequeueable() {
    return this == PENDING || this == RATE_LIMITED;
  }
}
