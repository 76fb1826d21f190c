package io.b2mash.outreach.queue;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Send counter of one resource for one local calendar day. Rows are created lazily by the first
 * reservation of the day and only changed through conditional updates in {@link
 * AccountDailyStateRepository}, so this entity is read-only.
 */
@Entity
@Table(name = "account_daily_states")
public class AccountDailyState {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "resource_id", nullable = false, updatable = false)
  private UUID resourceId;

  @Column(name = "state_date", nullable = false, updatable = false)
  private LocalDate stateDate;

  @Column(name = "daily_limit", nullable = false, updatable = false)
  private int dailyLimit;

  @Column(name = "actions_sent", nullable = false, updatable = false)
  private int actionsSent;

  @Column(name = "last_action_at", updatable = false)
  private Instant lastActionAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AccountDailyState() {}

  public int remaining() {
    return Math.max(0, dailyLimit - actionsSent);
  }

  public UUID getId() {
    return id;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public LocalDate getStateDate() {
    return stateDate;
  }

  public int getDailyLimit() {
    return dailyLimit;
  }

  public int getActionsSent() {
    return actionsSent;
  }

  public Instant getLastActionAt() {
    return lastActionAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
