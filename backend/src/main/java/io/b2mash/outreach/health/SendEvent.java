package io.b2mash.outreach.health;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One delivery outcome reported against a resource. Append-only input to the health windows. */
@Entity
@Table(name = "send_events")
public class SendEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "resource_id", nullable = false, updatable = false)
  private UUID resourceId;

  @Column(name = "tenant_id", updatable = false)
  private UUID tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "event_type", nullable = false, length = 30, updatable = false)
  private SendEventType eventType;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "recorded_at", nullable = false, updatable = false)
  private Instant recordedAt;

  protected SendEvent() {}

  public SendEvent(UUID resourceId, UUID tenantId, SendEventType eventType, Instant occurredAt) {
    this.resourceId = resourceId;
    this.tenantId = tenantId;
    this.eventType = eventType;
    this.occurredAt = occurredAt;
    this.recordedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public SendEventType getEventType() {
    return eventType;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public Instant getRecordedAt() {
    return recordedAt;
  }
}
