package io.b2mash.outreach.pool;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/** A tenant's do-not-contact entry for an email address or a whole domain. */
@Entity
@Table(name = "suppression_entries")
public class SuppressionEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 10)
  private SuppressionKind kind;

  @Column(name = "value", nullable = false, length = 320)
  private String value;

  @Column(name = "reason", length = 100)
  private String reason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SuppressionEntry() {}

  public SuppressionEntry(UUID tenantId, SuppressionKind kind, String value, String reason) {
    this.tenantId = tenantId;
    this.kind = kind;
    this.value = value.trim().toLowerCase(Locale.ROOT);
    this.reason = reason;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public SuppressionKind getKind() {
    return kind;
  }

  public String getValue() {
    return value;
  }

  public String getReason() {
    return reason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
