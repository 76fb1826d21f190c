package io.b2mash.outreach.pool;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SuppressionEntryRepository extends JpaRepository<SuppressionEntry, UUID> {

  List<SuppressionEntry> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

  Optional<SuppressionEntry> findByIdAndTenantId(UUID id, UUID tenantId);

  boolean existsByTenantIdAndKindAndValue(UUID tenantId, SuppressionKind kind, String value);

  /** Finds the entry that suppresses the given address, matching either the address or domain. */
  @Query(
      """
      SELECT s FROM SuppressionEntry s
      WHERE s.tenantId = :tenantId
        AND ((s.kind = :emailKind AND s.value = :email)
          OR (s.kind = :domainKind AND s.value = :domain))
      """)
  List<SuppressionEntry> findMatching(
      @Param("tenantId") UUID tenantId,
      @Param("emailKind") SuppressionKind emailKind,
      @Param("email") String email,
      @Param("domainKind") SuppressionKind domainKind,
      @Param("domain") String domain);
}
