package io.b2mash.outreach.resource;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantResourceGrantRepository extends JpaRepository<TenantResourceGrant, UUID> {

  List<TenantResourceGrant> findByTenantIdAndStatus(UUID tenantId, GrantStatus status);

  List<TenantResourceGrant> findByResourceIdAndStatus(UUID resourceId, GrantStatus status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT g FROM TenantResourceGrant g WHERE g.id = :id")
  Optional<TenantResourceGrant> findByIdForUpdate(@Param("id") UUID id);

  /**
   * Closes a grant only if it is still active in the database, regardless of the copy the caller
   * holds.
   *
   * @return 1 if this call closed the grant, 0 if it was already released
   */
  @Modifying
  @Query(
      """
      UPDATE TenantResourceGrant g SET g.status = :released, g.releasedAt = :now
      WHERE g.id = :id AND g.status = :active
      """)
  int closeIfActive(
      @Param("id") UUID id,
      @Param("now") Instant now,
      @Param("active") GrantStatus active,
      @Param("released") GrantStatus released);

  /** Reads only the resource id, so the grant itself is not cached ahead of the resource lock. */
  @Query(
      "SELECT g.resourceId FROM TenantResourceGrant g WHERE g.id = :id AND g.tenantId = :tenantId")
  Optional<UUID> findResourceIdByIdAndTenantId(
      @Param("id") UUID id, @Param("tenantId") UUID tenantId);

  @Query(
      """
      SELECT g.resourceId FROM TenantResourceGrant g
      WHERE g.tenantId = :tenantId AND g.status = :status
      """)
  List<UUID> findResourceIdsByTenantIdAndStatus(
      @Param("tenantId") UUID tenantId, @Param("status") GrantStatus status);

  long countByTenantIdAndResourceTypeAndStatus(
      UUID tenantId, ResourceType resourceType, GrantStatus status);

  boolean existsByTenantIdAndResourceIdAndStatus(
      UUID tenantId, UUID resourceId, GrantStatus status);

  Optional<TenantResourceGrant> findByTenantIdAndResourceIdAndStatus(
      UUID tenantId, UUID resourceId, GrantStatus status);
}
