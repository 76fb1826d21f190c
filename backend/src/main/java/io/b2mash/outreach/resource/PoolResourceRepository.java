package io.b2mash.outreach.resource;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PoolResourceRepository extends JpaRepository<PoolResource, UUID> {

  boolean existsByResourceValue(String resourceValue);

  List<PoolResource> findByStatusNot(ResourceStatus status);

  List<PoolResource> findByStatus(ResourceStatus status);

  List<PoolResource> findByResourceTypeAndStatusNot(ResourceType type, ResourceStatus status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT r FROM PoolResource r WHERE r.id = :id")
  Optional<PoolResource> findByIdForUpdate(@Param("id") UUID id);

  /**
   * Ranks shareable resources of a type: warm-up complete first, then reputation, then fewest
   * tenants, then oldest.
   */
  @Query(
      """
      SELECT r FROM PoolResource r
      WHERE r.resourceType = :type
        AND r.status IN :statuses
        AND r.currentTenants < r.maxTenants
      ORDER BY CASE WHEN r.warmupCompletedAt IS NULL THEN 1 ELSE 0 END,
        r.reputationScore DESC,
        r.currentTenants ASC,
        r.createdAt ASC
      """)
  List<PoolResource> findCandidates(
      @Param("type") ResourceType type,
      @Param("statuses") Collection<ResourceStatus> statuses,
      Pageable pageable);

  /**
   * Ids in the same ranking as {@link #findCandidates}, excluding resources the tenant already
   * holds. Only ids are returned so each resource is first loaded by its locking read.
   */
  @Query(
      """
      SELECT r.id FROM PoolResource r
      WHERE r.resourceType = :type
        AND r.status IN :statuses
        AND r.currentTenants < r.maxTenants
        AND NOT EXISTS (
          SELECT g.id FROM TenantResourceGrant g
          WHERE g.resourceId = r.id AND g.tenantId = :tenantId AND g.status = :active)
      ORDER BY CASE WHEN r.warmupCompletedAt IS NULL THEN 1 ELSE 0 END,
        r.reputationScore DESC,
        r.currentTenants ASC,
        r.createdAt ASC
      """)
  List<UUID> findCandidateIdsForTenant(
      @Param("type") ResourceType type,
      @Param("statuses") Collection<ResourceStatus> statuses,
      @Param("tenantId") UUID tenantId,
      @Param("active") GrantStatus active,
      Pageable pageable);
}
