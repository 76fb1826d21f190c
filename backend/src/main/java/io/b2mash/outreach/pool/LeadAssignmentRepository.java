package io.b2mash.outreach.pool;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadAssignmentRepository extends JpaRepository<LeadAssignment, UUID> {

  Optional<LeadAssignment> findByLeadIdAndStatus(UUID leadId, AssignmentStatus status);

  boolean existsByLeadIdAndStatus(UUID leadId, AssignmentStatus status);

  long countByLeadIdAndStatus(UUID leadId, AssignmentStatus status);

  Optional<LeadAssignment> findByTenantIdAndLeadIdAndStatus(
      UUID tenantId, UUID leadId, AssignmentStatus status);

  List<LeadAssignment> findByTenantIdAndStatus(UUID tenantId, AssignmentStatus status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT a FROM LeadAssignment a WHERE a.id = :id")
  Optional<LeadAssignment> findByIdForUpdate(@Param("id") UUID id);

  /** Reads only the lead id, so the assignment itself is not cached ahead of the lead lock. */
  @Query("SELECT a.leadId FROM LeadAssignment a WHERE a.id = :id AND a.tenantId = :tenantId")
  Optional<UUID> findLeadIdByIdAndTenantId(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

  @Query(
      """
      SELECT a.leadId FROM LeadAssignment a
      WHERE a.tenantId = :tenantId AND a.status = :status
      """)
  List<UUID> findLeadIdsByTenantIdAndStatus(
      @Param("tenantId") UUID tenantId, @Param("status") AssignmentStatus status);

  long countByTenantIdAndStatus(UUID tenantId, AssignmentStatus status);

  long countByTenantIdAndStatusAndReplied(UUID tenantId, AssignmentStatus status, boolean replied);

  @Query(
      """
      SELECT COALESCE(SUM(a.totalTouches), 0) FROM LeadAssignment a
      WHERE a.tenantId = :tenantId AND a.status = :status
      """)
  long sumTouches(@Param("tenantId") UUID tenantId, @Param("status") AssignmentStatus status);
}
