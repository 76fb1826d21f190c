package io.b2mash.outreach.queue;

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

public interface ActionQueueRepository extends JpaRepository<ActionQueueItem, UUID> {

  interface StatusCount {
    ActionStatus getStatus();

    long getCount();
  }

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT i FROM ActionQueueItem i WHERE i.id = :id")
  Optional<ActionQueueItem> findByIdForUpdate(@Param("id") UUID id);

  /**
   * Locks the next due items in dispatch order, skipping rows another worker already holds. Must
   * run inside the transaction that claims them.
   */
  @Query(
      value =
          """
          SELECT id FROM action_queue_items
          WHERE status IN ('PENDING', 'RATE_LIMITED')
            AND scheduled_at <= :now
            AND attempts < max_attempts
          ORDER BY priority DESC, scheduled_at ASC
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
          """,
      nativeQuery = true)
  List<UUID> lockDueIds(@Param("now") Instant now, @Param("limit") int limit);

  @Query(
      value =
          """
          SELECT id FROM action_queue_items
          WHERE resource_id = :resourceId
            AND status IN ('PENDING', 'RATE_LIMITED')
            AND scheduled_at <= :now
            AND attempts < max_attempts
          ORDER BY priority DESC, scheduled_at ASC
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
          """,
      nativeQuery = true)
  List<UUID> lockDueIdsForResource(
      @Param("resourceId") UUID resourceId, @Param("now") Instant now, @Param("limit") int limit);

  /**
   * Claims one item if it is due and unclaimed, or if its claim is older than {@code
   * staleBefore}. Returns the number of rows updated (0 or 1).
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE action_queue_items
          SET status = 'PROCESSING', attempts = attempts + 1,
              claimed_by = :workerId, claimed_at = :now, updated_at = :now
          WHERE id = :id
            AND attempts < max_attempts
            AND ((status IN ('PENDING', 'RATE_LIMITED') AND scheduled_at <= :now)
              OR (status = 'PROCESSING' AND claimed_at < :staleBefore))
          """,
      nativeQuery = true)
  int claim(
      @Param("id") UUID id,
      @Param("workerId") String workerId,
      @Param("now") Instant now,
      @Param("staleBefore") Instant staleBefore);

  @Query(
      """
      SELECT i.id FROM ActionQueueItem i
      WHERE i.status = :status AND i.claimedAt < :staleBefore
      ORDER BY i.claimedAt
      """)
  List<UUID> findStaleClaimIds(
      @Param("status") ActionStatus status, @Param("staleBefore") Instant staleBefore);

  List<ActionQueueItem> findByTenantIdOrderByScheduledAtAsc(UUID tenantId);

  List<ActionQueueItem> findByTenantIdAndStatusOrderByScheduledAtAsc(
      UUID tenantId, ActionStatus status);

  @Query(
      """
      SELECT i.status AS status, COUNT(i) AS count FROM ActionQueueItem i
      GROUP BY i.status
      """)
  List<StatusCount> countByStatus();

  @Query(
      """
      SELECT i.status AS status, COUNT(i) AS count FROM ActionQueueItem i
      WHERE i.tenantId = :tenantId
      GROUP BY i.status
      """)
  List<StatusCount> countByStatusForTenant(@Param("tenantId") UUID tenantId);
}
