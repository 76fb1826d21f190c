package io.b2mash.outreach.pool;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PoolLeadRepository extends JpaRepository<PoolLead, UUID> {

  /** Pool-wide count per status, for stats. */
  interface StatusCount {
    PoolStatus getStatus();

    long getCount();
  }

  Optional<PoolLead> findByEmail(String email);

  boolean existsByEmail(String email);

  boolean existsByExternalId(String externalId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT l FROM PoolLead l WHERE l.id = :id")
  Optional<PoolLead> findByIdForUpdate(@Param("id") UUID id);

  /**
   * Locks up to {@code limit} available leads matching the criteria, skipping rows another
   * transaction already holds. Empty criteria arrays match everything. Best-scored leads first.
   */
  @Query(
      value =
          """
          SELECT * FROM pool_leads l
          WHERE l.pool_status = 'AVAILABLE'
            AND l.is_bounced = false
            AND l.is_unsubscribed = false
            AND l.email_verification IN (:verifications)
            AND (:anyIndustry = true OR lower(l.industry) IN (:industries))
            AND (:anyCountry = true OR lower(l.country) IN (:countries))
            AND (:anySeniority = true OR lower(l.seniority) IN (:seniorities))
            AND (CAST(:minEmployees AS INTEGER) IS NULL OR l.employee_count >= :minEmployees)
            AND (CAST(:maxEmployees AS INTEGER) IS NULL OR l.employee_count <= :maxEmployees)
          ORDER BY l.als_score DESC NULLS LAST, l.created_at ASC
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
          """,
      nativeQuery = true)
  List<PoolLead> lockMatchingAvailable(
      @Param("verifications") List<String> verifications,
      @Param("anyIndustry") boolean anyIndustry,
      @Param("industries") List<String> industries,
      @Param("anyCountry") boolean anyCountry,
      @Param("countries") List<String> countries,
      @Param("anySeniority") boolean anySeniority,
      @Param("seniorities") List<String> seniorities,
      @Param("minEmployees") Integer minEmployees,
      @Param("maxEmployees") Integer maxEmployees,
      @Param("limit") int limit);

  @Query("SELECT l.poolStatus AS status, COUNT(l) AS count FROM PoolLead l GROUP BY l.poolStatus")
  List<StatusCount> countByPoolStatus();

  List<PoolLead> findByAlsScoreIsNull();
}
