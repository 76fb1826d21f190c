package io.b2mash.outreach.tenant;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

  List<Tenant> findByStatus(TenantStatus status);

  /** Locks the tenant row. Serializes per-tenant bookkeeping such as campaign allocation sums. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Tenant t WHERE t.id = :id")
  Optional<Tenant> findByIdForUpdate(@Param("id") UUID id);
}
