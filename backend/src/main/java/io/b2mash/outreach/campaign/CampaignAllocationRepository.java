package io.b2mash.outreach.campaign;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CampaignAllocationRepository extends JpaRepository<CampaignAllocation, UUID> {

  Optional<CampaignAllocation> findByTenantIdAndCampaignId(UUID tenantId, UUID campaignId);

  List<CampaignAllocation> findByTenantIdOrderByCreatedAtAsc(UUID tenantId);

  List<CampaignAllocation> findByTenantIdAndStatus(UUID tenantId, CampaignStatus status);

  /** Sum of percentages held by the tenant's campaigns in the given statuses, minus one. */
  @Query(
      """
      SELECT COALESCE(SUM(c.leadAllocationPct), 0) FROM CampaignAllocation c
      WHERE c.tenantId = :tenantId
        AND c.status IN :statuses
        AND c.campaignId <> :excludedCampaignId
      """)
  long sumAllocatedExcluding(
      @Param("tenantId") UUID tenantId,
      @Param("statuses") Collection<CampaignStatus> statuses,
      @Param("excludedCampaignId") UUID excludedCampaignId);
}
