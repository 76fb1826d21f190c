package io.b2mash.outreach.campaign;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.outreach.TestcontainersConfiguration;
import io.b2mash.outreach.exception.AllocationExceededException;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantService;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class CampaignAllocationIntegrationTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;
  @Autowired private TenantService tenantService;
  @Autowired private CampaignAllocationService allocationService;

  private TenantContext newTenant() {
    return TenantContext.of(tenantService.createTenant("Campaign Co", "velocity-monthly", "UTC"));
  }

  private ResultActions putAllocation(TenantContext tenant, UUID campaignId, int pct)
      throws Exception {
    return mockMvc.perform(
        put("/internal/tenants/{t}/campaign-allocations/{c}", tenant.tenantId(), campaignId)
            .header("X-API-KEY", API_KEY)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\": \"Campaign " + pct + "\", \"leadAllocationPct\": " + pct + "}"));
  }

  @Test
  void thirdCampaign_cannotPushTotalPastHundred() throws Exception {
    var tenant = newTenant();
    putAllocation(tenant, UUID.randomUUID(), 60).andExpect(status().isOk());
    putAllocation(tenant, UUID.randomUUID(), 30)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DRAFT"));

    putAllocation(tenant, UUID.randomUUID(), 15)
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.title").value("Allocation exceeded"))
        .andExpect(jsonPath("$.code").value("ALLOCATION_EXCEEDED"))
        .andExpect(jsonPath("$.allocated").value(90))
        .andExpect(jsonPath("$.available").value(10));

    mockMvc
        .perform(
            get("/internal/tenants/{t}/campaign-allocations", tenant.tenantId())
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.allocatedPct").value(90))
        .andExpect(jsonPath("$.remainingPct").value(10));
  }

  @Test
  void validate_excludesCampaignsOwnShare() throws Exception {
    var tenant = newTenant();
    var campaignId = UUID.randomUUID();
    allocationService.upsert(tenant, campaignId, "Main", 70);

    mockMvc
        .perform(
            post("/internal/tenants/{t}/campaign-allocations/validate", tenant.tenantId())
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"campaignId\": \"" + campaignId + "\", \"leadAllocationPct\": 100}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.allocatedElsewhere").value(0))
        .andExpect(jsonPath("$.remaining").value(0));
  }

  @Test
  void cancelledCampaign_freesItsShare() throws Exception {
    var tenant = newTenant();
    var big = UUID.randomUUID();
    allocationService.upsert(tenant, big, "Big", 80);

    assertThatThrownBy(() -> allocationService.upsert(tenant, UUID.randomUUID(), "Small", 30))
        .isInstanceOf(AllocationExceededException.class);

    mockMvc
        .perform(
            post("/internal/tenants/{t}/campaign-allocations/{c}/status", tenant.tenantId(), big)
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"CANCELLED\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"));

    var small = allocationService.upsert(tenant, UUID.randomUUID(), "Small", 30);
    assertThat(small.getLeadAllocationPct()).isEqualTo(30);
    assertThat(allocationService.summary(tenant).allocatedPct()).isEqualTo(30);
  }

  @Test
  void closedCampaign_cannotBeEdited() {
    var tenant = newTenant();
    var campaignId = UUID.randomUUID();
    allocationService.upsert(tenant, campaignId, "Done", 20);
    allocationService.changeStatus(tenant, campaignId, CampaignStatus.ACTIVE);
    allocationService.changeStatus(tenant, campaignId, CampaignStatus.COMPLETED);

    assertThatThrownBy(() -> allocationService.upsert(tenant, campaignId, "Done again", 10))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void outOfRangePct_failsValidation() throws Exception {
    putAllocation(newTenant(), UUID.randomUUID(), 0).andExpect(status().isBadRequest());
  }

  @Test
  void leadShare_roundsDown() {
    var tenant = newTenant();
    var campaignId = UUID.randomUUID();
    allocationService.upsert(tenant, campaignId, "Third", 33);

    assertThat(allocationService.leadShare(tenant, campaignId, 100)).isEqualTo(33);
    assertThat(allocationService.leadShare(tenant, campaignId, 10)).isEqualTo(3);
  }
}
