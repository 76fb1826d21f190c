package io.b2mash.outreach.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.outreach.TestcontainersConfiguration;
import io.b2mash.outreach.exception.CapacityExceededException;
import io.b2mash.outreach.exception.InvalidStateException;
import io.b2mash.outreach.exception.ResourceConflictException;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantService;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ResourceAllocatorIntegrationTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;
  @Autowired private TenantService tenantService;
  @Autowired private ResourceAllocator resourceAllocator;
  @Autowired private TenantResourceGrantRepository grantRepository;
  @Autowired private PlatformTransactionManager transactionManager;

  private TenantContext newTenant(String planSlug, String timezone) {
    return TenantContext.of(tenantService.createTenant("Grant " + planSlug, planSlug, timezone));
  }

  private PoolResource newResource(ResourceType type, int maxTenants) {
    return resourceAllocator.addResource(
        new ResourceAllocator.AddResourceCommand(
            type,
            "res-" + UUID.randomUUID(),
            maxTenants,
            "test",
            null,
            Instant.now().minus(Duration.ofDays(60))));
  }

  @Test
  void concurrentGrants_neverExceedMaxTenants() throws Exception {
    var resource = newResource(ResourceType.EMAIL_DOMAIN, 2);
    int contenders = 5;
    var tenants = new ArrayList<TenantContext>();
    for (int i = 0; i < contenders; i++) {
      tenants.add(newTenant("velocity", "UTC"));
    }

    var latch = new CountDownLatch(1);
    var granted = new ConcurrentLinkedQueue<UUID>();
    var rejected = new ConcurrentLinkedQueue<Throwable>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(contenders);
    for (var tenant : tenants) {
      executor.submit(
          () -> {
            try {
              latch.await();
              granted.add(resourceAllocator.grant(tenant, resource.getId()).getId());
            } catch (CapacityExceededException e) {
              rejected.add(e);
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }
    latch.countDown();
    executor.shutdown();

    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    assertThat(granted).hasSize(2);
    assertThat(rejected).hasSize(3);

    var reloaded = resourceAllocator.getResource(resource.getId());
    assertThat(reloaded.getCurrentTenants()).isEqualTo(2);
    assertThat(reloaded.getStatus()).isEqualTo(ResourceStatus.ASSIGNED);
  }

  @Test
  void fullResource_returnsConflict() throws Exception {
    var resource = newResource(ResourceType.LINKEDIN_SEAT, 1);
    resourceAllocator.grant(newTenant("velocity", "UTC"), resource.getId());
    var latecomer = newTenant("velocity", "UTC");

    mockMvc
        .perform(
            post(
                    "/internal/tenants/{t}/resources/{r}/grant",
                    latecomer.tenantId(),
                    resource.getId())
                .header("X-API-KEY", API_KEY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Resource at capacity"));
  }

  @Test
  void sameTenant_cannotHoldResourceTwice() {
    var resource = newResource(ResourceType.EMAIL_DOMAIN, 3);
    var tenant = newTenant("velocity", "UTC");
    resourceAllocator.grant(tenant, resource.getId());

    assertThatThrownBy(() -> resourceAllocator.grant(tenant, resource.getId()))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void revoke_freesSlotForAnotherTenant() {
    var resource = newResource(ResourceType.LINKEDIN_SEAT, 1);
    var first = newTenant("velocity", "UTC");
    var grant = resourceAllocator.grant(first, resource.getId());

    resourceAllocator.revoke(first, grant.getId());

    assertThat(resourceAllocator.holds(first, resource.getId())).isFalse();
    var second = newTenant("velocity", "UTC");
    resourceAllocator.grant(second, resource.getId());
    assertThat(resourceAllocator.getResource(resource.getId()).getCurrentTenants()).isEqualTo(1);
  }

  @Test
  void concurrentRevokes_freeSlotOnce() throws Exception {
    var resource = newResource(ResourceType.EMAIL_DOMAIN, 2);
    var leaving = newTenant("velocity", "UTC");
    var staying = newTenant("velocity", "UTC");
    var grant = resourceAllocator.grant(leaving, resource.getId());
    resourceAllocator.grant(staying, resource.getId());

    int callers = 5;
    var latch = new CountDownLatch(1);
    var revoked = new ConcurrentLinkedQueue<UUID>();
    var rejected = new ConcurrentLinkedQueue<Throwable>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(callers);
    for (int i = 0; i < callers; i++) {
      executor.submit(
          () -> {
            try {
              latch.await();
              revoked.add(resourceAllocator.revoke(leaving, grant.getId()).getId());
            } catch (InvalidStateException e) {
              rejected.add(e);
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }
    latch.countDown();
    executor.shutdown();

    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    assertThat(revoked).hasSize(1);
    assertThat(rejected).hasSize(callers - 1);
    assertThat(resourceAllocator.getResource(resource.getId()).getCurrentTenants()).isEqualTo(1);
    assertThat(resourceAllocator.holds(staying, resource.getId())).isTrue();
  }

  @Test
  void revokeOfGrantReleasedElsewhere_doesNotFreeSecondSlot() {
    var resource = newResource(ResourceType.LINKEDIN_SEAT, 2);
    var leaving = newTenant("velocity", "UTC");
    var staying = newTenant("velocity", "UTC");
    var grant = resourceAllocator.grant(leaving, resource.getId());
    resourceAllocator.grant(staying, resource.getId());
    var tx = new TransactionTemplate(transactionManager);

    assertThatThrownBy(
            () ->
                tx.executeWithoutResult(
                    status -> {
                      // cache the grant while it is still active
                      assertThat(grantRepository.findById(grant.getId()))
                          .hasValueSatisfying(g -> assertThat(g.isActive()).isTrue());
                      inOtherTransaction(() -> resourceAllocator.revoke(leaving, grant.getId()));
                      resourceAllocator.revoke(leaving, grant.getId());
                    }))
        .isInstanceOf(InvalidStateException.class);

    assertThat(resourceAllocator.getResource(resource.getId()).getCurrentTenants()).isEqualTo(1);
  }

  @Test
  void concurrentRequests_skipResourcesFilledByOthers() throws Exception {
    newResource(ResourceType.PHONE_NUMBER, 1);
    newResource(ResourceType.PHONE_NUMBER, 1);
    int contenders = 6;
    var tenants = new ArrayList<TenantContext>();
    for (int i = 0; i < contenders; i++) {
      tenants.add(newTenant("velocity", "UTC"));
    }

    var latch = new CountDownLatch(1);
    var granted = new ConcurrentLinkedQueue<TenantResourceGrant>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(contenders);
    for (var tenant : tenants) {
      executor.submit(
          () -> {
            try {
              latch.await();
              List<TenantResourceGrant> grants =
                  resourceAllocator.requestResources(tenant, ResourceType.PHONE_NUMBER, 1);
              assertThat(grants).hasSizeLessThanOrEqualTo(1);
              granted.addAll(grants);
            } catch (Throwable e) {
              errors.add(e);
            }
          });
    }
    latch.countDown();
    executor.shutdown();

    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    assertThat(granted).isNotEmpty();
    var holdersByResource =
        granted.stream()
            .collect(
                Collectors.groupingBy(TenantResourceGrant::getResourceId, Collectors.counting()));
    holdersByResource.forEach(
        (resourceId, holders) -> {
          var reloaded = resourceAllocator.getResource(resourceId);
          assertThat(holders).isLessThanOrEqualTo(reloaded.getMaxTenants());
          assertThat(reloaded.getCurrentTenants()).isLessThanOrEqualTo(reloaded.getMaxTenants());
        });
  }

  private static void inOtherTransaction(Runnable work) {
    var executor = Executors.newSingleThreadExecutor();
    try {
      executor.submit(work).get(30, TimeUnit.SECONDS);
    } catch (Exception e) {
      throw new IllegalStateException("Background work failed", e);
    } finally {
      executor.shutdown();
    }
  }

  @Test
  void firstHolder_setsResourceTimezone() {
    var resource = newResource(ResourceType.EMAIL_DOMAIN, 2);
    var sydney = newTenant("velocity", "Australia/Sydney");

    resourceAllocator.grant(sydney, resource.getId());

    assertThat(resourceAllocator.getResource(resource.getId()).zone())
        .isEqualTo(ZoneId.of("Australia/Sydney"));
  }

  @Test
  void requestBeyondTierQuota_isRejected() throws Exception {
    newResource(ResourceType.PHONE_NUMBER, 1);
    newResource(ResourceType.PHONE_NUMBER, 1);
    var ignition = newTenant("ignition", "UTC");

    mockMvc
        .perform(
            post("/internal/tenants/{t}/resources/request", ignition.tenantId())
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resourceType\": \"PHONE_NUMBER\", \"count\": 2}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("Plan limit exceeded"));
  }

  @Test
  void heldResource_cannotBeRetired() {
    var resource = newResource(ResourceType.EMAIL_DOMAIN, 2);
    resourceAllocator.grant(newTenant("velocity", "UTC"), resource.getId());

    assertThatThrownBy(() -> resourceAllocator.retire(resource.getId(), "reputation"))
        .isInstanceOf(InvalidStateException.class);
  }
}
