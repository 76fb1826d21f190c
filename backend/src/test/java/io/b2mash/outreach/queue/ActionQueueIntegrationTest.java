package io.b2mash.outreach.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.outreach.TestcontainersConfiguration;
import io.b2mash.outreach.audit.AuditEvent;
import io.b2mash.outreach.audit.AuditService;
import io.b2mash.outreach.health.HealthMonitorService;
import io.b2mash.outreach.pool.EmailVerification;
import io.b2mash.outreach.pool.LeadPoolService;
import io.b2mash.outreach.queue.ActionDispatcher.DispatchResult;
import io.b2mash.outreach.resource.PoolResource;
import io.b2mash.outreach.resource.ResourceAllocator;
import io.b2mash.outreach.resource.ResourceType;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantService;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ActionQueueIntegrationTest {

  private static final String API_KEY = "test-api-key";

  @Autowired private MockMvc mockMvc;
  @Autowired private TenantService tenantService;
  @Autowired private LeadPoolService leadPoolService;
  @Autowired private ResourceAllocator resourceAllocator;
  @Autowired private HealthMonitorService healthMonitorService;
  @Autowired private ActionQueueService queueService;
  @Autowired private ActionQueueRepository queueRepository;
  @Autowired private AccountDailyStateRepository dailyStateRepository;
  @Autowired private ActionDispatcher dispatcher;
  @Autowired private JdbcActionLease actionLease;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private AuditService auditService;

  @MockitoBean private DeliveryProvider deliveryProvider;

  private TenantContext tenant;
  private PoolResource resource;

  @BeforeEach
  void setUp() throws Exception {
    when(deliveryProvider.providerId()).thenReturn("mock");
    when(deliveryProvider.deliver(any())).thenReturn(new DeliveryReceipt("msg-1"));

    tenant =
        TenantContext.of(tenantService.createTenant("Queue Co", "velocity-monthly", "UTC"));
    resource =
        resourceAllocator.addResource(
            new ResourceAllocator.AddResourceCommand(
                ResourceType.EMAIL_DOMAIN,
                "mail-" + UUID.randomUUID() + ".example.com",
                3,
                "test",
                null,
                Instant.now().minus(Duration.ofDays(30))));
    resourceAllocator.grant(tenant, resource.getId());
  }

  private UUID assignedLead() {
    var suffix = UUID.randomUUID().toString().substring(0, 8);
    var lead =
        leadPoolService.submitLead(
            new LeadPoolService.SubmitLeadCommand(
                "ext-" + suffix,
                "queue-" + suffix + "@example.com",
                EmailVerification.VERIFIED,
                "Sam",
                "Taylor",
                "Head of Sales",
                "director",
                null,
                null,
                "Example Pty Ltd",
                "example.com",
                "Software",
                120,
                "Australia",
                false,
                null));
    leadPoolService.assign(tenant, lead.getId(), null, null, "test");
    return lead.getId();
  }

  private ActionQueueItem enqueueEmail(int maxAttempts) {
    return queueService.enqueue(
        tenant,
        new ActionQueueService.EnqueueCommand(
            resource.getId(),
            assignedLead(),
            null,
            ActionType.EMAIL,
            "template-1",
            null,
            0,
            maxAttempts));
  }

  private ActionQueueItem reload(UUID itemId) {
    return queueRepository.findById(itemId).orElseThrow();
  }

  private int actionsSentToday() {
    var today = LocalDate.ofInstant(Instant.now(), resource.zone());
    return dailyStateRepository
        .findByResourceIdAndStateDate(resource.getId(), today)
        .map(AccountDailyState::getActionsSent)
        .orElse(0);
  }

  private void makeDue(UUID itemId) {
    jdbcTemplate.update(
        "UPDATE action_queue_items SET scheduled_at = now() - interval '1 minute' WHERE id = ?",
        itemId);
  }

  @Test
  void dailyLimit_defersActionsBeyondCap() {
    healthMonitorService.changeDailyLimitOverride(resource.getId(), 2);
    var items = List.of(enqueueEmail(3), enqueueEmail(3), enqueueEmail(3));

    var results = dispatcher.drain(resource.getId(), "worker-cap", 10);

    assertThat(results).containsEntry(DispatchResult.SENT, 2);
    assertThat(results).containsEntry(DispatchResult.RATE_LIMITED, 1);
    assertThat(actionsSentToday()).isEqualTo(2);

    var deferred =
        items.stream()
            .map(item -> reload(item.getId()))
            .filter(item -> item.getStatus() == ActionStatus.RATE_LIMITED)
            .toList();
    assertThat(deferred).hasSize(1);
    assertThat(deferred.get(0).getAttempts()).isZero();
    assertThat(deferred.get(0).getScheduledAt()).isAfter(Instant.now());
  }

  @Test
  void concurrentWorkers_neverSendPastDailyCap() throws Exception {
    healthMonitorService.changeDailyLimitOverride(resource.getId(), 2);
    int itemCount = 6;
    var itemIds = new ArrayList<UUID>();
    for (int i = 0; i < itemCount; i++) {
      itemIds.add(enqueueEmail(3).getId());
    }

    int workers = 3;
    var latch = new CountDownLatch(1);
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(workers);
    for (int w = 0; w < workers; w++) {
      var workerId = "worker-cap-" + w;
      executor.submit(
          () -> {
            try {
              latch.await();
              dispatcher.drain(resource.getId(), workerId, itemCount);
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }
    latch.countDown();
    executor.shutdown();

    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();
    // pick up anything skipped while another worker held the row
    dispatcher.drain(resource.getId(), "worker-cap-sweep", itemCount);

    Map<ActionStatus, Long> byStatus =
        itemIds.stream()
            .map(this::reload)
            .collect(Collectors.groupingBy(ActionQueueItem::getStatus, Collectors.counting()));
    assertThat(byStatus)
        .containsOnlyKeys(ActionStatus.SENT, ActionStatus.RATE_LIMITED)
        .containsEntry(ActionStatus.SENT, 2L)
        .containsEntry(ActionStatus.RATE_LIMITED, (long) itemCount - 2);
    assertThat(actionsSentToday()).isEqualTo(2);
    verify(deliveryProvider, times(2)).deliver(any());
  }

  @Test
  void repeatedProviderErrors_failActionAndRefundSlots() throws Exception {
    when(deliveryProvider.deliver(any()))
        .thenThrow(new DeliveryProviderException("503 service unavailable"));
    var item = enqueueEmail(3);

    assertThat(dispatcher.drain(resource.getId(), "worker-e", 1))
        .containsEntry(DispatchResult.RETRY_SCHEDULED, 1);
    assertThat(reload(item.getId()).getStatus()).isEqualTo(ActionStatus.PENDING);
    assertThat(reload(item.getId()).getAttempts()).isEqualTo(1);

    makeDue(item.getId());
    assertThat(dispatcher.drain(resource.getId(), "worker-e", 1))
        .containsEntry(DispatchResult.RETRY_SCHEDULED, 1);

    makeDue(item.getId());
    assertThat(dispatcher.drain(resource.getId(), "worker-e", 1))
        .containsEntry(DispatchResult.FAILED, 1);

    var failed = reload(item.getId());
    assertThat(failed.getStatus()).isEqualTo(ActionStatus.FAILED);
    assertThat(failed.getAttempts()).isEqualTo(3);
    assertThat(failed.getLastError()).contains("503");
    assertThat(actionsSentToday()).isZero();
    assertThat(auditService.findForEntity(item.getId()))
        .extracting(AuditEvent::getEventType, AuditEvent::getSource)
        .containsExactly(tuple("action.failed", "SCHEDULED"));

    makeDue(item.getId());
    assertThat(queueService.dequeueNext(resource.getId(), "worker-e")).isEmpty();
  }

  @Test
  void concurrentDequeue_neverHandsOutSameItemTwice() throws Exception {
    int itemCount = 6;
    for (int i = 0; i < itemCount; i++) {
      enqueueEmail(3);
    }

    int workers = 4;
    var latch = new CountDownLatch(1);
    var claimed = new ConcurrentLinkedQueue<UUID>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(workers);
    for (int w = 0; w < workers; w++) {
      var workerId = "worker-" + w;
      executor.submit(
          () -> {
            try {
              latch.await();
              for (int i = 0; i < 3; i++) {
                queueService
                    .dequeueNext(resource.getId(), workerId)
                    .ifPresent(item -> claimed.add(item.getId()));
              }
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }
    latch.countDown();
    executor.shutdown();

    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    assertThat(errors).isEmpty();

    // rows skipped while another worker held them are still due
    var leftover = queueService.dequeueNext(resource.getId(), "worker-sweep");
    while (leftover.isPresent()) {
      claimed.add(leftover.get().getId());
      leftover = queueService.dequeueNext(resource.getId(), "worker-sweep");
    }
    assertThat(new HashSet<>(claimed)).hasSameSizeAs(claimed);
    assertThat(claimed).hasSize(itemCount);
  }

  @Test
  void lease_isExclusiveUntilItExpires() {
    var item = enqueueEmail(3);
    var now = Instant.now().plusSeconds(1);
    var lease = Duration.ofMinutes(5);

    assertThat(actionLease.tryClaim(item.getId(), "worker-a", lease, now))
        .isEqualTo(ClaimResult.CLAIMED);
    assertThat(actionLease.tryClaim(item.getId(), "worker-b", lease, now))
        .isEqualTo(ClaimResult.ALREADY_CLAIMED);
    var afterExpiry = now.plus(lease).plusSeconds(1);
    assertThat(actionLease.tryClaim(item.getId(), "worker-b", lease, afterExpiry))
        .isEqualTo(ClaimResult.CLAIMED);
  }

  @Test
  void enqueueOnUngrantedResource_isForbidden() throws Exception {
    var outsider =
        TenantContext.of(tenantService.createTenant("Outsider", "velocity-monthly", "UTC"));

    mockMvc
        .perform(
            post("/internal/tenants/{t}/actions", outsider.tenantId())
                .header("X-API-KEY", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"resourceId\": \""
                        + resource.getId()
                        + "\", \"leadId\": \""
                        + UUID.randomUUID()
                        + "\", \"actionType\": \"EMAIL\", \"payloadRef\": \"t-1\","
                        + " \"priority\": 0, \"maxAttempts\": 3}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("Resource not granted"));
  }
}
