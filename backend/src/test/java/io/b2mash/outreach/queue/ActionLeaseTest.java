package io.b2mash.outreach.queue;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class ActionLeaseTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
  private static final Duration LEASE = Duration.ofMinutes(10);

  private final InMemoryActionLease lease = new InMemoryActionLease();

  private UUID addPending(int maxAttempts) {
    var id = UUID.randomUUID();
    lease.add(
        id,
        new ActionQueueItem(
            UUID.randomUUID(),
            UUID.randomUUID(),
            UUID.randomUUID(),
            null,
            ActionType.CONNECTION_REQUEST,
            null,
            NOW,
            0,
            maxAttempts));
    return id;
  }

  @Test
  void secondClaim_withinLease_isRefused() {
    var id = addPending(3);

    assertThat(lease.tryClaim(id, "worker-a", LEASE, NOW)).isEqualTo(ClaimResult.CLAIMED);
    assertThat(lease.tryClaim(id, "worker-b", LEASE, NOW.plusSeconds(30)))
        .isEqualTo(ClaimResult.ALREADY_CLAIMED);
  }

  @Test
  void staleClaim_canBeTakenOver() {
    var id = addPending(3);
    lease.tryClaim(id, "worker-a", LEASE, NOW);

    assertThat(lease.tryClaim(id, "worker-b", LEASE, NOW.plus(Duration.ofMinutes(11))))
        .isEqualTo(ClaimResult.CLAIMED);
  }

  @Test
  void exhaustedItem_isNeverClaimed() {
    var id = addPending(1);
    lease.tryClaim(id, "worker-a", LEASE, NOW);

    assertThat(lease.tryClaim(id, "worker-b", LEASE, NOW.plus(Duration.ofHours(1))))
        .isEqualTo(ClaimResult.ALREADY_CLAIMED);
  }

  @Test
  void concurrentClaims_exactlyOneWins() throws Exception {
    var id = addPending(3);
    int workers = 8;
    var start = new CountDownLatch(1);
    var pool = Executors.newFixedThreadPool(workers);
    try {
      var futures = new ArrayList<Future<ClaimResult>>();
      for (int i = 0; i < workers; i++) {
        var workerId = "worker-" + i;
        Callable<ClaimResult> claim =
            () -> {
              start.await();
              return lease.tryClaim(id, workerId, LEASE, NOW);
            };
        futures.add(pool.submit(claim));
      }
      start.countDown();

      int claimed = 0;
      for (var future : futures) {
        if (future.get() == ClaimResult.CLAIMED) {
          claimed++;
        }
      }
      assertThat(claimed).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
