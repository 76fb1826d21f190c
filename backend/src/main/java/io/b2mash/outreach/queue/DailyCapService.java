package io.b2mash.outreach.queue;

import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.health.DailyLimitPolicy;
import io.b2mash.outreach.resource.PoolResource;
import io.b2mash.outreach.resource.PoolResourceRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Enforces the per-resource daily send cap at dispatch time. The day is the resource's local
 * calendar day; its row is created on the first reservation, so no midnight reset is needed.
 */
@Service
public class DailyCapService {

  private static final Logger log = LoggerFactory.getLogger(DailyCapService.class);

  private final AccountDailyStateRepository dailyStateRepository;
  private final PoolResourceRepository resourceRepository;
  private final DailyLimitPolicy dailyLimitPolicy;
  private final IntUnaryOperator jitter;

  /** Outcome of a reservation attempt. */
  public record Reservation(boolean reserved, LocalDate stateDate, Instant nextWindow) {}

  @Autowired
  public DailyCapService(
      AccountDailyStateRepository dailyStateRepository,
      PoolResourceRepository resourceRepository,
      DailyLimitPolicy dailyLimitPolicy,
      QueueProperties queueProperties) {
    this(
        dailyStateRepository,
        resourceRepository,
        dailyLimitPolicy,
        randomJitter(queueProperties.jitterPct()));
  }

  DailyCapService(
      AccountDailyStateRepository dailyStateRepository,
      PoolResourceRepository resourceRepository,
      DailyLimitPolicy dailyLimitPolicy,
      IntUnaryOperator jitter) {
    this.dailyStateRepository = dailyStateRepository;
    this.resourceRepository = resourceRepository;
    this.dailyLimitPolicy = dailyLimitPolicy;
    this.jitter = jitter;
  }

  /**
   * Takes one send slot for today. The comparison and increment are a single conditional update,
   * so concurrent dispatchers never push {@code actions_sent} past the limit.
   */
  @Transactional
  public Reservation tryReserve(UUID resourceId, Instant now) {
    var resource =
        resourceRepository
            .findById(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    ZoneId zone = resource.zone();
    LocalDate today = LocalDate.ofInstant(now, zone);
    int effective = dailyLimitPolicy.effectiveDailyLimit(resource, now);

    dailyStateRepository.insertIfAbsent(resourceId, today, jitter.applyAsInt(effective), now);
    boolean reserved = dailyStateRepository.tryReserve(resourceId, today, effective, now) == 1;
    if (!reserved) {
      log.debug(
          "Resource {} is at its daily limit for {} (effective {})", resourceId, today, effective);
    }
    return new Reservation(reserved, today, reserved ? null : nextWindow(zone, today));
  }

  /** Returns a slot taken by {@link #tryReserve} whose send did not go out. */
  @Transactional
  public void refund(UUID resourceId, LocalDate stateDate) {
    if (dailyStateRepository.refund(resourceId, stateDate) == 0) {
      log.warn("No slot to refund for resource {} on {}", resourceId, stateDate);
    }
  }

  @Transactional(readOnly = true)
  public AccountDailyState today(PoolResource resource, Instant now) {
    return dailyStateRepository
        .findByResourceIdAndStateDate(resource.getId(), LocalDate.ofInstant(now, resource.zone()))
        .orElse(null);
  }

  /** Start of the day after {@code today} in {@code zone}. */
  public static Instant nextWindow(ZoneId zone, LocalDate today) {
    return today.plusDays(1).atStartOfDay(zone).toInstant();
  }

  /** Lowers a new day's limit by a random amount of up to {@code pct} percent. */
  static IntUnaryOperator randomJitter(int pct) {
    if (pct <= 0) {
      return IntUnaryOperator.identity();
    }
    return limit -> {
      int maxReduction = limit * pct / 100;
      if (maxReduction == 0) {
        return limit;
      }
      return limit - ThreadLocalRandom.current().nextInt(maxReduction + 1);
    };
  }
}
