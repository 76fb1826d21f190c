package io.b2mash.outreach.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.outreach.health.DailyLimitPolicy;
import io.b2mash.outreach.resource.PoolResource;
import io.b2mash.outreach.resource.PoolResourceRepository;
import io.b2mash.outreach.resource.ResourceType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DailyCapServiceTest {

  private static final ZoneId SYDNEY = ZoneId.of("Australia/Sydney");

  private AccountDailyStateRepository dailyStateRepository;
  private PoolResourceRepository resourceRepository;
  private DailyLimitPolicy dailyLimitPolicy;
  private DailyCapService service;
  private PoolResource resource;
  private final UUID resourceId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    dailyStateRepository = mock(AccountDailyStateRepository.class);
    resourceRepository = mock(PoolResourceRepository.class);
    dailyLimitPolicy = mock(DailyLimitPolicy.class);
    service =
        new DailyCapService(
            dailyStateRepository, resourceRepository, dailyLimitPolicy, limit -> limit - 2);
    resource = new PoolResource(ResourceType.LINKEDIN_SEAT, "seat-1", 1, "unipile", null);
    resource.adoptTimezone(SYDNEY);
    when(resourceRepository.findById(resourceId)).thenReturn(Optional.of(resource));
  }

  @Test
  void reserve_usesResourceLocalDayAndJittersNewRow() {
    // 20:00 UTC on 1 June is already 2 June in Sydney
    var now = Instant.parse("2025-06-01T20:00:00Z");
    var localDay = LocalDate.of(2025, 6, 2);
    when(dailyLimitPolicy.effectiveDailyLimit(resource, now)).thenReturn(20);
    when(dailyStateRepository.tryReserve(resourceId, localDay, 20, now)).thenReturn(1);

    var reservation = service.tryReserve(resourceId, now);

    verify(dailyStateRepository).insertIfAbsent(resourceId, localDay, 18, now);
    assertThat(reservation.reserved()).isTrue();
    assertThat(reservation.stateDate()).isEqualTo(localDay);
    assertThat(reservation.nextWindow()).isNull();
  }

  @Test
  void fullDay_pointsAtLocalMidnight() {
    var now = Instant.parse("2025-06-01T20:00:00Z");
    when(dailyLimitPolicy.effectiveDailyLimit(any(), any())).thenReturn(20);
    when(dailyStateRepository.tryReserve(eq(resourceId), any(), anyInt(), eq(now)))
        .thenReturn(0);

    var reservation = service.tryReserve(resourceId, now);

    assertThat(reservation.reserved()).isFalse();
    assertThat(reservation.nextWindow()).isEqualTo(Instant.parse("2025-06-02T14:00:00Z"));
  }

  @Test
  void randomJitter_staysWithinBounds() {
    var jitter = DailyCapService.randomJitter(10);
    for (int i = 0; i < 200; i++) {
      assertThat(jitter.applyAsInt(50)).isBetween(45, 50);
    }
    assertThat(jitter.applyAsInt(5)).isEqualTo(5);
    assertThat(DailyCapService.randomJitter(0).applyAsInt(50)).isEqualTo(50);
  }
}
