package io.b2mash.outreach.queue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountDailyStateRepository extends JpaRepository<AccountDailyState, UUID> {

  Optional<AccountDailyState> findByResourceIdAndStateDate(UUID resourceId, LocalDate stateDate);

  List<AccountDailyState> findByResourceIdOrderByStateDateDesc(UUID resourceId);

  /** Creates the day's row with its limit fixed; a concurrent creator wins silently. */
  @Modifying(flushAutomatically = true)
  @Query(
      value =
          """
          INSERT INTO account_daily_states
            (id, resource_id, state_date, daily_limit, actions_sent, created_at)
          VALUES (gen_random_uuid(), :resourceId, :stateDate, :dailyLimit, 0, :now)
          ON CONFLICT (resource_id, state_date) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("resourceId") UUID resourceId,
      @Param("stateDate") LocalDate stateDate,
      @Param("dailyLimit") int dailyLimit,
      @Param("now") Instant now);

  /**
   * Takes one slot if both the day's fixed limit and the limit in force right now allow it.
   * Returns 1 on success and 0 when the day is full.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE account_daily_states
          SET actions_sent = actions_sent + 1, last_action_at = :now
          WHERE resource_id = :resourceId AND state_date = :stateDate
            AND actions_sent < LEAST(daily_limit, :effectiveLimit)
          """,
      nativeQuery = true)
  int tryReserve(
      @Param("resourceId") UUID resourceId,
      @Param("stateDate") LocalDate stateDate,
      @Param("effectiveLimit") int effectiveLimit,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          """
          UPDATE account_daily_states
          SET actions_sent = actions_sent - 1
          WHERE resource_id = :resourceId AND state_date = :stateDate AND actions_sent > 0
          """,
      nativeQuery = true)
  int refund(@Param("resourceId") UUID resourceId, @Param("stateDate") LocalDate stateDate);
}
