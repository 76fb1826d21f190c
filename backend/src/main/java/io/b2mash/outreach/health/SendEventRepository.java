package io.b2mash.outreach.health;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SendEventRepository extends JpaRepository<SendEvent, UUID> {

  /** Typed projection for per-type event counts. */
  interface EventTypeCount {
    SendEventType getEventType();

    long getCount();
  }

  @Query(
      """
      SELECT e.eventType AS eventType, COUNT(e) AS count FROM SendEvent e
      WHERE e.resourceId = :resourceId AND e.occurredAt >= :since AND e.occurredAt <= :until
      GROUP BY e.eventType
      """)
  List<EventTypeCount> countByTypeInWindow(
      @Param("resourceId") UUID resourceId,
      @Param("since") Instant since,
      @Param("until") Instant until);
}
