package io.b2mash.outreach.scoring;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LeadScoreRecordRepository extends JpaRepository<LeadScoreRecord, UUID> {

  Optional<LeadScoreRecord> findByLeadId(UUID leadId);
}
