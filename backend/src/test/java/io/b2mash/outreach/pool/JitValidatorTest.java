package io.b2mash.outreach.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.Tier;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JitValidatorTest {

  private static final UUID LEAD_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
  private static final TenantContext TENANT =
      new TenantContext(UUID.randomUUID(), Tier.VELOCITY, ZoneOffset.UTC);

  @Mock private PoolLeadRepository leadRepository;
  @Mock private LeadAssignmentRepository assignmentRepository;
  @Mock private SuppressionEntryRepository suppressionRepository;

  private JitValidator validator;

  @BeforeEach
  void setUp() {
    validator =
        new JitValidator(
            leadRepository,
            assignmentRepository,
            suppressionRepository,
            new PoolProperties(Duration.ofDays(2), 1000));
  }

  private PoolLead verifiedLead() {
    var lead = new PoolLead("ext-1", "sam@acme.com", EmailVerification.VERIFIED);
    when(leadRepository.findById(LEAD_ID)).thenReturn(Optional.of(lead));
    return lead;
  }

  private LeadAssignment activeAssignment() {
    var assignment = new LeadAssignment(LEAD_ID, TENANT.tenantId(), null, "allocator", null);
    when(suppressionRepository.findMatching(any(), any(), any(), any(), any()))
        .thenReturn(List.of());
    when(assignmentRepository.findByTenantIdAndLeadIdAndStatus(
            eq(TENANT.tenantId()), any(), eq(AssignmentStatus.ACTIVE)))
        .thenReturn(Optional.of(assignment));
    return assignment;
  }

  @Test
  void missingLead_isRejected() {
    when(leadRepository.findById(LEAD_ID)).thenReturn(Optional.empty());

    var result = validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW);

    assertThat(result.valid()).isFalse();
    assertThat(result.rejection()).isEqualTo(JitRejection.LEAD_NOT_FOUND);
  }

  @Test
  void bouncedLead_isRejectedBeforeAnyLookup() {
    verifiedLead().flagBounced("hard");

    var result = validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW);

    assertThat(result.rejection()).isEqualTo(JitRejection.BOUNCED_GLOBALLY);
    verifyNoInteractions(assignmentRepository, suppressionRepository);
  }

  @Test
  void unsubscribedLead_isRejected() {
    verifiedLead().flagUnsubscribed();

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.LINKEDIN, NOW).rejection())
        .isEqualTo(JitRejection.UNSUBSCRIBED_GLOBALLY);
  }

  @Test
  void guessedEmail_isRejectedForEmailOnly() {
    var lead = new PoolLead("ext-2", "sam@acme.com", EmailVerification.GUESSED);
    when(leadRepository.findById(LEAD_ID)).thenReturn(Optional.of(lead));

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.UNVERIFIED_EMAIL);
  }

  @Test
  void suppressedDomain_isRejected() {
    verifiedLead();
    when(suppressionRepository.findMatching(
            TENANT.tenantId(),
            SuppressionKind.EMAIL,
            "sam@acme.com",
            SuppressionKind.DOMAIN,
            "acme.com"))
        .thenReturn(
            List.of(
                new SuppressionEntry(
                    TENANT.tenantId(), SuppressionKind.DOMAIN, "acme.com", "complaint")));

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.SUPPRESSED);
  }

  @Test
  void leadOwnedByAnotherTenant_isNotAssigned() {
    verifiedLead();
    when(suppressionRepository.findMatching(any(), any(), any(), any(), any()))
        .thenReturn(List.of());
    when(assignmentRepository.findByTenantIdAndLeadIdAndStatus(any(), any(), any()))
        .thenReturn(Optional.empty());

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.NOT_ASSIGNED);
  }

  @Test
  void maxTouches_isEnforced() {
    verifiedLead();
    var assignment = activeAssignment();
    assignment.changeMaxTouches(1);
    assignment.recordTouch(Channel.EMAIL, NOW.minus(Duration.ofDays(5)));

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.MAX_TOUCHES_REACHED);
  }

  @Test
  void negativeReply_blocksFurtherOutreach() {
    verifiedLead();
    activeAssignment().recordReply("not_interested", NOW.minus(Duration.ofDays(1)));

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.NEGATIVE_REPLY);
  }

  @Test
  void coolingPeriod_blocksUntilItEnds() {
    verifiedLead();
    activeAssignment().coolOff(NOW.plus(Duration.ofDays(3)));

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.COOLING_PERIOD);
    var later = NOW.plus(Duration.ofDays(4));
    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, later).valid()).isTrue();
  }

  @Test
  void touchWithinMinimumGap_isTooRecent() {
    verifiedLead();
    activeAssignment().recordTouch(Channel.LINKEDIN, NOW.minus(Duration.ofHours(20)));

    assertThat(validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW).rejection())
        .isEqualTo(JitRejection.TOO_RECENT);
  }

  @Test
  void healthyAssignment_passesAndIsIdempotent() {
    verifiedLead();
    activeAssignment();

    var first = validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW);
    var second = validator.validate(TENANT, LEAD_ID, Channel.EMAIL, NOW);

    assertThat(first.valid()).isTrue();
    assertThat(first.rejection()).isNull();
    assertThat(second).isEqualTo(first);
  }

  @Test
  void batch_preservesOrder() {
    var other = UUID.randomUUID();
    verifiedLead();
    activeAssignment();
    when(leadRepository.findById(other)).thenReturn(Optional.empty());

    var results = validator.validateBatch(TENANT, List.of(other, LEAD_ID), Channel.EMAIL, NOW);

    assertThat(results.keySet()).containsExactly(other, LEAD_ID);
    assertThat(results.get(other).rejection()).isEqualTo(JitRejection.LEAD_NOT_FOUND);
    assertThat(results.get(LEAD_ID).valid()).isTrue();
  }
}
