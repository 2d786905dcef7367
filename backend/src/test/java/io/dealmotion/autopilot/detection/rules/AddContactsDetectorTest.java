package io.dealmotion.autopilot.detection.rules;

import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.OWNER;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectRecord;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
import io.dealmotion.autopilot.pipeline.ResearchRecord;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AddContactsDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  @Mock private ResearchBriefReadRepository research;
  @Mock private ProspectReadRepository prospects;

  private AddContactsDetector detector;

  @BeforeEach
  void setUp() {
    detector = new AddContactsDetector(new PriorityCalculator(), research, prospects);
  }

  private static ResearchRecord brief(UUID prospectId) {
    return new ResearchRecord(
        UUID.randomUUID(),
        OWNER.userId(),
        OWNER.organizationId(),
        prospectId,
        "Acme",
        "completed",
        NOW.minus(1, ChronoUnit.DAYS),
        NOW.minus(2, ChronoUnit.DAYS));
  }

  private static ProspectRecord prospect(UUID id, String status) {
    return new ProspectRecord(
        id, OWNER.organizationId(), "Acme", status, BigDecimal.valueOf(60_000), null, NOW);
  }

  private void givenBriefs(ResearchRecord... briefs) {
    when(research.findCompletedSince(OWNER.organizationId(), NOW.minus(7, ChronoUnit.DAYS)))
        .thenReturn(List.of(briefs));
  }

  @Test
  void researchedProspectWithoutContacts_yieldsOneCandidatePerProspect() {
    var prospectId = UUID.randomUUID();
    var first = brief(prospectId);
    givenBriefs(first, brief(prospectId));
    when(prospects.hasContacts(prospectId)).thenReturn(false);
    when(prospects.findById(prospectId))
        .thenReturn(Optional.of(prospect(prospectId, "qualified")));

    var candidates = detector.detect(context(NOW));

    assertThat(candidates)
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey()).isEqualTo("add_contacts:" + prospectId);
              assertThat(c.priority()).isEqualTo(80 + 10 + 5);
              assertThat(c.refs().researchId()).isEqualTo(first.id());
              assertThat(c.contextData()).containsEntry("flow_step", "add_contacts");
              assertThat(c.expiresAt()).isEqualTo(NOW.plus(7, ChronoUnit.DAYS));
            });
  }

  @Test
  void prospectWithContacts_isSkipped() {
    var prospectId = UUID.randomUUID();
    givenBriefs(brief(prospectId));
    when(prospects.hasContacts(prospectId)).thenReturn(true);

    assertThat(detector.detect(context(NOW))).isEmpty();
    verify(prospects, never()).findById(any());
  }

  @Test
  void closedProspect_isSkipped() {
    var prospectId = UUID.randomUUID();
    givenBriefs(brief(prospectId));
    when(prospects.hasContacts(prospectId)).thenReturn(false);
    when(prospects.findById(prospectId)).thenReturn(Optional.of(prospect(prospectId, "lost")));

    assertThat(detector.detect(context(NOW))).isEmpty();
  }

  @Test
  void briefWithoutProspect_isIgnored() {
    givenBriefs(brief(null));

    assertThat(detector.detect(context(NOW))).isEmpty();
    verifyNoInteractions(prospects);
  }
}
