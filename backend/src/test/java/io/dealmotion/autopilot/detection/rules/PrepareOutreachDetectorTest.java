package io.dealmotion.autopilot.detection.rules;

import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.OWNER;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.ContactRecord;
import io.dealmotion.autopilot.pipeline.OutreachReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectRecord;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PrepareOutreachDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  @Mock private ProspectReadRepository prospects;
  @Mock private ResearchBriefReadRepository research;
  @Mock private CalendarMeetingReadRepository meetings;
  @Mock private OutreachReadRepository outreach;

  private PrepareOutreachDetector detector;
  private ProspectRecord prospect;

  @BeforeEach
  void setUp() {
    detector =
        new PrepareOutreachDetector(
            new PriorityCalculator(), prospects, research, meetings, outreach);
    prospect =
        new ProspectRecord(
            UUID.randomUUID(), OWNER.organizationId(), "Acme", "new", null, NOW, NOW);
    when(prospects.findActive(OWNER.organizationId())).thenReturn(List.of(prospect));
  }

  private ContactRecord contact(String name) {
    return new ContactRecord(UUID.randomUUID(), prospect.id(), OWNER.organizationId(), name, NOW);
  }

  @Test
  void contactOutsideCooldown_yieldsCandidatePerContact() {
    var ada = contact("Ada");
    var bob = contact("Bob");
    when(research.existsCompletedForProspect(prospect.id())).thenReturn(true);
    when(meetings.existsForProspect(prospect.id())).thenReturn(false);
    when(prospects.findContacts(prospect.id())).thenReturn(List.of(ada, bob));
    when(outreach.existsForContactSince(eq(ada.id()), any(Instant.class))).thenReturn(false);
    when(outreach.existsForContactSince(eq(bob.id()), any(Instant.class))).thenReturn(true);

    var candidates = detector.detect(context(NOW));

    assertThat(candidates)
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey())
                  .isEqualTo("prepare_outreach:" + prospect.id() + ":" + ada.id());
              assertThat(c.expiresAt()).isEqualTo(NOW.plus(14, ChronoUnit.DAYS));
            });
    verify(outreach).existsForContactSince(ada.id(), NOW.minus(14, ChronoUnit.DAYS));
  }

  @Test
  void prospectWithMeeting_isNotOfferedOutreach() {
    when(research.existsCompletedForProspect(prospect.id())).thenReturn(true);
    when(meetings.existsForProspect(prospect.id())).thenReturn(true);

    assertThat(detector.detect(context(NOW))).isEmpty();
    verify(prospects, never()).findContacts(any());
  }

  @Test
  void prospectWithoutCompletedResearch_isNotOfferedOutreach() {
    when(research.existsCompletedForProspect(prospect.id())).thenReturn(false);

    assertThat(detector.detect(context(NOW))).isEmpty();
  }
}
