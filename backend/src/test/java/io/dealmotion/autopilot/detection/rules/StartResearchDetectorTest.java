package io.dealmotion.autopilot.detection.rules;

import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.OWNER;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.context;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.withFlags;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.MeetingRecord;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectRecord;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StartResearchDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  @Mock private ProspectReadRepository prospects;
  @Mock private ResearchBriefReadRepository research;
  @Mock private CalendarMeetingReadRepository meetings;

  private StartResearchDetector detector;

  @BeforeEach
  void setUp() {
    detector = new StartResearchDetector(new PriorityCalculator(), prospects, research, meetings);
  }

  private static ProspectRecord prospect(String name) {
    return new ProspectRecord(
        UUID.randomUUID(), OWNER.organizationId(), name, "new", null, NOW, NOW);
  }

  private static MeetingRecord unlinkedMeeting(String title) {
    var start = NOW.plus(6, ChronoUnit.HOURS);
    return new MeetingRecord(
        UUID.randomUUID(),
        OWNER.userId(),
        OWNER.organizationId(),
        null,
        title,
        start,
        start.plus(1, ChronoUnit.HOURS),
        "confirmed");
  }

  @Test
  void prospectWithoutResearch_yieldsProspectVariant() {
    var fresh = prospect("Acme");
    var researched = prospect("Globex");
    when(meetings.findUpcoming(eq(OWNER.userId()), eq(NOW), any(Instant.class)))
        .thenReturn(List.of());
    when(research.findProspectIdsWithResearch(OWNER.organizationId()))
        .thenReturn(Set.of(researched.id()));
    when(prospects.findActive(OWNER.organizationId())).thenReturn(List.of(fresh, researched));

    var candidates = detector.detect(context(NOW));

    assertThat(candidates)
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey()).isEqualTo("start_research:prospect:" + fresh.id());
              assertThat(c.priority()).isEqualTo(70);
              assertThat(c.expiresAt()).isEqualTo(NOW.plus(7, ChronoUnit.DAYS));
            });
  }

  @Test
  void unlinkedUpcomingMeeting_yieldsMeetingVariantUnlessExcluded() {
    var intro = unlinkedMeeting("Intro with Initech");
    var standup = unlinkedMeeting("Team standup");
    when(meetings.findUpcoming(eq(OWNER.userId()), eq(NOW), any(Instant.class)))
        .thenReturn(List.of(intro, standup));
    when(research.findProspectIdsWithResearch(OWNER.organizationId())).thenReturn(Set.of());
    when(prospects.findActive(OWNER.organizationId())).thenReturn(List.of());

    var candidates = detector.detect(context(NOW));

    assertThat(candidates)
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey()).isEqualTo("start_research:meeting:" + intro.id());
              assertThat(c.entityKey()).isEqualTo("meeting:" + intro.id());
              assertThat(c.priority()).isEqualTo(75);
            });
  }

  @Test
  void meetingVariant_isGatedByAutoResearchFlag() {
    when(research.findProspectIdsWithResearch(OWNER.organizationId())).thenReturn(Set.of());
    when(prospects.findActive(OWNER.organizationId())).thenReturn(List.of());

    var candidates =
        detector.detect(context(NOW, withFlags(false, true, true), Set.of(), Set.of(), Map.of()));

    assertThat(candidates).isEmpty();
    verifyNoInteractions(meetings);
  }
}
