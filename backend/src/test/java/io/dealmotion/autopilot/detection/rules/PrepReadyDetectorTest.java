package io.dealmotion.autopilot.detection.rules;

import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.OWNER;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.pipeline.MeetingPrepReadRepository;
import io.dealmotion.autopilot.pipeline.PrepRecord;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.settings.OwnerSettings;
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
class PrepReadyDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  @Mock private MeetingPrepReadRepository preps;

  private PrepReadyDetector detector;

  @BeforeEach
  void setUp() {
    detector = new PrepReadyDetector(new PriorityCalculator(), preps);
  }

  private static PrepRecord prep() {
    return new PrepRecord(
        UUID.randomUUID(),
        OWNER.userId(),
        OWNER.organizationId(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        "completed",
        NOW.minus(1, ChronoUnit.HOURS),
        NOW.minus(2, ChronoUnit.HOURS));
  }

  @Test
  void completedPrep_isAnnouncedOnItsProspectRatherThanTheMeeting() {
    var prep = prep();
    when(preps.findCompletedSince(OWNER.userId(), NOW.minus(2, ChronoUnit.DAYS)))
        .thenReturn(List.of(prep));

    assertThat(detector.detect(context(NOW)))
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey()).isEqualTo("prep_ready:" + prep.id());
              assertThat(c.entityKey()).isEqualTo("prospect:" + prep.prospectId());
              assertThat(c.refs().meetingId()).isNull();
              assertThat(c.priority()).isEqualTo(85);
              assertThat(c.expiresAt()).isEqualTo(NOW.plus(2, ChronoUnit.DAYS));
            });
  }

  @Test
  void prepWithLiveProposal_isSkipped() {
    var prep = prep();
    when(preps.findCompletedSince(OWNER.userId(), NOW.minus(2, ChronoUnit.DAYS)))
        .thenReturn(List.of(prep));
    var ctx =
        context(
            NOW, OwnerSettings.defaults(3), Set.of("prep_ready:" + prep.id()), Set.of(), Map.of());

    assertThat(detector.detect(ctx)).isEmpty();
  }
}
