package io.dealmotion.autopilot.detection.rules;

import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.OWNER;
import static io.dealmotion.autopilot.detection.rules.DetectorTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.pipeline.OutreachReadRepository;
import io.dealmotion.autopilot.pipeline.OutreachRecord;
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
class FirstTouchSentDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

  @Mock private OutreachReadRepository outreach;

  private FirstTouchSentDetector detector;
  private OutreachRecord message;

  @BeforeEach
  void setUp() {
    detector = new FirstTouchSentDetector(new PriorityCalculator(), outreach);
    message =
        new OutreachRecord(
            UUID.randomUUID(),
            OWNER.userId(),
            OWNER.organizationId(),
            UUID.randomUUID(),
            UUID.randomUUID(),
            "sent",
            NOW.minus(2, ChronoUnit.DAYS),
            NOW.minus(3, ChronoUnit.DAYS));
    when(outreach.findSentSince(OWNER.userId(), NOW.minus(7, ChronoUnit.DAYS)))
        .thenReturn(List.of(message));
  }

  @Test
  void sentMessage_isConfirmedOnItsProspect() {
    var candidates = detector.detect(context(NOW));

    assertThat(candidates)
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.dedupeKey())
                  .isEqualTo("first_touch_sent:" + message.prospectId() + ":" + message.id());
              assertThat(c.entityKey()).isEqualTo("prospect:" + message.prospectId());
              assertThat(c.refs().outreachId()).isEqualTo(message.id());
              assertThat(c.refs().contactId()).isEqualTo(message.contactId());
              assertThat(c.priority()).isEqualTo(40);
              assertThat(c.expiresAt()).isEqualTo(NOW.plus(3, ChronoUnit.DAYS));
            });
  }

  @Test
  void alreadyConfirmedMessage_isNotRaisedAgain() {
    var key = "first_touch_sent:" + message.prospectId() + ":" + message.id();
    var ctx = context(NOW, OwnerSettings.defaults(3), Set.of(), Set.of(key), Map.of());

    assertThat(detector.detect(ctx)).isEmpty();
  }
}
