package io.dealmotion.autopilot.trigger;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.dealmotion.autopilot.detection.DetectionEngine;
import io.dealmotion.autopilot.detection.DetectionResult;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DetectionTriggerListenerTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final UUID ORG_ID = UUID.randomUUID();

  @Mock private DetectionEngine detectionEngine;
  @InjectMocks private DetectionTriggerListener listener;

  @Test
  void calendarSync_runsDetectionForTheOwner() {
    var owner = new ProposalOwner(USER_ID, ORG_ID);
    when(detectionEngine.run(owner)).thenReturn(DetectionResult.skipped(USER_ID));

    listener.onCalendarSynced(new CalendarSyncedEvent(USER_ID, ORG_ID));

    verify(detectionEngine).run(owner);
  }

  @Test
  void failingDetection_isContainedInTheListener() {
    var owner = new ProposalOwner(USER_ID, ORG_ID);
    when(detectionEngine.run(owner)).thenThrow(new IllegalStateException("db down"));

    assertThatCode(
            () -> listener.onResearchCompleted(new ResearchCompletedEvent(USER_ID, ORG_ID, null)))
        .doesNotThrowAnyException();
  }
}
