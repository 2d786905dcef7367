package io.dealmotion.autopilot.trigger;

import io.dealmotion.autopilot.detection.DetectionEngine;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs detection for one owner when upstream state changes. Events may arrive more than once;
 * detection is idempotent, so a repeat just creates nothing.
 */
@Component
public class DetectionTriggerListener {

  private static final Logger log = LoggerFactory.getLogger(DetectionTriggerListener.class);

  private final DetectionEngine detectionEngine;

  public DetectionTriggerListener(DetectionEngine detectionEngine) {
    this.detectionEngine = detectionEngine;
  }

  @EventListener
  public void onCalendarSynced(CalendarSyncedEvent event) {
    run(new ProposalOwner(event.userId(), event.organizationId()), "calendar sync");
  }

  @EventListener
  public void onResearchCompleted(ResearchCompletedEvent event) {
    run(new ProposalOwner(event.userId(), event.organizationId()), "research completion");
  }

  private void run(ProposalOwner owner, String trigger) {
    try {
      var result = detectionEngine.run(owner);
      log.debug(
          "Detection after {} for user {} created {} proposals",
          trigger,
          owner.userId(),
          result.created());
    } catch (Exception e) {
      log.error("Detection after {} failed for user {}", trigger, owner.userId(), e);
    }
  }
}
