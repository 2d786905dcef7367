package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.OutreachReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Confirms recently sent outreach so the owner can plan the next touch. */
@Component
public class FirstTouchSentDetector extends AbstractDetector {

  static final Duration SENT_WINDOW = Duration.ofDays(7);

  private final OutreachReadRepository outreach;

  public FirstTouchSentDetector(
      PriorityCalculator priorityCalculator, OutreachReadRepository outreach) {
    super(ProposalType.FIRST_TOUCH_SENT, priorityCalculator);
    this.outreach = outreach;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var sent = outreach.findSentSince(context.owner().userId(), context.now().minus(SENT_WINDOW));
    for (var message : sent) {
      if (isFull(found, context)) {
        break;
      }
      var key = type().dedupeKey(message.prospectId(), message.id());
      if (context.isBlocked(key)) {
        continue;
      }
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder()
                  .prospect(message.prospectId())
                  .contact(message.contactId())
                  .outreach(message.id())
                  .build(),
              PriorityInputs.none(),
              Map.of("outreach_id", message.id().toString())));
    }
    return found;
  }
}
