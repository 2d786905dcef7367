package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.pipeline.FollowupReadRepository;
import io.dealmotion.autopilot.pipeline.FollowupRecord;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.proposal.ProposalType;
import org.springframework.stereotype.Component;

/** Last step of the post-meeting chain; only offered when the analysis found action items. */
@Component
public class CreateActionItemsDetector extends PostMeetingDetector {

  static final String FLOW_STEP = "complete_actions";

  public CreateActionItemsDetector(
      PriorityCalculator priorityCalculator,
      FollowupReadRepository followups,
      ProspectReadRepository prospects) {
    super(ProposalType.CREATE_ACTION_ITEMS, priorityCalculator, followups, prospects);
  }

  @Override
  boolean applies(FollowupRecord followup) {
    return followup.actionItemCount() > 0;
  }

  @Override
  String flowStep() {
    return FLOW_STEP;
  }
}
