package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.pipeline.FollowupReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.proposal.ProposalType;
import org.springframework.stereotype.Component;

@Component
public class SendFollowupEmailDetector extends PostMeetingDetector {

  public SendFollowupEmailDetector(
      PriorityCalculator priorityCalculator,
      FollowupReadRepository followups,
      ProspectReadRepository prospects) {
    super(ProposalType.SEND_FOLLOWUP_EMAIL, priorityCalculator, followups, prospects);
  }
}
