package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.pipeline.FollowupReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.proposal.ProposalType;
import org.springframework.stereotype.Component;

/** Syncs meeting notes to the CRM. Runs in parallel with the rest of the chain. */
@Component
public class UpdateCrmNotesDetector extends PostMeetingDetector {

  public UpdateCrmNotesDetector(
      PriorityCalculator priorityCalculator,
      FollowupReadRepository followups,
      ProspectReadRepository prospects) {
    super(ProposalType.UPDATE_CRM_NOTES, priorityCalculator, followups, prospects);
  }
}
