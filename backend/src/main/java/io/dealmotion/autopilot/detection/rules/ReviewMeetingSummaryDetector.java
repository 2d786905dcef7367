package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.pipeline.FollowupReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.proposal.ProposalType;
import org.springframework.stereotype.Component;

/** Asks the owner to review the summary of an analysed meeting. */
@Component
public class ReviewMeetingSummaryDetector extends PostMeetingDetector {

  public ReviewMeetingSummaryDetector(
      PriorityCalculator priorityCalculator,
      FollowupReadRepository followups,
      ProspectReadRepository prospects) {
    super(ProposalType.REVIEW_MEETING_SUMMARY, priorityCalculator, followups, prospects);
  }
}
