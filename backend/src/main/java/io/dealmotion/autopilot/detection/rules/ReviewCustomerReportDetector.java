package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.pipeline.FollowupReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.proposal.ProposalType;
import org.springframework.stereotype.Component;

@Component
public class ReviewCustomerReportDetector extends PostMeetingDetector {

  public ReviewCustomerReportDetector(
      PriorityCalculator priorityCalculator,
      FollowupReadRepository followups,
      ProspectReadRepository prospects) {
    super(ProposalType.REVIEW_CUSTOMER_REPORT, priorityCalculator, followups, prospects);
  }
}
