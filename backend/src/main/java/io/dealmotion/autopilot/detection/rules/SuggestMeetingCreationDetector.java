package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Suggests booking a meeting with qualified prospects that have none. */
@Component
public class SuggestMeetingCreationDetector extends AbstractDetector {

  static final String QUALIFIED = "qualified";
  static final String FLOW_STEP = "plan_meeting";

  private final ProspectReadRepository prospects;
  private final CalendarMeetingReadRepository meetings;

  public SuggestMeetingCreationDetector(
      PriorityCalculator priorityCalculator,
      ProspectReadRepository prospects,
      CalendarMeetingReadRepository meetings) {
    super(ProposalType.SUGGEST_MEETING_CREATION, priorityCalculator);
    this.prospects = prospects;
    this.meetings = meetings;
  }

  @Override
  public int maxCandidates(DetectionContext context) {
    return Math.min(2, context.maxCandidatesPerDetector());
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var qualified =
        prospects.findByStatuses(context.owner().organizationId(), List.of(QUALIFIED));
    for (var prospect : qualified) {
      if (isFull(found, context)) {
        break;
      }
      var key = type().dedupeKey(prospect.id());
      if (context.isBlocked(key) || meetings.existsForProspect(prospect.id())) {
        continue;
      }
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder().prospect(prospect.id()).build(),
              PriorityInputs.forDeal(prospect.dealValue(), prospect.status())
                  .withFlowStep(FLOW_STEP),
              Map.of(
                  "company_name", String.valueOf(prospect.companyName()),
                  "flow_step", FLOW_STEP)));
    }
    return found;
  }
}
