package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.FollowupReadRepository;
import io.dealmotion.autopilot.pipeline.FollowupRecord;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import io.dealmotion.autopilot.sequencing.DependencyGraph;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for the steps that follow an analysed meeting. Every step is sourced from completed
 * followups that carry an executive summary, keyed on the meeting (or the followup when the
 * meeting is unknown), and held back until its prerequisite step has completed for that entity.
 */
abstract class PostMeetingDetector extends AbstractDetector {

  static final int CAP = 2;

  private final FollowupReadRepository followups;
  private final ProspectReadRepository prospects;

  PostMeetingDetector(
      ProposalType type,
      PriorityCalculator priorityCalculator,
      FollowupReadRepository followups,
      ProspectReadRepository prospects) {
    super(type, priorityCalculator);
    this.followups = followups;
    this.prospects = prospects;
  }

  @Override
  public int maxCandidates(DetectionContext context) {
    return Math.min(CAP, context.maxCandidatesPerDetector());
  }

  /** Extra per-step condition on the followup; all steps accept by default. */
  boolean applies(FollowupRecord followup) {
    return true;
  }

  /** Flow-position hint passed to priority scoring, or null. */
  String flowStep() {
    return null;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    if (!context.settings().autoFollowupAfterMeeting()) {
      return List.of();
    }
    var found = new ArrayList<ProposalCandidate>();
    var analysed = followups.findAnalysedSince(context.owner().userId(), context.lookbackStart());
    for (var followup : analysed) {
      if (isFull(found, context)) {
        break;
      }
      if (!followup.hasExecutiveSummary() || !applies(followup)) {
        continue;
      }
      var refs =
          TriggerRefs.builder()
              .meeting(followup.meetingId())
              .followup(followup.id())
              .prospect(followup.prospectId())
              .build();
      var anchor = followup.meetingId() != null ? followup.meetingId() : followup.id();
      var key = type().dedupeKey(anchor);
      if (context.isBlocked(key)
          || !DependencyGraph.isSatisfied(
              type(), refs.entityKey(), context.completedTypesByEntity())) {
        continue;
      }
      found.add(candidate(context, key, refs, inputsFor(followup), contextData(followup)));
    }
    return found;
  }

  private PriorityInputs inputsFor(FollowupRecord followup) {
    var inputs =
        followup.prospectId() == null
            ? PriorityInputs.none()
            : prospects
                .findById(followup.prospectId())
                .map(p -> PriorityInputs.forDeal(p.dealValue(), p.status()))
                .orElseGet(PriorityInputs::none);
    return inputs.withFlowStep(flowStep());
  }

  private Map<String, Object> contextData(FollowupRecord followup) {
    var data = new LinkedHashMap<String, Object>();
    data.put("followup_id", followup.id().toString());
    if (followup.meetingId() != null) {
      data.put("meeting_id", followup.meetingId().toString());
    }
    if (flowStep() != null) {
      data.put("flow_step", flowStep());
    }
    return data;
  }
}
