package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.MeetingPrepReadRepository;
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

@Component
public class PrepReadyDetector extends AbstractDetector {

  static final Duration READY_WINDOW = Duration.ofDays(2);

  private final MeetingPrepReadRepository preps;

  public PrepReadyDetector(PriorityCalculator priorityCalculator, MeetingPrepReadRepository preps) {
    super(ProposalType.PREP_READY, priorityCalculator);
    this.preps = preps;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var completed =
        preps.findCompletedSince(context.owner().userId(), context.now().minus(READY_WINDOW));
    for (var prep : completed) {
      if (isFull(found, context)) {
        break;
      }
      var key = type().dedupeKey(prep.id());
      if (context.isBlocked(key)) {
        continue;
      }
      // Keyed on the prep, not the meeting, so it never waits on the meeting's own proposals.
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder().prep(prep.id()).prospect(prep.prospectId()).build(),
              PriorityInputs.none(),
              Map.of("prep_id", prep.id().toString())));
    }
    return found;
  }
}
