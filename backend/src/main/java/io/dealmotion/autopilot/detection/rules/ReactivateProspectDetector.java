package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
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

/** Flags promising prospects that have gone quiet for longer than the owner's threshold. */
@Component
public class ReactivateProspectDetector extends AbstractDetector {

  static final List<String> ENGAGED_STATUSES = List.of("qualified", "meeting_scheduled");
  static final int CAP = 5;

  private final ProspectReadRepository prospects;

  public ReactivateProspectDetector(
      PriorityCalculator priorityCalculator, ProspectReadRepository prospects) {
    super(ProposalType.REACTIVATE_PROSPECT, priorityCalculator);
    this.prospects = prospects;
  }

  @Override
  public int maxCandidates(DetectionContext context) {
    return CAP;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var now = context.now();
    var cutoff = now.minus(Duration.ofDays(context.settings().reactivationDaysThreshold()));
    var silent =
        prospects.findSilentSince(context.owner().organizationId(), ENGAGED_STATUSES, cutoff);
    for (var prospect : silent) {
      if (isFull(found, context)) {
        break;
      }
      var key = type().dedupeKey(prospect.id());
      if (context.isBlocked(key)) {
        continue;
      }
      int daysSilent = prospect.daysSilent(now);
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder().prospect(prospect.id()).build(),
              PriorityInputs.forDeal(prospect.dealValue(), prospect.status())
                  .withDaysSilent(daysSilent),
              Map.of(
                  "company_name", String.valueOf(prospect.companyName()),
                  "days_silent", daysSilent)));
    }
    return found;
  }
}
