package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Points the owner at research briefs that finished within the lookback window. */
@Component
public class ReviewResearchDetector extends AbstractDetector {

  private final ResearchBriefReadRepository research;
  private final ProspectReadRepository prospects;

  public ReviewResearchDetector(
      PriorityCalculator priorityCalculator,
      ResearchBriefReadRepository research,
      ProspectReadRepository prospects) {
    super(ProposalType.REVIEW_RESEARCH, priorityCalculator);
    this.research = research;
    this.prospects = prospects;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var completed =
        research.findCompletedSince(context.owner().organizationId(), context.lookbackStart());
    for (var brief : completed) {
      if (isFull(found, context)) {
        break;
      }
      var key = type().dedupeKey(brief.id());
      if (context.isBlocked(key)) {
        continue;
      }
      var inputs =
          brief.prospectId() == null
              ? PriorityInputs.none()
              : prospects
                  .findById(brief.prospectId())
                  .map(p -> PriorityInputs.forDeal(p.dealValue(), p.status()))
                  .orElseGet(PriorityInputs::none);
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder().research(brief.id()).prospect(brief.prospectId()).build(),
              inputs,
              Map.of(
                  "research_id", brief.id().toString(),
                  "company_name", String.valueOf(brief.companyName()))));
    }
    return found;
  }
}
