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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Asks for contacts on prospects whose research just finished but who have nobody to talk to. */
@Component
public class AddContactsDetector extends AbstractDetector {

  static final String FLOW_STEP = "add_contacts";

  private final ResearchBriefReadRepository research;
  private final ProspectReadRepository prospects;

  public AddContactsDetector(
      PriorityCalculator priorityCalculator,
      ResearchBriefReadRepository research,
      ProspectReadRepository prospects) {
    super(ProposalType.ADD_CONTACTS, priorityCalculator);
    this.research = research;
    this.prospects = prospects;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var seen = new HashSet<UUID>();
    var completed =
        research.findCompletedSince(context.owner().organizationId(), context.lookbackStart());
    for (var brief : completed) {
      if (isFull(found, context)) {
        break;
      }
      var prospectId = brief.prospectId();
      if (prospectId == null || !seen.add(prospectId)) {
        continue;
      }
      var key = type().dedupeKey(prospectId);
      if (context.isBlocked(key) || prospects.hasContacts(prospectId)) {
        continue;
      }
      var prospect = prospects.findById(prospectId);
      if (prospect.isEmpty() || !prospect.get().isActive()) {
        continue;
      }
      var p = prospect.get();
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder().prospect(prospectId).research(brief.id()).build(),
              PriorityInputs.forDeal(p.dealValue(), p.status()).withFlowStep(FLOW_STEP),
              Map.of(
                  "company_name", String.valueOf(p.companyName()),
                  "flow_step", FLOW_STEP)));
    }
    return found;
  }
}
