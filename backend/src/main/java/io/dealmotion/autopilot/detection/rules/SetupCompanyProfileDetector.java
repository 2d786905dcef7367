package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Nudges the owner to describe their own company while the organization has no profile. */
@Component
public class SetupCompanyProfileDetector extends AbstractDetector {

  private final ProspectReadRepository prospects;

  public SetupCompanyProfileDetector(
      PriorityCalculator priorityCalculator, ProspectReadRepository prospects) {
    super(ProposalType.SETUP_COMPANY_PROFILE, priorityCalculator);
    this.prospects = prospects;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var orgId = context.owner().organizationId();
    var key = type().dedupeKey(orgId);
    if (context.isBlocked(key) || prospects.hasCompanyProfile(orgId)) {
      return List.of();
    }
    return List.of(
        candidate(
            context,
            key,
            TriggerRefs.none(),
            PriorityInputs.none(),
            Map.of("route", "/settings/company-profile")));
  }
}
