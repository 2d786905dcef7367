package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.OutreachReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
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

/**
 * Suggests a first message to a contact once the prospect is researched, as long as no meeting is
 * booked with them and the contact has not been written to within the cooldown.
 */
@Component
public class PrepareOutreachDetector extends AbstractDetector {

  private final ProspectReadRepository prospects;
  private final ResearchBriefReadRepository research;
  private final CalendarMeetingReadRepository meetings;
  private final OutreachReadRepository outreach;

  public PrepareOutreachDetector(
      PriorityCalculator priorityCalculator,
      ProspectReadRepository prospects,
      ResearchBriefReadRepository research,
      CalendarMeetingReadRepository meetings,
      OutreachReadRepository outreach) {
    super(ProposalType.PREPARE_OUTREACH, priorityCalculator);
    this.prospects = prospects;
    this.research = research;
    this.meetings = meetings;
    this.outreach = outreach;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    var cooldownStart =
        context.now().minus(Duration.ofDays(context.settings().outreachCooldownDays()));

    for (var prospect : prospects.findActive(context.owner().organizationId())) {
      if (isFull(found, context)) {
        break;
      }
      if (!research.existsCompletedForProspect(prospect.id())
          || meetings.existsForProspect(prospect.id())) {
        continue;
      }
      for (var contact : prospects.findContacts(prospect.id())) {
        if (isFull(found, context)) {
          break;
        }
        var key = type().dedupeKey(prospect.id(), contact.id());
        if (context.isBlocked(key) || outreach.existsForContactSince(contact.id(), cooldownStart)) {
          continue;
        }
        found.add(
            candidate(
                context,
                key,
                TriggerRefs.builder().prospect(prospect.id()).contact(contact.id()).build(),
                PriorityInputs.forDeal(prospect.dealValue(), prospect.status()),
                Map.of(
                    "company_name", String.valueOf(prospect.companyName()),
                    "contact_name", String.valueOf(contact.name()))));
      }
    }
    return found;
  }
}
