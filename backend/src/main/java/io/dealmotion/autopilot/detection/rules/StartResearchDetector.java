package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.priority.UrgencyWindow;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Suggests research for active prospects that have none, and for upcoming meetings that are not
 * linked to any prospect yet.
 */
@Component
public class StartResearchDetector extends AbstractDetector {

  private final ProspectReadRepository prospects;
  private final ResearchBriefReadRepository research;
  private final CalendarMeetingReadRepository meetings;

  public StartResearchDetector(
      PriorityCalculator priorityCalculator,
      ProspectReadRepository prospects,
      ResearchBriefReadRepository research,
      CalendarMeetingReadRepository meetings) {
    super(ProposalType.START_RESEARCH, priorityCalculator);
    this.prospects = prospects;
    this.research = research;
    this.meetings = meetings;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var found = new ArrayList<ProposalCandidate>();
    detectUnlinkedMeetings(context, found);
    detectUnresearchedProspects(context, found);
    return found;
  }

  private void detectUnlinkedMeetings(DetectionContext context, List<ProposalCandidate> found) {
    var settings = context.settings();
    if (!settings.autoResearchNewMeetings()) {
      return;
    }
    var horizon = context.now().plus(Duration.ofHours(settings.prepReminderHours()));
    for (var meeting : meetings.findUpcoming(context.owner().userId(), context.now(), horizon)) {
      if (isFull(found, context)) {
        return;
      }
      if (meeting.prospectId() != null || settings.isExcludedMeeting(meeting.title())) {
        continue;
      }
      var key = type().dedupeKey("meeting", meeting.id());
      if (context.isBlocked(key)) {
        continue;
      }
      var urgency = UrgencyWindow.forHoursUntil(meeting.hoursUntilStart(context.now()));
      found.add(
          candidate(
              key,
              TriggerRefs.builder().meeting(meeting.id()).build(),
              PriorityInputs.none().withUrgency(urgency),
              Map.of("meeting_title", String.valueOf(meeting.title())),
              meeting.startTime()));
    }
  }

  private void detectUnresearchedProspects(
      DetectionContext context, List<ProposalCandidate> found) {
    var orgId = context.owner().organizationId();
    var researched = research.findProspectIdsWithResearch(orgId);
    for (var prospect : prospects.findActive(orgId)) {
      if (isFull(found, context)) {
        return;
      }
      if (researched.contains(prospect.id())) {
        continue;
      }
      var key = type().dedupeKey("prospect", prospect.id());
      if (context.isBlocked(key)) {
        continue;
      }
      found.add(
          candidate(
              context,
              key,
              TriggerRefs.builder().prospect(prospect.id()).build(),
              PriorityInputs.forDeal(prospect.dealValue(), prospect.status()),
              Map.of("company_name", String.valueOf(prospect.companyName()))));
    }
  }
}
