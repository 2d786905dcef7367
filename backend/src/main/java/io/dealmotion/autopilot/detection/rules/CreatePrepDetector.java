package io.dealmotion.autopilot.detection.rules;

import io.dealmotion.autopilot.detection.AbstractDetector;
import io.dealmotion.autopilot.detection.DetectionContext;
import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.MeetingPrepReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
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
 * Offers meeting prep for upcoming meetings with known prospects. The urgency bucket is part of
 * the dedupe key, so a meeting drifting from "24h" to "4h" gets a fresh, higher-priority proposal
 * while the earlier one is still pending.
 */
@Component
public class CreatePrepDetector extends AbstractDetector {

  private final CalendarMeetingReadRepository meetings;
  private final MeetingPrepReadRepository preps;
  private final ProspectReadRepository prospects;

  public CreatePrepDetector(
      PriorityCalculator priorityCalculator,
      CalendarMeetingReadRepository meetings,
      MeetingPrepReadRepository preps,
      ProspectReadRepository prospects) {
    super(ProposalType.CREATE_PREP, priorityCalculator);
    this.meetings = meetings;
    this.preps = preps;
    this.prospects = prospects;
  }

  @Override
  public List<ProposalCandidate> detect(DetectionContext context) {
    var settings = context.settings();
    if (!settings.autoPrepKnownProspects()) {
      return List.of();
    }
    var found = new ArrayList<ProposalCandidate>();
    var now = context.now();
    var horizon = now.plus(Duration.ofHours(settings.prepReminderHours()));

    for (var meeting : meetings.findUpcoming(context.owner().userId(), now, horizon)) {
      if (isFull(found, context)) {
        break;
      }
      if (meeting.prospectId() == null || settings.isExcludedMeeting(meeting.title())) {
        continue;
      }
      var urgency = UrgencyWindow.forHoursUntil(meeting.hoursUntilStart(now));
      var key = type().dedupeKey(meeting.id(), urgency.label());
      if (context.isBlocked(key) || preps.existsForMeeting(meeting.id())) {
        continue;
      }
      var inputs =
          prospects
              .findById(meeting.prospectId())
              .map(p -> PriorityInputs.forDeal(p.dealValue(), p.status()))
              .orElseGet(PriorityInputs::none)
              .withUrgency(urgency);
      found.add(
          candidate(
              key,
              TriggerRefs.builder().meeting(meeting.id()).prospect(meeting.prospectId()).build(),
              inputs,
              Map.of(
                  "meeting_title", String.valueOf(meeting.title()),
                  "urgency", urgency.label()),
              meeting.startTime()));
    }
    return found;
  }
}
