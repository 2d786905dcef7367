package io.dealmotion.autopilot.lifecycle;

import io.dealmotion.autopilot.pipeline.CalendarMeetingReadRepository;
import io.dealmotion.autopilot.pipeline.MeetingPrepReadRepository;
import io.dealmotion.autopilot.pipeline.OutreachReadRepository;
import io.dealmotion.autopilot.pipeline.ProspectReadRepository;
import io.dealmotion.autopilot.pipeline.ResearchBriefReadRepository;
import io.dealmotion.autopilot.proposal.Proposal;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Re-derives whether a pending proposal's action has already happened outside the engine, for
 * example contacts added by hand while an "add contacts" proposal was waiting.
 *
 * <p>Types without a rule are always {@link ReconciliationOutcome#STILL_VALID}. A missing trigger
 * entity, or a failing lookup, yields {@link ReconciliationOutcome#UNKNOWN} so the proposal is kept
 * rather than guessed away.
 */
@Component
public class ProposalReconciler {

  private static final Logger log = LoggerFactory.getLogger(ProposalReconciler.class);

  private final ProspectReadRepository prospects;
  private final ResearchBriefReadRepository research;
  private final CalendarMeetingReadRepository meetings;
  private final MeetingPrepReadRepository preps;
  private final OutreachReadRepository outreach;

  public ProposalReconciler(
      ProspectReadRepository prospects,
      ResearchBriefReadRepository research,
      CalendarMeetingReadRepository meetings,
      MeetingPrepReadRepository preps,
      OutreachReadRepository outreach) {
    this.prospects = prospects;
    this.research = research;
    this.meetings = meetings;
    this.preps = preps;
    this.outreach = outreach;
  }

  public ReconciliationOutcome reconcile(Proposal proposal) {
    try {
      return check(proposal);
    } catch (DataAccessException e) {
      log.warn(
          "Could not reconcile proposal {} ({}), leaving it as is: {}",
          proposal.getId(),
          proposal.getType().key(),
          e.getMessage());
      return ReconciliationOutcome.UNKNOWN;
    }
  }

  private ReconciliationOutcome check(Proposal proposal) {
    var refs = proposal.getTriggerRefs();
    return switch (proposal.getType()) {
      case ADD_CONTACTS ->
          withProspect(proposal, () -> prospects.hasContacts(refs.prospectId()));
      case START_RESEARCH -> {
        if (refs.prospectId() == null) {
          // Meeting variant: nothing to check until the meeting is linked to a prospect.
          yield refs.meetingId() != null && meetings.findById(refs.meetingId()).isPresent()
              ? ReconciliationOutcome.STILL_VALID
              : ReconciliationOutcome.UNKNOWN;
        }
        yield withProspect(proposal, () -> research.existsCompletedForProspect(refs.prospectId()));
      }
      case CREATE_PREP -> {
        if (refs.meetingId() == null || meetings.findById(refs.meetingId()).isEmpty()) {
          yield ReconciliationOutcome.UNKNOWN;
        }
        yield outcome(preps.existsForMeeting(refs.meetingId()));
      }
      case SUGGEST_MEETING_CREATION ->
          withProspect(proposal, () -> meetings.existsForProspect(refs.prospectId()));
      case SETUP_COMPANY_PROFILE ->
          outcome(prospects.hasCompanyProfile(proposal.getOrganizationId()));
      case PREPARE_OUTREACH -> {
        if (refs.contactId() == null) {
          yield ReconciliationOutcome.UNKNOWN;
        }
        yield outcome(outreach.existsForContactSince(refs.contactId(), proposal.getCreatedAt()));
      }
      case REACTIVATE_PROSPECT ->
          withProspect(
              proposal,
              () -> prospects.hasActivitySince(refs.prospectId(), proposal.getCreatedAt()));
      default -> ReconciliationOutcome.STILL_VALID;
    };
  }

  private ReconciliationOutcome withProspect(Proposal proposal, BooleanSupplier satisfied) {
    var prospectId = proposal.getTriggerRefs().prospectId();
    if (prospectId == null || prospects.findById(prospectId).isEmpty()) {
      return ReconciliationOutcome.UNKNOWN;
    }
    return outcome(satisfied.getAsBoolean());
  }

  private static ReconciliationOutcome outcome(boolean satisfied) {
    return satisfied ? ReconciliationOutcome.SATISFIED : ReconciliationOutcome.STILL_VALID;
  }
}
