package io.dealmotion.autopilot.lifecycle;

import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalStatus;
import java.util.List;
import java.util.Map;

/**
 * What the owner sees right now.
 *
 * @param proposed waiting on the owner, highest priority first
 * @param inProgress accepted or executing
 * @param snoozed hidden until their snooze ends
 * @param failed failed within the lookback window, with their error, eligible for retry
 * @param counts stored proposals per status
 */
public record ProposalInbox(
    List<Proposal> proposed,
    List<Proposal> inProgress,
    List<Proposal> snoozed,
    List<Proposal> failed,
    Map<ProposalStatus, Long> counts) {

  public ProposalInbox {
    proposed = List.copyOf(proposed);
    inProgress = List.copyOf(inProgress);
    snoozed = List.copyOf(snoozed);
    failed = List.copyOf(failed);
    counts = Map.copyOf(counts);
  }
}
