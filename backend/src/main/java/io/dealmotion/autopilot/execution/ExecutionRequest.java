package io.dealmotion.autopilot.execution;

import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalType;
import java.util.Map;
import java.util.UUID;

/** What the execution pipeline receives for one accepted proposal. */
public record ExecutionRequest(
    UUID proposalId, ProposalOwner owner, ProposalType type, Map<String, Object> contextData) {

  public static ExecutionRequest from(ExecuteProposalEvent event) {
    return new ExecutionRequest(
        event.proposalId(),
        new ProposalOwner(event.userId(), event.organizationId()),
        event.type(),
        event.contextData());
  }
}
