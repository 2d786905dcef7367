package io.dealmotion.autopilot.execution;

import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published when a proposal is accepted or retried. Consumed after commit by {@link
 * ExecutionDispatcher}; delivery may repeat, so consumers must tolerate a proposal that has already
 * moved on.
 */
public record ExecuteProposalEvent(
    UUID proposalId,
    UUID userId,
    UUID organizationId,
    ProposalType type,
    Map<String, Object> contextData) {

  public ExecuteProposalEvent {
    contextData =
        contextData != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(contextData))
            : Map.of();
  }

  public static ExecuteProposalEvent from(Proposal proposal) {
    return new ExecuteProposalEvent(
        proposal.getId(),
        proposal.getUserId(),
        proposal.getOrganizationId(),
        proposal.getType(),
        proposal.getContextData());
  }
}
