package io.dealmotion.autopilot.proposal;

import java.util.Objects;
import java.util.UUID;

/** The user and organization a proposal belongs to. Uniqueness and visibility are per user. */
public record ProposalOwner(UUID userId, UUID organizationId) {

  public ProposalOwner {
    Objects.requireNonNull(userId, "userId must not be null");
    Objects.requireNonNull(organizationId, "organizationId must not be null");
  }
}
