package io.dealmotion.autopilot.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a guarded proposal transition does not apply: the proposal does not exist for the
 * caller, or another actor already moved it out of the expected status. Callers may ignore it or
 * re-read the proposal; repeating the same transition will not succeed.
 */
public class ProposalNotFoundOrProcessedException extends ErrorResponseException {

  private final UUID proposalId;

  public ProposalNotFoundOrProcessedException(UUID proposalId, String detail) {
    super(
        HttpStatus.CONFLICT,
        InvalidStateException.problem(
            HttpStatus.CONFLICT, "Proposal not found or already processed", detail),
        null);
    this.proposalId = proposalId;
  }

  public UUID getProposalId() {
    return proposalId;
  }
}
