package io.dealmotion.autopilot.proposal;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum ProposalStatus {
  /** Raised by detection and waiting for the owner to decide. */
  PROPOSED(false),
  /** Accepted by the owner; handed to the execution pipeline. */
  ACCEPTED(false),
  /** The execution pipeline has picked the proposal up. */
  EXECUTING(false),
  /** Done, either by the pipeline, inline by the owner, or through reconciliation. */
  COMPLETED(true),
  /** Execution failed or timed out. Can be retried. */
  FAILED(true),
  /** Dismissed by the owner. */
  DECLINED(true),
  /** Hidden until {@code snoozedUntil}, then returned to PROPOSED by the sweep. */
  SNOOZED(false),
  /** Passed its {@code expiresAt} while still PROPOSED. */
  EXPIRED(true);

  public static final Set<ProposalStatus> NON_TERMINAL =
      Collections.unmodifiableSet(EnumSet.of(PROPOSED, ACCEPTED, EXECUTING, SNOOZED));

  public static final Set<ProposalStatus> TERMINAL =
      Collections.unmodifiableSet(EnumSet.of(COMPLETED, FAILED, DECLINED, EXPIRED));

  private final boolean terminal;

  ProposalStatus(boolean terminal) {
    this.terminal = terminal;
  }

  /**
   * Terminal statuses release the dedupe key. FAILED counts as terminal for uniqueness even though
   * an explicit retry may move it back to ACCEPTED.
   */
  public boolean isTerminal() {
    return terminal;
  }
}
