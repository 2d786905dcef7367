package io.dealmotion.autopilot.lifecycle;

/** Result of re-checking a pending proposal against the current pipeline state. */
public enum ReconciliationOutcome {
  /** The underlying action is still outstanding. */
  STILL_VALID,
  /** The action already happened through another path; the proposal can be auto-completed. */
  SATISFIED,
  /** The state could not be checked conclusively; leave the proposal alone. */
  UNKNOWN
}
