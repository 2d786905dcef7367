package io.dealmotion.autopilot.detection;

import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import java.util.List;

/**
 * A rule that inspects the owner's pipeline and yields candidates of exactly one {@link
 * ProposalType}. Implementations only read; every write goes through the detection engine.
 *
 * <p>Spring collects every bean implementing this interface, so adding a rule is a matter of
 * declaring a new {@code @Component}.
 */
public interface Detector {

  ProposalType type();

  /**
   * Returns candidates for the owner in the given context. Candidates whose dedupe key the context
   * reports as blocked must not be returned.
   */
  List<ProposalCandidate> detect(DetectionContext context);

  /** Upper bound on candidates kept from one run of this detector. */
  default int maxCandidates(DetectionContext context) {
    return context.maxCandidatesPerDetector();
  }
}
