package io.dealmotion.autopilot.detection;

import io.dealmotion.autopilot.priority.PriorityCalculator;
import io.dealmotion.autopilot.priority.PriorityInputs;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.proposal.TriggerRefs;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Shared plumbing for detectors: priority scoring and candidate construction. */
public abstract class AbstractDetector implements Detector {

  private final ProposalType type;
  private final PriorityCalculator priorityCalculator;

  protected AbstractDetector(ProposalType type, PriorityCalculator priorityCalculator) {
    this.type = type;
    this.priorityCalculator = priorityCalculator;
  }

  @Override
  public ProposalType type() {
    return type;
  }

  /** True once {@code collected} has reached this detector's cap. */
  protected boolean isFull(List<ProposalCandidate> collected, DetectionContext context) {
    return collected.size() >= maxCandidates(context);
  }

  /** Builds a candidate that expires after the type's default time-to-live. */
  protected ProposalCandidate candidate(
      DetectionContext context,
      String dedupeKey,
      TriggerRefs refs,
      PriorityInputs inputs,
      Map<String, Object> contextData) {
    return candidate(
        dedupeKey, refs, inputs, contextData, context.now().plus(type.defaultTtl()));
  }

  protected ProposalCandidate candidate(
      String dedupeKey,
      TriggerRefs refs,
      PriorityInputs inputs,
      Map<String, Object> contextData,
      Instant expiresAt) {
    return new ProposalCandidate(
        type,
        dedupeKey,
        priorityCalculator.calculate(type, inputs),
        refs,
        contextData,
        expiresAt);
  }
}
