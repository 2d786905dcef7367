package io.dealmotion.autopilot.proposal;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A proposal a detector would like to raise. Candidates are plain values; nothing is persisted
 * until the detection engine has sequenced and capped them.
 */
public record ProposalCandidate(
    ProposalType type,
    String dedupeKey,
    int priority,
    TriggerRefs refs,
    Map<String, Object> contextData,
    Instant expiresAt) {

  public ProposalCandidate {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(dedupeKey, "dedupeKey must not be null");
    if (priority < 0 || priority > 100) {
      throw new IllegalArgumentException("priority must be within [0, 100] but was " + priority);
    }
    refs = refs != null ? refs : TriggerRefs.none();
    contextData = contextData != null ? Map.copyOf(contextData) : Map.of();
  }

  public String entityKey() {
    return refs.entityKey();
  }
}
