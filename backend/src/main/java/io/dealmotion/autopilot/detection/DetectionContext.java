package io.dealmotion.autopilot.detection;

import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalType;
import io.dealmotion.autopilot.settings.OwnerSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Read-only snapshot assembled once per detection run and shared by every detector.
 *
 * @param owner whose pipeline is being scanned
 * @param now the run's reference instant; detectors never read the clock themselves
 * @param settings the owner's resolved settings
 * @param activeDedupeKeys dedupe keys currently held by non-terminal proposals
 * @param recentlyClosedKeys dedupe keys of proposals closed within the lookback window
 * @param completedTypesByEntity proposal types completed within the lookback window, per entity key
 * @param sequentialPending whether a sequential-class proposal is already non-terminal
 * @param surfacedCount number of proposals currently in {@code proposed}
 * @param lookback the trailing window for completed and closed sets
 * @param maxCandidatesPerDetector default per-detector cap
 */
public record DetectionContext(
    ProposalOwner owner,
    Instant now,
    OwnerSettings settings,
    Set<String> activeDedupeKeys,
    Set<String> recentlyClosedKeys,
    Map<String, Set<ProposalType>> completedTypesByEntity,
    boolean sequentialPending,
    long surfacedCount,
    Duration lookback,
    int maxCandidatesPerDetector) {

  public DetectionContext {
    activeDedupeKeys = Set.copyOf(activeDedupeKeys);
    recentlyClosedKeys = Set.copyOf(recentlyClosedKeys);
    completedTypesByEntity = Map.copyOf(completedTypesByEntity);
  }

  /** True if a live proposal holds the key, or one was closed with it inside the lookback. */
  public boolean isBlocked(String dedupeKey) {
    return activeDedupeKeys.contains(dedupeKey) || recentlyClosedKeys.contains(dedupeKey);
  }

  /** Start of the lookback window. */
  public Instant lookbackStart() {
    return now.minus(lookback);
  }
}
