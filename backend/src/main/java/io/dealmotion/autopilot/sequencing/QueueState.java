package io.dealmotion.autopilot.sequencing;

import io.dealmotion.autopilot.proposal.ProposalType;
import java.util.Map;
import java.util.Set;

/**
 * What the owner's queue looks like right now, as far as sequencing is concerned.
 *
 * @param completedTypesByEntity types completed within the lookback window, per entity key
 * @param sequentialPending whether a sequential-class proposal is already non-terminal
 * @param surfacedCount proposals currently in {@code proposed}
 * @param maxConcurrent the owner's cap on surfaced proposals
 */
public record QueueState(
    Map<String, Set<ProposalType>> completedTypesByEntity,
    boolean sequentialPending,
    long surfacedCount,
    int maxConcurrent) {

  public QueueState {
    completedTypesByEntity = Map.copyOf(completedTypesByEntity);
  }

  public int freeSlots() {
    return (int) Math.max(0, maxConcurrent - surfacedCount);
  }
}
