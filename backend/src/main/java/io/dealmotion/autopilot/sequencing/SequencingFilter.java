package io.dealmotion.autopilot.sequencing;

import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.sequencing.SequencingResult.DropReason;
import io.dealmotion.autopilot.sequencing.SequencingResult.Dropped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides which candidates of a detection run may be persisted.
 *
 * <ol>
 *   <li>Candidates are ordered by descending priority; ties keep detector order.
 *   <li>A candidate whose prerequisites have not completed for its entity is dropped.
 *   <li>A sequential candidate is dropped if a sequential proposal is already pending, or if an
 *       earlier candidate in this run already took the sequential slot.
 *   <li>The survivors are truncated to the owner's free surfaced-proposal slots.
 * </ol>
 */
@Component
public class SequencingFilter {

  private static final Logger log = LoggerFactory.getLogger(SequencingFilter.class);

  private static final Comparator<ProposalCandidate> BY_PRIORITY_DESC =
      Comparator.comparingInt(ProposalCandidate::priority).reversed();

  public SequencingResult apply(List<ProposalCandidate> candidates, QueueState state) {
    var ordered = new ArrayList<>(candidates);
    ordered.sort(BY_PRIORITY_DESC);

    var admitted = new ArrayList<ProposalCandidate>();
    var dropped = new ArrayList<Dropped>();
    boolean sequentialTaken = state.sequentialPending();
    int slots = state.freeSlots();

    for (var candidate : ordered) {
      var type = candidate.type();
      if (!DependencyGraph.isSatisfied(
          type, candidate.entityKey(), state.completedTypesByEntity())) {
        dropped.add(new Dropped(candidate, DropReason.UNMET_DEPENDENCY));
        continue;
      }
      if (type.isSequential() && sequentialTaken) {
        dropped.add(new Dropped(candidate, DropReason.SEQUENTIAL_PENDING));
        continue;
      }
      if (admitted.size() >= slots) {
        dropped.add(new Dropped(candidate, DropReason.CAPACITY));
        continue;
      }
      if (type.isSequential()) {
        sequentialTaken = true;
      }
      admitted.add(candidate);
    }

    if (!dropped.isEmpty()) {
      log.debug(
          "Sequencing admitted {} and dropped {} candidates", admitted.size(), dropped.size());
    }
    return new SequencingResult(admitted, dropped);
  }
}
