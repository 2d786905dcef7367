package io.dealmotion.autopilot.sequencing;

import io.dealmotion.autopilot.proposal.ProposalCandidate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Candidates admitted by {@link SequencingFilter}, in admission order, plus what was dropped. */
public record SequencingResult(List<ProposalCandidate> admitted, List<Dropped> dropped) {

  public enum DropReason {
    UNMET_DEPENDENCY,
    SEQUENTIAL_PENDING,
    CAPACITY
  }

  public record Dropped(ProposalCandidate candidate, DropReason reason) {}

  public SequencingResult {
    admitted = List.copyOf(admitted);
    dropped = List.copyOf(dropped);
  }

  public Map<DropReason, Integer> droppedByReason() {
    var counts = new EnumMap<DropReason, Integer>(DropReason.class);
    dropped.forEach(d -> counts.merge(d.reason(), 1, Integer::sum));
    return counts;
  }
}
