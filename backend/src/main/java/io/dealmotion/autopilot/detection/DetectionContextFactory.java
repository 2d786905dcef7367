package io.dealmotion.autopilot.detection;

import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalStatus;
import io.dealmotion.autopilot.proposal.ProposalStore;
import io.dealmotion.autopilot.settings.OwnerSettings;
import java.time.Instant;
import org.springframework.stereotype.Component;

/** Builds the per-run {@link DetectionContext} from the proposal store. */
@Component
public class DetectionContextFactory {

  private final ProposalStore store;
  private final AutopilotProperties properties;

  public DetectionContextFactory(ProposalStore store, AutopilotProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  public DetectionContext create(ProposalOwner owner, OwnerSettings settings, Instant now) {
    var lookbackStart = now.minus(properties.completedLookback());
    boolean sequentialPending =
        store.findByStatuses(owner, ProposalStatus.NON_TERMINAL).stream()
            .anyMatch(p -> p.getType().isSequential());

    return new DetectionContext(
        owner,
        now,
        settings,
        store.findActiveDedupeKeys(owner),
        store.findDedupeKeysClosedSince(owner, lookbackStart),
        store.findCompletedTypesByEntity(owner, lookbackStart),
        sequentialPending,
        store.countByStatus(owner, ProposalStatus.PROPOSED),
        properties.completedLookback(),
        properties.maxCandidatesPerDetector());
  }
}
