package io.dealmotion.autopilot.lifecycle;

import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.exception.ProposalNotFoundOrProcessedException;
import io.dealmotion.autopilot.exception.ResourceNotFoundException;
import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalStatus;
import io.dealmotion.autopilot.proposal.ProposalStore;
import io.dealmotion.autopilot.sequencing.DependencyGraph;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Assembles the owner's inbox. Before anything is shown, stuck executions are settled and pending
 * proposals are reconciled, so an action done elsewhere is completed instead of offered again.
 *
 * <p>Not transactional itself: each settle or auto-complete commits on its own, so one proposal
 * that moved on concurrently cannot roll back the others.
 */
@Service
public class ProposalInboxService {

  private static final Logger log = LoggerFactory.getLogger(ProposalInboxService.class);

  private static final Comparator<Proposal> SURFACING_ORDER =
      Comparator.comparingInt(Proposal::getPriority)
          .reversed()
          .thenComparing(Proposal::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

  private final ProposalStore store;
  private final ProposalReconciler reconciler;
  private final ProposalLifecycleService lifecycleService;
  private final ExecutionWatchdog watchdog;
  private final AutopilotProperties properties;

  public ProposalInboxService(
      ProposalStore store,
      ProposalReconciler reconciler,
      ProposalLifecycleService lifecycleService,
      ExecutionWatchdog watchdog,
      AutopilotProperties properties) {
    this.store = store;
    this.reconciler = reconciler;
    this.lifecycleService = lifecycleService;
    this.watchdog = watchdog;
    this.properties = properties;
  }

  public ProposalInbox inbox(ProposalOwner owner) {
    watchdog.settleStuck(owner);

    var now = Instant.now();
    var lookbackStart = now.minus(properties.completedLookback());
    var stillPending = reconcilePending(owner);
    var completedByEntity = store.findCompletedTypesByEntity(owner, lookbackStart);
    var proposed =
        stillPending.stream()
            .filter(p -> !p.isOverdue(now))
            .filter(
                p -> DependencyGraph.isSatisfied(p.getType(), p.getEntityKey(), completedByEntity))
            .sorted(SURFACING_ORDER)
            .toList();

    var inProgress =
        store.findByStatuses(owner, EnumSet.of(ProposalStatus.ACCEPTED, ProposalStatus.EXECUTING));
    var snoozed = store.findByStatuses(owner, EnumSet.of(ProposalStatus.SNOOZED));
    var failed = store.findRecentlyUpdated(owner, ProposalStatus.FAILED, lookbackStart);

    var counts = new EnumMap<ProposalStatus, Long>(ProposalStatus.class);
    for (var status : ProposalStatus.values()) {
      counts.put(status, store.countByStatus(owner, status));
    }
    return new ProposalInbox(proposed, inProgress, snoozed, failed, counts);
  }

  public Proposal get(ProposalOwner owner, UUID proposalId) {
    return store
        .findForOwner(proposalId, owner)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  /** Terminal proposals, newest first. */
  public List<Proposal> history(ProposalOwner owner, int limit) {
    return store.findHistory(owner, limit);
  }

  private List<Proposal> reconcilePending(ProposalOwner owner) {
    var pending = store.findByStatuses(owner, EnumSet.of(ProposalStatus.PROPOSED));
    var kept = new ArrayList<Proposal>();
    for (var proposal : pending) {
      if (reconciler.reconcile(proposal) != ReconciliationOutcome.SATISFIED) {
        kept.add(proposal);
        continue;
      }
      try {
        lifecycleService.autoComplete(proposal.getId(), ExecutionWatchdog.COMPLETED_OUTSIDE);
      } catch (ProposalNotFoundOrProcessedException e) {
        log.debug("Proposal {} moved on while reconciling: {}", proposal.getId(), e.getMessage());
      }
    }
    return kept;
  }
}
