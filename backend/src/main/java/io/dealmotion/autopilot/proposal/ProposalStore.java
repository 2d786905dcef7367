package io.dealmotion.autopilot.proposal;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persistence boundary for proposals. Creation is an insert guarded by the per-user dedupe
 * uniqueness constraint; every later change is a transition guarded by the proposal's current
 * status and version. No method takes a lock.
 */
public interface ProposalStore {

  /**
   * Inserts a new proposal in its own transaction.
   *
   * @return the stored proposal, or empty if a live proposal already holds the dedupe key
   *     for the owner
   */
  Optional<Proposal> insert(Proposal proposal);

  Optional<Proposal> findForOwner(UUID id, ProposalOwner owner);

  /**
   * Applies {@code change} to the owner's proposal and flushes it with a version check.
   *
   * @throws io.dealmotion.autopilot.exception.ProposalNotFoundOrProcessedException if the proposal
   *     does not exist for the owner, {@code change} rejects the current status, or a concurrent
   *     writer got there first
   * @throws io.dealmotion.autopilot.exception.ResourceConflictException if the change re-claims a
   *     dedupe key that a newer live proposal now holds
   */
  Proposal transition(UUID id, ProposalOwner owner, Consumer<Proposal> change);

  /** Same as {@link #transition(UUID, ProposalOwner, Consumer)} for system actors. */
  Proposal transition(UUID id, Consumer<Proposal> change);

  List<Proposal> findByStatuses(ProposalOwner owner, Set<ProposalStatus> statuses);

  List<Proposal> findRecentlyUpdated(ProposalOwner owner, ProposalStatus status, Instant since);

  List<Proposal> findHistory(ProposalOwner owner, int limit);

  long countByStatus(ProposalOwner owner, ProposalStatus status);

  Set<String> findActiveDedupeKeys(ProposalOwner owner);

  Set<String> findDedupeKeysClosedSince(ProposalOwner owner, Instant since);

  /** Types completed within the window, grouped by the proposals' entity keys. */
  Map<String, Set<ProposalType>> findCompletedTypesByEntity(ProposalOwner owner, Instant since);

  List<Proposal> findStuck(Instant cutoff);

  List<Proposal> findStuck(ProposalOwner owner, Instant cutoff);

  /** Bulk PROPOSED → EXPIRED for proposals past {@code expiresAt}. Requires a transaction. */
  int expireOverdue(Instant now);

  /** Bulk SNOOZED → PROPOSED for proposals past {@code snoozedUntil}. Requires a transaction. */
  int unsnoozeDue(Instant now);
}
