package io.dealmotion.autopilot.proposal;

import io.dealmotion.autopilot.exception.InvalidStateException;
import io.dealmotion.autopilot.exception.ProposalNotFoundOrProcessedException;
import io.dealmotion.autopilot.exception.ResourceConflictException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JPA-backed {@link ProposalStore}. Inserts run in their own transaction so a unique-constraint
 * rejection never poisons the caller's transaction; transitions flush immediately so version
 * conflicts surface inside the call rather than at commit.
 */
@Repository
public class JpaProposalStore implements ProposalStore {

  private static final Logger log = LoggerFactory.getLogger(JpaProposalStore.class);

  private static final Set<ProposalStatus> IN_FLIGHT =
      EnumSet.of(ProposalStatus.ACCEPTED, ProposalStatus.EXECUTING);

  static final String EXPIRED_REASON = "Time expired";

  private final ProposalRepository repository;
  private final TransactionTemplate requiresNew;

  public JpaProposalStore(
      ProposalRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public Optional<Proposal> insert(Proposal proposal) {
    try {
      return Optional.ofNullable(requiresNew.execute(status -> repository.saveAndFlush(proposal)));
    } catch (DataIntegrityViolationException e) {
      if (findActiveDedupeKeys(proposal.getOwner()).contains(proposal.getDedupeKey())) {
        log.debug(
            "Live proposal already holds dedupe key {} for user {}",
            proposal.getDedupeKey(),
            proposal.getUserId());
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Proposal> findForOwner(UUID id, ProposalOwner owner) {
    return repository.findByIdAndUserId(id, owner.userId());
  }

  @Override
  @Transactional
  public Proposal transition(UUID id, ProposalOwner owner, Consumer<Proposal> change) {
    var proposal =
        repository.findByIdAndUserId(id, owner.userId()).orElseThrow(() -> notFound(id));
    return apply(proposal, change);
  }

  @Override
  @Transactional
  public Proposal transition(UUID id, Consumer<Proposal> change) {
    var proposal = repository.findById(id).orElseThrow(() -> notFound(id));
    return apply(proposal, change);
  }

  private static ProposalNotFoundOrProcessedException notFound(UUID id) {
    return new ProposalNotFoundOrProcessedException(id, "No proposal found with id " + id);
  }

  private Proposal apply(Proposal proposal, Consumer<Proposal> change) {
    var before = proposal.getStatus();
    try {
      change.accept(proposal);
    } catch (InvalidStateException e) {
      throw new ProposalNotFoundOrProcessedException(
          proposal.getId(), "Proposal " + proposal.getId() + " is already " + before);
    }
    try {
      return repository.saveAndFlush(proposal);
    } catch (OptimisticLockingFailureException e) {
      throw new ProposalNotFoundOrProcessedException(
          proposal.getId(), "Proposal " + proposal.getId() + " was changed concurrently");
    } catch (DataIntegrityViolationException e) {
      if (proposal.getActiveDedupeKey() != null && isHeldByAnother(proposal)) {
        throw new ResourceConflictException(
            "Proposal superseded",
            "A newer proposal already holds dedupe key " + proposal.getDedupeKey());
      }
      throw e;
    }
  }

  /** Checked in a fresh transaction; the current one is unusable after a constraint failure. */
  private boolean isHeldByAnother(Proposal proposal) {
    Set<String> liveKeys =
        requiresNew.execute(
            status -> new HashSet<>(repository.findActiveDedupeKeys(proposal.getUserId())));
    return liveKeys != null && liveKeys.contains(proposal.getDedupeKey());
  }

  @Override
  @Transactional(readOnly = true)
  public List<Proposal> findByStatuses(ProposalOwner owner, Set<ProposalStatus> statuses) {
    return repository.findByUserIdAndStatusIn(owner.userId(), statuses);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Proposal> findRecentlyUpdated(
      ProposalOwner owner, ProposalStatus status, Instant since) {
    return repository.findByUserIdAndStatusAndUpdatedAtAfter(owner.userId(), status, since);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Proposal> findHistory(ProposalOwner owner, int limit) {
    return repository.findByUserIdAndStatusInOrderByUpdatedAtDesc(
        owner.userId(), ProposalStatus.TERMINAL, PageRequest.of(0, Math.max(1, limit)));
  }

  @Override
  @Transactional(readOnly = true)
  public long countByStatus(ProposalOwner owner, ProposalStatus status) {
    return repository.countByUserIdAndStatus(owner.userId(), status);
  }

  @Override
  @Transactional(readOnly = true)
  public Set<String> findActiveDedupeKeys(ProposalOwner owner) {
    return new HashSet<>(repository.findActiveDedupeKeys(owner.userId()));
  }

  @Override
  @Transactional(readOnly = true)
  public Set<String> findDedupeKeysClosedSince(ProposalOwner owner, Instant since) {
    return new HashSet<>(
        repository.findDedupeKeysClosedSince(owner.userId(), ProposalStatus.TERMINAL, since));
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, Set<ProposalType>> findCompletedTypesByEntity(
      ProposalOwner owner, Instant since) {
    return repository.findCompletedSince(owner.userId(), ProposalStatus.COMPLETED, since).stream()
        .collect(
            Collectors.groupingBy(
                Proposal::getEntityKey,
                Collectors.mapping(
                    Proposal::getType,
                    Collectors.toCollection(() -> EnumSet.noneOf(ProposalType.class)))));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Proposal> findStuck(Instant cutoff) {
    return repository.findStuck(IN_FLIGHT, cutoff);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Proposal> findStuck(ProposalOwner owner, Instant cutoff) {
    return repository.findStuckForUser(owner.userId(), IN_FLIGHT, cutoff);
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public int expireOverdue(Instant now) {
    return repository.expireOverdue(
        ProposalStatus.PROPOSED, ProposalStatus.EXPIRED, EXPIRED_REASON, now);
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public int unsnoozeDue(Instant now) {
    return repository.unsnoozeDue(ProposalStatus.SNOOZED, ProposalStatus.PROPOSED, now);
  }
}
