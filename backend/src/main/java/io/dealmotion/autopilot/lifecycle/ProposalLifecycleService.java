package io.dealmotion.autopilot.lifecycle;

import io.dealmotion.autopilot.audit.AuditEventBuilder;
import io.dealmotion.autopilot.audit.AuditService;
import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.exception.InvalidStateException;
import io.dealmotion.autopilot.exception.ResourceConflictException;
import io.dealmotion.autopilot.execution.ExecuteProposalEvent;
import io.dealmotion.autopilot.execution.ExecutionStatusUpdate;
import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalStatus;
import io.dealmotion.autopilot.proposal.ProposalStore;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only writer of proposal state after creation. Every operation is a guarded transition: if
 * the proposal is missing, belongs to someone else, or has already moved past the expected status,
 * the call fails with {@code ProposalNotFoundOrProcessedException} and changes nothing.
 *
 * <p>Accept and retry publish an {@link ExecuteProposalEvent}; the handoff happens after commit, so
 * acceptance stands even if the handoff later fails.
 */
@Service
public class ProposalLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(ProposalLifecycleService.class);

  static final String ENTITY_TYPE = "autopilot_proposal";

  private final ProposalStore store;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final AutopilotProperties properties;

  public ProposalLifecycleService(
      ProposalStore store,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      AutopilotProperties properties) {
    this.store = store;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
  }

  @Transactional
  public Proposal accept(UUID proposalId, ProposalOwner owner, String reason) {
    var proposal = store.transition(proposalId, owner, p -> p.accept(reason));
    var details = reasonDetails(reason);
    if (proposal.getViewedAt() != null) {
      details.put(
          "time_to_action_seconds",
          Duration.between(proposal.getViewedAt(), proposal.getDecidedAt()).toSeconds());
    }
    audit(proposal, "accepted", owner.userId(), details);
    eventPublisher.publishEvent(ExecuteProposalEvent.from(proposal));
    log.info("Proposal {} accepted by user {}", proposalId, owner.userId());
    return proposal;
  }

  /** The proposal was rendered to its owner; {@code viewedAt} is kept from the first call. */
  @Transactional
  public Proposal markShown(UUID proposalId, ProposalOwner owner) {
    var firstView = new AtomicBoolean();
    var proposal = store.transition(proposalId, owner, p -> firstView.set(p.markShown()));
    var details = new LinkedHashMap<String, Object>();
    details.put("first_view", firstView.get());
    audit(proposal, "shown", owner.userId(), details);
    log.debug(
        "Proposal {} shown to user {} (first view: {})", proposalId, owner.userId(), firstView);
    return proposal;
  }

  @Transactional
  public Proposal decline(UUID proposalId, ProposalOwner owner, String reason) {
    var proposal = store.transition(proposalId, owner, p -> p.decline(reason));
    audit(proposal, "declined", owner.userId(), reasonDetails(reason));
    log.info("Proposal {} declined by user {}", proposalId, owner.userId());
    return proposal;
  }

  /** Snoozes until an explicit instant, which must lie in the future. */
  @Transactional
  public Proposal snooze(UUID proposalId, ProposalOwner owner, Instant until, String reason) {
    Objects.requireNonNull(until, "until must not be null");
    if (!until.isAfter(Instant.now())) {
      throw new InvalidStateException(
          "Invalid snooze time", "Cannot snooze until " + until + ", which is not in the future");
    }
    var proposal = store.transition(proposalId, owner, p -> p.snooze(until, reason));
    var details = reasonDetails(reason);
    details.put("snoozed_until", until.toString());
    audit(proposal, "snoozed", owner.userId(), details);
    log.info("Proposal {} snoozed until {} by user {}", proposalId, until, owner.userId());
    return proposal;
  }

  @Transactional
  public Proposal snooze(UUID proposalId, ProposalOwner owner, SnoozeOption option, String reason) {
    Objects.requireNonNull(option, "option must not be null");
    var until =
        option.resolve(Instant.now(), properties.snoozeZone(), properties.snoozeMorningHour());
    return snooze(proposalId, owner, until, reason);
  }

  /**
   * Re-arms a failed proposal and hands it to execution again. A sequential proposal cannot be
   * re-armed while another sequential proposal of the owner is still live.
   */
  @Transactional
  public Proposal retry(UUID proposalId, ProposalOwner owner) {
    store
        .findForOwner(proposalId, owner)
        .filter(p -> p.getStatus() == ProposalStatus.FAILED && p.getType().isSequential())
        .ifPresent(failed -> requireSequentialSlotFree(failed, owner));
    var proposal = store.transition(proposalId, owner, Proposal::retry);
    audit(proposal, "retried", owner.userId(), new LinkedHashMap<>());
    eventPublisher.publishEvent(ExecuteProposalEvent.from(proposal));
    log.info("Proposal {} retried by user {}", proposalId, owner.userId());
    return proposal;
  }

  /** The owner did the work elsewhere; completes without dispatching anything. */
  @Transactional
  public Proposal completeInline(UUID proposalId, ProposalOwner owner, String note) {
    var proposal = store.transition(proposalId, owner, p -> p.completeInline(note));
    var details = new LinkedHashMap<String, Object>();
    if (note != null) {
      details.put("note", note);
    }
    audit(proposal, "completed_inline", owner.userId(), details);
    log.info("Proposal {} completed inline by user {}", proposalId, owner.userId());
    return proposal;
  }

  /** Reconciliation found the action already done. Acts as SYSTEM. */
  @Transactional
  public Proposal autoComplete(UUID proposalId, String reason) {
    var proposal = store.transition(proposalId, p -> p.completeOutsideEngine(reason));
    audit(proposal, "auto_completed", null, reasonDetails(reason));
    log.info("Proposal {} auto-completed: {}", proposalId, reason);
    return proposal;
  }

  /** The watchdog gave up on an in-flight proposal. Acts as SYSTEM. */
  @Transactional
  public Proposal failTimedOut(UUID proposalId, String error) {
    var proposal = store.transition(proposalId, p -> p.markFailed(error));
    audit(proposal, "timed_out", null, errorDetails(error));
    log.warn("Proposal {} failed by watchdog: {}", proposalId, error);
    return proposal;
  }

  /** Progress report from the execution side. */
  @Transactional
  public Proposal updateExecutionStatus(UUID proposalId, ExecutionStatusUpdate update) {
    Objects.requireNonNull(update, "update must not be null");
    return switch (update.state()) {
      case EXECUTING -> {
        var proposal = store.transition(proposalId, Proposal::markExecuting);
        audit(proposal, "executing", null, new LinkedHashMap<>());
        log.debug("Proposal {} is executing", proposalId);
        yield proposal;
      }
      case COMPLETED -> {
        var proposal =
            store.transition(
                proposalId, p -> p.markCompleted(update.result(), update.artifacts()));
        var details = new LinkedHashMap<String, Object>();
        details.put("artifact_count", update.artifacts().size());
        audit(proposal, "completed", null, details);
        log.info("Proposal {} completed with {} artifacts", proposalId, update.artifacts().size());
        yield proposal;
      }
      case FAILED -> {
        var proposal = store.transition(proposalId, p -> p.markFailed(update.error()));
        audit(proposal, "failed", null, errorDetails(update.error()));
        log.warn("Proposal {} failed: {}", proposalId, update.error());
        yield proposal;
      }
    };
  }

  private void requireSequentialSlotFree(Proposal failed, ProposalOwner owner) {
    var holder =
        store.findByStatuses(owner, ProposalStatus.NON_TERMINAL).stream()
            .filter(p -> p.getType().isSequential())
            .findFirst();
    if (holder.isPresent()) {
      throw new ResourceConflictException(
          "Sequential proposal in progress",
          "Cannot retry proposal "
              + failed.getId()
              + " while "
              + holder.get().getType().key()
              + " proposal "
              + holder.get().getId()
              + " is "
              + holder.get().getStatus());
    }
  }

  private void audit(Proposal proposal, String action, UUID actorId, Map<String, Object> extra) {
    var details = new LinkedHashMap<String, Object>();
    details.put("type", proposal.getType().key());
    details.put("dedupe_key", proposal.getDedupeKey());
    details.put("status", proposal.getStatus().name());
    details.putAll(extra);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(ENTITY_TYPE + "." + action)
            .entityType(ENTITY_TYPE)
            .entityId(proposal.getId())
            .actorId(actorId)
            .source(actorId != null ? "USER_ACTION" : "INTERNAL")
            .details(details)
            .build());
  }

  private static Map<String, Object> reasonDetails(String reason) {
    var details = new LinkedHashMap<String, Object>();
    if (reason != null) {
      details.put("reason", reason);
    }
    return details;
  }

  private static Map<String, Object> errorDetails(String error) {
    var details = new LinkedHashMap<String, Object>();
    details.put("error", error);
    return details;
  }
}
