package io.dealmotion.autopilot.proposal;

import io.dealmotion.autopilot.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A next action suggested to a sales user by the detection engine.
 *
 * <p>Lifecycle: PROPOSED → ACCEPTED → EXECUTING → COMPLETED | FAILED; PROPOSED → DECLINED | SNOOZED
 * | EXPIRED; SNOOZED → PROPOSED; FAILED → ACCEPTED (retry). Priority is fixed at creation.
 *
 * <p>{@code activeDedupeKey} equals {@code dedupeKey} while the status is non-terminal and is null
 * otherwise; the {@code (user_id, active_dedupe_key)} unique constraint therefore only blocks live
 * duplicates. Concurrent writers are fenced by {@code @Version}.
 */
@Entity
@Table(name = "autopilot_proposals")
public class Proposal {

  static final int MAX_REASON_LENGTH = 500;
  static final int MAX_ERROR_LENGTH = 2000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "proposal_type", nullable = false, updatable = false, length = 40)
  private ProposalType type;

  @Column(name = "dedupe_key", nullable = false, updatable = false, length = 255)
  private String dedupeKey;

  @Column(name = "active_dedupe_key", length = 255)
  private String activeDedupeKey;

  @Column(name = "entity_key", nullable = false, updatable = false, length = 120)
  private String entityKey;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProposalStatus status;

  @Column(name = "priority", nullable = false, updatable = false)
  private int priority;

  // --- Trigger references ---

  @Column(name = "prospect_id", updatable = false)
  private UUID prospectId;

  @Column(name = "contact_id", updatable = false)
  private UUID contactId;

  @Column(name = "meeting_id", updatable = false)
  private UUID meetingId;

  @Column(name = "research_id", updatable = false)
  private UUID researchId;

  @Column(name = "prep_id", updatable = false)
  private UUID prepId;

  @Column(name = "followup_id", updatable = false)
  private UUID followupId;

  @Column(name = "outreach_id", updatable = false)
  private UUID outreachId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context_data", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> contextData = new LinkedHashMap<>();

  // --- Lifecycle timestamps ---

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "snoozed_until")
  private Instant snoozedUntil;

  @Column(name = "viewed_at")
  private Instant viewedAt;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "decision_reason", length = MAX_REASON_LENGTH)
  private String decisionReason;

  @Column(name = "execution_started_at")
  private Instant executionStartedAt;

  @Column(name = "execution_completed_at")
  private Instant executionCompletedAt;

  // --- Outcome ---

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "execution_result", columnDefinition = "jsonb")
  private Map<String, Object> executionResult;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "artifacts", nullable = false, columnDefinition = "jsonb")
  private List<Map<String, Object>> artifacts = new ArrayList<>();

  @Column(name = "error", length = MAX_ERROR_LENGTH)
  private String error;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Proposal() {}

  public Proposal(ProposalOwner owner, ProposalCandidate candidate) {
    Objects.requireNonNull(owner, "owner must not be null");
    Objects.requireNonNull(candidate, "candidate must not be null");
    this.userId = owner.userId();
    this.organizationId = owner.organizationId();
    this.type = candidate.type();
    this.dedupeKey = candidate.dedupeKey();
    this.entityKey = candidate.entityKey();
    this.priority = candidate.priority();
    var refs = candidate.refs();
    this.prospectId = refs.prospectId();
    this.contactId = refs.contactId();
    this.meetingId = refs.meetingId();
    this.researchId = refs.researchId();
    this.prepId = refs.prepId();
    this.followupId = refs.followupId();
    this.outreachId = refs.outreachId();
    this.contextData = new LinkedHashMap<>(candidate.contextData());
    this.expiresAt = candidate.expiresAt();
    moveTo(ProposalStatus.PROPOSED);
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    if (this.createdAt == null) {
      this.createdAt = now;
    }
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle methods ---

  /**
   * Records that the proposal was rendered to its owner. Valid in any status; only the first call
   * sets {@code viewedAt}.
   *
   * @return true if this was the first time the proposal was shown
   */
  public boolean markShown() {
    if (this.viewedAt != null) {
      return false;
    }
    this.viewedAt = Instant.now();
    return true;
  }

  /** Owner accepts the proposal. Only valid from PROPOSED. */
  public void accept(String reason) {
    requireStatus(EnumSet.of(ProposalStatus.PROPOSED), "accept");
    this.decidedAt = Instant.now();
    this.decisionReason = bounded(reason, MAX_REASON_LENGTH);
    moveTo(ProposalStatus.ACCEPTED);
  }

  /** Owner dismisses the proposal. Only valid from PROPOSED. */
  public void decline(String reason) {
    requireStatus(EnumSet.of(ProposalStatus.PROPOSED), "decline");
    this.decidedAt = Instant.now();
    this.decisionReason = bounded(reason, MAX_REASON_LENGTH);
    moveTo(ProposalStatus.DECLINED);
  }

  /** Hides the proposal until {@code until}. Only valid from PROPOSED. */
  public void snooze(Instant until, String reason) {
    requireStatus(EnumSet.of(ProposalStatus.PROPOSED), "snooze");
    this.snoozedUntil = Objects.requireNonNull(until, "until must not be null");
    this.decisionReason = bounded(reason, MAX_REASON_LENGTH);
    moveTo(ProposalStatus.SNOOZED);
  }

  /** Returns a snoozed proposal to the owner. Only valid from SNOOZED. */
  public void unsnooze() {
    requireStatus(EnumSet.of(ProposalStatus.SNOOZED), "unsnooze");
    this.snoozedUntil = null;
    moveTo(ProposalStatus.PROPOSED);
  }

  /** Marks a proposal as expired. Only valid from PROPOSED. */
  public void expire(String reason) {
    requireStatus(EnumSet.of(ProposalStatus.PROPOSED), "expire");
    this.decisionReason = bounded(reason, MAX_REASON_LENGTH);
    moveTo(ProposalStatus.EXPIRED);
  }

  /** The execution pipeline picked the proposal up. Only valid from ACCEPTED. */
  public void markExecuting() {
    requireStatus(EnumSet.of(ProposalStatus.ACCEPTED), "start execution of");
    this.executionStartedAt = Instant.now();
    moveTo(ProposalStatus.EXECUTING);
  }

  /** The execution pipeline finished successfully. Only valid from EXECUTING. */
  public void markCompleted(Map<String, Object> result, List<ProposalArtifact> produced) {
    requireStatus(EnumSet.of(ProposalStatus.EXECUTING), "complete");
    this.executionCompletedAt = Instant.now();
    this.executionResult = result != null ? new LinkedHashMap<>(result) : null;
    this.artifacts = toMaps(produced);
    this.error = null;
    moveTo(ProposalStatus.COMPLETED);
  }

  /**
   * Execution failed, or the watchdog gave up waiting. Valid from ACCEPTED (the handoff never
   * started) and EXECUTING.
   */
  public void markFailed(String error) {
    requireStatus(EnumSet.of(ProposalStatus.ACCEPTED, ProposalStatus.EXECUTING), "fail");
    this.executionCompletedAt = Instant.now();
    Objects.requireNonNull(error, "error must not be null");
    this.error = bounded(error, MAX_ERROR_LENGTH);
    moveTo(ProposalStatus.FAILED);
  }

  /**
   * The owner did the work through another surface. Valid from PROPOSED, ACCEPTED and EXECUTING;
   * records a synthetic inline artifact and never touches {@code executionStartedAt}.
   */
  public void completeInline(String note) {
    requireStatus(
        EnumSet.of(ProposalStatus.PROPOSED, ProposalStatus.ACCEPTED, ProposalStatus.EXECUTING),
        "complete inline");
    var now = Instant.now();
    if (this.decidedAt == null) {
      this.decidedAt = now;
    }
    this.executionCompletedAt = now;
    var result = new LinkedHashMap<String, Object>();
    result.put("completed_inline", true);
    if (note != null) {
      result.put("note", note);
    }
    this.executionResult = result;
    this.artifacts = toMaps(List.of(ProposalArtifact.of("inline", this.type.key())));
    moveTo(ProposalStatus.COMPLETED);
  }

  /**
   * Reconciliation found that the underlying action already happened. Valid from any non-terminal
   * status; the result records that the engine did not perform the work.
   */
  public void completeOutsideEngine(String reason) {
    requireStatus(ProposalStatus.NON_TERMINAL, "auto-complete");
    this.executionCompletedAt = Instant.now();
    this.snoozedUntil = null;
    var result = new LinkedHashMap<String, Object>();
    result.put("auto_completed", true);
    result.put("reason", reason);
    this.executionResult = result;
    this.artifacts = toMaps(List.of(ProposalArtifact.of("reconciled", this.type.key())));
    moveTo(ProposalStatus.COMPLETED);
  }

  /**
   * Re-arms a failed proposal for another execution attempt. Only valid from FAILED; clears the
   * error and both execution timestamps and re-claims the dedupe key.
   */
  public void retry() {
    requireStatus(EnumSet.of(ProposalStatus.FAILED), "retry");
    this.error = null;
    this.executionStartedAt = null;
    this.executionCompletedAt = null;
    this.executionResult = null;
    this.decidedAt = Instant.now();
    moveTo(ProposalStatus.ACCEPTED);
  }

  // --- Guards ---

  public boolean isTerminal() {
    return this.status.isTerminal();
  }

  /** True while the proposal is waiting on the owner and past its deadline. */
  public boolean isOverdue(Instant now) {
    return this.status == ProposalStatus.PROPOSED
        && this.expiresAt != null
        && this.expiresAt.isBefore(now);
  }

  private void requireStatus(Set<ProposalStatus> allowed, String action) {
    if (!allowed.contains(this.status)) {
      throw new InvalidStateException(
          "Invalid proposal state", "Cannot " + action + " proposal in status " + this.status);
    }
  }

  private void moveTo(ProposalStatus next) {
    this.status = next;
    this.activeDedupeKey = next.isTerminal() ? null : this.dedupeKey;
    this.updatedAt = Instant.now();
  }

  private static String bounded(String value, int maxLength) {
    return value != null && value.length() > maxLength ? value.substring(0, maxLength) : value;
  }

  private static List<Map<String, Object>> toMaps(List<ProposalArtifact> produced) {
    var maps = new ArrayList<Map<String, Object>>();
    if (produced != null) {
      produced.forEach(artifact -> maps.add(artifact.toMap()));
    }
    return maps;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public long getVersion() {
    return version;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public ProposalOwner getOwner() {
    return new ProposalOwner(userId, organizationId);
  }

  public ProposalType getType() {
    return type;
  }

  public String getDedupeKey() {
    return dedupeKey;
  }

  public String getActiveDedupeKey() {
    return activeDedupeKey;
  }

  public String getEntityKey() {
    return entityKey;
  }

  public ProposalStatus getStatus() {
    return status;
  }

  public int getPriority() {
    return priority;
  }

  public TriggerRefs getTriggerRefs() {
    return new TriggerRefs(
        prospectId, contactId, meetingId, researchId, prepId, followupId, outreachId);
  }

  public Map<String, Object> getContextData() {
    return contextData;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getSnoozedUntil() {
    return snoozedUntil;
  }

  public Instant getViewedAt() {
    return viewedAt;
  }

  public Instant getDecidedAt() {
    return decidedAt;
  }

  public String getDecisionReason() {
    return decisionReason;
  }

  public Instant getExecutionStartedAt() {
    return executionStartedAt;
  }

  public Instant getExecutionCompletedAt() {
    return executionCompletedAt;
  }

  public Map<String, Object> getExecutionResult() {
    return executionResult;
  }

  public List<ProposalArtifact> getArtifacts() {
    return artifacts == null
        ? List.of()
        : artifacts.stream().map(ProposalArtifact::fromMap).toList();
  }

  public String getError() {
    return error;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
