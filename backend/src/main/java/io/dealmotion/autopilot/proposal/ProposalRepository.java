package io.dealmotion.autopilot.proposal;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProposalRepository extends JpaRepository<Proposal, UUID> {

  Optional<Proposal> findByIdAndUserId(UUID id, UUID userId);

  List<Proposal> findByUserIdAndStatusIn(UUID userId, Collection<ProposalStatus> statuses);

  List<Proposal> findByUserIdAndStatusInOrderByUpdatedAtDesc(
      UUID userId, Collection<ProposalStatus> statuses, Pageable pageable);

  List<Proposal> findByUserIdAndStatusAndUpdatedAtAfter(
      UUID userId, ProposalStatus status, Instant since);

  long countByUserIdAndStatus(UUID userId, ProposalStatus status);

  @Query(
      """
      SELECT p.dedupeKey FROM Proposal p
      WHERE p.userId = :userId
        AND p.activeDedupeKey IS NOT NULL
      """)
  List<String> findActiveDedupeKeys(@Param("userId") UUID userId);

  @Query(
      """
      SELECT p.dedupeKey FROM Proposal p
      WHERE p.userId = :userId
        AND p.status IN :statuses
        AND p.updatedAt > :since
      """)
  List<String> findDedupeKeysClosedSince(
      @Param("userId") UUID userId,
      @Param("statuses") Collection<ProposalStatus> statuses,
      @Param("since") Instant since);

  @Query(
      """
      SELECT p FROM Proposal p
      WHERE p.userId = :userId
        AND p.status = :status
        AND p.executionCompletedAt > :since
      """)
  List<Proposal> findCompletedSince(
      @Param("userId") UUID userId,
      @Param("status") ProposalStatus status,
      @Param("since") Instant since);

  /**
   * Proposals sitting in ACCEPTED or EXECUTING since before {@code cutoff}. An ACCEPTED proposal
   * whose handoff never started is measured from its decision time.
   */
  @Query(
      """
      SELECT p FROM Proposal p
      WHERE p.status IN :statuses
        AND COALESCE(p.executionStartedAt, p.decidedAt) < :cutoff
      ORDER BY p.decidedAt
      """)
  List<Proposal> findStuck(
      @Param("statuses") Collection<ProposalStatus> statuses, @Param("cutoff") Instant cutoff);

  @Query(
      """
      SELECT p FROM Proposal p
      WHERE p.userId = :userId
        AND p.status IN :statuses
        AND COALESCE(p.executionStartedAt, p.decidedAt) < :cutoff
      """)
  List<Proposal> findStuckForUser(
      @Param("userId") UUID userId,
      @Param("statuses") Collection<ProposalStatus> statuses,
      @Param("cutoff") Instant cutoff);

  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE Proposal p
      SET p.status = :expired,
          p.activeDedupeKey = NULL,
          p.decisionReason = :reason,
          p.updatedAt = :now,
          p.version = p.version + 1
      WHERE p.status = :proposed
        AND p.expiresAt < :now
      """)
  int expireOverdue(
      @Param("proposed") ProposalStatus proposed,
      @Param("expired") ProposalStatus expired,
      @Param("reason") String reason,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE Proposal p
      SET p.status = :proposed,
          p.snoozedUntil = NULL,
          p.updatedAt = :now,
          p.version = p.version + 1
      WHERE p.status = :snoozed
        AND p.snoozedUntil < :now
      """)
  int unsnoozeDue(
      @Param("snoozed") ProposalStatus snoozed,
      @Param("proposed") ProposalStatus proposed,
      @Param("now") Instant now);
}
