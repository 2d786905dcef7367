package io.dealmotion.autopilot.sweep;

import io.dealmotion.autopilot.proposal.ProposalStore;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Bulk status sweeps, independent of detection runs. Both are single guarded UPDATEs, so running
 * them twice in a row changes nothing the second time. Unsnooze runs first so a proposal that
 * wakes up past its deadline is expired in the same pass.
 */
@Component
public class ProposalSweepJobs {

  private static final Logger log = LoggerFactory.getLogger(ProposalSweepJobs.class);

  private final ProposalStore store;
  private final TransactionTemplate transactionTemplate;

  public ProposalSweepJobs(ProposalStore store, TransactionTemplate transactionTemplate) {
    this.store = store;
    this.transactionTemplate = transactionTemplate;
  }

  @Scheduled(fixedRateString = "${autopilot.sweep.interval:300000}")
  public void runSweeps() {
    log.info("Proposal sweep started");
    var now = Instant.now();
    int expired = 0;
    int unsnoozed = 0;
    try {
      unsnoozed = unsnoozeDue(now);
    } catch (Exception e) {
      log.error("Proposal sweep failed to unsnooze due proposals", e);
    }
    try {
      expired = expireOverdue(now);
    } catch (Exception e) {
      log.error("Proposal sweep failed to expire overdue proposals", e);
    }
    log.info("Proposal sweep completed: {} expired, {} unsnoozed", expired, unsnoozed);
  }

  /** PROPOSED past {@code expiresAt} becomes EXPIRED. */
  public int expireOverdue(Instant now) {
    Integer count = transactionTemplate.execute(status -> store.expireOverdue(now));
    return count != null ? count : 0;
  }

  /** SNOOZED past {@code snoozedUntil} returns to PROPOSED. */
  public int unsnoozeDue(Instant now) {
    Integer count = transactionTemplate.execute(status -> store.unsnoozeDue(now));
    return count != null ? count : 0;
  }
}
