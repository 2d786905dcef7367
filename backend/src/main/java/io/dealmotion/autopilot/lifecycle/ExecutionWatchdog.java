package io.dealmotion.autopilot.lifecycle;

import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.exception.ProposalNotFoundOrProcessedException;
import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalStore;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Settles proposals stuck in ACCEPTED or EXECUTING for longer than the configured threshold. Age is
 * measured from {@code executionStartedAt}, or from {@code decidedAt} when execution never
 * started. A stuck proposal whose action turns out to be done is auto-completed; every other one is
 * failed with a timeout error and can be retried.
 */
@Component
public class ExecutionWatchdog {

  private static final Logger log = LoggerFactory.getLogger(ExecutionWatchdog.class);

  static final String COMPLETED_OUTSIDE = "Action completed outside Autopilot";

  private final ProposalStore store;
  private final ProposalReconciler reconciler;
  private final ProposalLifecycleService lifecycleService;
  private final AutopilotProperties properties;

  public ExecutionWatchdog(
      ProposalStore store,
      ProposalReconciler reconciler,
      ProposalLifecycleService lifecycleService,
      AutopilotProperties properties) {
    this.store = store;
    this.reconciler = reconciler;
    this.lifecycleService = lifecycleService;
    this.properties = properties;
  }

  @Scheduled(fixedRateString = "${autopilot.watchdog.interval:60000}")
  public void settleAllStuck() {
    log.debug("Execution watchdog started");
    var stuck = store.findStuck(cutoff());
    int settled = settle(stuck);
    if (settled > 0) {
      log.info(
          "Execution watchdog completed: {} of {} stuck proposals settled", settled, stuck.size());
    } else {
      log.debug("Execution watchdog completed: nothing stuck");
    }
  }

  /** Settles one owner's stuck proposals; used before surfacing their inbox. */
  public int settleStuck(ProposalOwner owner) {
    return settle(store.findStuck(owner, cutoff()));
  }

  private Instant cutoff() {
    return Instant.now().minus(properties.watchdogThreshold());
  }

  private int settle(List<Proposal> stuck) {
    int settled = 0;
    for (var proposal : stuck) {
      try {
        if (reconciler.reconcile(proposal) == ReconciliationOutcome.SATISFIED) {
          lifecycleService.autoComplete(proposal.getId(), COMPLETED_OUTSIDE);
        } else {
          lifecycleService.failTimedOut(proposal.getId(), timeoutMessage());
        }
        settled++;
      } catch (ProposalNotFoundOrProcessedException e) {
        log.debug("Stuck proposal {} moved on before the watchdog reached it", proposal.getId());
      } catch (Exception e) {
        log.error("Execution watchdog failed to settle proposal {}", proposal.getId(), e);
      }
    }
    return settled;
  }

  String timeoutMessage() {
    return "Execution timed out after " + properties.watchdogThreshold().toMinutes() + " minutes";
  }
}
