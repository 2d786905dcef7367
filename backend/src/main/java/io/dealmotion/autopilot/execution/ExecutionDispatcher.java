package io.dealmotion.autopilot.execution;

import io.dealmotion.autopilot.config.AsyncConfig;
import io.dealmotion.autopilot.exception.ProposalNotFoundOrProcessedException;
import io.dealmotion.autopilot.lifecycle.ProposalLifecycleService;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands accepted proposals to the {@link ExecutionPipeline} once the acceptance has committed.
 *
 * <p>The proposal is moved to EXECUTING first. If that guard misses, the event is a redelivery and
 * nothing else happens. A handoff failure is logged and left for the watchdog, which fails the
 * proposal once it has been in flight too long.
 */
@Component
public class ExecutionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

  private final ProposalLifecycleService lifecycleService;
  private final ExecutionPipeline pipeline;
  private final Executor executor;

  public ExecutionDispatcher(
      ProposalLifecycleService lifecycleService,
      ExecutionPipeline pipeline,
      @Qualifier(AsyncConfig.AUTOPILOT_EXECUTOR) Executor executor) {
    this.lifecycleService = lifecycleService;
    this.pipeline = pipeline;
    this.executor = executor;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onExecuteProposal(ExecuteProposalEvent event) {
    try {
      executor.execute(() -> dispatch(event));
    } catch (RejectedExecutionException e) {
      log.error(
          "Executor rejected handoff of proposal {}, leaving it for the watchdog",
          event.proposalId(),
          e);
    }
  }

  void dispatch(ExecuteProposalEvent event) {
    try {
      lifecycleService.updateExecutionStatus(event.proposalId(), ExecutionStatusUpdate.executing());
    } catch (ProposalNotFoundOrProcessedException e) {
      log.info(
          "Proposal {} is no longer awaiting execution, ignoring redelivered event",
          event.proposalId());
      return;
    }

    try {
      pipeline.submit(ExecutionRequest.from(event));
      log.debug("Handed proposal {} to the execution pipeline", event.proposalId());
    } catch (Exception e) {
      log.error(
          "Execution handoff failed for proposal {}, leaving it for the watchdog",
          event.proposalId(),
          e);
    }
  }
}
