package io.dealmotion.autopilot.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default pipeline that only logs. Proposals handed to it stay EXECUTING until the watchdog settles
 * them, or until an external caller reports the outcome. A real pipeline replaces it by being
 * declared {@code @Primary}.
 */
@Component
public class NoOpExecutionPipeline implements ExecutionPipeline {

  private static final Logger log = LoggerFactory.getLogger(NoOpExecutionPipeline.class);

  @Override
  public void submit(ExecutionRequest request) {
    log.info(
        "NoOp pipeline: would execute {} proposal {} for user {}",
        request.type().key(),
        request.proposalId(),
        request.owner().userId());
  }
}
