package io.dealmotion.autopilot.execution;

/**
 * Port to the content-generation pipelines that carry out accepted proposals. Implementations
 * accept the request and return promptly; the outcome comes back later through {@code
 * ProposalLifecycleService.updateExecutionStatus}.
 */
public interface ExecutionPipeline {

  /**
   * Hands the request over.
   *
   * @throws ExecutionHandoffException if the request could not be handed over
   */
  void submit(ExecutionRequest request);
}
