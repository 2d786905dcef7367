package io.dealmotion.autopilot.execution;

import io.dealmotion.autopilot.proposal.ProposalArtifact;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A progress report from the execution side.
 *
 * @param state the state being reported
 * @param result free-form result payload, for {@link State#COMPLETED}
 * @param artifacts records produced, for {@link State#COMPLETED}
 * @param error failure message, for {@link State#FAILED}
 */
public record ExecutionStatusUpdate(
    State state, Map<String, Object> result, List<ProposalArtifact> artifacts, String error) {

  public enum State {
    EXECUTING,
    COMPLETED,
    FAILED
  }

  public ExecutionStatusUpdate {
    Objects.requireNonNull(state, "state must not be null");
    artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    if (state == State.FAILED && (error == null || error.isBlank())) {
      throw new IllegalArgumentException("A failed update must carry an error");
    }
  }

  public static ExecutionStatusUpdate executing() {
    return new ExecutionStatusUpdate(State.EXECUTING, null, null, null);
  }

  public static ExecutionStatusUpdate completed(
      Map<String, Object> result, List<ProposalArtifact> artifacts) {
    return new ExecutionStatusUpdate(State.COMPLETED, result, artifacts, null);
  }

  public static ExecutionStatusUpdate failed(String error) {
    return new ExecutionStatusUpdate(State.FAILED, null, null, error);
  }
}
