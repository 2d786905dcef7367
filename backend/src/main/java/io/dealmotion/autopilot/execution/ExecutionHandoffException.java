package io.dealmotion.autopilot.execution;

/** The execution pipeline could not take a request. */
public class ExecutionHandoffException extends RuntimeException {

  public ExecutionHandoffException(String message) {
    super(message);
  }

  public ExecutionHandoffException(String message, Throwable cause) {
    super(message, cause);
  }
}
