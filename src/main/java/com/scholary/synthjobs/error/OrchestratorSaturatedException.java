package com.scholary.synthjobs.error;

/**
 * Thrown when the orchestrator cannot take on another job, either because the tracking table is
 * full or because the job executor rejected the task.
 */
public class OrchestratorSaturatedException extends RuntimeException {

  public OrchestratorSaturatedException(String message) {
    super(message);
  }

  public OrchestratorSaturatedException(String message, Throwable cause) {
    super(message, cause);
  }
}
