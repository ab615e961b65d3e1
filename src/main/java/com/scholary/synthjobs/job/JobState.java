package com.scholary.synthjobs.job;

/**
 * Lifecycle states of a job.
 *
 * <pre>
 * QUEUED ──► SUBMITTING ──► POLLING ──► SUCCEEDED
 *    │            │            │    └─► FAILED
 *    │            │            ├──────► TIMED_OUT
 *    │            │            └──────► CANCELLED
 *    │            ├─► SUCCEEDED (provider answered synchronously)
 *    │            └─► FAILED | TIMED_OUT | CANCELLED
 *    └─► FAILED (admission denied) | TIMED_OUT | CANCELLED
 * </pre>
 */
public enum JobState {
  QUEUED,
  SUBMITTING,
  POLLING,
  SUCCEEDED,
  FAILED,
  TIMED_OUT,
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == TIMED_OUT || this == CANCELLED;
  }
}
