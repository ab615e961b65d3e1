package com.scholary.synthjobs.job;

import java.time.Instant;

/** Immutable view of a job at one point in time. */
public record JobSnapshot(
    String jobId,
    String admissionKey,
    JobState state,
    String externalRef,
    JobResult result,
    JobError error,
    int attempts,
    Instant createdAt,
    Instant updatedAt,
    Instant deadline) {

  public boolean isTerminal() {
    return state.isTerminal();
  }

  public JobHandle handle() {
    return JobHandle.of(jobId);
  }
}
