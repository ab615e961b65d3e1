package com.scholary.synthjobs.job;

/** Caller-facing reference to a tracked job. */
public record JobHandle(String jobId) {

  public JobHandle {
    if (jobId == null || jobId.isBlank()) {
      throw new IllegalArgumentException("jobId cannot be blank");
    }
  }

  public static JobHandle of(String jobId) {
    return new JobHandle(jobId);
  }
}
