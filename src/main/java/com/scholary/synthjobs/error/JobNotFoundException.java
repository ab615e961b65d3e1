package com.scholary.synthjobs.error;

/** Thrown when a job handle is unknown or its entry has already been evicted. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
