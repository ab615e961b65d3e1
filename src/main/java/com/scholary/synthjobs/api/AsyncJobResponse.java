package com.scholary.synthjobs.api;

/**
 * Response for an accepted job.
 *
 * <p>Returns the job ID and the URL to poll for its status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {

  public static AsyncJobResponse forJob(String jobId) {
    return new AsyncJobResponse(jobId, "/api/jobs/" + jobId);
  }
}
