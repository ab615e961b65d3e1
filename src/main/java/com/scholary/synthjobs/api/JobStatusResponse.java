package com.scholary.synthjobs.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.synthjobs.job.ErrorKind;
import com.scholary.synthjobs.job.JobSnapshot;
import com.scholary.synthjobs.job.JobState;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job, with the result if it succeeded or the classified error if
 * it did not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId,
    JobState state,
    String externalRef,
    JsonNode result,
    ErrorBody error,
    int attempts,
    Instant createdAt,
    Instant updatedAt,
    Instant deadline) {

  public record ErrorBody(ErrorKind kind, String message) {}

  public static JobStatusResponse from(JobSnapshot snapshot) {
    return new JobStatusResponse(
        snapshot.jobId(),
        snapshot.state(),
        snapshot.externalRef(),
        snapshot.result() == null ? null : snapshot.result().output(),
        snapshot.error() == null
            ? null
            : new ErrorBody(snapshot.error().kind(), snapshot.error().message()),
        snapshot.attempts(),
        snapshot.createdAt(),
        snapshot.updatedAt(),
        snapshot.deadline());
  }
}
