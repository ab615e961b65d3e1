package com.scholary.synthjobs.job;

import java.time.Duration;

/**
 * Classified error recorded on a job.
 *
 * <p>The message is safe to show to callers; raw provider detail is only logged.
 *
 * @param retryAfter set only for {@link ErrorKind#ADMISSION_DENIED}
 */
public record JobError(ErrorKind kind, String message, Duration retryAfter) {

  public static JobError of(ErrorKind kind, String message) {
    return new JobError(kind, message, null);
  }

  public static JobError rateLimited(Duration retryAfter) {
    return new JobError(
        ErrorKind.ADMISSION_DENIED,
        "Too many generation requests. Please try again later.",
        retryAfter);
  }

  public static JobError deadlineExceeded() {
    return of(ErrorKind.DEADLINE_EXCEEDED, "Job did not finish before its deadline");
  }

  public static JobError cancelled() {
    return of(ErrorKind.CANCELLATION_REQUESTED, "Job was cancelled");
  }
}
