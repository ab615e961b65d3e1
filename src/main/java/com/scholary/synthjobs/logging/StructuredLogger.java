package com.scholary.synthjobs.logging;

import com.scholary.synthjobs.job.JobState;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets {@code event_type} plus its own fields, logs one line, and clears the event
 * fields again. The job context ({@code jobId}, {@code admissionKey}) stays in place for the
 * lifetime of the job's task.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log an admission denial. */
  public void logAdmissionDenied(String admissionKey, int cost, Duration retryAfter) {
    try {
      MDC.put("event_type", "admission_denied");
      MDC.put("admissionKey", admissionKey);
      MDC.put("cost", String.valueOf(cost));
      MDC.put("retryAfterMs", String.valueOf(retryAfter.toMillis()));

      logger.info(
          "Admission denied: key={}, cost={}, retryAfter={}ms",
          admissionKey,
          cost,
          retryAfter.toMillis());
    } finally {
      clearEventFields();
    }
  }

  /** Log a job state transition. */
  public void logJobTransition(String jobId, JobState from, JobState to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromState", String.valueOf(from));
      MDC.put("toState", String.valueOf(to));

      logger.info("Job transition: jobId={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log the next scheduled status poll. */
  public void logPollScheduled(String jobId, int attempt, Duration delay) {
    try {
      MDC.put("event_type", "poll_scheduled");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("delayMs", String.valueOf(delay.toMillis()));

      logger.debug(
          "Poll scheduled: jobId={}, attempt={}, delay={}ms", jobId, attempt, delay.toMillis());
    } finally {
      clearEventFields();
    }
  }

  /** Log a submission retry after a transient provider error. */
  public void logSubmitRetry(
      String jobId, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "submit_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Submit retry: jobId={}, attempt={}/{}, error={}, message={}",
          jobId,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed status poll that will be retried. */
  public void logPollFailed(String jobId, int attempt, String errorType, String message) {
    try {
      MDC.put("event_type", "poll_failed");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("errorType", errorType);

      logger.warn(
          "Poll failed: jobId={}, attempt={}, error={}, message={}",
          jobId,
          attempt,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log delivery of a terminal outcome to the result sink. */
  public void logJobDelivered(String jobId, JobState state, int attempts, long elapsedMs) {
    try {
      MDC.put("event_type", "job_delivered");
      MDC.put("toState", String.valueOf(state));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Job delivered: jobId={}, state={}, attempts={}, elapsed={}ms",
          jobId,
          state,
          attempts,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String admissionKey) {
    MDC.put("jobId", jobId);
    MDC.put("admissionKey", admissionKey);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("admissionKey");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("cost");
    MDC.remove("retryAfterMs");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("attempt");
    MDC.remove("delayMs");
    MDC.remove("maxRetries");
    MDC.remove("errorType");
    MDC.remove("elapsedMs");
  }
}
