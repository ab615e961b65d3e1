package com.scholary.synthjobs.orchestrator;

import com.scholary.synthjobs.admission.AdmissionDecision;
import com.scholary.synthjobs.admission.AdmissionGate;
import com.scholary.synthjobs.admission.AdmissionKey;
import com.scholary.synthjobs.config.OrchestratorProperties;
import com.scholary.synthjobs.error.AdmissionDeniedException;
import com.scholary.synthjobs.error.JobConfigurationException;
import com.scholary.synthjobs.error.OrchestratorSaturatedException;
import com.scholary.synthjobs.job.ErrorKind;
import com.scholary.synthjobs.job.Job;
import com.scholary.synthjobs.job.JobError;
import com.scholary.synthjobs.job.JobHandle;
import com.scholary.synthjobs.job.JobPayload;
import com.scholary.synthjobs.job.JobSnapshot;
import com.scholary.synthjobs.job.JobState;
import com.scholary.synthjobs.logging.PayloadRedactor;
import com.scholary.synthjobs.logging.StructuredLogger;
import com.scholary.synthjobs.provider.ExternalJobClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Entry point for running jobs against the external provider.
 *
 * <p>Each request is checked by the {@link AdmissionGate} before anything else happens. An
 * admitted job is registered in the {@link ResultSink} and handed to the job executor, where a
 * {@link JobRunner} drives it to a terminal state in short steps re-armed on the job scheduler.
 * Callers either keep the returned handle and poll {@link #getStatus(JobHandle)}, or use {@link
 * #runAndWait} to block for a bounded time.
 *
 * <p>All jobs run in this process. A job is never picked up by another instance, and tracked jobs
 * are lost on restart.
 */
@Service
public class JobOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final AdmissionGate admissionGate;
  private final ExternalJobClient client;
  private final PollScheduler scheduler;
  private final ResultSink sink;
  private final AsyncTaskExecutor jobExecutor;
  private final TaskScheduler jobScheduler;
  private final Executor providerExecutor;
  private final OrchestratorProperties properties;
  private final Clock clock;

  public JobOrchestrator(
      AdmissionGate admissionGate,
      ExternalJobClient client,
      PollScheduler scheduler,
      ResultSink sink,
      @Qualifier("jobExecutor") AsyncTaskExecutor jobExecutor,
      @Qualifier("jobScheduler") TaskScheduler jobScheduler,
      @Qualifier("providerExecutor") Executor providerExecutor,
      OrchestratorProperties properties,
      Clock clock) {
    this.admissionGate = admissionGate;
    this.client = client;
    this.scheduler = scheduler;
    this.sink = sink;
    this.jobExecutor = jobExecutor;
    this.jobScheduler = jobScheduler;
    this.providerExecutor = providerExecutor;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Admit and launch a job.
   *
   * @param key caller and operation class to charge
   * @param payload opaque provider input
   * @param deadline total time budget for the job, or null for the configured default
   * @return a handle for status queries and cancellation
   * @throws JobConfigurationException if the deadline or operation class is invalid
   * @throws AdmissionDeniedException if the caller is over budget; nothing was submitted
   * @throws OrchestratorSaturatedException if no more jobs can be tracked or queued
   */
  public JobHandle requestJob(AdmissionKey key, JobPayload payload, Duration deadline) {
    Duration budget = resolveDeadline(deadline);
    Instant now = clock.instant();
    Job job = new Job(UUID.randomUUID().toString(), key.value(), payload, now, now.plus(budget));

    AdmissionDecision decision = admissionGate.tryAdmit(key);
    if (decision.denied()) {
      job.terminate(JobState.FAILED, JobError.rateLimited(decision.retryAfter()), now);
      throw new AdmissionDeniedException(key.value(), decision.retryAfter());
    }

    job.transitionTo(JobState.SUBMITTING, clock.instant());
    TrackedJob tracked = new TrackedJob(job);
    sink.register(tracked);

    StructuredLogger.setJobContext(job.getId(), key.value());
    try {
      structuredLogger.logJobTransition(job.getId(), JobState.QUEUED, JobState.SUBMITTING);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(
            "Job payload: jobId={}, payload={}",
            job.getId(),
            PayloadRedactor.redact(payload.body()));
      }
      launch(tracked);
    } finally {
      StructuredLogger.clearJobContext();
    }

    LOGGER.info(
        "Job accepted: jobId={}, key={}, deadline={}", job.getId(), key.value(), job.getDeadline());
    return JobHandle.of(job.getId());
  }

  /**
   * Current view of a job. A terminal view is handed out once and then evicted.
   *
   * @throws com.scholary.synthjobs.error.JobNotFoundException if the handle is unknown
   */
  public JobSnapshot getStatus(JobHandle handle) {
    return sink.fetch(handle);
  }

  /**
   * Withdraw interest in a job.
   *
   * <p>Idempotent: unknown, evicted and already-terminal jobs are left as they are. A running job
   * is finished at once by its cancellation listener. The provider is asked to stop if it
   * supports that, but the job is marked cancelled without waiting for it.
   */
  public void cancelJob(JobHandle handle) {
    Optional<TrackedJob> found = sink.find(handle.jobId());
    if (found.isEmpty()) {
      LOGGER.debug("Cancel ignored for unknown job: jobId={}", handle.jobId());
      return;
    }
    TrackedJob tracked = found.get();
    Job job = tracked.getJob();
    if (job.isTerminal()) {
      LOGGER.debug(
          "Cancel ignored for finished job: jobId={}, state={}", job.getId(), job.getState());
      return;
    }

    if (tracked.getCancellation().cancel()) {
      LOGGER.info("Cancellation requested: jobId={}", job.getId());
    }

    // Still queued: no task will ever observe the token, so finish the job here
    if (tracked.claim()) {
      Future<?> task = tracked.getTask();
      if (task != null) {
        task.cancel(false);
      }
      JobState from = job.getState();
      if (job.terminate(JobState.CANCELLED, JobError.cancelled(), clock.instant())) {
        structuredLogger.logJobTransition(job.getId(), from, JobState.CANCELLED);
        sink.deliver(tracked);
      }
    }
  }

  /**
   * Launch a job and wait for it up to the configured synchronous bound.
   *
   * @return the terminal snapshot, or the current non-terminal one if the job is still running,
   *     in which case the caller continues with {@link JobSnapshot#handle()}
   */
  public JobSnapshot runAndWait(AdmissionKey key, JobPayload payload, Duration deadline) {
    JobHandle handle = requestJob(key, payload, deadline);
    return sink.await(handle, properties.syncWait());
  }

  private Duration resolveDeadline(Duration deadline) {
    if (deadline == null) {
      return properties.defaultDeadline();
    }
    if (deadline.isZero() || deadline.isNegative()) {
      throw new JobConfigurationException("deadline must be positive (current: " + deadline + ")");
    }
    if (deadline.compareTo(properties.maxDeadline()) > 0) {
      throw new JobConfigurationException(
          String.format(
              "deadline %ds exceeds the maximum of %ds",
              deadline.toSeconds(), properties.maxDeadline().toSeconds()));
    }
    return deadline;
  }

  private void launch(TrackedJob tracked) {
    JobRunner runner =
        new JobRunner(
            tracked,
            client,
            scheduler,
            sink,
            jobExecutor,
            jobScheduler,
            providerExecutor,
            properties.maxSubmissionRetries(),
            clock);
    try {
      tracked.setTask(jobExecutor.submit(runner));
    } catch (TaskRejectedException e) {
      Job job = tracked.getJob();
      LOGGER.error("Job executor rejected job: jobId={}", job.getId(), e);
      if (tracked.claim()) {
        job.terminate(
            JobState.FAILED,
            JobError.of(ErrorKind.TRANSIENT_PROVIDER_ERROR, "Service is at capacity"),
            clock.instant());
      }
      // The caller never receives a handle for this job
      sink.remove(tracked);
      throw new OrchestratorSaturatedException("Job executor queue is full", e);
    }
  }
}
